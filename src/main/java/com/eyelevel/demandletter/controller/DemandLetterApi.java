package com.eyelevel.demandletter.controller;

import com.eyelevel.demandletter.dto.common.ErrorResponse;
import com.eyelevel.demandletter.dto.history.JobHistoryResponse;
import com.eyelevel.demandletter.dto.status.JobStatusResponse;
import com.eyelevel.demandletter.dto.upload.UploadResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.core.io.Resource;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDateTime;

@Tag(name = "Demand Letters", description = "Upload a template and its data, poll the generation job and download the letter.")
public interface DemandLetterApi {

    @Operation(summary = "Upload Template and Data",
            description = "Validates a .txt template and a .csv data file, records a job and starts document generation in the background. Returns immediately with the job ID.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Upload accepted.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = UploadResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "success": true,
                                        "job_id": 1
                                    }
                                    """))),
            @ApiResponse(responseCode = "400", description = "Bad Request - A file is missing, empty, not UTF-8 or has the wrong extension.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ErrorResponse.class),
                            examples = @ExampleObject(name = "Wrong type", value = """
                                    {
                                        "error": "Invalid file types. Only TXT and CSV files are allowed"
                                    }
                                    """))),
            @ApiResponse(responseCode = "413", description = "Payload Too Large",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<UploadResponse> upload(
            @Parameter(description = "The letter template, a UTF-8 .txt file.", required = true)
            MultipartFile txtFile,
            @Parameter(description = "The data rows, a UTF-8 .csv file.", required = true)
            MultipartFile csvFile);

    @Operation(summary = "Check Job Status",
            description = "Returns the current status of a job, the generated document's name once completed, and the failure reason if it failed.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status found.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = JobStatusResponse.class),
                            examples = @ExampleObject(name = "Completed", value = """
                                    {
                                        "status": "completed",
                                        "filename": "demand_letter_1.docx"
                                    }
                                    """))),
            @ApiResponse(responseCode = "404", description = "Not Found - The job ID does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<JobStatusResponse> checkStatus(
            @Parameter(description = "The job ID returned by the upload.", required = true, example = "1")
            long jobId);

    @Operation(summary = "Download Generated Letter",
            description = "Streams the generated .docx of a completed job as an attachment.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "The document.",
                    content = @Content(mediaType = "application/vnd.openxmlformats-officedocument.wordprocessingml.document")),
            @ApiResponse(responseCode = "404", description = "Not Found - The job does not exist or failed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "409", description = "Conflict - The job is still processing.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<Resource> download(
            @Parameter(description = "The job ID returned by the upload.", required = true, example = "1")
            long jobId);

    @Operation(summary = "Job History",
            description = "Lists jobs matching the given criteria, newest first by default, with per-status counts.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "History retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = JobHistoryResponse.class))),
            @ApiResponse(responseCode = "400", description = "Bad Request - Unknown status, sort key or direction, or an invalid range.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<JobHistoryResponse> history(
            @Parameter(description = "Only list jobs in this status.", example = "completed") String status,
            @Parameter(description = "Substring of the template, data or generated filename.", example = "invoice") String filename,
            @Parameter(description = "Match the filename case-sensitively. Defaults to the configured behaviour.") Boolean caseSensitive,
            @Parameter(description = "Inclusive lower bound on the upload time (ISO date-time).", example = "2024-01-01T00:00:00") LocalDateTime from,
            @Parameter(description = "Inclusive upper bound on the upload time (ISO date-time).", example = "2024-12-31T23:59:59") LocalDateTime to,
            @Parameter(description = "Sort key: uploadTimestamp, id, txtFilename, csvFilename or status.", example = "uploadTimestamp") String sort,
            @Parameter(description = "ASC or DESC.", example = "DESC") String direction,
            @Parameter(description = "Maximum number of jobs to return.", example = "50") Integer limit);
}
