package com.eyelevel.demandletter.controller;

import com.eyelevel.demandletter.dto.download.DocumentArtifact;
import com.eyelevel.demandletter.dto.history.JobHistoryFilter;
import com.eyelevel.demandletter.dto.history.JobHistoryResponse;
import com.eyelevel.demandletter.dto.status.JobStatusResponse;
import com.eyelevel.demandletter.dto.upload.UploadResponse;
import com.eyelevel.demandletter.service.history.JobHistoryService;
import com.eyelevel.demandletter.service.job.ArtifactService;
import com.eyelevel.demandletter.service.job.JobStatusService;
import com.eyelevel.demandletter.service.upload.UploadIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDateTime;

/**
 * REST controller for the demand letter workflow: upload, status polling, download and history.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class DemandLetterController implements DemandLetterApi {

    private final UploadIngestionService uploadIngestionService;
    private final JobStatusService jobStatusService;
    private final ArtifactService artifactService;
    private final JobHistoryService jobHistoryService;

    @Override
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(
            @RequestParam(value = "txt_file", required = false) final MultipartFile txtFile,
            @RequestParam(value = "csv_file", required = false) final MultipartFile csvFile) {

        log.info("Received upload: txt='{}', csv='{}'",
                txtFile != null ? txtFile.getOriginalFilename() : null,
                csvFile != null ? csvFile.getOriginalFilename() : null);
        return ResponseEntity.ok(uploadIngestionService.ingest(txtFile, csvFile));
    }

    @Override
    @GetMapping("/check_status/{job_id}")
    public ResponseEntity<JobStatusResponse> checkStatus(@PathVariable("job_id") final long jobId) {
        return ResponseEntity.ok(jobStatusService.getStatus(jobId));
    }

    @Override
    @GetMapping("/download/{job_id}")
    public ResponseEntity<Resource> download(@PathVariable("job_id") final long jobId) {
        final DocumentArtifact artifact = artifactService.getArtifact(jobId);

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(DocumentArtifact.DOCX_MEDIA_TYPE))
                .contentLength(artifact.content().length)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.filename()).build().toString())
                .body(new ByteArrayResource(artifact.content()));
    }

    @Override
    @GetMapping("/history")
    public ResponseEntity<JobHistoryResponse> history(
            @RequestParam(value = "status", required = false) final String status,
            @RequestParam(value = "filename", required = false) final String filename,
            @RequestParam(value = "caseSensitive", required = false) final Boolean caseSensitive,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) final LocalDateTime from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) final LocalDateTime to,
            @RequestParam(value = "sort", required = false) final String sort,
            @RequestParam(value = "direction", required = false) final String direction,
            @RequestParam(value = "limit", required = false) final Integer limit) {

        final JobHistoryFilter filter = jobHistoryService.buildFilter(status, filename, caseSensitive, from, to,
                sort, direction, limit);
        log.debug("Fetching job history with filter: {}", filter);
        return ResponseEntity.ok(jobHistoryService.query(filter));
    }
}
