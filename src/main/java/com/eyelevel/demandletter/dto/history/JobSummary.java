package com.eyelevel.demandletter.dto.history;

import com.eyelevel.demandletter.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * A job row without its payloads, as listed in the history view.
 */
public record JobSummary(
        Long id,
        @JsonProperty("txt_filename") String txtFilename,
        @JsonProperty("csv_filename") String csvFilename,
        @JsonProperty("docx_filename") String docxFilename,
        @JsonProperty("upload_timestamp") LocalDateTime uploadTimestamp,
        JobStatus status) {
}
