package com.eyelevel.demandletter.dto.status;

import com.eyelevel.demandletter.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The polling answer for a job.
 *
 * @param status   The current status.
 * @param filename The generated document's name; null until the job completes.
 * @param error    The failure reason; present only for failed jobs.
 */
public record JobStatusResponse(
        JobStatus status,
        String filename,
        @JsonInclude(JsonInclude.Include.NON_NULL) String error) {
}
