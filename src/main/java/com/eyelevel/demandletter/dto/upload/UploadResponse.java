package com.eyelevel.demandletter.dto.upload;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Returned as soon as an upload is accepted; the job ID is then used for polling.
 */
public record UploadResponse(boolean success, @JsonProperty("job_id") long jobId) {

    public static UploadResponse accepted(long jobId) {
        return new UploadResponse(true, jobId);
    }
}
