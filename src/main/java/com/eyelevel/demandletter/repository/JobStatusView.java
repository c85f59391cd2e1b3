package com.eyelevel.demandletter.repository;

import com.eyelevel.demandletter.model.JobStatus;

/**
 * Closed projection of a job used by status polling; keeps the payload columns out of the query.
 */
public interface JobStatusView {

    JobStatus getStatus();

    String getDocxFilename();

    String getErrorMessage();
}
