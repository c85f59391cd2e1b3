package com.eyelevel.demandletter.service.job;

import com.eyelevel.demandletter.dto.status.JobStatusResponse;
import com.eyelevel.demandletter.exception.JobNotFoundException;
import com.eyelevel.demandletter.model.JobStatus;
import com.eyelevel.demandletter.repository.JobStatusView;
import com.eyelevel.demandletter.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read-only status lookups for polling clients. Always reflects the latest committed state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStatusService {

    private final JobStore jobStore;

    public JobStatusResponse getStatus(final long jobId) {
        final JobStatusView view = jobStore.findStatus(jobId)
                .orElseThrow(() -> new JobNotFoundException("File not found"));

        log.debug("Job {} is {}", jobId, view.getStatus());
        return new JobStatusResponse(
                view.getStatus(),
                view.getDocxFilename(),
                view.getStatus() == JobStatus.FAILED ? view.getErrorMessage() : null);
    }
}
