package com.eyelevel.demandletter.service.job;

import com.eyelevel.demandletter.dto.download.DocumentArtifact;
import com.eyelevel.demandletter.exception.ArtifactNotReadyException;
import com.eyelevel.demandletter.exception.JobNotFoundException;
import com.eyelevel.demandletter.model.DocumentJob;
import com.eyelevel.demandletter.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Serves the generated document of a completed job.
 * <p>
 * The artifact and the {@code COMPLETED} status are written in one transaction, so a reader sees
 * either both or neither.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArtifactService {

    private final JobStore jobStore;

    /**
     * @param jobId The job whose document is requested.
     * @return The stored document and its name.
     * @throws ArtifactNotReadyException if the job is still processing.
     * @throws JobNotFoundException      if the job is unknown or failed.
     */
    public DocumentArtifact getArtifact(final long jobId) {
        final DocumentJob job = jobStore.getJob(jobId)
                .orElseThrow(() -> new JobNotFoundException("File not found or not ready"));

        switch (job.getStatus()) {
            case PROCESSING -> throw new ArtifactNotReadyException("File not ready");
            case FAILED -> throw new JobNotFoundException("File not found or not ready");
            default -> {
                // COMPLETED
            }
        }
        if (!job.hasArtifact()) {
            log.error("Job {} is COMPLETED but has no stored document.", jobId);
            throw new JobNotFoundException("File not found or not ready");
        }

        log.info("Serving '{}' for job {} ({} bytes).", job.getDocxFilename(), jobId, job.getDocxContent().length);
        return new DocumentArtifact(job.getDocxFilename(), job.getDocxContent());
    }
}
