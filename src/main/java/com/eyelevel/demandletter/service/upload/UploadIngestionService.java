package com.eyelevel.demandletter.service.upload;

import com.eyelevel.demandletter.dto.upload.UploadResponse;
import com.eyelevel.demandletter.dto.upload.ValidatedUpload;
import com.eyelevel.demandletter.service.dispatch.WebhookDispatcher;
import com.eyelevel.demandletter.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Turns a validated upload into a job and hands it to the dispatcher without waiting for the webhook.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadIngestionService {

    private final UploadValidationService uploadValidationService;
    private final JobStore jobStore;
    private final WebhookDispatcher webhookDispatcher;

    /**
     * Validates the pair, creates exactly one job in {@code PROCESSING} and schedules its dispatch.
     * The job row is committed before the dispatch task is submitted.
     *
     * @param txtFile The template part.
     * @param csvFile The data part.
     * @return The accepted job's ID.
     * @throws com.eyelevel.demandletter.exception.UploadValidationException if the files are rejected;
     *                                                                       no job is created.
     */
    public UploadResponse ingest(final MultipartFile txtFile, final MultipartFile csvFile) {
        final ValidatedUpload upload = uploadValidationService.validate(txtFile, csvFile);

        final long jobId = jobStore.createJob(upload.txtFilename(), upload.csvFilename(),
                upload.txtContent(), upload.csvContent());
        webhookDispatcher.dispatch(jobId, upload.txtContent(), upload.csvContent());

        log.info("Accepted upload as job {}; generation continues in the background.", jobId);
        return UploadResponse.accepted(jobId);
    }
}
