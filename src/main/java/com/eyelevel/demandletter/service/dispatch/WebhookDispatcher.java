package com.eyelevel.demandletter.service.dispatch;

import com.eyelevel.demandletter.common.apiclient.model.ApiResponse;
import com.eyelevel.demandletter.common.apiclient.webhook.DocumentWebhookClient;
import com.eyelevel.demandletter.config.DemandLetterConfig;
import com.eyelevel.demandletter.exception.DispatchFailureException;
import com.eyelevel.demandletter.exception.apiclient.ApiException;
import com.eyelevel.demandletter.exception.apiclient.RequestInterruptedException;
import com.eyelevel.demandletter.model.JobStatus;
import com.eyelevel.demandletter.repository.JobStatusView;
import com.eyelevel.demandletter.service.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Runs the document-generation webhook call for a job on the dispatch pool and records the outcome.
 * <p>
 * The call has no timeout, so it never runs on the thread that accepted the upload. Each dispatch
 * ends in exactly one terminal write: {@code completeJob} when the webhook returns a document,
 * {@code failJob} for any transport error, non-2xx status or malformed body. If the process dies
 * or the pool is shut down mid-call, the job stays {@code PROCESSING}; it is reported at startup and
 * never retried.
 */
@Slf4j
@Service
public class WebhookDispatcher {

    private final DocumentWebhookClient documentWebhookClient;
    private final JobStore jobStore;
    private final DemandLetterConfig config;
    private final AsyncTaskExecutor dispatchExecutor;

    public WebhookDispatcher(final DocumentWebhookClient documentWebhookClient,
                             final JobStore jobStore,
                             final DemandLetterConfig config,
                             @Qualifier("webhookDispatchExecutor") final AsyncTaskExecutor dispatchExecutor) {
        this.documentWebhookClient = documentWebhookClient;
        this.jobStore = jobStore;
        this.config = config;
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Schedules the webhook call for a job and returns immediately.
     *
     * @param jobId      The job to dispatch; must already be committed in {@code PROCESSING}.
     * @param txtContent The template text.
     * @param csvContent The CSV data.
     * @return A future completing with the status the job ended in once the call finishes. If the pool
     * rejects the task, the job is failed at once and the future is already complete.
     */
    public CompletableFuture<JobStatus> dispatch(final long jobId, final String txtContent, final String csvContent) {
        try {
            return dispatchExecutor.submitCompletable(() -> runDispatch(jobId, txtContent, csvContent));
        } catch (TaskRejectedException e) {
            log.error("Dispatch pool rejected job {}; marking it as failed.", jobId, e);
            recordFailure(jobId, "Dispatch rejected: too many documents are being generated, please retry later");
            return CompletableFuture.completedFuture(JobStatus.FAILED);
        }
    }

    /**
     * The body of a dispatch task. Never throws: every outcome is written to the job store.
     */
    JobStatus runDispatch(final long jobId, final String txtContent, final String csvContent) {
        final long startedAt = System.currentTimeMillis();
        try {
            final ApiResponse response = documentWebhookClient.generateDocument(jobId, txtContent, csvContent);
            final byte[] document = extractDocument(response);
            final String docxFilename = config.docxFilenameFor(jobId);

            log.info("Webhook returned a {}-byte document for job {} after {} ms.", document.length, jobId,
                    System.currentTimeMillis() - startedAt);
            return recordCompletion(jobId, docxFilename, document);

        } catch (RequestInterruptedException e) {
            return abandon(jobId);
        } catch (ApiException e) {
            return recordFailure(jobId, "Document webhook call failed: " + e.getMessage());
        } catch (DispatchFailureException e) {
            return recordFailure(jobId, e.getMessage());
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                return abandon(jobId);
            }
            log.error("Unexpected error while dispatching job {}", jobId, e);
            return recordFailure(jobId, "Unexpected dispatch error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Accepts any non-empty, non-textual body as the generated document. A JSON or text body on a 2xx
     * response is the webhook reporting an error in-band.
     */
    private static byte[] extractDocument(final ApiResponse response) {
        if (response == null || !response.hasData()) {
            throw new DispatchFailureException("Malformed webhook response: the body is empty");
        }
        final MediaType contentType = response.getContentType();
        if (contentType != null && (MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                || "text".equalsIgnoreCase(contentType.getType()))) {
            throw new DispatchFailureException("Malformed webhook response: expected a document but received "
                    + contentType);
        }
        return response.getData();
    }

    /**
     * The pool is shutting down and the webhook's answer will never be read. No terminal write is made:
     * the outcome is unknown, so the job stays {@code PROCESSING} and is reported at the next startup.
     */
    private JobStatus abandon(final long jobId) {
        Thread.currentThread().interrupt();
        log.warn("Dispatch of job {} was interrupted before the webhook answered; the job stays PROCESSING.", jobId);
        return JobStatus.PROCESSING;
    }

    private JobStatus recordCompletion(final long jobId, final String docxFilename, final byte[] document) {
        try {
            return jobStore.completeJob(jobId, docxFilename, document) ? JobStatus.COMPLETED : storedStatus(jobId);
        } catch (Exception e) {
            log.error("CRITICAL: Could not store the document for job {}. The job remains PROCESSING.", jobId, e);
            return JobStatus.PROCESSING;
        }
    }

    private JobStatus recordFailure(final long jobId, final String reason) {
        try {
            return jobStore.failJob(jobId, reason) ? JobStatus.FAILED : storedStatus(jobId);
        } catch (Exception e) {
            log.error("CRITICAL: Could not record the failure of job {} ({}). The job remains PROCESSING.",
                    jobId, reason, e);
            return JobStatus.PROCESSING;
        }
    }

    private JobStatus storedStatus(final long jobId) {
        return jobStore.findStatus(jobId)
                .map(JobStatusView::getStatus)
                .orElse(JobStatus.FAILED);
    }
}
