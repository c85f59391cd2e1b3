package com.eyelevel.demandletter.service.store;

import com.eyelevel.demandletter.dto.history.JobHistoryFilter;
import com.eyelevel.demandletter.dto.history.JobSummary;
import com.eyelevel.demandletter.model.ChatMessage;
import com.eyelevel.demandletter.model.DocumentJob;
import com.eyelevel.demandletter.model.JobStatus;
import com.eyelevel.demandletter.repository.ChatMessageRepository;
import com.eyelevel.demandletter.repository.DocumentJobRepository;
import com.eyelevel.demandletter.repository.JobStatusView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The single owner of job and chat records.
 * <p>
 * Every write runs in its own short transaction ({@code REQUIRES_NEW}) so that a dispatch callback
 * commits independently of whatever else is running, and is retried on transient lock failures
 * instead of surfacing them. Terminal job transitions are conditional updates guarded on the
 * {@code PROCESSING} status, which makes {@link #completeJob} and {@link #failJob} idempotent and
 * lets only the first of two racing callbacks win.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    private final DocumentJobRepository documentJobRepository;
    private final ChatMessageRepository chatMessageRepository;

    /**
     * Records a new upload in {@code PROCESSING}.
     *
     * @return The generated job ID.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "#{${app.processing.store.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.store.retry.delay-ms}}"),
            listeners = {"storeRetryListener"})
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public long createJob(final String txtFilename, final String csvFilename,
                          final String txtContent, final String csvContent) {
        final DocumentJob job = new DocumentJob();
        job.setTxtFilename(txtFilename);
        job.setCsvFilename(csvFilename);
        job.setTxtContent(txtContent);
        job.setCsvContent(csvContent);
        job.setStatus(JobStatus.PROCESSING);

        final Long id = documentJobRepository.saveAndFlush(job).getId();
        log.info("Created job {} for template '{}' and data '{}'.", id, txtFilename, csvFilename);
        return id;
    }

    /**
     * Attaches the generated document and marks the job {@code COMPLETED}.
     *
     * @return {@code true} if this call performed the transition; {@code false} if the job is unknown
     * or was already terminal, in which case nothing changed.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "#{${app.processing.store.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.store.retry.delay-ms}}"),
            listeners = {"storeRetryListener"})
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean completeJob(final long id, final String docxFilename, final byte[] docxContent) {
        final int updated = documentJobRepository.markCompleted(id, docxFilename, docxContent,
                LocalDateTime.now(), JobStatus.PROCESSING, JobStatus.COMPLETED);
        if (updated == 0) {
            log.warn("Ignoring completion of job {}: it is unknown or already terminal.", id);
            return false;
        }
        log.info("Job {} completed with '{}' ({} bytes).", id, docxFilename, docxContent.length);
        return true;
    }

    /**
     * Marks the job {@code FAILED} with a reason. Same idempotence as {@link #completeJob}.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "#{${app.processing.store.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.store.retry.delay-ms}}"),
            listeners = {"storeRetryListener"})
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean failJob(final long id, final String reason) {
        final int updated = documentJobRepository.markFailed(id, reason, LocalDateTime.now(),
                JobStatus.PROCESSING, JobStatus.FAILED);
        if (updated == 0) {
            log.warn("Ignoring failure of job {}: it is unknown or already terminal.", id);
            return false;
        }
        log.warn("Job {} failed: {}", id, reason);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<DocumentJob> getJob(final long id) {
        return documentJobRepository.findById(id);
    }

    /**
     * Reads only the status, document name and failure reason of a job.
     */
    @Transactional(readOnly = true)
    public Optional<JobStatusView> findStatus(final long id) {
        return documentJobRepository.findStatusViewById(id);
    }

    @Transactional(readOnly = true)
    public List<JobSummary> listJobs(final JobHistoryFilter filter) {
        return documentJobRepository.findSummaries(filter);
    }

    @Transactional(readOnly = true)
    public Map<JobStatus, Long> countJobsByStatus(final JobHistoryFilter filter) {
        return documentJobRepository.countMatchingByStatus(filter);
    }

    @Transactional(readOnly = true)
    public List<Long> findJobsStillProcessing() {
        return documentJobRepository.findIdsByStatus(JobStatus.PROCESSING);
    }

    /**
     * Records a user message whose bot response is not known yet.
     *
     * @return The generated chat message ID.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "#{${app.processing.store.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.store.retry.delay-ms}}"),
            listeners = {"storeRetryListener"})
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public long createChat(final String userMessage) {
        final ChatMessage message = new ChatMessage();
        message.setUserMessage(userMessage);
        return chatMessageRepository.saveAndFlush(message).getId();
    }

    /**
     * Sets the bot response of a chat message once.
     *
     * @return {@code true} if the response was written; {@code false} if the message is unknown or
     * already had a response.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "#{${app.processing.store.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.store.retry.delay-ms}}"),
            listeners = {"storeRetryListener"})
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean fillChatResponse(final long id, final String botResponse) {
        final boolean filled = chatMessageRepository.fillResponseIfEmpty(id, botResponse) > 0;
        if (!filled) {
            log.warn("Ignoring response for chat message {}: it is unknown or already answered.", id);
        }
        return filled;
    }

    /**
     * All chat exchanges in insertion order.
     */
    @Transactional(readOnly = true)
    public List<ChatMessage> listChats() {
        return chatMessageRepository.findAllByOrderByIdAsc();
    }
}
