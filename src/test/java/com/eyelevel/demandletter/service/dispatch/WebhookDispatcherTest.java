package com.eyelevel.demandletter.service.dispatch;

import com.eyelevel.demandletter.common.apiclient.model.ApiResponse;
import com.eyelevel.demandletter.common.apiclient.webhook.DocumentWebhookClient;
import com.eyelevel.demandletter.config.DemandLetterConfig;
import com.eyelevel.demandletter.exception.apiclient.InternalServerException;
import com.eyelevel.demandletter.exception.apiclient.RequestInterruptedException;
import com.eyelevel.demandletter.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.demandletter.model.JobStatus;
import com.eyelevel.demandletter.repository.JobStatusView;
import com.eyelevel.demandletter.service.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WebhookDispatcherTest {

    private static final long JOB_ID = 7L;
    private static final byte[] DOCX = {'P', 'K', 3, 4, 20, 0};

    private DocumentWebhookClient webhookClient;
    private JobStore jobStore;
    private WebhookDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        webhookClient = mock(DocumentWebhookClient.class);
        jobStore = mock(JobStore.class);
        dispatcher = new WebhookDispatcher(webhookClient, jobStore, new DemandLetterConfig(),
                new SimpleAsyncTaskExecutor("test-dispatch-"));
    }

    private static ApiResponse response(byte[] body, MediaType contentType) {
        return ApiResponse.builder()
                .data(body)
                .contentType(contentType)
                .statusCode(200)
                .build();
    }

    @Test
    void documentBodyCompletesJob() throws Exception {
        when(webhookClient.generateDocument(JOB_ID, "tpl", "csv"))
                .thenReturn(response(DOCX, MediaType.APPLICATION_OCTET_STREAM));
        when(jobStore.completeJob(anyLong(), anyString(), any())).thenReturn(true);

        JobStatus status = dispatcher.dispatch(JOB_ID, "tpl", "csv").get(5, TimeUnit.SECONDS);

        assertEquals(JobStatus.COMPLETED, status);
        verify(jobStore).completeJob(JOB_ID, "demand_letter_7.docx", DOCX);
        verify(jobStore, never()).failJob(anyLong(), anyString());
    }

    @Test
    void jsonBodyOnSuccessIsMalformed() {
        when(webhookClient.generateDocument(anyLong(), anyString(), anyString()))
                .thenReturn(response("{\"error\":\"template invalid\"}".getBytes(), MediaType.APPLICATION_JSON));
        when(jobStore.failJob(anyLong(), anyString())).thenReturn(true);

        assertEquals(JobStatus.FAILED, dispatcher.runDispatch(JOB_ID, "tpl", "csv"));
        verify(jobStore).failJob(eq(JOB_ID), startsWith("Malformed webhook response"));
        verify(jobStore, never()).completeJob(anyLong(), anyString(), any());
    }

    @Test
    void emptyBodyIsMalformed() {
        when(webhookClient.generateDocument(anyLong(), anyString(), anyString()))
                .thenReturn(response(new byte[0], null));
        when(jobStore.failJob(anyLong(), anyString())).thenReturn(true);

        assertEquals(JobStatus.FAILED, dispatcher.runDispatch(JOB_ID, "tpl", "csv"));
        verify(jobStore).failJob(JOB_ID, "Malformed webhook response: the body is empty");
    }

    @Test
    void httpErrorFailsJobWithDiagnostic() {
        when(webhookClient.generateDocument(anyLong(), anyString(), anyString()))
                .thenThrow(new InternalServerException("Webhook responded with HTTP 500: boom"));
        when(jobStore.failJob(anyLong(), anyString())).thenReturn(true);

        assertEquals(JobStatus.FAILED, dispatcher.runDispatch(JOB_ID, "tpl", "csv"));
        verify(jobStore).failJob(JOB_ID, "Document webhook call failed: Webhook responded with HTTP 500: boom");
    }

    @Test
    void transportErrorFailsJob() {
        when(webhookClient.generateDocument(anyLong(), anyString(), anyString()))
                .thenThrow(new ServiceUnavailableException("Failed to connect to external service: Connection refused"));
        when(jobStore.failJob(anyLong(), anyString())).thenReturn(true);

        assertEquals(JobStatus.FAILED, dispatcher.runDispatch(JOB_ID, "tpl", "csv"));
        verify(jobStore).failJob(eq(JOB_ID), contains("Connection refused"));
    }

    @Test
    void unexpectedErrorNeverEscapesTheTask() {
        when(webhookClient.generateDocument(anyLong(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("codec exploded"));
        when(jobStore.failJob(anyLong(), anyString())).thenReturn(true);

        assertEquals(JobStatus.FAILED, assertDoesNotThrow(() -> dispatcher.runDispatch(JOB_ID, "tpl", "csv")));
        verify(jobStore).failJob(eq(JOB_ID), contains("codec exploded"));
    }

    @Test
    void interruptedCallLeavesJobProcessingAndKeepsInterruptFlag() {
        when(webhookClient.generateDocument(anyLong(), anyString(), anyString()))
                .thenThrow(new RequestInterruptedException("Webhook call was interrupted", new InterruptedException()));

        try {
            assertEquals(JobStatus.PROCESSING, dispatcher.runDispatch(JOB_ID, "tpl", "csv"));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        verify(jobStore, never()).failJob(anyLong(), anyString());
        verify(jobStore, never()).completeJob(anyLong(), anyString(), any());
    }

    @Test
    void lostRaceReportsStoredStatus() {
        JobStatusView stored = mock(JobStatusView.class);
        when(stored.getStatus()).thenReturn(JobStatus.FAILED);
        when(webhookClient.generateDocument(anyLong(), anyString(), anyString()))
                .thenReturn(response(DOCX, MediaType.APPLICATION_OCTET_STREAM));
        when(jobStore.completeJob(anyLong(), anyString(), any())).thenReturn(false);
        when(jobStore.findStatus(JOB_ID)).thenReturn(Optional.of(stored));

        assertEquals(JobStatus.FAILED, dispatcher.runDispatch(JOB_ID, "tpl", "csv"));
    }

    @Test
    void storeOutageLeavesJobProcessing() {
        when(webhookClient.generateDocument(anyLong(), anyString(), anyString()))
                .thenReturn(response(DOCX, MediaType.APPLICATION_OCTET_STREAM));
        when(jobStore.completeJob(anyLong(), anyString(), any()))
                .thenThrow(new QueryTimeoutException("database locked"));

        assertEquals(JobStatus.PROCESSING, dispatcher.runDispatch(JOB_ID, "tpl", "csv"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void rejectedDispatchFailsJobImmediately() throws Exception {
        AsyncTaskExecutor saturated = mock(AsyncTaskExecutor.class);
        when(saturated.submitCompletable(any(Callable.class))).thenThrow(new TaskRejectedException("queue full"));
        when(jobStore.failJob(anyLong(), anyString())).thenReturn(true);
        WebhookDispatcher rejecting = new WebhookDispatcher(webhookClient, jobStore, new DemandLetterConfig(), saturated);

        CompletableFuture<JobStatus> future = rejecting.dispatch(JOB_ID, "tpl", "csv");

        assertTrue(future.isDone());
        assertEquals(JobStatus.FAILED, future.get());
        verify(jobStore).failJob(eq(JOB_ID), startsWith("Dispatch rejected"));
        verifyNoInteractions(webhookClient);
    }
}
