package com.eyelevel.demandletter.service.dispatch;

import com.eyelevel.demandletter.common.apiclient.webhook.DocumentWebhookClient;
import com.eyelevel.demandletter.config.DemandLetterConfig;
import com.eyelevel.demandletter.model.JobStatus;
import com.eyelevel.demandletter.repository.JobStatusView;
import com.eyelevel.demandletter.service.store.JobStore;
import com.eyelevel.demandletter.support.WebhookStubSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class WebhookDispatcherShutdownTest extends WebhookStubSupport {

    @Autowired
    private DocumentWebhookClient documentWebhookClient;

    @Autowired
    private JobStore jobStore;

    @Autowired
    private DemandLetterConfig demandLetterConfig;

    @Test
    void shutdownDuringWebhookCallLeavesJobProcessing() throws Exception {
        WIREMOCK.stubFor(post(urlEqualTo(DOCUMENT_PATH))
                .willReturn(aResponse().withStatus(200)
                        .withHeader("Content-Type", DOCX_MEDIA_TYPE)
                        .withBody(new byte[]{1, 2, 3})
                        .withFixedDelay(20_000)));

        // Same shutdown policy as the application's dispatch pool.
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.setThreadNamePrefix("shutdown-test-");
        pool.setWaitForTasksToCompleteOnShutdown(false);
        pool.initialize();
        WebhookDispatcher dispatcher = new WebhookDispatcher(documentWebhookClient, jobStore, demandLetterConfig, pool);

        long jobId = jobStore.createJob("slow.txt", "slow.csv", "template", "a\n1");
        CompletableFuture<JobStatus> outcome = dispatcher.dispatch(jobId, "template", "a\n1");

        await().atMost(Duration.ofSeconds(10))
                .until(() -> !WIREMOCK.findAll(postRequestedFor(urlEqualTo(DOCUMENT_PATH))).isEmpty());
        pool.shutdown();

        assertEquals(JobStatus.PROCESSING, outcome.get(10, TimeUnit.SECONDS));
        JobStatusView stored = jobStore.findStatus(jobId).orElseThrow();
        assertEquals(JobStatus.PROCESSING, stored.getStatus());
        assertNull(stored.getErrorMessage());

        List<Long> orphaned = jobStore.findJobsStillProcessing();
        assertTrue(orphaned.contains(jobId));
    }
}
