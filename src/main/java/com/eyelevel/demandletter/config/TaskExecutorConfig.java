package com.eyelevel.demandletter.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the thread pool that runs document-generation webhook calls.
 * <p>
 * Webhook calls have no timeout, so a stuck call holds its thread indefinitely. The pool is bounded
 * (threads and queue) so a backlog degrades throughput instead of exhausting the process; excess
 * dispatches are rejected and the affected jobs are marked failed.
 */
@Slf4j
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the bounded executor for webhook dispatch tasks.
     *
     * @param config The processing configuration providing the pool sizes.
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("webhookDispatchExecutor")
    public AsyncTaskExecutor webhookDispatchExecutor(final DemandLetterConfig config) {
        final DemandLetterConfig.Dispatch dispatch = config.getDispatch();
        log.info("Initializing webhook dispatch pool: core={}, max={}, queue={}",
                dispatch.getCorePoolSize(), dispatch.getMaxPoolSize(), dispatch.getQueueCapacity());

        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.getCorePoolSize());
        executor.setMaxPoolSize(dispatch.getMaxPoolSize());
        executor.setQueueCapacity(dispatch.getQueueCapacity());
        executor.setThreadNamePrefix("webhook-dispatch-");
        // In-flight calls cannot be cancelled; shutdown does not wait for them.
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
