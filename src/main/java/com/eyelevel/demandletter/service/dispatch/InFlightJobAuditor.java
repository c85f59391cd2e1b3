package com.eyelevel.demandletter.service.dispatch;

import com.eyelevel.demandletter.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports, at startup, jobs that a previous process left in {@code PROCESSING}.
 * <p>
 * Their dispatch tasks died with that process, so they will never reach a terminal status.
 * They are deliberately left untouched and not re-dispatched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InFlightJobAuditor {

    private final JobStore jobStore;

    @EventListener(ApplicationReadyEvent.class)
    public void reportOrphanedJobs() {
        final List<Long> orphaned = jobStore.findJobsStillProcessing();
        if (orphaned.isEmpty()) {
            log.info("No jobs were left in PROCESSING by a previous run.");
            return;
        }
        log.warn("{} job(s) were left in PROCESSING by a previous run and will not complete: {}",
                orphaned.size(), orphaned);
    }
}
