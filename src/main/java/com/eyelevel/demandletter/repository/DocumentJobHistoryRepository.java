package com.eyelevel.demandletter.repository;

import com.eyelevel.demandletter.dto.history.JobHistoryFilter;
import com.eyelevel.demandletter.dto.history.JobSummary;
import com.eyelevel.demandletter.model.JobStatus;

import java.util.List;
import java.util.Map;

/**
 * Custom fragment of {@link DocumentJobRepository} for the filtered history view.
 */
public interface DocumentJobHistoryRepository {

    /**
     * Lists job summaries matching the filter, ordered and limited as the filter requests.
     */
    List<JobSummary> findSummaries(JobHistoryFilter filter);

    /**
     * Counts the jobs matching the filter, grouped by status. Statuses with no match are absent.
     * The filter's own status criterion, limit and ordering are ignored here.
     */
    Map<JobStatus, Long> countMatchingByStatus(JobHistoryFilter filter);
}
