package com.eyelevel.demandletter.dto.history;

import java.util.List;
import java.util.Map;

/**
 * The matching jobs plus per-status counts over the whole filtered set, not just the returned page.
 * The counts apply every criterion except the status one.
 *
 * @param jobs   The matching jobs, ordered and limited as requested.
 * @param counts Count of matching jobs per status, keyed by the wire status name.
 * @param total  Sum of the counts.
 */
public record JobHistoryResponse(List<JobSummary> jobs, Map<String, Long> counts, long total) {
}
