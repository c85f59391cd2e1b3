package com.eyelevel.demandletter.service.history;

import com.eyelevel.demandletter.config.DemandLetterConfig;
import com.eyelevel.demandletter.dto.history.HistorySortKey;
import com.eyelevel.demandletter.dto.history.JobHistoryFilter;
import com.eyelevel.demandletter.dto.history.JobHistoryResponse;
import com.eyelevel.demandletter.dto.history.JobSummary;
import com.eyelevel.demandletter.exception.apiclient.BadRequestException;
import com.eyelevel.demandletter.model.JobStatus;
import com.eyelevel.demandletter.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the filtered job history: a limited, ordered list of summaries plus per-status counts.
 * Counts ignore the status criterion so the caller always sees the spread across all three states.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobHistoryService {

    private final JobStore jobStore;
    private final DemandLetterConfig demandLetterConfig;

    /**
     * Parses raw request parameters into a {@link JobHistoryFilter}, applying configured defaults.
     *
     * @throws BadRequestException if a status, sort key, direction or limit is invalid, or if
     *                             {@code from} is after {@code to}.
     */
    public JobHistoryFilter buildFilter(final String status, final String filename, final Boolean caseSensitive,
                                        final LocalDateTime from, final LocalDateTime to, final String sort,
                                        final String direction, final Integer limit) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new BadRequestException("'from' must not be after 'to'.");
        }
        if (limit != null && limit < 1) {
            throw new BadRequestException("'limit' must be at least 1.");
        }

        final DemandLetterConfig.History history = demandLetterConfig.getHistory();
        return JobHistoryFilter.builder()
                .status(StringUtils.hasText(status) ? parseStatus(status) : null)
                .filename(StringUtils.hasText(filename) ? filename.trim() : null)
                .caseSensitive(caseSensitive != null ? caseSensitive : history.isCaseSensitiveFilenameMatch())
                .from(from)
                .to(to)
                .sort(StringUtils.hasText(sort) ? HistorySortKey.from(sort) : HistorySortKey.UPLOAD_TIMESTAMP)
                .direction(StringUtils.hasText(direction) ? parseDirection(direction) : Sort.Direction.DESC)
                .limit(Math.min(limit != null ? limit : history.getDefaultLimit(), history.getMaxLimit()))
                .build();
    }

    public JobHistoryResponse query(final JobHistoryFilter filter) {
        final List<JobSummary> jobs = jobStore.listJobs(filter);
        final Map<JobStatus, Long> byStatus = jobStore.countJobsByStatus(filter);

        final Map<String, Long> counts = new LinkedHashMap<>();
        long total = 0;
        for (JobStatus status : JobStatus.values()) {
            final long count = byStatus.getOrDefault(status, 0L);
            counts.put(status.getValue(), count);
            total += count;
        }

        log.debug("History query returned {} of {} matching jobs.", jobs.size(), total);
        return new JobHistoryResponse(jobs, counts, total);
    }

    private static JobStatus parseStatus(final String value) {
        try {
            return JobStatus.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Unsupported status '" + value + "'.");
        }
    }

    private static Sort.Direction parseDirection(final String value) {
        try {
            return Sort.Direction.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Unsupported direction '" + value + "'.");
        }
    }
}
