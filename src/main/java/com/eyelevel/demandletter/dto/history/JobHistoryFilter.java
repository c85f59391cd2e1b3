package com.eyelevel.demandletter.dto.history;

import com.eyelevel.demandletter.model.JobStatus;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Sort;
import org.springframework.lang.Nullable;

import java.time.LocalDateTime;

/**
 * Criteria for the job history view. Every criterion is optional; an empty filter matches all jobs.
 */
@Value
@Builder
public class JobHistoryFilter {

    @Nullable
    JobStatus status;

    /**
     * Substring matched against the txt, csv and docx filenames.
     */
    @Nullable
    String filename;

    boolean caseSensitive;

    /**
     * Inclusive lower bound on the upload timestamp.
     */
    @Nullable
    LocalDateTime from;

    /**
     * Inclusive upper bound on the upload timestamp.
     */
    @Nullable
    LocalDateTime to;

    @Builder.Default
    HistorySortKey sort = HistorySortKey.UPLOAD_TIMESTAMP;

    @Builder.Default
    Sort.Direction direction = Sort.Direction.DESC;

    int limit;
}
