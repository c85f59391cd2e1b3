package com.eyelevel.demandletter.repository;

import com.eyelevel.demandletter.dto.history.JobHistoryFilter;
import com.eyelevel.demandletter.dto.history.JobSummary;
import com.eyelevel.demandletter.model.DocumentJob;
import com.eyelevel.demandletter.model.JobStatus;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Criteria API implementation of {@link DocumentJobHistoryRepository}. Filtering, ordering, limiting and
 * grouping all run in the database; the text payloads and the artifact are never selected.
 */
@Slf4j
public class DocumentJobHistoryRepositoryImpl implements DocumentJobHistoryRepository {

    private static final char LIKE_ESCAPE = '\\';

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<JobSummary> findSummaries(final JobHistoryFilter filter) {
        final CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        final CriteriaQuery<JobSummary> query = cb.createQuery(JobSummary.class);
        final Root<DocumentJob> job = query.from(DocumentJob.class);

        final List<Predicate> predicates = buildPredicates(cb, job, filter);
        if (filter.getStatus() != null) {
            predicates.add(cb.equal(job.get("status"), filter.getStatus()));
        }

        final Expression<?> sortExpression = job.get(filter.getSort().getAttribute());
        query.select(cb.construct(JobSummary.class,
                        job.get("id"),
                        job.get("txtFilename"),
                        job.get("csvFilename"),
                        job.get("docxFilename"),
                        job.get("uploadTimestamp"),
                        job.get("status")))
                .where(predicates.toArray(Predicate[]::new))
                .orderBy(filter.getDirection() == Sort.Direction.ASC ? cb.asc(sortExpression) : cb.desc(sortExpression),
                        cb.desc(job.get("id")));

        log.debug("Querying job history with filter: {}", filter);
        return entityManager.createQuery(query)
                .setMaxResults(filter.getLimit())
                .getResultList();
    }

    @Override
    public Map<JobStatus, Long> countMatchingByStatus(final JobHistoryFilter filter) {
        final CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        final CriteriaQuery<Tuple> query = cb.createTupleQuery();
        final Root<DocumentJob> job = query.from(DocumentJob.class);

        query.multiselect(job.get("status").alias("status"), cb.count(job).alias("total"))
                .where(buildPredicates(cb, job, filter).toArray(Predicate[]::new))
                .groupBy(job.get("status"));

        final Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (final Tuple row : entityManager.createQuery(query).getResultList()) {
            counts.put(row.get("status", JobStatus.class), row.get("total", Long.class));
        }
        return counts;
    }

    /**
     * Builds the filename and date-range predicates shared by the listing and the counts.
     */
    private List<Predicate> buildPredicates(final CriteriaBuilder cb, final Root<DocumentJob> job,
                                            final JobHistoryFilter filter) {
        final List<Predicate> predicates = new ArrayList<>();

        if (StringUtils.hasText(filter.getFilename())) {
            final String needle = filter.isCaseSensitive()
                    ? filter.getFilename()
                    : filter.getFilename().toLowerCase(Locale.ROOT);
            final String pattern = "%" + escapeLike(needle) + "%";
            predicates.add(cb.or(
                    filenameLike(cb, job.<String>get("txtFilename"), pattern, filter.isCaseSensitive()),
                    filenameLike(cb, job.<String>get("csvFilename"), pattern, filter.isCaseSensitive()),
                    filenameLike(cb, job.<String>get("docxFilename"), pattern, filter.isCaseSensitive())));
        }
        if (filter.getFrom() != null) {
            predicates.add(cb.greaterThanOrEqualTo(job.<LocalDateTime>get("uploadTimestamp"), filter.getFrom()));
        }
        if (filter.getTo() != null) {
            predicates.add(cb.lessThanOrEqualTo(job.<LocalDateTime>get("uploadTimestamp"), filter.getTo()));
        }
        return predicates;
    }

    private static Predicate filenameLike(final CriteriaBuilder cb, final Expression<String> column,
                                          final String pattern, final boolean caseSensitive) {
        return caseSensitive
                ? cb.like(column, pattern, LIKE_ESCAPE)
                : cb.like(cb.lower(column), pattern, LIKE_ESCAPE);
    }

    private static String escapeLike(final String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
