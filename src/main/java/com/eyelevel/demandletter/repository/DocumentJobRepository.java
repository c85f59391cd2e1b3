package com.eyelevel.demandletter.repository;

import com.eyelevel.demandletter.model.DocumentJob;
import com.eyelevel.demandletter.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link DocumentJob} entity.
 */
@Repository
public interface DocumentJobRepository extends JpaRepository<DocumentJob, Long>, DocumentJobHistoryRepository {

    /**
     * Reads the polling-relevant columns of a job.
     *
     * @param id The job ID.
     * @return The status view, or empty if the job does not exist.
     */
    Optional<JobStatusView> findStatusViewById(Long id);

    /**
     * Attaches the generated document and moves the job to {@code COMPLETED}, but only while it is
     * still in {@code expected}. Returns the number of updated rows, so 0 means the job was unknown or
     * already terminal.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE DocumentJob j
               SET j.status = :completed, j.docxFilename = :docxFilename, j.docxContent = :docxContent,
                   j.errorMessage = null, j.updatedAt = :now
             WHERE j.id = :id AND j.status = :expected
            """)
    int markCompleted(@Param("id") Long id,
                      @Param("docxFilename") String docxFilename,
                      @Param("docxContent") byte[] docxContent,
                      @Param("now") LocalDateTime now,
                      @Param("expected") JobStatus expected,
                      @Param("completed") JobStatus completed);

    /**
     * Moves the job to {@code FAILED} with a reason, only while it is still in {@code expected}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE DocumentJob j
               SET j.status = :failed, j.errorMessage = :reason, j.updatedAt = :now
             WHERE j.id = :id AND j.status = :expected
            """)
    int markFailed(@Param("id") Long id,
                   @Param("reason") String reason,
                   @Param("now") LocalDateTime now,
                   @Param("expected") JobStatus expected,
                   @Param("failed") JobStatus failed);

    @Query("SELECT j.id FROM DocumentJob j WHERE j.status = :status ORDER BY j.id")
    List<Long> findIdsByStatus(@Param("status") JobStatus status);
}
