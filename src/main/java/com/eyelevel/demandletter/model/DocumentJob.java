package com.eyelevel.demandletter.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * One upload's full lifecycle record: the two source files, the processing status and,
 * once completed, the generated document.
 */
@Entity
@Table(name = "document_job", indexes = {
        @Index(name = "idx_document_job_status", columnList = "status"),
        @Index(name = "idx_document_job_upload_timestamp", columnList = "upload_timestamp")
})
@Data
public class DocumentJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String txtFilename;

    @Column(nullable = false)
    private String csvFilename;

    @Lob
    @Column(nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private String txtContent;

    @Lob
    @Column(nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private String csvContent;

    /**
     * Set only when the job completes.
     */
    @Column
    private String docxFilename;

    /**
     * Present if and only if {@link #status} is {@link JobStatus#COMPLETED}.
     */
    @Lob
    @Column
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private byte[] docxContent;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status = JobStatus.PROCESSING;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "upload_timestamp", nullable = false, updatable = false)
    private LocalDateTime uploadTimestamp;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Transient
    public boolean hasArtifact() {
        return docxContent != null && docxContent.length > 0;
    }
}
