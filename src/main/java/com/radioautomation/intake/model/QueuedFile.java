package com.radioautomation.intake.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "queued_file",
       uniqueConstraints = @UniqueConstraint(name = "uk_queued_file_show_filename", columnNames = {"show_id", "filename"}),
       indexes = @Index(name = "idx_queued_file_status", columnList = "status"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueuedFile {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String filename;

    @Column(name = "show_id", nullable = false)
    private String showId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FileStatus status;

    @Column(nullable = false, length = 2048)
    private String sourcePath;

    @Column(length = 2048)
    private String outputPath;

    @Column(length = 4000)
    private String errorMessage;

    private Long processingTimeMs;

    private Long bytesProcessed;

    /**
     * Set when the output name had to be suffixed because the computed destination already existed.
     */
    private boolean conflictResolved;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime addedAt;

    private LocalDateTime processedAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    /**
     * Bumped by every write, including the conditional status updates, so a stale read-modify-write fails
     * instead of overwriting a newer state.
     */
    @Version
    private Long version;
}
