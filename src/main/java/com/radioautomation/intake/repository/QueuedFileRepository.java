package com.radioautomation.intake.repository;

import com.radioautomation.intake.model.FileStatus;
import com.radioautomation.intake.model.QueuedFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link QueuedFile} entity.
 */
@Repository
public interface QueuedFileRepository extends JpaRepository<QueuedFile, String> {

    List<QueuedFile> findAllByOrderByAddedAtAsc();

    List<QueuedFile> findByStatusOrderByAddedAtAsc(FileStatus status);

    List<QueuedFile> findByStatusAndUpdatedAtBefore(FileStatus status, LocalDateTime threshold);

    boolean existsByShowIdAndFilename(String showId, String filename);

    long deleteByStatus(FileStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update QueuedFile q set q.status = :newStatus, q.updatedAt = :now, q.version = q.version + 1 "
           + "where q.id = :id and q.status = :expectedStatus")
    int updateStatusIfExpected(@Param("id") String id, @Param("expectedStatus") FileStatus expectedStatus,
                               @Param("newStatus") FileStatus newStatus, @Param("now") LocalDateTime now);

    /**
     * Writes the outcome of a processing attempt, but only while the record is still in the expected status.
     *
     * @return The number of updated rows: 1 if the outcome was written, 0 otherwise.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update QueuedFile q set q.status = :newStatus, q.outputPath = :outputPath, "
           + "q.errorMessage = :errorMessage, q.processingTimeMs = :processingTimeMs, "
           + "q.bytesProcessed = :bytesProcessed, q.conflictResolved = :conflictResolved, "
           + "q.processedAt = :processedAt, q.updatedAt = :now, q.version = q.version + 1 "
           + "where q.id = :id and q.status = :expectedStatus")
    int recordOutcomeIfExpected(@Param("id") String id, @Param("expectedStatus") FileStatus expectedStatus,
                                @Param("newStatus") FileStatus newStatus, @Param("outputPath") String outputPath,
                                @Param("errorMessage") String errorMessage,
                                @Param("processingTimeMs") Long processingTimeMs,
                                @Param("bytesProcessed") Long bytesProcessed,
                                @Param("conflictResolved") boolean conflictResolved,
                                @Param("processedAt") LocalDateTime processedAt, @Param("now") LocalDateTime now);

    /**
     * Moves a record to a new status and wipes the outcome of its previous attempt in one statement.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update QueuedFile q set q.status = :newStatus, q.outputPath = null, q.errorMessage = null, "
           + "q.processingTimeMs = null, q.bytesProcessed = null, q.conflictResolved = false, "
           + "q.processedAt = null, q.updatedAt = :now, q.version = q.version + 1 "
           + "where q.id = :id and q.status = :expectedStatus")
    int resetResultIfExpected(@Param("id") String id, @Param("expectedStatus") FileStatus expectedStatus,
                              @Param("newStatus") FileStatus newStatus, @Param("now") LocalDateTime now);
}
