package com.radioautomation.intake.store;

import com.radioautomation.intake.exception.DuplicateQueueEntryException;
import com.radioautomation.intake.model.FileStatus;
import com.radioautomation.intake.model.QueuedFile;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable mapping of queued-file records keyed by id, and the single source of truth for queue state.
 * Implementations must apply every insert and update to a single record atomically.
 */
public interface QueueStore {

    /**
     * @return every record, oldest first.
     */
    List<QueuedFile> getQueue();

    Optional<QueuedFile> findById(String id);

    List<QueuedFile> findByStatus(FileStatus status);

    /**
     * @return records in the given status whose last update happened before the threshold.
     */
    List<QueuedFile> findByStatusUpdatedBefore(FileStatus status, LocalDateTime threshold);

    boolean existsByShowAndFilename(String showId, String filename);

    /**
     * Inserts a new record and assigns its id.
     *
     * @param draft The record to insert. Any id it carries is replaced.
     * @return The stored record.
     * @throws DuplicateQueueEntryException if the show already has a record for the same filename.
     */
    QueuedFile addToQueue(QueuedFile draft);

    /**
     * Applies the non-null fields of the update to the record.
     *
     * @return The updated record, or empty if no record has that id.
     * @throws org.springframework.dao.OptimisticLockingFailureException if the record was changed concurrently.
     */
    Optional<QueuedFile> updateQueueItem(String id, QueueItemUpdate update);

    /**
     * Atomically writes the status and every result field of the update, provided the record is still in the
     * expected status. Unset result fields are cleared.
     *
     * @return The updated record, or empty if the record is missing or no longer in the expected status.
     */
    Optional<QueuedFile> recordOutcome(String id, FileStatus expected, QueueItemUpdate outcome);

    /**
     * Atomically moves a FAILED record back to PENDING and clears the outcome of its last attempt.
     *
     * @return {@code true} if the record was FAILED and has been reset.
     */
    boolean resetForRetry(String id);

    /**
     * Atomically moves a record from one status to another.
     *
     * @return {@code true} if the record was in the expected status and has been moved.
     */
    boolean transitionStatus(String id, FileStatus expected, FileStatus next);

    boolean removeFromQueue(String id);

    void clearQueue();

    /**
     * Removes every completed record.
     *
     * @return The number of records removed.
     */
    int clearCompleted();
}
