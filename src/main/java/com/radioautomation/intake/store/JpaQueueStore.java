package com.radioautomation.intake.store;

import com.radioautomation.intake.exception.DuplicateQueueEntryException;
import com.radioautomation.intake.model.FileStatus;
import com.radioautomation.intake.model.QueuedFile;
import com.radioautomation.intake.repository.QueuedFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link QueueStore} backed by the {@code queued_file} table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaQueueStore implements QueueStore {

    private final QueuedFileRepository queuedFileRepository;
    private final QueuedFileAtomicService queuedFileAtomicService;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<QueuedFile> getQueue() {
        return queuedFileRepository.findAllByOrderByAddedAtAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<QueuedFile> findById(final String id) {
        return queuedFileRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueuedFile> findByStatus(final FileStatus status) {
        return queuedFileRepository.findByStatusOrderByAddedAtAsc(status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueuedFile> findByStatusUpdatedBefore(final FileStatus status, final LocalDateTime threshold) {
        return queuedFileRepository.findByStatusAndUpdatedAtBefore(status, threshold);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByShowAndFilename(final String showId, final String filename) {
        return queuedFileRepository.existsByShowIdAndFilename(showId, filename);
    }

    @Override
    public QueuedFile addToQueue(final QueuedFile draft) {
        draft.setId(UUID.randomUUID().toString());
        if (draft.getStatus() == null) {
            draft.setStatus(FileStatus.PENDING);
        }
        try {
            final QueuedFile saved = queuedFileAtomicService.attemptToCreate(draft);
            log.debug("Inserted queue record {} for '{}' (show {})", saved.getId(), saved.getFilename(),
                      saved.getShowId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateQueueEntryException(draft.getShowId(), draft.getFilename(), e);
        }
    }

    @Override
    @Transactional
    public Optional<QueuedFile> updateQueueItem(final String id, final QueueItemUpdate update) {
        return queuedFileRepository.findById(id).map(file -> {
            if (update.getStatus() != null) {
                file.setStatus(update.getStatus());
            }
            if (update.getOutputPath() != null) {
                file.setOutputPath(update.getOutputPath());
            }
            if (update.getErrorMessage() != null) {
                file.setErrorMessage(update.getErrorMessage());
            }
            if (update.getProcessingTimeMs() != null) {
                file.setProcessingTimeMs(update.getProcessingTimeMs());
            }
            if (update.getBytesProcessed() != null) {
                file.setBytesProcessed(update.getBytesProcessed());
            }
            if (update.getConflictResolved() != null) {
                file.setConflictResolved(update.getConflictResolved());
            }
            if (update.getProcessedAt() != null) {
                file.setProcessedAt(update.getProcessedAt());
            }
            final QueuedFile saved = queuedFileRepository.save(file);
            log.debug("Updated queue record {} to status {}", id, saved.getStatus());
            return saved;
        });
    }

    @Override
    @Transactional
    public boolean transitionStatus(final String id, final FileStatus expected, final FileStatus next) {
        return queuedFileRepository.updateStatusIfExpected(id, expected, next, LocalDateTime.now(clock)) == 1;
    }

    @Override
    @Transactional
    public Optional<QueuedFile> recordOutcome(final String id, final FileStatus expected,
                                              final QueueItemUpdate outcome) {
        final int updated = queuedFileRepository.recordOutcomeIfExpected(
                id, expected, outcome.getStatus(), outcome.getOutputPath(), outcome.getErrorMessage(),
                outcome.getProcessingTimeMs(), outcome.getBytesProcessed(),
                Boolean.TRUE.equals(outcome.getConflictResolved()), outcome.getProcessedAt(),
                LocalDateTime.now(clock));
        if (updated == 0) {
            log.debug("Outcome {} for record {} not written: it is not {}", outcome.getStatus(), id, expected);
            return Optional.empty();
        }
        return queuedFileRepository.findById(id);
    }

    @Override
    @Transactional
    public boolean resetForRetry(final String id) {
        return queuedFileRepository.resetResultIfExpected(id, FileStatus.FAILED, FileStatus.PENDING,
                                                          LocalDateTime.now(clock)) == 1;
    }

    @Override
    @Transactional
    public boolean removeFromQueue(final String id) {
        if (!queuedFileRepository.existsById(id)) {
            return false;
        }
        queuedFileRepository.deleteById(id);
        return true;
    }

    @Override
    @Transactional
    public void clearQueue() {
        queuedFileRepository.deleteAllInBatch();
    }

    @Override
    @Transactional
    public int clearCompleted() {
        return (int) queuedFileRepository.deleteByStatus(FileStatus.COMPLETED);
    }
}
