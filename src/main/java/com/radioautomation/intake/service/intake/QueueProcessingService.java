package com.radioautomation.intake.service.intake;

import com.radioautomation.intake.catalog.ShowCatalog;
import com.radioautomation.intake.exception.IntakeErrorCode;
import com.radioautomation.intake.model.FileStatus;
import com.radioautomation.intake.model.QueuedFile;
import com.radioautomation.intake.model.ShowProfile;
import com.radioautomation.intake.service.relocation.FileRelocator;
import com.radioautomation.intake.service.relocation.RelocationResult;
import com.radioautomation.intake.store.QueueItemUpdate;
import com.radioautomation.intake.store.QueueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs one processing attempt for a queued file: {@code PENDING -> PROCESSING -> COMPLETED | FAILED}.
 * <p>
 * The record is claimed with an atomic status transition before any I/O, so a file is never processed by two
 * attempts at once. The outcome is only written while the record is still PROCESSING. Ids with an attempt
 * running in this process are tracked so that stale-record recovery leaves them alone.
 * A failure is recorded on the record and never propagates to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueProcessingService {

    private final QueueStore queueStore;
    private final ShowCatalog showCatalog;
    private final FileRelocator fileRelocator;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * Processes a pending file.
     *
     * @param fileId The id of the queued file.
     * @return The record after the attempt, or empty if the attempt was not made because the record or its show
     * is missing, or because the record was not pending.
     */
    public Optional<QueuedFile> processFile(final String fileId) {
        final Optional<QueuedFile> queued = queueStore.findById(fileId);
        if (queued.isEmpty()) {
            log.error("File {} not found in queue", fileId);
            return Optional.empty();
        }
        final QueuedFile file = queued.get();

        final Optional<ShowProfile> owningShow = showCatalog.getShow(file.getShowId());
        if (owningShow.isEmpty()) {
            log.error("Show {} of queued file {} ('{}') not found, leaving the record untouched.", file.getShowId(),
                      fileId, file.getFilename());
            return Optional.empty();
        }

        if (!inFlight.add(fileId)) {
            log.debug("Skipping file {}: an attempt is already running.", fileId);
            return Optional.empty();
        }
        try {
            if (!queueStore.transitionStatus(fileId, FileStatus.PENDING, FileStatus.PROCESSING)) {
                log.debug("Skipping file {}: it is not pending (status was {}).", fileId, file.getStatus());
                return Optional.empty();
            }
            return runAttempt(file, owningShow.get());
        } finally {
            inFlight.remove(fileId);
        }
    }

    /**
     * @return {@code true} while an attempt for the file is running in this process.
     */
    public boolean isInFlight(final String fileId) {
        return inFlight.contains(fileId);
    }

    private Optional<QueuedFile> runAttempt(final QueuedFile file, final ShowProfile show) {
        final String fileId = file.getId();
        log.info("Processing file: {}", file.getFilename());
        final long startNanos = System.nanoTime();
        RelocationResult result;
        try {
            result = fileRelocator.relocate(Paths.get(file.getSourcePath()), show);
        } catch (RuntimeException e) {
            log.error("Unexpected error while relocating file {}", fileId, e);
            result = RelocationResult.failure(IntakeErrorCode.UNKNOWN_PROCESSING_ERROR,
                                              e.getMessage() != null ? e.getMessage() : "Unknown error");
        }
        final long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        final QueueItemUpdate outcome;
        if (result.isSuccess()) {
            log.info("Successfully processed: {} -> {}", file.getFilename(), result.getOutputPath());
            outcome = QueueItemUpdate.builder()
                                     .status(FileStatus.COMPLETED)
                                     .outputPath(result.getOutputPath().toString())
                                     .bytesProcessed(result.getBytesProcessed())
                                     .conflictResolved(result.isConflictResolved())
                                     .processedAt(LocalDateTime.now(clock))
                                     .processingTimeMs(elapsedMs)
                                     .build();
        } else {
            log.error("Failed to process {} ({}): {}", file.getFilename(), result.getErrorCode(),
                      result.getErrorMessage());
            outcome = QueueItemUpdate.builder()
                                     .status(FileStatus.FAILED)
                                     .errorMessage(result.getErrorMessage())
                                     .processedAt(LocalDateTime.now(clock))
                                     .processingTimeMs(elapsedMs)
                                     .build();
        }

        final Optional<QueuedFile> recorded = queueStore.recordOutcome(fileId, FileStatus.PROCESSING, outcome);
        if (recorded.isEmpty()) {
            log.warn("Outcome {} of file {} was discarded: the record left PROCESSING during the attempt.",
                     outcome.getStatus(), fileId);
            return queueStore.findById(fileId);
        }
        return recorded;
    }
}
