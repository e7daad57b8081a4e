package com.radioautomation.intake.service.intake;

import com.radioautomation.intake.catalog.ShowCatalog;
import com.radioautomation.intake.exception.DuplicateQueueEntryException;
import com.radioautomation.intake.exception.InvalidStateForRetryException;
import com.radioautomation.intake.exception.QueuedFileNotFoundException;
import com.radioautomation.intake.model.FilePattern;
import com.radioautomation.intake.model.FileStatus;
import com.radioautomation.intake.model.QueuedFile;
import com.radioautomation.intake.model.ShowProfile;
import com.radioautomation.intake.service.pattern.PatternMatcher;
import com.radioautomation.intake.service.watch.DetectedFileHandler;
import com.radioautomation.intake.service.watch.ShowDirectoryWatcher;
import com.radioautomation.intake.service.watch.ShowWatcherFactory;
import com.radioautomation.intake.store.QueueStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates the intake pipeline: owns one {@link ShowDirectoryWatcher} per watched show, turns detected files
 * into queue records and drives them through {@link QueueProcessingService}.
 * <p>
 * Starting and stopping a show's watcher happen under a per-show lock, so a watcher is always closed before
 * its replacement starts. Failures of individual files are recorded on their queue records; only caller errors
 * such as retrying an unknown or non-failed file are thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntakeQueueEngine implements DetectedFileHandler {

    private final ShowCatalog showCatalog;
    private final QueueStore queueStore;
    private final PatternMatcher patternMatcher;
    private final QueueProcessingService queueProcessingService;
    private final ShowWatcherFactory showWatcherFactory;

    private final Map<String, ShowDirectoryWatcher> watchers = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> showLocks = new ConcurrentHashMap<>();
    private volatile boolean running;

    /**
     * Starts watching every enabled show that has auto-processing turned on.
     */
    public void initialize() {
        log.info("Initializing file watcher service...");
        final List<String> showIds = showCatalog.getAllShows().stream()
                                                .filter(show -> show.isEnabled() && show.isAutoProcessing())
                                                .map(ShowProfile::getId)
                                                .toList();
        startWatchingShows(showIds);
        log.info("File watcher initialized with {} show(s)", showIds.size());
    }

    /**
     * Starts (or restarts) the watcher of each listed show. Unknown, disabled and non-watchable shows are skipped
     * with a warning.
     *
     * @param showIds The shows to watch.
     */
    public void startWatchingShows(final List<String> showIds) {
        log.info("Starting to watch {} show(s)", showIds.size());
        for (final String showId : showIds) {
            startWatchingShow(showId);
        }
        running = true;
        log.info("File watching started");
    }

    /**
     * Stops and forgets every active watcher. In-flight processing attempts run to completion.
     * Safe to call when nothing is being watched.
     */
    public void stopWatching() {
        log.info("Stopping file watchers...");
        for (final String showId : List.copyOf(watchers.keySet())) {
            stopWatchingShow(showId);
        }
        running = false;
        log.info("All file watchers stopped");
    }

    @PreDestroy
    public void stop() {
        stopWatching();
    }

    /**
     * Puts a failed file back into the queue and processes it again straight away.
     *
     * @param fileId The id of the queued file.
     * @return The record after the new attempt.
     * @throws QueuedFileNotFoundException    if no record has that id.
     * @throws InvalidStateForRetryException if the record is not in the FAILED state.
     */
    public QueuedFile retryFile(final String fileId) {
        final QueuedFile file = queueStore.findById(fileId)
                                          .orElseThrow(() -> new QueuedFileNotFoundException(fileId));
        if (file.getStatus() != FileStatus.FAILED) {
            throw new InvalidStateForRetryException(fileId, file.getStatus());
        }

        log.info("Retrying file: {}", file.getFilename());
        if (!queueStore.resetForRetry(fileId)) {
            final FileStatus current = queueStore.findById(fileId)
                                                 .map(QueuedFile::getStatus)
                                                 .orElseThrow(() -> new QueuedFileNotFoundException(fileId));
            throw new InvalidStateForRetryException(fileId, current);
        }

        return queueProcessingService.processFile(fileId)
                                     .or(() -> queueStore.findById(fileId))
                                     .orElseThrow(() -> new QueuedFileNotFoundException(fileId));
    }

    /**
     * Processes every pending record, one after another.
     *
     * @return One entry per file that ended up failed or could not be processed at all.
     */
    public List<ProcessingFailure> processPending() {
        final List<QueuedFile> pending = queueStore.findByStatus(FileStatus.PENDING);
        log.info("Processing {} pending file(s)", pending.size());

        final List<ProcessingFailure> failures = new ArrayList<>();
        for (final QueuedFile file : pending) {
            try {
                final Optional<QueuedFile> outcome = queueProcessingService.processFile(file.getId());
                if (outcome.isPresent() && outcome.get().getStatus() == FileStatus.FAILED) {
                    failures.add(new ProcessingFailure(file.getId(), file.getFilename(),
                                                       outcome.get().getErrorMessage()));
                } else if (outcome.isEmpty() && showCatalog.getShow(file.getShowId()).isEmpty()) {
                    failures.add(new ProcessingFailure(file.getId(), file.getFilename(),
                                                       "Show " + file.getShowId() + " not found"));
                }
            } catch (RuntimeException e) {
                log.error("Error processing pending file {}", file.getId(), e);
                failures.add(new ProcessingFailure(file.getId(), file.getFilename(), e.getMessage()));
            }
        }
        log.info("Processed {} pending file(s), {} failure(s)", pending.size(), failures.size());
        return failures;
    }

    /**
     * Queues a file for a show outside of directory watching and processes it.
     *
     * @param showId     The owning show.
     * @param sourcePath The file to queue.
     * @return The record after processing, or empty if the file does not match the show's patterns or is
     * already queued.
     * @throws IllegalArgumentException if the show is unknown.
     */
    public Optional<QueuedFile> enqueue(final String showId, final Path sourcePath) {
        final ShowProfile show = showCatalog.getShow(showId)
                                            .orElseThrow(() -> new IllegalArgumentException(
                                                    "Show " + showId + " not found"));
        return enqueueIfAbsent(show, sourcePath).flatMap(file -> queueProcessingService.processFile(file.getId()));
    }

    @Override
    public void onFileAppeared(final ShowProfile show, final Path path) {
        log.info("New file detected: {} for show: {}", path.getFileName(), show.getName());
        enqueueIfAbsent(show, path).ifPresent(file -> queueProcessingService.processFile(file.getId()));
    }

    /**
     * Reports the watching state. Has no side effects.
     */
    public WatcherStatus getStatus() {
        final List<String> active = watchers.keySet().stream().sorted().toList();
        return new WatcherStatus(running, active.size(), active);
    }

    public List<QueuedFile> getQueue() {
        return queueStore.getQueue();
    }

    public boolean removeFile(final String fileId) {
        final boolean removed = queueStore.removeFromQueue(fileId);
        if (removed) {
            log.info("Removed file from queue: {}", fileId);
        }
        return removed;
    }

    public void clearQueue() {
        queueStore.clearQueue();
        log.info("Queue cleared");
    }

    public int clearCompleted() {
        final int removed = queueStore.clearCompleted();
        log.info("Removed {} completed file(s) from the queue", removed);
        return removed;
    }

    private Optional<QueuedFile> enqueueIfAbsent(final ShowProfile show, final Path path) {
        final String filename = String.valueOf(path.getFileName());
        final Optional<FilePattern> pattern = patternMatcher.findMatchingPattern(filename, show.getFilePatterns());
        if (pattern.isEmpty()) {
            log.info("File {} doesn't match any pattern for show {}", filename, show.getName());
            return Optional.empty();
        }
        if (queueStore.existsByShowAndFilename(show.getId(), filename)) {
            log.info("File {} already in queue for show {}", filename, show.getName());
            return Optional.empty();
        }
        try {
            final QueuedFile queued = queueStore.addToQueue(QueuedFile.builder()
                                                                      .filename(filename)
                                                                      .showId(show.getId())
                                                                      .status(FileStatus.PENDING)
                                                                      .sourcePath(path.toAbsolutePath().toString())
                                                                      .build());
            log.info("Queued file {} for show {} (pattern '{}', id {})", filename, show.getName(),
                     pattern.get().getPattern(), queued.getId());
            return Optional.of(queued);
        } catch (DuplicateQueueEntryException e) {
            log.info("File {} was queued concurrently for show {}", filename, show.getName());
            return Optional.empty();
        }
    }

    private void startWatchingShow(final String showId) {
        final ReentrantLock lock = showLocks.computeIfAbsent(showId, id -> new ReentrantLock());
        lock.lock();
        try {
            final Optional<ShowProfile> show = showCatalog.getShow(showId);
            if (show.isEmpty() || !show.get().isEnabled()) {
                log.warn("Show {} not found or disabled", showId);
                return;
            }
            if (!show.get().isAutoProcessing()) {
                log.warn("Show {} has auto-processing turned off and will not be watched", showId);
                return;
            }
            if (show.get().getWatchPatterns().isEmpty()) {
                log.warn("No watch patterns found for show: {}", show.get().getName());
                return;
            }

            final ShowDirectoryWatcher previous = watchers.remove(showId);
            if (previous != null) {
                log.info("Replacing the running watcher of show {}", showId);
                previous.stop();
            }

            final ShowDirectoryWatcher watcher = showWatcherFactory.create(show.get(), this);
            try {
                watcher.start();
                watchers.put(showId, watcher);
            } catch (RuntimeException e) {
                log.error("Failed to start watching show {}", showId, e);
            }
        } finally {
            lock.unlock();
        }
    }

    private void stopWatchingShow(final String showId) {
        final ReentrantLock lock = showLocks.computeIfAbsent(showId, id -> new ReentrantLock());
        lock.lock();
        try {
            final ShowDirectoryWatcher watcher = watchers.remove(showId);
            if (watcher != null) {
                watcher.stop();
            }
        } finally {
            lock.unlock();
        }
    }
}
