package com.radioautomation.intake.service.watch;

import com.radioautomation.intake.exception.WatcherException;
import com.radioautomation.intake.model.FilePattern;
import com.radioautomation.intake.model.ShowProfile;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.filefilter.HiddenFileFilter;
import org.apache.commons.io.monitor.FileAlterationListenerAdaptor;
import org.apache.commons.io.monitor.FileAlterationMonitor;
import org.apache.commons.io.monitor.FileAlterationObserver;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Observes the watch directories of one show and reports files once they have been stable for the quiet period.
 * <p>
 * One {@link FileAlterationMonitor} is created per show, holding one recursive observer per directory.
 * Stable files are put on the show's event queue and handed to the {@link DetectedFileHandler} by a single
 * worker, so the show's files are handled one at a time in the order they settled. Hidden files and
 * directories are ignored. Files already present when the watcher starts are reported as well.
 */
@Slf4j
public class ShowDirectoryWatcher {

    private static final Path STOP_SIGNAL = Paths.get(".stop-signal");

    @Getter
    private final ShowProfile show;
    @Getter
    private final List<Path> directories;
    private final DetectedFileHandler handler;
    private final Executor workerExecutor;
    private final FileStabilityTracker stabilityTracker;
    private final Duration pollInterval;
    private final Duration stopTimeout;

    private final BlockingQueue<Path> events = new LinkedBlockingQueue<>();
    private final Set<Path> missingDirectories = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private FileAlterationMonitor monitor;

    public ShowDirectoryWatcher(final ShowProfile show, final List<Path> directories,
                                final DetectedFileHandler handler, final Executor workerExecutor,
                                final FileStabilityTracker stabilityTracker, final Duration pollInterval,
                                final Duration stopTimeout) {
        this.show = show;
        this.directories = List.copyOf(directories);
        this.handler = handler;
        this.workerExecutor = workerExecutor;
        this.stabilityTracker = stabilityTracker;
        this.pollInterval = pollInterval;
        this.stopTimeout = stopTimeout;
    }

    /**
     * Creates any missing watch directory, queues the files already present and starts observing.
     *
     * @throws WatcherException if the underlying monitor could not be started.
     */
    public synchronized void start() {
        if (running.get()) {
            return;
        }
        final FileAlterationMonitor newMonitor = new FileAlterationMonitor(pollInterval.toMillis());
        newMonitor.setThreadFactory(daemonThreadFactory("show-monitor-" + show.getId() + "-"));
        final ObserverListener listener = new ObserverListener();

        for (final Path directory : directories) {
            try {
                Files.createDirectories(directory);
                log.info("Ensured watch directory exists: {}", directory);
            } catch (IOException e) {
                log.error("Failed to create watch directory {} for show '{}'", directory, show.getName(), e);
            }
            final FileAlterationObserver observer = new FileAlterationObserver(directory.toFile(),
                                                                               HiddenFileFilter.VISIBLE);
            observer.addListener(listener);
            newMonitor.addObserver(observer);
        }

        try {
            newMonitor.start();
        } catch (Exception e) {
            throw new WatcherException("Failed to start watcher for show " + show.getId(), e);
        }
        monitor = newMonitor;
        directories.forEach(this::trackExistingFiles);
        running.set(true);
        try {
            workerExecutor.execute(this::drainEvents);
        } catch (RuntimeException e) {
            stop();
            throw new WatcherException("No worker available for show " + show.getId(), e);
        }
        log.info("Started watching '{}': patterns {} in directories {}", show.getName(),
                 show.getWatchPatterns().stream().map(FilePattern::getPattern).toList(), directories);
    }

    /**
     * Closes the monitor and lets the worker finish the file it is currently handling. Files that were detected
     * but not yet handed over are dropped; they are picked up again by the initial scan of the next start.
     * Calling this on a stopped watcher does nothing.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            monitor.stop(stopTimeout.toMillis());
        } catch (Exception e) {
            log.warn("Error while closing the monitor of show '{}': {}", show.getName(), e.getMessage());
        }
        events.clear();
        events.offer(STOP_SIGNAL);
        log.info("Stopped watching show: {}", show.getId());
    }

    public boolean isRunning() {
        return running.get();
    }

    private void trackExistingFiles(final Path directory) {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    return !dir.equals(directory) && isHidden(dir)
                            ? FileVisitResult.SKIP_SUBTREE
                            : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !isHidden(file)) {
                        stabilityTracker.observe(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Cannot scan {} for show '{}': {}", file, show.getName(), exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.error("Error scanning directory {} for show '{}'", directory, show.getName(), e);
        }
    }

    private void drainEvents() {
        while (true) {
            final Path path;
            try {
                path = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Worker for show '{}' interrupted, no further files will be handled.", show.getName());
                return;
            }
            if (path == STOP_SIGNAL) {
                log.debug("Worker for show '{}' finished.", show.getName());
                return;
            }
            try {
                handler.onFileAppeared(show, path);
            } catch (RuntimeException e) {
                log.error("Error handling detected file {} for show '{}'", path, show.getName(), e);
            }
        }
    }

    private void publishStableFiles() {
        if (!running.get()) {
            return;
        }
        for (final Path path : stabilityTracker.pollStableFiles()) {
            log.debug("File {} is stable, queueing it for show '{}'", path, show.getName());
            events.offer(path);
        }
    }

    private void checkDirectory(final File directory) {
        final Path path = directory.toPath();
        if (!directory.isDirectory()) {
            if (missingDirectories.add(path)) {
                final WatcherException error = new WatcherException(
                        "Watch directory " + path + " of show " + show.getId() + " is no longer accessible");
                log.error("Watcher error for show '{}': {}", show.getName(), error.getMessage());
            }
        } else if (missingDirectories.remove(path)) {
            log.info("Watch directory {} of show '{}' is accessible again", path, show.getName());
        }
    }

    private static boolean isHidden(final Path path) {
        final Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    private static CustomizableThreadFactory daemonThreadFactory(final String prefix) {
        final CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(prefix);
        threadFactory.setDaemon(true);
        return threadFactory;
    }

    private final class ObserverListener extends FileAlterationListenerAdaptor {

        @Override
        public void onFileCreate(final File file) {
            log.debug("File added: {}", file);
            stabilityTracker.observe(file.toPath());
        }

        @Override
        public void onFileChange(final File file) {
            log.debug("File changed: {}", file);
            stabilityTracker.observe(file.toPath());
        }

        @Override
        public void onFileDelete(final File file) {
            log.debug("File removed: {}", file);
            stabilityTracker.forget(file.toPath());
        }

        @Override
        public void onStop(final FileAlterationObserver observer) {
            try {
                checkDirectory(observer.getDirectory());
                publishStableFiles();
            } catch (RuntimeException e) {
                log.error("Watcher error for show '{}'", show.getName(), e);
            }
        }
    }
}
