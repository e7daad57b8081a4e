package com.radioautomation.intake.service.watch;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds back detected files until their size and modification time have stopped changing for the
 * configured quiet period, so partially written files are never reported.
 */
@Slf4j
public class FileStabilityTracker {

    private final Duration stabilityThreshold;
    private final Clock clock;
    private final Map<Path, Snapshot> candidates = new LinkedHashMap<>();

    public FileStabilityTracker(final Duration stabilityThreshold, final Clock clock) {
        this.stabilityThreshold = stabilityThreshold;
        this.clock = clock;
    }

    /**
     * Starts tracking a file. Files already being tracked keep their current quiet-period start.
     */
    public synchronized void observe(final Path path) {
        if (candidates.containsKey(path)) {
            return;
        }
        try {
            candidates.put(path, snapshot(path));
            log.debug("Tracking {} until it is stable for {} ms", path, stabilityThreshold.toMillis());
        } catch (NoSuchFileException e) {
            log.debug("File {} disappeared before it could be tracked", path);
        } catch (IOException e) {
            log.warn("Cannot read attributes of {}: {}", path, e.getMessage());
        }
    }

    public synchronized void forget(final Path path) {
        candidates.remove(path);
    }

    /**
     * Re-reads every tracked file and releases those whose size and modification time have not changed
     * for the quiet period. Files that vanished are dropped.
     *
     * @return The stable files, in the order they were first observed.
     */
    public synchronized List<Path> pollStableFiles() {
        final List<Path> stable = new ArrayList<>();
        final Iterator<Map.Entry<Path, Snapshot>> iterator = candidates.entrySet().iterator();
        while (iterator.hasNext()) {
            final Map.Entry<Path, Snapshot> entry = iterator.next();
            final Path path = entry.getKey();
            final Snapshot previous = entry.getValue();
            final Snapshot current;
            try {
                current = snapshot(path);
            } catch (IOException e) {
                log.debug("Dropping {} from stability tracking: {}", path, e.getMessage());
                iterator.remove();
                continue;
            }
            if (current.size() != previous.size() || current.lastModified() != previous.lastModified()) {
                entry.setValue(current);
            } else if (Duration.ofMillis(clock.millis() - previous.since()).compareTo(stabilityThreshold) >= 0) {
                iterator.remove();
                stable.add(path);
            }
        }
        return stable;
    }

    public synchronized int size() {
        return candidates.size();
    }

    private Snapshot snapshot(final Path path) throws IOException {
        final BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        return new Snapshot(attributes.size(), attributes.lastModifiedTime().toMillis(), clock.millis());
    }

    private record Snapshot(long size, long lastModified, long since) {
    }
}
