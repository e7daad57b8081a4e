package com.radioautomation.intake.service.watch;

import com.radioautomation.intake.model.ShowProfile;

import java.nio.file.Path;

/**
 * Receives files a {@link ShowDirectoryWatcher} has seen appear and settle.
 */
@FunctionalInterface
public interface DetectedFileHandler {

    /**
     * Called on the show's worker thread, one file at a time, in the order the files became stable.
     *
     * @param show The show whose watcher reported the file.
     * @param path The detected file.
     */
    void onFileAppeared(ShowProfile show, Path path);
}
