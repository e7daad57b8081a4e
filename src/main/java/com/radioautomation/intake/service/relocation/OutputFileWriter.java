package com.radioautomation.intake.service.relocation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Writes relocated files to their destination. Never replaces an existing file.
 */
@Slf4j
@Component
public class OutputFileWriter {

    /**
     * Copies the source file byte-for-byte to a destination that must not exist yet.
     * Transient I/O failures are retried; permission, missing-file and name-collision errors are not.
     *
     * @param source      The file to copy.
     * @param destination The destination path.
     * @return The number of bytes written.
     * @throws FileAlreadyExistsException if the destination was created concurrently.
     * @throws IOException                if the copy failed. A partially written destination is removed first.
     */
    @Retryable(
            retryFor = {IOException.class},
            noRetryFor = {FileAlreadyExistsException.class, AccessDeniedException.class, NoSuchFileException.class},
            maxAttemptsExpression = "#{${app.intake.relocation.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.intake.relocation.retry.delay-ms:250}}"),
            listeners = {"relocationRetryListener"}
    )
    public long copy(final Path source, final Path destination) throws IOException {
        log.debug("Copying file: {} -> {}", source, destination);
        try {
            transfer(source, destination);
        } catch (FileAlreadyExistsException e) {
            throw e;
        } catch (IOException e) {
            deletePartialOutput(destination);
            throw e;
        }
        final long bytes = Files.size(destination);
        log.debug("File copy completed: {} ({} bytes)", destination, bytes);
        return bytes;
    }

    /**
     * Moves the bytes. Fails with {@link FileAlreadyExistsException} when the destination exists.
     */
    protected void transfer(final Path source, final Path destination) throws IOException {
        Files.copy(source, destination);
    }

    private void deletePartialOutput(final Path destination) {
        try {
            if (Files.deleteIfExists(destination)) {
                log.warn("Removed partially written output file {}", destination);
            }
        } catch (IOException cleanupError) {
            log.error("Could not remove partially written output file {}", destination, cleanupError);
        }
    }
}
