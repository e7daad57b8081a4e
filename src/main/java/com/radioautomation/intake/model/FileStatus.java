package com.radioautomation.intake.model;

/**
 * Defines the possible states for a {@link QueuedFile} during its processing lifecycle.
 * <p>
 * {@code PENDING -> PROCESSING -> COMPLETED | FAILED}, and {@code FAILED -> PENDING} on an explicit retry.
 */
public enum FileStatus {
    /**
     * The file has been detected and is waiting to be processed.
     */
    PENDING,
    /**
     * A processing attempt has claimed the file and is relocating it.
     */
    PROCESSING,
    /**
     * The file was relocated to the show's output directory.
     */
    COMPLETED,
    /**
     * Validation or relocation failed. The record keeps the error message until it is retried or removed.
     */
    FAILED
}
