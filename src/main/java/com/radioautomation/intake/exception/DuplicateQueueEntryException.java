package com.radioautomation.intake.exception;

import java.io.Serial;

/**
 * Thrown by the queue store when a record for the same show and filename already exists.
 */
public class DuplicateQueueEntryException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public DuplicateQueueEntryException(String showId, String filename, Throwable cause) {
        super("File " + filename + " is already queued for show " + showId, cause);
    }
}
