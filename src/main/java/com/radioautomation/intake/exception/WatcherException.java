package com.radioautomation.intake.exception;

import java.io.Serial;

public class WatcherException extends IntakeException {
    @Serial
    private static final long serialVersionUID = -1107925306155930628L;

    public WatcherException(String message) {
        super(IntakeErrorCode.WATCHER_ERROR, message);
    }

    public WatcherException(String message, Throwable cause) {
        super(IntakeErrorCode.WATCHER_ERROR, message, cause);
    }
}
