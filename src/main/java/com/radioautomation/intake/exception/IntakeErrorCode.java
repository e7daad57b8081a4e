package com.radioautomation.intake.exception;

/**
 * Error taxonomy shared by per-file failures recorded on queue records and by exceptions thrown to callers.
 */
public enum IntakeErrorCode {
    SOURCE_NOT_FOUND,
    UNSUPPORTED_EXTENSION,
    TOO_MANY_CONFLICTS,
    INVALID_STATE_FOR_RETRY,
    FILE_NOT_FOUND,
    WATCHER_ERROR,
    UNKNOWN_PROCESSING_ERROR
}
