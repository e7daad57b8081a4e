package com.radioautomation.intake.service.relocation;

import com.radioautomation.intake.exception.IntakeErrorCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Outcome of a single relocation. Either carries the output path and the number of bytes written,
 * or the error code and message describing why the file could not be relocated.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RelocationResult {

    private final boolean success;
    private final Path outputPath;
    private final long bytesProcessed;
    private final boolean conflictResolved;
    private final IntakeErrorCode errorCode;
    private final String errorMessage;

    public static RelocationResult success(final Path outputPath, final long bytesProcessed,
                                           final boolean conflictResolved) {
        return new RelocationResult(true, outputPath, bytesProcessed, conflictResolved, null, null);
    }

    public static RelocationResult failure(final IntakeErrorCode errorCode, final String errorMessage) {
        return new RelocationResult(false, null, 0L, false, errorCode, errorMessage);
    }
}
