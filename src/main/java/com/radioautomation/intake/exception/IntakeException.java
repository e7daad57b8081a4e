package com.radioautomation.intake.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * A base exception for errors raised by the intake engine. Each instance carries the {@link IntakeErrorCode}
 * describing the failure category.
 */
@Getter
public class IntakeException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2291836412285531479L;

    private final IntakeErrorCode errorCode;

    public IntakeException(IntakeErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public IntakeException(IntakeErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
