package com.radioautomation.intake.exception;

import java.io.Serial;

/**
 * Raised inside the relocation step. The relocator converts it into a failed result before returning.
 */
public class RelocationException extends IntakeException {
    @Serial
    private static final long serialVersionUID = 8151530272309921164L;

    public RelocationException(IntakeErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public RelocationException(IntakeErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
