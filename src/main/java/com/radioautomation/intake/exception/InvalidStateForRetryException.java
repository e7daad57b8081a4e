package com.radioautomation.intake.exception;

import com.radioautomation.intake.model.FileStatus;

import java.io.Serial;

public class InvalidStateForRetryException extends IntakeException {
    @Serial
    private static final long serialVersionUID = -3824510983470018245L;

    public InvalidStateForRetryException(String fileId, FileStatus currentStatus) {
        super(IntakeErrorCode.INVALID_STATE_FOR_RETRY,
              "Cannot retry: file " + fileId + " is not in a FAILED state. Current state: " + currentStatus);
    }
}
