package com.radioautomation.intake.exception;

import java.io.Serial;

public class QueuedFileNotFoundException extends IntakeException {
    @Serial
    private static final long serialVersionUID = 6470149253640151127L;

    public QueuedFileNotFoundException(String fileId) {
        super(IntakeErrorCode.FILE_NOT_FOUND, "File " + fileId + " not found in queue");
    }
}
