package com.radioautomation.intake.service.intake;

/**
 * One file that could not be processed during a bulk run.
 */
public record ProcessingFailure(String fileId, String filename, String errorMessage) {
}
