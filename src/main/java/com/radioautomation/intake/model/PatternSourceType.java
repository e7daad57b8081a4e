package com.radioautomation.intake.model;

/**
 * Indicates where the files described by a {@link FilePattern} come from.
 */
public enum PatternSourceType {
    /**
     * Files dropped into a watched directory. Only these patterns take part in directory watching.
     */
    WATCH,

    /**
     * Files fetched from an FTP source by an external collaborator.
     */
    FTP
}
