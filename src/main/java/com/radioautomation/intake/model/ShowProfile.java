package com.radioautomation.intake.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration describing which files to watch for on behalf of a show and where to put the processed output.
 * Read-only to the intake engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShowProfile {

    @NotBlank
    private String id;

    @NotBlank
    private String name;

    private boolean enabled;

    private boolean autoProcessing;

    @Valid
    @Builder.Default
    private List<FilePattern> filePatterns = new ArrayList<>();

    private String outputDirectory;

    /**
     * Optional template such as {@code {showName}_{YYYY}-{MM}-{DD}}. Without one the output is named after the show.
     */
    private String outputFilenameTemplate;

    public List<FilePattern> getWatchPatterns() {
        return filePatterns.stream().filter(FilePattern::isWatchPattern).toList();
    }
}
