package com.radioautomation.intake.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilePattern {

    private String id;

    /**
     * Glob-style pattern: {@code *} any run of characters, {@code ?} a single character.
     */
    @NotBlank
    private String pattern;

    @Builder.Default
    private PatternSourceType type = PatternSourceType.WATCH;

    /**
     * Directory watched for this pattern. Falls back to the global watch directory when blank.
     */
    private String watchPath;

    public boolean isWatchPattern() {
        return type == PatternSourceType.WATCH;
    }
}
