package com.radioautomation.intake.config;

import com.radioautomation.intake.model.ShowProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds application properties under the "app.intake" prefix to a strongly-typed
 * configuration object. Environment-level settings (allowed extensions, debounce interval,
 * default directories) are passed to the engine from here rather than hard-coded.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.intake")
public class IntakeProperties {

    /**
     * Start watching every enabled auto-processing show once the application is ready.
     */
    private boolean autoStart = true;

    @NotEmpty
    private List<String> allowedExtensions = new ArrayList<>(List.of("mp3", "wav", "flac", "aac", "m4a"));

    /**
     * Used when a show does not define its own output directory.
     */
    @NotBlank
    private String defaultOutputDirectory = "Output";

    /**
     * Used by watch patterns that do not define their own watch path.
     */
    @NotBlank
    private String globalWatchDirectory = "Watch";

    @Min(1)
    private int maxConflictAttempts = 1000;

    /**
     * Records stuck in PROCESSING longer than this are marked FAILED by the recovery scheduler.
     */
    @Positive
    private long staleProcessingMinutes = 30;

    @Valid
    private Watch watch = new Watch();
    @Valid
    private Relocation relocation = new Relocation();
    @Valid
    private List<ShowProfile> shows = new ArrayList<>();

    @Data
    public static class RetryConfig {
        @Min(0)
        private int attempts;
        @Min(0)
        private long delayMs;
    }

    @Data
    public static class Watch {
        @NotNull
        private Duration pollInterval = Duration.ofMillis(500);
        @NotNull
        private Duration stabilityThreshold = Duration.ofSeconds(2);
        @NotNull
        private Duration stopTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Relocation {
        @Valid
        private RetryConfig retry = new RetryConfig();
    }
}
