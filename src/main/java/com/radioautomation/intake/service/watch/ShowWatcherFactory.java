package com.radioautomation.intake.service.watch;

import com.radioautomation.intake.config.IntakeProperties;
import com.radioautomation.intake.model.FilePattern;
import com.radioautomation.intake.model.ShowProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link ShowDirectoryWatcher} for a show from its watch patterns and the configured intervals.
 */
@Slf4j
@Component
public class ShowWatcherFactory {

    private final IntakeProperties properties;
    private final TaskExecutor watcherTaskExecutor;
    private final Clock clock;

    public ShowWatcherFactory(IntakeProperties properties,
                              @Qualifier("watcherTaskExecutor") TaskExecutor watcherTaskExecutor,
                              Clock clock) {
        this.properties = properties;
        this.watcherTaskExecutor = watcherTaskExecutor;
        this.clock = clock;
    }

    public ShowDirectoryWatcher create(final ShowProfile show, final DetectedFileHandler handler) {
        final IntakeProperties.Watch watch = properties.getWatch();
        return new ShowDirectoryWatcher(show, resolveWatchDirectories(show), handler, watcherTaskExecutor,
                                        new FileStabilityTracker(watch.getStabilityThreshold(), clock),
                                        watch.getPollInterval(), watch.getStopTimeout());
    }

    /**
     * Collects the distinct directories a show's watch patterns point at. Patterns without a watch path use the
     * global watch directory.
     */
    public List<Path> resolveWatchDirectories(final ShowProfile show) {
        final Set<Path> directories = new LinkedHashSet<>();
        for (final FilePattern pattern : show.getWatchPatterns()) {
            final String watchPath = StringUtils.hasText(pattern.getWatchPath())
                    ? pattern.getWatchPath()
                    : properties.getGlobalWatchDirectory();
            directories.add(Paths.get(watchPath.trim()).toAbsolutePath().normalize());
        }
        log.debug("Show '{}' resolves to watch directories {}", show.getName(), directories);
        return List.copyOf(directories);
    }
}
