package com.radioautomation.intake.catalog;

import com.radioautomation.intake.config.IntakeProperties;
import com.radioautomation.intake.model.ShowProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Serves the shows declared under {@code app.intake.shows}.
 */
@Slf4j
@Service
public class ConfiguredShowCatalog implements ShowCatalog {

    private final IntakeProperties properties;

    public ConfiguredShowCatalog(IntakeProperties properties) {
        this.properties = properties;
        log.info("ShowCatalog initialized with {} configured show(s).", properties.getShows().size());
    }

    @Override
    public List<ShowProfile> getAllShows() {
        return List.copyOf(properties.getShows());
    }

    @Override
    public Optional<ShowProfile> getShow(final String showId) {
        if (showId == null) {
            return Optional.empty();
        }
        return properties.getShows().stream()
                         .filter(show -> Objects.equals(showId, show.getId()))
                         .findFirst();
    }
}
