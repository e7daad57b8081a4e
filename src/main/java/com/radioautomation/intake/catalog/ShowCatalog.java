package com.radioautomation.intake.catalog;

import com.radioautomation.intake.model.ShowProfile;

import java.util.List;
import java.util.Optional;

/**
 * Read-only source of show configuration consumed by the intake engine.
 */
public interface ShowCatalog {

    List<ShowProfile> getAllShows();

    Optional<ShowProfile> getShow(String showId);
}
