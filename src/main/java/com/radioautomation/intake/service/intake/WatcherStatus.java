package com.radioautomation.intake.service.intake;

import java.util.List;

/**
 * Snapshot of the engine's watching state.
 *
 * @param running        Whether watching has been started and not stopped since.
 * @param watchedShows   How many shows are actively watched.
 * @param activeWatchers The ids of the actively watched shows.
 */
public record WatcherStatus(boolean running, int watchedShows, List<String> activeWatchers) {
}
