package com.radioautomation.intake.scheduler;

import com.radioautomation.intake.config.IntakeProperties;
import com.radioautomation.intake.model.FileStatus;
import com.radioautomation.intake.model.QueuedFile;
import com.radioautomation.intake.service.intake.QueueProcessingService;
import com.radioautomation.intake.store.QueueItemUpdate;
import com.radioautomation.intake.store.QueueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * A scheduler that fails files left in PROCESSING, for example after the service was killed mid-copy,
 * so that operators can retry them. Files whose attempt is still running in this process are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleProcessingRecoveryScheduler {

    private final QueueStore queueStore;
    private final QueueProcessingService queueProcessingService;
    private final IntakeProperties properties;
    private final Clock clock;

    /**
     * Periodically finds records that have been {@code PROCESSING} for longer than
     * {@code app.intake.stale-processing-minutes} and marks them as FAILED.
     *
     * @return The number of records marked as failed.
     */
    @Scheduled(fixedDelayString = "${app.intake.stale-processing-check-ms:300000}",
               initialDelayString = "${app.intake.stale-processing-check-ms:300000}")
    public int failStaleProcessingFiles() {
        final LocalDateTime threshold = LocalDateTime.now(clock).minusMinutes(properties.getStaleProcessingMinutes());
        log.debug("Running stale processing recovery. Finding files in PROCESSING updated before {}.", threshold);

        final List<QueuedFile> staleFiles = queueStore.findByStatusUpdatedBefore(FileStatus.PROCESSING, threshold);
        if (CollectionUtils.isEmpty(staleFiles)) {
            return 0;
        }

        log.warn("Found {} file(s) stuck in PROCESSING to mark as FAILED.", staleFiles.size());
        int recovered = 0;
        for (final QueuedFile file : staleFiles) {
            if (queueProcessingService.isInFlight(file.getId())) {
                log.info("File {} is still being processed, leaving it in PROCESSING.", file.getId());
                continue;
            }
            final QueueItemUpdate outcome = QueueItemUpdate.builder()
                    .status(FileStatus.FAILED)
                    .errorMessage(String.format(
                            "Processing did not finish within %d minutes and was abandoned. Retry the file to process it again.",
                            properties.getStaleProcessingMinutes()))
                    .processedAt(LocalDateTime.now(clock))
                    .build();
            if (queueStore.recordOutcome(file.getId(), FileStatus.PROCESSING, outcome).isPresent()) {
                recovered++;
            }
        }
        log.info("Finished stale processing recovery. Marked {} file(s) as FAILED.", recovered);
        return recovered;
    }
}
