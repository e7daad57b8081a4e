package com.radioautomation.intake.store;

import com.radioautomation.intake.model.FileStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Partial update of a queue record. Null fields are left untouched by
 * {@link QueueStore#updateQueueItem(String, QueueItemUpdate)}; {@link QueueStore#recordOutcome} writes every
 * result field as given.
 */
@Getter
@Builder
@ToString
public class QueueItemUpdate {

    private final FileStatus status;
    private final String outputPath;
    private final String errorMessage;
    private final Long processingTimeMs;
    private final Long bytesProcessed;
    private final Boolean conflictResolved;
    private final LocalDateTime processedAt;
}
