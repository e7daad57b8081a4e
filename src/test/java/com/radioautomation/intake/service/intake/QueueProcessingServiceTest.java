package com.radioautomation.intake.service.intake;

import com.radioautomation.intake.catalog.ShowCatalog;
import com.radioautomation.intake.exception.IntakeErrorCode;
import com.radioautomation.intake.model.FileStatus;
import com.radioautomation.intake.model.QueuedFile;
import com.radioautomation.intake.model.ShowProfile;
import com.radioautomation.intake.service.relocation.FileRelocator;
import com.radioautomation.intake.service.relocation.RelocationResult;
import com.radioautomation.intake.store.QueueItemUpdate;
import com.radioautomation.intake.store.QueueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueueProcessingServiceTest {

    @Mock
    private QueueStore queueStore;
    @Mock
    private ShowCatalog showCatalog;
    @Mock
    private FileRelocator fileRelocator;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-07T10:15:00Z"), ZoneOffset.UTC);
    private QueueProcessingService service;

    private final ShowProfile show = ShowProfile.builder().id("s").name("S").build();
    private final QueuedFile file = QueuedFile.builder()
            .id("f1")
            .showId("s")
            .filename("MorningShow_Ep1.mp3")
            .status(FileStatus.PENDING)
            .sourcePath("/watch/MorningShow_Ep1.mp3")
            .build();

    @BeforeEach
    void setUp() {
        service = new QueueProcessingService(queueStore, showCatalog, fileRelocator, clock);
    }

    @Test
    void shouldCompleteFileAfterSuccessfulRelocation() {
        Path output = Paths.get("/out/S.mp3");
        when(queueStore.findById("f1")).thenReturn(Optional.of(file));
        when(showCatalog.getShow("s")).thenReturn(Optional.of(show));
        when(queueStore.transitionStatus("f1", FileStatus.PENDING, FileStatus.PROCESSING)).thenReturn(true);
        when(fileRelocator.relocate(Paths.get(file.getSourcePath()), show))
                .thenReturn(RelocationResult.success(output, 11L, false));
        when(queueStore.recordOutcome(eq("f1"), eq(FileStatus.PROCESSING), any())).thenReturn(Optional.of(file));

        assertThat(service.processFile("f1")).isPresent();

        ArgumentCaptor<QueueItemUpdate> update = ArgumentCaptor.forClass(QueueItemUpdate.class);
        verify(queueStore).recordOutcome(eq("f1"), eq(FileStatus.PROCESSING), update.capture());
        assertThat(update.getValue().getStatus()).isEqualTo(FileStatus.COMPLETED);
        assertThat(update.getValue().getOutputPath()).isEqualTo(output.toString());
        assertThat(update.getValue().getBytesProcessed()).isEqualTo(11L);
        assertThat(update.getValue().getProcessedAt()).isEqualTo(LocalDateTime.of(2024, 3, 7, 10, 15));
        assertThat(update.getValue().getProcessingTimeMs()).isNotNull().isNotNegative();
        assertThat(update.getValue().getErrorMessage()).isNull();
    }

    @Test
    void shouldRecordFailureWithErrorMessage() {
        when(queueStore.findById("f1")).thenReturn(Optional.of(file));
        when(showCatalog.getShow("s")).thenReturn(Optional.of(show));
        when(queueStore.transitionStatus("f1", FileStatus.PENDING, FileStatus.PROCESSING)).thenReturn(true);
        when(fileRelocator.relocate(any(), eq(show)))
                .thenReturn(RelocationResult.failure(IntakeErrorCode.SOURCE_NOT_FOUND, "Source file not found: x"));
        when(queueStore.recordOutcome(eq("f1"), eq(FileStatus.PROCESSING), any())).thenReturn(Optional.of(file));

        service.processFile("f1");

        ArgumentCaptor<QueueItemUpdate> update = ArgumentCaptor.forClass(QueueItemUpdate.class);
        verify(queueStore).recordOutcome(eq("f1"), eq(FileStatus.PROCESSING), update.capture());
        assertThat(update.getValue().getStatus()).isEqualTo(FileStatus.FAILED);
        assertThat(update.getValue().getErrorMessage()).isEqualTo("Source file not found: x");
        assertThat(update.getValue().getOutputPath()).isNull();
    }

    @Test
    void shouldRecordUnexpectedExceptionAsFailure() {
        when(queueStore.findById("f1")).thenReturn(Optional.of(file));
        when(showCatalog.getShow("s")).thenReturn(Optional.of(show));
        when(queueStore.transitionStatus("f1", FileStatus.PENDING, FileStatus.PROCESSING)).thenReturn(true);
        when(fileRelocator.relocate(any(), any())).thenThrow(new IllegalStateException("kaboom"));

        service.processFile("f1");

        ArgumentCaptor<QueueItemUpdate> update = ArgumentCaptor.forClass(QueueItemUpdate.class);
        verify(queueStore).recordOutcome(eq("f1"), eq(FileStatus.PROCESSING), update.capture());
        assertThat(update.getValue().getStatus()).isEqualTo(FileStatus.FAILED);
        assertThat(update.getValue().getErrorMessage()).isEqualTo("kaboom");
    }

    @Test
    void shouldSkipFileThatIsNoLongerPending() {
        when(queueStore.findById("f1")).thenReturn(Optional.of(file));
        when(showCatalog.getShow("s")).thenReturn(Optional.of(show));
        when(queueStore.transitionStatus("f1", FileStatus.PENDING, FileStatus.PROCESSING)).thenReturn(false);

        assertThat(service.processFile("f1")).isEmpty();

        verifyNoInteractions(fileRelocator);
        verify(queueStore, never()).recordOutcome(any(), any(), any());
    }

    @Test
    void shouldLeaveRecordUntouchedWhenShowIsUnknown() {
        when(queueStore.findById("f1")).thenReturn(Optional.of(file));
        when(showCatalog.getShow("s")).thenReturn(Optional.empty());

        assertThat(service.processFile("f1")).isEmpty();

        verify(queueStore, never()).transitionStatus(any(), any(), any());
        verifyNoInteractions(fileRelocator);
    }

    @Test
    void shouldReturnEmptyForUnknownFile() {
        when(queueStore.findById("nope")).thenReturn(Optional.empty());

        assertThat(service.processFile("nope")).isEmpty();

        verifyNoInteractions(showCatalog, fileRelocator);
    }

    @Test
    void shouldRejectSecondAttemptWhileFirstIsRunning() {
        AtomicReference<Optional<QueuedFile>> nested = new AtomicReference<>();
        AtomicReference<Boolean> inFlightDuringRelocation = new AtomicReference<>();
        when(queueStore.findById("f1")).thenReturn(Optional.of(file));
        when(showCatalog.getShow("s")).thenReturn(Optional.of(show));
        when(queueStore.transitionStatus("f1", FileStatus.PENDING, FileStatus.PROCESSING)).thenReturn(true);
        when(fileRelocator.relocate(any(), eq(show))).thenAnswer(invocation -> {
            inFlightDuringRelocation.set(service.isInFlight("f1"));
            nested.set(service.processFile("f1"));
            return RelocationResult.success(Paths.get("/out/S.mp3"), 3L, false);
        });
        when(queueStore.recordOutcome(eq("f1"), eq(FileStatus.PROCESSING), any())).thenReturn(Optional.of(file));

        service.processFile("f1");

        assertThat(inFlightDuringRelocation.get()).isTrue();
        assertThat(nested.get()).isEmpty();
        assertThat(service.isInFlight("f1")).isFalse();
        verify(queueStore, times(1)).transitionStatus("f1", FileStatus.PENDING, FileStatus.PROCESSING);
        verify(fileRelocator, times(1)).relocate(any(), any());
    }

    @Test
    void shouldReturnCurrentRecordWhenOutcomeIsDiscarded() {
        QueuedFile abandoned = QueuedFile.builder()
                .id("f1")
                .showId("s")
                .filename(file.getFilename())
                .status(FileStatus.FAILED)
                .errorMessage("Processing did not finish")
                .build();
        when(queueStore.findById("f1")).thenReturn(Optional.of(file), Optional.of(abandoned));
        when(showCatalog.getShow("s")).thenReturn(Optional.of(show));
        when(queueStore.transitionStatus("f1", FileStatus.PENDING, FileStatus.PROCESSING)).thenReturn(true);
        when(fileRelocator.relocate(any(), eq(show)))
                .thenReturn(RelocationResult.success(Paths.get("/out/S.mp3"), 3L, false));
        when(queueStore.recordOutcome(eq("f1"), eq(FileStatus.PROCESSING), any())).thenReturn(Optional.empty());

        Optional<QueuedFile> result = service.processFile("f1");

        assertThat(result).containsSame(abandoned);
        assertThat(service.isInFlight("f1")).isFalse();
    }

    @Test
    void shouldReleaseInFlightMarkWhenFileIsNotPending() {
        when(queueStore.findById("f1")).thenReturn(Optional.of(file));
        when(showCatalog.getShow("s")).thenReturn(Optional.of(show));
        when(queueStore.transitionStatus("f1", FileStatus.PENDING, FileStatus.PROCESSING)).thenReturn(false);

        service.processFile("f1");

        assertThat(service.isInFlight("f1")).isFalse();
    }
}
