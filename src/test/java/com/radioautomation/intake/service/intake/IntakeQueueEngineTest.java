package com.radioautomation.intake.service.intake;

import com.radioautomation.intake.catalog.ShowCatalog;
import com.radioautomation.intake.exception.DuplicateQueueEntryException;
import com.radioautomation.intake.exception.InvalidStateForRetryException;
import com.radioautomation.intake.exception.QueuedFileNotFoundException;
import com.radioautomation.intake.model.FilePattern;
import com.radioautomation.intake.model.FileStatus;
import com.radioautomation.intake.model.QueuedFile;
import com.radioautomation.intake.model.ShowProfile;
import com.radioautomation.intake.service.pattern.PatternMatcher;
import com.radioautomation.intake.service.watch.ShowDirectoryWatcher;
import com.radioautomation.intake.service.watch.ShowWatcherFactory;
import com.radioautomation.intake.store.QueueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntakeQueueEngineTest {

    @Mock
    private ShowCatalog showCatalog;
    @Mock
    private QueueStore queueStore;
    @Mock
    private QueueProcessingService processingService;
    @Mock
    private ShowWatcherFactory watcherFactory;

    private IntakeQueueEngine engine;

    private final ShowProfile morning = show("morning", true, true);

    @BeforeEach
    void setUp() {
        engine = new IntakeQueueEngine(showCatalog, queueStore, new PatternMatcher(), processingService,
                                       watcherFactory);
    }

    @Test
    void shouldReportIdleStatusBeforeStart() {
        WatcherStatus status = engine.getStatus();

        assertThat(status.running()).isFalse();
        assertThat(status.watchedShows()).isZero();
        assertThat(status.activeWatchers()).isEmpty();
    }

    @Test
    void shouldStartOneWatcherPerWatchableShow() {
        ShowProfile evening = show("evening", true, true);
        ShowDirectoryWatcher morningWatcher = mock(ShowDirectoryWatcher.class);
        ShowDirectoryWatcher eveningWatcher = mock(ShowDirectoryWatcher.class);
        when(showCatalog.getShow("morning")).thenReturn(Optional.of(morning));
        when(showCatalog.getShow("evening")).thenReturn(Optional.of(evening));
        when(showCatalog.getShow("ghost")).thenReturn(Optional.empty());
        when(watcherFactory.create(morning, engine)).thenReturn(morningWatcher);
        when(watcherFactory.create(evening, engine)).thenReturn(eveningWatcher);

        engine.startWatchingShows(List.of("morning", "ghost", "evening"));

        WatcherStatus status = engine.getStatus();
        assertThat(status.running()).isTrue();
        assertThat(status.watchedShows()).isEqualTo(2);
        assertThat(status.activeWatchers()).containsExactly("evening", "morning");
        verify(morningWatcher).start();
        verify(eveningWatcher).start();
    }

    @Test
    void shouldSkipDisabledAndManualShows() {
        when(showCatalog.getShow("off")).thenReturn(Optional.of(show("off", false, true)));
        when(showCatalog.getShow("manual")).thenReturn(Optional.of(show("manual", true, false)));

        engine.startWatchingShows(List.of("off", "manual"));

        assertThat(engine.getStatus().activeWatchers()).isEmpty();
        verifyNoInteractions(watcherFactory);
    }

    @Test
    void shouldCloseExistingWatcherBeforeReplacingIt() {
        ShowDirectoryWatcher first = mock(ShowDirectoryWatcher.class);
        ShowDirectoryWatcher second = mock(ShowDirectoryWatcher.class);
        when(showCatalog.getShow("morning")).thenReturn(Optional.of(morning));
        when(watcherFactory.create(morning, engine)).thenReturn(first, second);

        engine.startWatchingShows(List.of("morning"));
        engine.startWatchingShows(List.of("morning"));

        InOrder order = inOrder(first, second);
        order.verify(first).start();
        order.verify(first).stop();
        order.verify(second).start();
        assertThat(engine.getStatus().activeWatchers()).containsExactly("morning");
    }

    @Test
    void shouldNotRegisterWatcherThatFailsToStart() {
        ShowDirectoryWatcher broken = mock(ShowDirectoryWatcher.class);
        when(showCatalog.getShow("morning")).thenReturn(Optional.of(morning));
        when(watcherFactory.create(morning, engine)).thenReturn(broken);
        doThrow(new IllegalStateException("no threads")).when(broken).start();

        engine.startWatchingShows(List.of("morning"));

        assertThat(engine.getStatus().activeWatchers()).isEmpty();
    }

    @Test
    void shouldInitializeFromEnabledAutoProcessingShows() {
        ShowDirectoryWatcher watcher = mock(ShowDirectoryWatcher.class);
        when(showCatalog.getAllShows()).thenReturn(List.of(morning, show("off", false, true)));
        when(showCatalog.getShow("morning")).thenReturn(Optional.of(morning));
        when(watcherFactory.create(morning, engine)).thenReturn(watcher);

        engine.initialize();

        assertThat(engine.getStatus().activeWatchers()).containsExactly("morning");
    }

    @Test
    void shouldStopAllWatchersAndTolerateRepeatedStop() {
        ShowDirectoryWatcher watcher = mock(ShowDirectoryWatcher.class);
        when(showCatalog.getShow("morning")).thenReturn(Optional.of(morning));
        when(watcherFactory.create(morning, engine)).thenReturn(watcher);
        engine.startWatchingShows(List.of("morning"));

        engine.stopWatching();
        engine.stopWatching();

        verify(watcher).stop();
        assertThat(engine.getStatus().running()).isFalse();
        assertThat(engine.getStatus().watchedShows()).isZero();
    }

    @Test
    void shouldQueueAndProcessMatchingFile() {
        QueuedFile queued = QueuedFile.builder().id("f1").filename("MorningShow_Ep1.mp3").build();
        when(queueStore.existsByShowAndFilename("morning", "MorningShow_Ep1.mp3")).thenReturn(false);
        when(queueStore.addToQueue(any())).thenReturn(queued);

        engine.onFileAppeared(morning, Paths.get("/watch/MorningShow_Ep1.mp3"));

        ArgumentCaptor<QueuedFile> draft = ArgumentCaptor.forClass(QueuedFile.class);
        verify(queueStore).addToQueue(draft.capture());
        assertThat(draft.getValue().getShowId()).isEqualTo("morning");
        assertThat(draft.getValue().getStatus()).isEqualTo(FileStatus.PENDING);
        assertThat(draft.getValue().getSourcePath()).isEqualTo(Paths.get("/watch/MorningShow_Ep1.mp3")
                                                                     .toAbsolutePath().toString());
        verify(processingService).processFile("f1");
    }

    @Test
    void shouldIgnoreFileThatMatchesNoPattern() {
        engine.onFileAppeared(morning, Paths.get("/watch/EveningShow_Ep1.mp3"));

        verifyNoInteractions(queueStore, processingService);
    }

    @Test
    void shouldIgnoreFileAlreadyQueued() {
        when(queueStore.existsByShowAndFilename("morning", "MorningShow_Ep1.mp3")).thenReturn(true);

        engine.onFileAppeared(morning, Paths.get("/watch/MorningShow_Ep1.mp3"));

        verify(queueStore, never()).addToQueue(any());
        verifyNoInteractions(processingService);
    }

    @Test
    void shouldIgnoreFileQueuedConcurrently() {
        when(queueStore.existsByShowAndFilename("morning", "MorningShow_Ep1.mp3")).thenReturn(false);
        when(queueStore.addToQueue(any()))
                .thenThrow(new DuplicateQueueEntryException("morning", "MorningShow_Ep1.mp3", null));

        engine.onFileAppeared(morning, Paths.get("/watch/MorningShow_Ep1.mp3"));

        verifyNoInteractions(processingService);
    }

    @Test
    void shouldRejectManualEnqueueForUnknownShow() {
        when(showCatalog.getShow("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> engine.enqueue("ghost", Paths.get("/watch/a.mp3")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void shouldRetryFailedFile() {
        QueuedFile failed = QueuedFile.builder().id("f1").filename("a.mp3").status(FileStatus.FAILED).build();
        QueuedFile completed = QueuedFile.builder().id("f1").filename("a.mp3").status(FileStatus.COMPLETED).build();
        when(queueStore.findById("f1")).thenReturn(Optional.of(failed));
        when(queueStore.resetForRetry("f1")).thenReturn(true);
        when(processingService.processFile("f1")).thenReturn(Optional.of(completed));

        QueuedFile result = engine.retryFile("f1");

        assertThat(result.getStatus()).isEqualTo(FileStatus.COMPLETED);
        InOrder order = inOrder(queueStore, processingService);
        order.verify(queueStore).resetForRetry("f1");
        order.verify(processingService).processFile("f1");
    }

    @Test
    void shouldRejectRetryWhenFileLeftFailedConcurrently() {
        QueuedFile failed = QueuedFile.builder().id("f1").filename("a.mp3").status(FileStatus.FAILED).build();
        QueuedFile processing = QueuedFile.builder().id("f1").filename("a.mp3").status(FileStatus.PROCESSING).build();
        when(queueStore.findById("f1")).thenReturn(Optional.of(failed), Optional.of(processing));
        when(queueStore.resetForRetry("f1")).thenReturn(false);

        assertThatThrownBy(() -> engine.retryFile("f1"))
                .isInstanceOf(InvalidStateForRetryException.class)
                .hasMessageContaining("PROCESSING");
        verifyNoInteractions(processingService);
    }

    @Test
    void shouldRejectRetryOfUnknownFile() {
        when(queueStore.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> engine.retryFile("nope"))
                .isInstanceOf(QueuedFileNotFoundException.class)
                .hasMessage("File nope not found in queue");
    }

    @Test
    void shouldRejectRetryOfFileThatIsNotFailed() {
        QueuedFile completed = QueuedFile.builder().id("f1").status(FileStatus.COMPLETED).build();
        when(queueStore.findById("f1")).thenReturn(Optional.of(completed));

        assertThatThrownBy(() -> engine.retryFile("f1"))
                .isInstanceOf(InvalidStateForRetryException.class)
                .hasMessageContaining("COMPLETED");
        verify(queueStore, never()).resetForRetry(any());
        verifyNoInteractions(processingService);
    }

    @Test
    void shouldCollectFailuresWhileProcessingPendingFiles() {
        QueuedFile ok = QueuedFile.builder().id("ok").filename("ok.mp3").showId("morning").build();
        QueuedFile bad = QueuedFile.builder().id("bad").filename("bad.mp3").showId("morning").build();
        QueuedFile orphan = QueuedFile.builder().id("orphan").filename("o.mp3").showId("ghost").build();
        QueuedFile boom = QueuedFile.builder().id("boom").filename("boom.mp3").showId("morning").build();
        when(queueStore.findByStatus(FileStatus.PENDING)).thenReturn(List.of(ok, bad, orphan, boom));
        when(processingService.processFile("ok"))
                .thenReturn(Optional.of(QueuedFile.builder().id("ok").status(FileStatus.COMPLETED).build()));
        when(processingService.processFile("bad"))
                .thenReturn(Optional.of(QueuedFile.builder().id("bad").status(FileStatus.FAILED)
                                                  .errorMessage("Source file not found: bad.mp3").build()));
        when(processingService.processFile("orphan")).thenReturn(Optional.empty());
        when(showCatalog.getShow("ghost")).thenReturn(Optional.empty());
        when(processingService.processFile("boom")).thenThrow(new IllegalStateException("db down"));

        List<ProcessingFailure> failures = engine.processPending();

        assertThat(failures).extracting(ProcessingFailure::fileId).containsExactly("bad", "orphan", "boom");
        assertThat(failures).extracting(ProcessingFailure::errorMessage)
                .containsExactly("Source file not found: bad.mp3", "Show ghost not found", "db down");
    }

    @Test
    void shouldDelegateQueueMaintenance() {
        when(queueStore.removeFromQueue("f1")).thenReturn(true);
        when(queueStore.clearCompleted()).thenReturn(3);

        assertThat(engine.removeFile("f1")).isTrue();
        assertThat(engine.clearCompleted()).isEqualTo(3);
        engine.clearQueue();

        verify(queueStore).clearQueue();
    }

    private static ShowProfile show(String id, boolean enabled, boolean autoProcessing) {
        return ShowProfile.builder()
                .id(id)
                .name(id)
                .enabled(enabled)
                .autoProcessing(autoProcessing)
                .filePatterns(List.of(FilePattern.builder().id(id + "-p").pattern("MorningShow_*.mp3").build()))
                .build();
    }
}
