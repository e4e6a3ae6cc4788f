package com.paxkun.tracker.service;

import com.paxkun.tracker.model.Chapter;
import com.paxkun.tracker.model.Manga;
import com.paxkun.tracker.model.MangaScanlator;
import com.paxkun.tracker.model.Scanlator;
import com.paxkun.tracker.model.ScrapingError;
import com.paxkun.tracker.repository.ChapterRepository;
import com.paxkun.tracker.repository.MangaRepository;
import com.paxkun.tracker.repository.MangaScanlatorRepository;
import com.paxkun.tracker.repository.ScrapingErrorRepository;
import com.paxkun.tracker.service.browser.BrowserEngine;
import com.paxkun.tracker.service.browser.BrowserEngineFactory;
import com.paxkun.tracker.service.browser.BrowserPage;
import com.paxkun.tracker.service.scanlator.ScanlatorPlugin;
import com.paxkun.tracker.service.scanlator.ScanlatorRegistration;
import com.paxkun.tracker.service.scanlator.ScanlatorRegistry;
import com.paxkun.tracker.service.scanlator.ScannedChapter;
import com.paxkun.tracker.service.scanlator.SearchResult;
import com.paxkun.tracker.service.tracking.NewChapterNotice;
import com.paxkun.tracker.service.tracking.TrackingJobStatus;
import com.paxkun.tracker.service.tracking.TrackingJobStore;
import com.paxkun.tracker.service.tracking.TrackingJobSummary;
import com.paxkun.tracker.service.tracking.TrackingRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TrackerServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 15, 12, 0);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private MangaScanlatorRepository mappingRepository;

    @Mock
    private ChapterRepository chapterRepository;

    @Mock
    private MangaRepository mangaRepository;

    @Mock
    private ScrapingErrorRepository scrapingErrorRepository;

    @Mock
    private BrowserEngineFactory browserFactory;

    @Mock
    private BrowserEngine engine;

    @Mock
    private BrowserPage page;

    @Mock
    private NotificationService notificationService;

    @Mock
    private LoggerService loggerService;

    private final Map<String, StubScanlator> plugins = new HashMap<>();
    private final Set<String> storedChapters = new HashSet<>();
    private TrackingJobStore jobStore;

    @BeforeEach
    void setUp() {
        jobStore = new TrackingJobStore(100);
        plugins.put("StubScans", new StubScanlator());
        plugins.put("OtherScans", new StubScanlator());

        when(browserFactory.launch()).thenReturn(engine);
        when(engine.newPage()).thenReturn(page);
        when(chapterRepository.existsByMangaScanlatorIdAndChapterNumber(anyLong(), anyString()))
                .thenAnswer(inv -> storedChapters.contains(inv.getArgument(0) + "#" + inv.getArgument(1)));
        when(chapterRepository.saveAndFlush(any(Chapter.class))).thenAnswer(inv -> {
            Chapter chapter = inv.getArgument(0);
            if (!storedChapters.add(chapter.getMangaScanlatorId() + "#" + chapter.getChapterNumber())) {
                throw new DataIntegrityViolationException("Duplicate entry");
            }
            return chapter;
        });
    }

    @Test
    void secondRunOnlyStoresChaptersNotSeenBefore() {
        MangaScanlator mapping = mapping(1L, "Solo Leveling", "StubScans");
        when(mappingRepository.findTrackable(1L, null)).thenReturn(List.of(mapping));
        StubScanlator plugin = plugins.get("StubScans");
        plugin.respond(chapters("1", "2"));
        plugin.respond(chapters("1", "2", "3"));
        TrackerService service = service(Runnable::run);

        String firstJob = service.trigger(new TrackingRequest(1L, null, true));
        String secondJob = service.trigger(new TrackingRequest(1L, null, true));

        TrackingJobStatus first = service.getStatus(firstJob).orElseThrow();
        TrackingJobStatus second = service.getStatus(secondJob).orElseThrow();
        assertThat(first.status()).isEqualTo("completed");
        assertThat(first.newChaptersFound()).isEqualTo(2);
        assertThat(second.status()).isEqualTo("completed");
        assertThat(second.newChaptersFound()).isEqualTo(1);
        assertThat(second.errors()).isEmpty();
        assertThat(storedChapters).containsExactlyInAnyOrder("1#1", "1#2", "1#3");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<NewChapterNotice>> notices = ArgumentCaptor.forClass(List.class);
        verify(notificationService, times(2)).notifyNewChapters(notices.capture());
        assertThat(notices.getAllValues().get(1))
                .singleElement()
                .satisfies(notice -> {
                    assertThat(notice.workTitle()).isEqualTo("Solo Leveling");
                    assertThat(notice.chapterNumber()).isEqualTo("3");
                    assertThat(notice.url()).isEqualTo("https://stub.example/solo-leveling/3");
                    assertThat(notice.sourceName()).isEqualTo("Stub Scans");
                    assertThat(notice.detectedAt()).isEqualTo(NOW);
                });
    }

    @Test
    void unchangedSourceYieldsNoNewChaptersOnRepeatRun() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of(mapping(1L, "Omniscient Reader", "StubScans")));
        StubScanlator plugin = plugins.get("StubScans");
        plugin.respond(chapters("10", "11"));
        plugin.respond(chapters("10", "11"));
        TrackerService service = service(Runnable::run);

        service.trigger(TrackingRequest.all());
        String repeat = service.trigger(TrackingRequest.all());

        assertThat(service.getStatus(repeat).orElseThrow().newChaptersFound()).isZero();
        verify(chapterRepository, times(2)).saveAndFlush(any(Chapter.class));
        verify(notificationService, times(1)).notifyNewChapters(anyList());
    }

    @Test
    void failingMappingDoesNotAbortTheJob() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of(
                mapping(1L, "Solo Leveling", "StubScans"),
                mapping(2L, "Nano Machine", "OtherScans"),
                mapping(3L, "Eleceed", "StubScans")));
        plugins.get("StubScans").respond(chapters("1"));
        plugins.get("StubScans").respond(chapters("5", "6"));
        plugins.get("OtherScans").failWith(new IllegalStateException("layout changed"));
        TrackerService service = service(Runnable::run);

        TrackingJobStatus status = service.getStatus(service.trigger(TrackingRequest.all())).orElseThrow();

        assertThat(status.status()).isEqualTo("completed");
        assertThat(status.totalMappings()).isEqualTo(3);
        assertThat(status.processedMappings()).isEqualTo(2);
        assertThat(status.newChaptersFound()).isEqualTo(3);
        assertThat(status.errors()).containsExactly("Error processing mapping 2: layout changed");
        assertThat(storedChapters).containsExactlyInAnyOrder("1#1", "3#5", "3#6");

        ArgumentCaptor<ScrapingError> error = ArgumentCaptor.forClass(ScrapingError.class);
        verify(scrapingErrorRepository).save(error.capture());
        assertThat(error.getValue().getMangaScanlatorId()).isEqualTo(2L);
        assertThat(error.getValue().getErrorType()).isEqualTo("IllegalStateException");
        verify(mangaRepository).updateLastChecked(1L, NOW);
        verify(mangaRepository, never()).updateLastChecked(2L, NOW);
    }

    @Test
    void unknownPluginIsRecordedAndJobContinues() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of(
                mapping(1L, "Solo Leveling", "Nonexistent"),
                mapping(2L, "Eleceed", "StubScans")));
        plugins.get("StubScans").respond(chapters("1"));
        TrackerService service = service(Runnable::run);

        TrackingJobStatus status = service.getStatus(service.trigger(TrackingRequest.all())).orElseThrow();

        assertThat(status.status()).isEqualTo("completed");
        assertThat(status.processedMappings()).isEqualTo(1);
        assertThat(status.newChaptersFound()).isEqualTo(1);
        assertThat(status.errors()).singleElement().asString()
                .startsWith("Error processing mapping 1:")
                .contains("Nonexistent");

        ArgumentCaptor<ScrapingError> error = ArgumentCaptor.forClass(ScrapingError.class);
        verify(scrapingErrorRepository).save(error.capture());
        assertThat(error.getValue().getErrorType()).isEqualTo("PluginResolutionException");
    }

    @Test
    void duplicateInsertFromConcurrentJobIsNotAnError() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of(mapping(1L, "Solo Leveling", "StubScans")));
        plugins.get("StubScans").respond(chapters("7"));
        when(chapterRepository.saveAndFlush(any(Chapter.class))).thenAnswer(inv -> {
            storedChapters.add("1#7");
            throw new DataIntegrityViolationException("Duplicate entry '1-7'");
        });
        TrackerService service = service(Runnable::run);

        TrackingJobStatus status = service.getStatus(service.trigger(TrackingRequest.all())).orElseThrow();

        assertThat(status.status()).isEqualTo("completed");
        assertThat(status.newChaptersFound()).isZero();
        assertThat(status.processedMappings()).isEqualTo(1);
        assertThat(status.errors()).isEmpty();
        verify(notificationService, never()).notifyNewChapters(anyList());
    }

    @Test
    void rejectedInsertThatIsNotADuplicateIsRecordedAsMappingError() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of(mapping(1L, "Solo Leveling", "StubScans")));
        plugins.get("StubScans").respond(chapters("8"));
        when(chapterRepository.saveAndFlush(any(Chapter.class)))
                .thenThrow(new DataIntegrityViolationException("Value too long for column CHAPTER_TITLE"));
        TrackerService service = service(Runnable::run);

        TrackingJobStatus status = service.getStatus(service.trigger(TrackingRequest.all())).orElseThrow();

        assertThat(status.status()).isEqualTo("completed");
        assertThat(status.newChaptersFound()).isZero();
        assertThat(status.processedMappings()).isZero();
        assertThat(status.errors()).singleElement().asString()
                .startsWith("Error processing mapping 1:")
                .contains("Value too long");

        ArgumentCaptor<ScrapingError> error = ArgumentCaptor.forClass(ScrapingError.class);
        verify(scrapingErrorRepository).save(error.capture());
        assertThat(error.getValue().getErrorType()).isEqualTo("DataIntegrityViolationException");
    }

    @Test
    void chaptersWithoutNumberOrUrlAreSkipped() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of(mapping(1L, "Solo Leveling", "StubScans")));
        plugins.get("StubScans").respond(List.of(
                new ScannedChapter("", "Teaser", "https://stub.example/teaser", NOW),
                new ScannedChapter("4", "Chapter 4", " ", NOW),
                new ScannedChapter("5", "Chapter 5", "https://stub.example/5", NOW)));
        TrackerService service = service(Runnable::run);

        TrackingJobStatus status = service.getStatus(service.trigger(TrackingRequest.all())).orElseThrow();

        assertThat(status.newChaptersFound()).isEqualTo(1);
        assertThat(storedChapters).containsExactly("1#5");
    }

    @Test
    void notifierFailureLeavesJobCompleted() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of(mapping(1L, "Solo Leveling", "StubScans")));
        plugins.get("StubScans").respond(chapters("1"));
        doThrow(new IllegalStateException("webhook down")).when(notificationService).notifyNewChapters(anyList());
        TrackerService service = service(Runnable::run);

        TrackingJobStatus status = service.getStatus(service.trigger(TrackingRequest.all())).orElseThrow();

        assertThat(status.status()).isEqualTo("completed");
        assertThat(status.errors()).isEmpty();
        assertThat(status.newChaptersFound()).isEqualTo(1);
    }

    @Test
    void notifierIsSkippedWhenNotRequested() {
        when(mappingRepository.findTrackable(isNull(), isNull())).thenReturn(List.of(mapping(1L, "Solo Leveling", "StubScans")));
        plugins.get("StubScans").respond(chapters("1"));
        TrackerService service = service(Runnable::run);

        service.trigger(new TrackingRequest(null, null, false));

        verify(notificationService, never()).notifyNewChapters(anyList());
    }

    @Test
    void faultOutsideMappingLoopFailsTheJob() {
        when(mappingRepository.findTrackable(null, null)).thenThrow(new IllegalStateException("db down"));
        TrackerService service = service(Runnable::run);

        TrackingJobStatus status = service.getStatus(service.trigger(TrackingRequest.all())).orElseThrow();

        assertThat(status.status()).isEqualTo("failed");
        assertThat(status.errors()).containsExactly("Job failed: db down");
        assertThat(status.completedAt()).isEqualTo(NOW);
        verify(notificationService, never()).notifyNewChapters(anyList());
    }

    @Test
    void errorOnJobThreadStillFailsTheJob() {
        when(mappingRepository.findTrackable(null, null)).thenThrow(new NoClassDefFoundError("org/openqa/selenium/WebDriver"));
        TrackerService service = service(Runnable::run);

        TrackingJobStatus status = service.getStatus(service.trigger(TrackingRequest.all())).orElseThrow();

        assertThat(status.status()).isEqualTo("failed");
        assertThat(status.errors()).containsExactly("Job failed: org/openqa/selenium/WebDriver");
        assertThat(status.completedAt()).isEqualTo(NOW);
    }

    @Test
    void browserLaunchFailureFailsTheJob() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of(mapping(1L, "Solo Leveling", "StubScans")));
        when(browserFactory.launch()).thenThrow(new IllegalStateException("chrome not found"));
        TrackerService service = service(Runnable::run);

        TrackingJobStatus status = service.getStatus(service.trigger(TrackingRequest.all())).orElseThrow();

        assertThat(status.status()).isEqualTo("failed");
        assertThat(status.errors()).containsExactly("Job failed: chrome not found");
    }

    @Test
    void browserResourcesAreReleasedOnEveryPath() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of(
                mapping(1L, "Solo Leveling", "StubScans"),
                mapping(2L, "Nano Machine", "OtherScans")));
        plugins.get("StubScans").respond(chapters("1"));
        plugins.get("OtherScans").failWith(new IllegalStateException("boom"));
        TrackerService service = service(Runnable::run);

        service.trigger(TrackingRequest.all());

        verify(browserFactory, times(1)).launch();
        verify(page, times(2)).close();
        verify(engine).close();
    }

    @Test
    void emptyScopeCompletesWithoutLaunchingBrowser() {
        when(mappingRepository.findTrackable(5L, 9L)).thenReturn(List.of());
        TrackerService service = service(Runnable::run);

        TrackingJobStatus status = service.getStatus(service.trigger(new TrackingRequest(5L, 9L, true))).orElseThrow();

        assertThat(status.status()).isEqualTo("completed");
        assertThat(status.totalMappings()).isZero();
        verify(browserFactory, never()).launch();
    }

    @Test
    void rejectedJobIsMarkedFailed() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("queue full");
        };
        TrackerService service = service(rejecting);

        TrackingJobStatus status = service.getStatus(service.trigger(TrackingRequest.all())).orElseThrow();

        assertThat(status.status()).isEqualTo("failed");
        assertThat(status.errors()).containsExactly("Job failed: queue full");
    }

    @Test
    void triggerReturnsImmediatelyAndJobCompletesInBackground() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of(mapping(1L, "Solo Leveling", "StubScans")));
        plugins.get("StubScans").respond(chapters("1", "2"));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            TrackerService service = service(executor);

            String jobId = service.trigger(TrackingRequest.all());

            assertThat(service.getStatus(jobId)).isPresent();
            verify(notificationService, timeout(5000)).notifyNewChapters(anyList());
            assertThat(service.getStatus(jobId).orElseThrow().status()).isEqualTo("completed");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void listsJobsNewestFirstAndValidatesLimit() {
        when(mappingRepository.findTrackable(null, null)).thenReturn(List.of());
        TrackerService service = service(Runnable::run);
        String first = service.trigger(TrackingRequest.all());
        String second = service.trigger(TrackingRequest.all());

        List<TrackingJobSummary> jobs = service.listJobs(20);

        assertThat(jobs).extracting(TrackingJobSummary::jobId).containsExactlyInAnyOrder(first, second);
        assertThat(jobs).extracting(TrackingJobSummary::status).containsOnly("completed");
        assertThatThrownBy(() -> service.listJobs(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.listJobs(101)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownJobIdHasNoStatus() {
        TrackerService service = service(Runnable::run);

        assertThat(service.getStatus("does-not-exist")).isEmpty();
    }

    private TrackerService service(Executor executor) {
        ScanlatorRegistry registry = new ScanlatorRegistry(List.of(
                new ScanlatorRegistration("StubScans", "Stub Scans", "https://stub.example",
                        p -> plugins.get("StubScans")),
                new ScanlatorRegistration("OtherScans", "Other Scans", "https://other.example",
                        p -> plugins.get("OtherScans"))));
        return new TrackerService(
                jobStore,
                mappingRepository,
                chapterRepository,
                mangaRepository,
                scrapingErrorRepository,
                registry,
                browserFactory,
                notificationService,
                loggerService,
                executor,
                CLOCK);
    }

    private static MangaScanlator mapping(long id, String title, String pluginKey) {
        Manga manga = new Manga(title);
        manga.setId(id);
        Scanlator scanlator = new Scanlator(pluginKey, "https://stub.example");
        scanlator.setId(id + 100);
        MangaScanlator mapping = new MangaScanlator(manga, scanlator,
                "https://stub.example/" + title.toLowerCase().replace(' ', '-'), true);
        mapping.setId(id);
        return mapping;
    }

    private static List<ScannedChapter> chapters(String... numbers) {
        return Arrays.stream(numbers)
                .map(n -> new ScannedChapter(n, "Chapter " + n, "https://stub.example/solo-leveling/" + n, NOW))
                .toList();
    }

    private static class StubScanlator implements ScanlatorPlugin {

        private final Deque<List<ScannedChapter>> responses = new ArrayDeque<>();
        private RuntimeException failure;

        void respond(List<ScannedChapter> chapters) {
            responses.add(chapters);
        }

        void failWith(RuntimeException failure) {
            this.failure = failure;
        }

        @Override
        public List<SearchResult> search(String title) {
            return List.of();
        }

        @Override
        public List<ScannedChapter> extractChapters(String workUrl) {
            if (failure != null) {
                throw failure;
            }
            return responses.isEmpty() ? List.of() : responses.poll();
        }

        @Override
        public String parseChapterNumber(String rawText) {
            return rawText;
        }
    }
}
