package com.paxkun.tracker.service;

import com.paxkun.tracker.model.Chapter;
import com.paxkun.tracker.model.MangaScanlator;
import com.paxkun.tracker.model.ScrapingError;
import com.paxkun.tracker.repository.ChapterRepository;
import com.paxkun.tracker.repository.MangaRepository;
import com.paxkun.tracker.repository.MangaScanlatorRepository;
import com.paxkun.tracker.repository.ScrapingErrorRepository;
import com.paxkun.tracker.service.browser.BrowserEngine;
import com.paxkun.tracker.service.browser.BrowserEngineFactory;
import com.paxkun.tracker.service.browser.BrowserPage;
import com.paxkun.tracker.service.scanlator.ScanlatorRegistration;
import com.paxkun.tracker.service.scanlator.ScanlatorRegistry;
import com.paxkun.tracker.service.scanlator.ScannedChapter;
import com.paxkun.tracker.service.tracking.NewChapterNotice;
import com.paxkun.tracker.service.tracking.TrackingJob;
import com.paxkun.tracker.service.tracking.TrackingJobStatus;
import com.paxkun.tracker.service.tracking.TrackingJobStore;
import com.paxkun.tracker.service.tracking.TrackingJobSummary;
import com.paxkun.tracker.service.tracking.TrackingRequest;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs tracking jobs: visits every eligible manga/scanlator mapping, extracts its chapter
 * list through the scanlator plugin and stores chapters not seen before.
 * <p>
 * {@link #trigger(TrackingRequest)} returns at once; the job runs on the tracking executor and
 * callers poll {@link #getStatus(String)}. Mappings inside one job are processed one after the
 * other with a single browser. A failing mapping is recorded on the job and the run continues.
 * <p>
 * Author: Pax
 */
@Service
public class TrackerService {

    private static final String TAG = "TRACKER";
    static final int MAX_LIST_LIMIT = 100;

    private final TrackingJobStore jobStore;
    private final MangaScanlatorRepository mappingRepository;
    private final ChapterRepository chapterRepository;
    private final MangaRepository mangaRepository;
    private final ScrapingErrorRepository scrapingErrorRepository;
    private final ScanlatorRegistry registry;
    private final BrowserEngineFactory browserFactory;
    private final NotificationService notificationService;
    private final LoggerService logger;
    private final Executor executor;
    private final Clock clock;

    @Value("${tracker.scraping.delay-min-ms:2000}")
    private long delayMinMillis;

    @Value("${tracker.scraping.delay-max-ms:5000}")
    private long delayMaxMillis;

    public TrackerService(TrackingJobStore jobStore,
                          MangaScanlatorRepository mappingRepository,
                          ChapterRepository chapterRepository,
                          MangaRepository mangaRepository,
                          ScrapingErrorRepository scrapingErrorRepository,
                          ScanlatorRegistry registry,
                          BrowserEngineFactory browserFactory,
                          NotificationService notificationService,
                          LoggerService logger,
                          @Qualifier("trackingExecutor") Executor executor,
                          Clock clock) {
        this.jobStore = jobStore;
        this.mappingRepository = mappingRepository;
        this.chapterRepository = chapterRepository;
        this.mangaRepository = mangaRepository;
        this.scrapingErrorRepository = scrapingErrorRepository;
        this.registry = registry;
        this.browserFactory = browserFactory;
        this.notificationService = notificationService;
        this.logger = logger;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Creates a pending job and hands it to the tracking executor.
     *
     * @return the new job id
     */
    public String trigger(TrackingRequest request) {
        TrackingRequest scope = request == null ? TrackingRequest.all() : request;
        TrackingJob job = jobStore.create(scope, now());
        logger.info(TAG, "🚀 Queued tracking job " + job.getJobId()
                + " | mangaId=" + scope.mangaId()
                + " | scanlatorId=" + scope.scanlatorId()
                + " | notify=" + scope.notifyEnabled());

        try {
            executor.execute(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            logger.error(TAG, "❌ Tracking executor rejected job " + job.getJobId(), e);
            job.markRunning(now());
            job.markFailed("Job failed: " + e.getMessage(), now());
        }
        return job.getJobId();
    }

    public Optional<TrackingJobStatus> getStatus(String jobId) {
        return jobStore.find(jobId).map(TrackingJob::toStatus);
    }

    /**
     * Recent jobs, newest start time first.
     *
     * @throws IllegalArgumentException when limit is outside 1..100
     */
    public List<TrackingJobSummary> listJobs(int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        return jobStore.recent(limit).stream()
                .map(TrackingJob::toSummary)
                .toList();
    }

    void runJob(TrackingJob job) {
        job.markRunning(now());
        TrackingRequest scope = job.getRequest();
        logger.info(TAG, "▶️ Starting tracking job " + job.getJobId());

        try {
            List<MangaScanlator> mappings = mappingRepository.findTrackable(scope.mangaId(), scope.scanlatorId());
            job.setTotalMappings(mappings.size());
            logger.info(TAG, "Found " + mappings.size() + " mapping(s) to check for job " + job.getJobId());

            if (!mappings.isEmpty()) {
                try (BrowserEngine engine = browserFactory.launch()) {
                    for (int i = 0; i < mappings.size(); i++) {
                        if (i > 0 && !politenessPause()) {
                            logger.warn(TAG, "⚠️ Job " + job.getJobId() + " interrupted, stopping early");
                            break;
                        }
                        processMapping(job, engine, mappings.get(i));
                    }
                }
            }

            job.markCompleted(now());
        } catch (Throwable e) {
            logger.error(TAG, "❌ Tracking job " + job.getJobId() + " failed", e);
            job.markFailed("Job failed: " + e.getMessage(), now());
            return;
        }

        TrackingJobStatus status = job.toStatus();
        logger.info(TAG, "✅ Job " + job.getJobId() + " completed | processed="
                + status.processedMappings() + "/" + status.totalMappings()
                + " | newChapters=" + status.newChaptersFound()
                + " | errors=" + status.errors().size());

        List<NewChapterNotice> notices = job.getNotices();
        if (scope.notifyEnabled() && !notices.isEmpty()) {
            try {
                notificationService.notifyNewChapters(notices);
            } catch (Exception e) {
                logger.error(TAG, "❌ Notification failed for job " + job.getJobId(), e);
            }
        }
    }

    void processMapping(TrackingJob job, BrowserEngine engine, MangaScanlator mapping) {
        String workTitle = mapping.getManga().getTitle();
        String pluginKey = mapping.getScanlator().getPluginKey();
        logger.info(TAG, "📖 Checking " + LoggerService.sanitizeForLog(workTitle) + " on " + pluginKey);

        try {
            ScanlatorRegistration registration = registry.require(pluginKey);

            List<ScannedChapter> chapters;
            try (BrowserPage page = engine.newPage()) {
                chapters = registration.create(page).extractChapters(mapping.getScanlatorMangaUrl());
            }

            int found = 0;
            for (ScannedChapter chapter : chapters) {
                if (saveIfNew(job, mapping, registration.displayName(), chapter)) {
                    found++;
                }
            }

            mangaRepository.updateLastChecked(mapping.getManga().getId(), now());
            job.mappingProcessed();
            logger.info(TAG, "Mapping " + mapping.getId() + " done | extracted=" + chapters.size() + " | new=" + found);
        } catch (Exception e) {
            String message = "Error processing mapping " + mapping.getId() + ": " + e.getMessage();
            logger.error(TAG, "❌ " + message, e);
            job.recordError(message);
            recordScrapingError(mapping, e);
        }
    }

    private boolean saveIfNew(TrackingJob job, MangaScanlator mapping, String sourceName, ScannedChapter scanned) {
        if (isBlank(scanned.number()) || isBlank(scanned.url())) {
            logger.warn(TAG, "⚠️ Skipping chapter without number or url on mapping " + mapping.getId()
                    + ": " + LoggerService.sanitizeForLog(scanned.title()));
            return false;
        }
        if (chapterRepository.existsByMangaScanlatorIdAndChapterNumber(mapping.getId(), scanned.number())) {
            return false;
        }

        LocalDateTime detectedAt = now();
        Chapter chapter = new Chapter();
        chapter.setMangaScanlatorId(mapping.getId());
        chapter.setChapterNumber(scanned.number());
        chapter.setChapterTitle(scanned.title());
        chapter.setChapterUrl(scanned.url());
        chapter.setPublishedDate(scanned.publishedAt());
        chapter.setDetectedDate(detectedAt);

        try {
            chapterRepository.saveAndFlush(chapter);
        } catch (DataIntegrityViolationException e) {
            if (!chapterRepository.existsByMangaScanlatorIdAndChapterNumber(mapping.getId(), scanned.number())) {
                throw e;
            }
            logger.debug(TAG, "Chapter " + scanned.number() + " of mapping " + mapping.getId() + " already stored");
            return false;
        }

        job.chapterFound(new NewChapterNotice(
                mapping.getManga().getTitle(),
                scanned.number(),
                scanned.title(),
                scanned.url(),
                sourceName,
                detectedAt));
        logger.info(TAG, "🆕 New chapter " + scanned.number() + " for " + LoggerService.sanitizeForLog(mapping.getManga().getTitle()));
        return true;
    }

    private void recordScrapingError(MangaScanlator mapping, Exception cause) {
        try {
            ScrapingError error = new ScrapingError();
            error.setMangaScanlatorId(mapping.getId());
            error.setErrorType(cause.getClass().getSimpleName());
            error.setErrorMessage(truncate(cause.getMessage(), 4000));
            error.setUrl(mapping.getScanlatorMangaUrl());
            error.setCreatedAt(now());
            scrapingErrorRepository.save(error);
        } catch (Exception e) {
            logger.warn(TAG, "⚠️ Could not record scraping error for mapping " + mapping.getId() + ": " + e.getMessage());
        }
    }

    private boolean politenessPause() {
        long min = Math.max(0, delayMinMillis);
        long max = Math.max(min, delayMaxMillis);
        long delay = min == max ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
        if (delay == 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
