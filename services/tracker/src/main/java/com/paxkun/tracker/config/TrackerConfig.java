package com.paxkun.tracker.config;

import com.paxkun.tracker.service.scanlator.ChapterDateParser;
import com.paxkun.tracker.service.scanlator.ChapterExtractor;
import com.paxkun.tracker.service.scanlator.ExtractionSettings;
import com.paxkun.tracker.service.scanlator.ScanlatorRegistry;
import com.paxkun.tracker.service.scanlator.sites.AsuraScans;
import com.paxkun.tracker.service.scanlator.sites.MadaraScans;
import com.paxkun.tracker.service.scanlator.sites.RavenScans;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class TrackerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ExtractionSettings extractionSettings(
            @Value("${tracker.extraction.max-reveal-clicks:50}") int maxRevealClicks,
            @Value("${tracker.extraction.settle-delay-ms:1500}") long settleDelayMillis,
            @Value("${tracker.extraction.navigation-timeout-ms:30000}") long navigationTimeoutMillis,
            @Value("${tracker.extraction.selector-timeout-ms:10000}") long selectorTimeoutMillis) {
        return new ExtractionSettings(
                maxRevealClicks,
                Duration.ofMillis(settleDelayMillis),
                Duration.ofMillis(navigationTimeoutMillis),
                Duration.ofMillis(selectorTimeoutMillis));
    }

    @Bean
    public ChapterDateParser chapterDateParser(Clock clock) {
        return new ChapterDateParser(clock);
    }

    @Bean
    public ChapterExtractor chapterExtractor(ExtractionSettings settings, ChapterDateParser dateParser) {
        return new ChapterExtractor(settings, dateParser);
    }

    /**
     * Every known plugin registers itself here. Adding a site means adding one line.
     */
    @Bean
    public ScanlatorRegistry scanlatorRegistry(ChapterExtractor extractor) {
        return new ScanlatorRegistry(List.of(
                AsuraScans.registration(extractor),
                RavenScans.registration(extractor),
                MadaraScans.registration(extractor)));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService trackingExecutor(@Value("${tracker.jobs.worker-threads:2}") int workerThreads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "tracking-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, workerThreads), threadFactory);
    }
}
