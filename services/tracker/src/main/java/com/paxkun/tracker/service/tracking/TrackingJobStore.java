package com.paxkun.tracker.service.tracking;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory table of tracking jobs for the lifetime of the process.
 * <p>
 * Reads are lock-free. Creation and eviction are serialized so retention is applied
 * consistently; only terminal jobs are ever evicted, oldest first.
 */
@Component
public class TrackingJobStore {

    private static final Comparator<Entry> NEWEST_FIRST = Comparator
            .comparing(Entry::startedAt, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(entry -> entry.job().getCreatedAt())
            .reversed();

    private final Map<String, TrackingJob> jobs = new ConcurrentHashMap<>();
    private final int retention;

    public TrackingJobStore(@Value("${tracker.jobs.retention:100}") int retention) {
        this.retention = Math.max(1, retention);
    }

    public synchronized TrackingJob create(TrackingRequest request, LocalDateTime now) {
        TrackingJob job = new TrackingJob(UUID.randomUUID().toString(), request, now);
        jobs.put(job.getJobId(), job);
        evictFinished();
        return job;
    }

    public Optional<TrackingJob> find(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Most recent jobs by start time; jobs that have not started yet sort last.
     */
    public List<TrackingJob> recent(int limit) {
        return jobs.values().stream()
                .map(job -> new Entry(job, job.getStartedAt()))
                .sorted(NEWEST_FIRST)
                .limit(Math.max(0, limit))
                .map(Entry::job)
                .toList();
    }

    public int size() {
        return jobs.size();
    }

    private void evictFinished() {
        List<TrackingJob> finished = jobs.values().stream()
                .filter(job -> job.getStatus().isTerminal())
                .sorted(Comparator.comparing(TrackingJob::getCreatedAt))
                .toList();
        int excess = finished.size() - retention;
        for (int i = 0; i < excess; i++) {
            jobs.remove(finished.get(i).getJobId());
        }
    }

    private record Entry(TrackingJob job, LocalDateTime startedAt) {
    }
}
