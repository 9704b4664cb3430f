package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.persistence.JoinJdbcRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Deletes join records and markers older than the retention period. Records still waiting
 * for delivery are kept.
 */
@Service
public class RetentionService {
    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private final JoinJdbcRepository repository;
    private final MonitorProperties.Retention retention;
    private final Duration dedupWindow;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public RetentionService(JoinJdbcRepository repository, MonitorProperties properties, Clock clock) {
        this.repository = repository;
        this.retention = properties.getRetention();
        this.dedupWindow = Duration.ofHours(properties.getDedup().getWindowHours());
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (!retention.isEnabled()) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("join-retention");
            thread.setDaemon(true);
            return thread;
        });
        long intervalHours = retention.getCleanupIntervalHours();
        scheduler.scheduleWithFixedDelay(this::runScheduledCleanup, 1, intervalHours * 60, TimeUnit.MINUTES);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    public CleanupResult cleanup() {
        Duration keep = Duration.ofDays(retention.getDays());
        // never cut into the dedup window, or a pair could be notified twice
        if (keep.compareTo(dedupWindow) < 0) {
            keep = dedupWindow;
        }
        Instant cutoff = clock.instant().minus(keep);
        int records = repository.deleteJoinRecordsBefore(cutoff);
        int markers = repository.deleteMarkersBefore(cutoff);
        log.info("Retention cleanup removed {} join record(s) and {} marker(s) older than {}", records, markers, cutoff);
        return new CleanupResult(cutoff, records, markers);
    }

    private void runScheduledCleanup() {
        try {
            cleanup();
        } catch (DataAccessException e) {
            log.warn("Retention cleanup failed", e);
        }
    }

    public record CleanupResult(Instant cutoff, int deletedRecords, int deletedMarkers) {
    }
}
