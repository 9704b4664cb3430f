package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.monitor.model.JoinRecord;
import com.joinwatch.tracker.monitor.model.JoinStats;
import com.joinwatch.tracker.monitor.model.MonitorStatusResponse;
import com.joinwatch.tracker.monitor.persistence.JoinJdbcRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class MonitorStatusService {
    private final JoinJdbcRepository repository;
    private final DetectorDaemonService detectorDaemonService;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;

    public MonitorStatusService(
        JoinJdbcRepository repository,
        DetectorDaemonService detectorDaemonService,
        NotificationDispatcher dispatcher,
        Clock clock
    ) {
        this.repository = repository;
        this.detectorDaemonService = detectorDaemonService;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public MonitorStatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception ignored) {
            dbConnected = false;
        }
        Map<String, Long> counts = new LinkedHashMap<>();
        JoinStats stats = null;
        if (dbConnected) {
            counts = repository.tableCounts();
            stats = repository.fetchJoinStats(clock.instant());
        }
        return new MonitorStatusResponse(
            dbConnected,
            counts,
            stats,
            detectorDaemonService.isRunning(),
            dispatcher.queueDepth(),
            detectorDaemonService.pollStatuses()
        );
    }

    public List<JoinRecord> getRecentJoins(Integer hours, String communityId, Integer limit) {
        int safeHours = hours == null ? 24 : Math.max(1, Math.min(hours, 24 * 90));
        int safeLimit = limit == null ? 50 : Math.max(1, Math.min(limit, 500));
        Instant since = clock.instant().minus(Duration.ofHours(safeHours));
        return repository.findRecentJoins(since, communityId, safeLimit);
    }
}
