package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.detect.DetectionState;
import com.joinwatch.tracker.monitor.detect.HeuristicDetector;
import com.joinwatch.tracker.monitor.model.CommunityPollStatus;
import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Schedules one recurring heuristic poll per watched community and keeps the set of tasks in
 * line with the community registry.
 */
@Service
public class DetectorDaemonService {
    private static final Logger log = LoggerFactory.getLogger(DetectorDaemonService.class);

    private final HeuristicDetector detector;
    private final CommunityRegistryService registry;
    private final JoinIntakeService intakeService;
    private final MonitorProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final Map<String, PollTask> tasks = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;

    public DetectorDaemonService(
        HeuristicDetector detector,
        CommunityRegistryService registry,
        JoinIntakeService intakeService,
        MonitorProperties properties
    ) {
        this.detector = detector;
        this.registry = registry;
        this.intakeService = intakeService;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getDetector().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            AtomicInteger threadIndex = new AtomicInteger();
            scheduler = Executors.newScheduledThreadPool(properties.getDetector().getWorkerThreads(), runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("detector-poll-" + threadIndex.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            scheduler.scheduleWithFixedDelay(
                this::refreshTargets,
                0,
                properties.getCommunities().getRefreshMinutes(),
                TimeUnit.MINUTES
            );
            log.info("Detector daemon started with {} worker thread(s)", properties.getDetector().getWorkerThreads());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            for (String communityId : new ArrayList<>(tasks.keySet())) {
                stopTask(communityId);
            }
            if (scheduler != null) {
                scheduler.shutdown();
                try {
                    if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                        scheduler.shutdownNow();
                    }
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                    scheduler.shutdownNow();
                }
                scheduler = null;
            }
            log.info("Detector daemon stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public void refreshTargets() {
        try {
            registry.discover();
            syncTasks();
        } catch (RuntimeException e) {
            log.warn("Community refresh failed; keeping current poll tasks", e);
        }
    }

    /**
     * Starts tasks for newly watched communities and stops tasks for ones no longer watched.
     */
    public void syncTasks() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            List<CommunityTarget> targets = registry.pollTargets();
            Set<String> wanted = targets.stream().map(CommunityTarget::id).collect(Collectors.toSet());
            for (String communityId : new ArrayList<>(tasks.keySet())) {
                if (!wanted.contains(communityId)) {
                    stopTask(communityId);
                }
            }
            for (CommunityTarget target : targets) {
                PollTask existing = tasks.get(target.id());
                if (existing == null) {
                    schedule(target);
                } else {
                    existing.target = target;
                }
            }
        }
    }

    /**
     * Stops the poll task before recording the exclusion, so an in-flight poll cannot write
     * baselines after they were dropped. Holding the lifecycle lock keeps a concurrent sync
     * from rescheduling the task in between.
     */
    public boolean excludeCommunity(String communityId) {
        synchronized (lifecycleLock) {
            stopTask(communityId);
            return registry.exclude(communityId);
        }
    }

    public boolean includeCommunity(String communityId) {
        boolean changed = registry.include(communityId);
        if (changed) {
            syncTasks();
        }
        return changed;
    }

    public List<CommunityPollStatus> pollStatuses() {
        return tasks.values().stream()
            .map(task -> task.state.snapshot(task.target.displayName()))
            .sorted(Comparator.comparing(CommunityPollStatus::communityId))
            .toList();
    }

    private void schedule(CommunityTarget target) {
        int intervalSeconds = properties.getDetector().getPollIntervalSeconds();
        PollTask task = new PollTask(target, detector.loadState(target.id()));
        long initialDelayMs = ThreadLocalRandom.current().nextLong(Math.max(1L, intervalSeconds * 1000L));
        task.future = scheduler.scheduleWithFixedDelay(
            () -> pollOnce(task),
            initialDelayMs,
            intervalSeconds * 1000L,
            TimeUnit.MILLISECONDS
        );
        tasks.put(target.id(), task);
        log.info("Polling community {} ({}) every {}s", target.id(), target.displayName(), intervalSeconds);
    }

    // A scheduled task that throws is never run again, so every failure stops here.
    private void pollOnce(PollTask task) {
        synchronized (task.state) {
            if (task.stopped) {
                return;
            }
            try {
                List<JoinCandidate> candidates = detector.poll(task.target, task.state);
                if (!candidates.isEmpty()) {
                    intakeService.submitAll(candidates);
                }
            } catch (RuntimeException e) {
                log.warn("Poll of community {} failed", task.target.id(), e);
            }
        }
    }

    private void stopTask(String communityId) {
        PollTask task = tasks.remove(communityId);
        if (task == null) {
            return;
        }
        if (task.future != null) {
            task.future.cancel(false);
        }
        // waits for an in-flight poll to finish
        synchronized (task.state) {
            task.stopped = true;
        }
        log.info("Stopped polling community {}", communityId);
    }

    private static final class PollTask {
        private final DetectionState state;
        private volatile CommunityTarget target;
        private volatile ScheduledFuture<?> future;
        private boolean stopped;

        private PollTask(CommunityTarget target, DetectionState state) {
            this.target = target;
            this.state = state;
        }
    }
}
