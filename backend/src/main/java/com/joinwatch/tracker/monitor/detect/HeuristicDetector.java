package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.PlatformClient;
import com.joinwatch.tracker.monitor.http.RateLimitedException;
import com.joinwatch.tracker.monitor.http.RemoteCallException;
import com.joinwatch.tracker.monitor.http.RemoteCallGate;
import com.joinwatch.tracker.monitor.http.TransientRemoteException;
import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.DetectionBaseline;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import com.joinwatch.tracker.monitor.persistence.DetectionStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the detection strategies for one community in fixed order. A failing strategy costs only
 * its own signal for the round.
 */
@Component
public class HeuristicDetector {
    private static final Logger log = LoggerFactory.getLogger(HeuristicDetector.class);

    private final List<DetectionStrategy> strategies;
    private final PlatformClient platformClient;
    private final RemoteCallGate gate;
    private final DetectionStateRepository stateRepository;
    private final Clock clock;
    private final Duration heartbeatStale;

    public HeuristicDetector(
        CountDeltaStrategy countDeltaStrategy,
        ActivityPatternStrategy activityPatternStrategy,
        PresenceDeltaStrategy presenceDeltaStrategy,
        PlatformClient platformClient,
        RemoteCallGate gate,
        DetectionStateRepository stateRepository,
        Clock clock,
        MonitorProperties properties
    ) {
        this.strategies = List.of(countDeltaStrategy, activityPatternStrategy, presenceDeltaStrategy);
        this.platformClient = platformClient;
        this.gate = gate;
        this.stateRepository = stateRepository;
        this.clock = clock;
        this.heartbeatStale = Duration.ofMinutes(properties.getDetector().getHeartbeatStaleMinutes());
    }

    public List<DetectionStrategy> getStrategies() {
        return strategies;
    }

    public DetectionState loadState(String communityId) {
        Instant now = clock.instant();
        try {
            return DetectionState.restore(communityId, now, stateRepository.findBaselines(communityId));
        } catch (DataAccessException e) {
            log.warn("Unable to load detection state for community {}; starting fresh", communityId, e);
            return new DetectionState(communityId, now);
        }
    }

    public List<JoinCandidate> poll(CommunityTarget target, DetectionState state) {
        Instant now = clock.instant();
        PollContext context = new PollContext(target, state, platformClient, now);
        List<JoinCandidate> candidates = new ArrayList<>();
        for (DetectionStrategy strategy : strategies) {
            if (!gate.isOpen()) {
                log.debug("Detector paused until {}; {} skipped for {}", gate.pausedUntil(), strategy.name(), target.id());
                continue;
            }
            try {
                List<JoinCandidate> found = strategy.detect(context);
                context.recordEmitted(strategy.name(), found.size());
                candidates.addAll(found);
                if (!found.isEmpty()) {
                    log.info("{} found {} join candidate(s) in {}", strategy.name(), found.size(), target.id());
                }
                RemoteCallException deferred = context.takeDeferredFailure();
                if (deferred == null) {
                    gate.onSuccess();
                } else {
                    onRemoteFailure(strategy, target, deferred);
                }
            } catch (RemoteCallException e) {
                onRemoteFailure(strategy, target, e);
            } catch (RuntimeException e) {
                log.warn("{} failed for {}", strategy.name(), target.id(), e);
            }
        }
        state.recordPoll(now, candidates.size());
        if (candidates.isEmpty()) {
            emitHeartbeatIfStale(target, state, now);
        }
        persistBaselines(state, now);
        return candidates;
    }

    private void onRemoteFailure(DetectionStrategy strategy, CommunityTarget target, RemoteCallException e) {
        if (e instanceof RateLimitedException rateLimited) {
            gate.onRateLimited(rateLimited.getRetryAfter());
        } else if (e instanceof TransientRemoteException) {
            log.warn("{} transient failure for {}: {}", strategy.name(), target.id(), e.getMessage());
            gate.onTransientFailure();
        } else {
            log.debug("{} produced no signal for {}: {}", strategy.name(), target.id(), e.getMessage());
        }
    }

    private void emitHeartbeatIfStale(CommunityTarget target, DetectionState state, Instant now) {
        Instant reference = state.lastLivenessAt();
        if (Duration.between(reference, now).compareTo(heartbeatStale) >= 0) {
            log.info(
                "Heartbeat: no join signal for {} since {} ({} polls so far)",
                target.id(),
                state.getLastSignalAt() == null ? "startup" : state.getLastSignalAt(),
                state.getPollCount()
            );
            state.markHeartbeat(now);
        }
    }

    private void persistBaselines(DetectionState state, Instant now) {
        List<DetectionBaseline> changed = state.drainDirty(now);
        try {
            for (DetectionBaseline baseline : changed) {
                stateRepository.saveBaseline(
                    baseline.communityId(),
                    baseline.strategyName(),
                    baseline.fieldName(),
                    baseline.lastValue(),
                    now
                );
            }
        } catch (DataAccessException e) {
            // in-memory baselines stay authoritative for this process
            log.warn("Unable to persist detection state for {}", state.getCommunityId(), e);
        }
    }
}
