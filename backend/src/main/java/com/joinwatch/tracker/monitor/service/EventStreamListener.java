package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.monitor.model.AdmissionResult;
import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import com.joinwatch.tracker.monitor.model.MonitoringMode;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Entry point for push "member joined" events. Events become confirmed candidates; delivery
 * guarantees are left to the pipeline, so nothing is retried here.
 */
@Service
public class EventStreamListener {
    private static final Logger log = LoggerFactory.getLogger(EventStreamListener.class);

    private final CommunityRegistryService registry;
    private final JoinIntakeService intakeService;
    private final Clock clock;

    public EventStreamListener(CommunityRegistryService registry, JoinIntakeService intakeService, Clock clock) {
        this.registry = registry;
        this.intakeService = intakeService;
        this.clock = clock;
    }

    /**
     * Turns one event into a confirmed candidate. An unknown community is registered as
     * event-stream; a community known only to the poller starts receiving events as well.
     *
     * @return the candidate, or empty when the community is excluded
     */
    public Optional<JoinCandidate> onMemberJoined(
        String communityId,
        String subjectId,
        SubjectSnapshot snapshot,
        Instant observedAt
    ) {
        if (registry.isExcluded(communityId)) {
            log.debug("Ignoring join of {} in excluded community {}", subjectId, communityId);
            return Optional.empty();
        }
        CommunityTarget target = registry.find(communityId);
        if (target == null) {
            target = registry.register(communityId, null, MonitoringMode.EVENT_STREAM);
        } else if (!target.monitoringMode().includesEventStream()) {
            target = registry.register(communityId, null, MonitoringMode.BOTH);
        }
        return Optional.of(JoinCandidate.confirmed(
            subjectId,
            communityId,
            target.displayName(),
            snapshot,
            observedAt == null ? clock.instant() : observedAt
        ));
    }

    /**
     * {@link #onMemberJoined} followed by intake.
     *
     * @return the admission result, or empty when the community is excluded
     */
    public Optional<AdmissionResult> accept(
        String communityId,
        String subjectId,
        SubjectSnapshot snapshot,
        Instant observedAt
    ) {
        return onMemberJoined(communityId, subjectId, snapshot, observedAt).map(intakeService::submit);
    }
}
