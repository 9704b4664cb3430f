package com.joinwatch.tracker.monitor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A detected "member joined" event before admission. Immutable, so handing it to the
 * guard leaves the producer with nothing it could mutate.
 */
public record JoinCandidate(
    String subjectId,
    String communityId,
    String communityName,
    Instant observedAt,
    JoinSource source,
    Confidence confidence,
    SubjectSnapshot snapshot
) {
    public JoinCandidate {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(communityId, "communityId");
        Objects.requireNonNull(observedAt, "observedAt");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(confidence, "confidence");
        if (snapshot == null) {
            snapshot = SubjectSnapshot.synthetic(null);
        }
    }

    public static JoinCandidate confirmed(
        String subjectId,
        String communityId,
        String communityName,
        SubjectSnapshot snapshot,
        Instant observedAt
    ) {
        return new JoinCandidate(
            subjectId,
            communityId,
            communityName,
            observedAt,
            JoinSource.EVENT_STREAM,
            Confidence.CONFIRMED,
            snapshot
        );
    }

    public static JoinCandidate inferred(
        String subjectId,
        String communityId,
        String communityName,
        String strategyName,
        SubjectSnapshot snapshot,
        Instant observedAt
    ) {
        return new JoinCandidate(
            subjectId,
            communityId,
            communityName,
            observedAt,
            JoinSource.heuristic(strategyName),
            Confidence.INFERRED,
            snapshot
        );
    }

    public String pairKey() {
        return subjectId + "@" + communityId;
    }
}
