package com.joinwatch.tracker.monitor.api;

import com.joinwatch.tracker.monitor.model.AdmissionDecision;

public record MemberJoinedResponse(
    boolean accepted,
    AdmissionDecision decision,
    Long joinRecordId
) {
}
