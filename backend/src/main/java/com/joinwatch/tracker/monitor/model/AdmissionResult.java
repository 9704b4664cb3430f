package com.joinwatch.tracker.monitor.model;

public record AdmissionResult(
    AdmissionDecision decision,
    Long joinRecordId
) {
    public static AdmissionResult admitted(long joinRecordId) {
        return new AdmissionResult(AdmissionDecision.ADMITTED, joinRecordId);
    }

    public static AdmissionResult rejected(AdmissionDecision decision) {
        return new AdmissionResult(decision, null);
    }

    public boolean isAdmitted() {
        return decision == AdmissionDecision.ADMITTED;
    }
}
