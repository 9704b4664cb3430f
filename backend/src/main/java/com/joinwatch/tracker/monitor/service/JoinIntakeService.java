package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.monitor.model.AdmissionResult;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class JoinIntakeService {
    private static final Logger log = LoggerFactory.getLogger(JoinIntakeService.class);

    private final DeduplicationGuard guard;
    private final NotificationDispatcher dispatcher;

    public JoinIntakeService(DeduplicationGuard guard, NotificationDispatcher dispatcher) {
        this.guard = guard;
        this.dispatcher = dispatcher;
    }

    public AdmissionResult submit(JoinCandidate candidate) {
        AdmissionResult result = guard.admit(candidate);
        switch (result.decision()) {
            case ADMITTED -> {
                log.info(
                    "Admitted join {} in {} from {} as record {}",
                    candidate.subjectId(),
                    candidate.communityId(),
                    candidate.source(),
                    result.joinRecordId()
                );
                dispatcher.enqueue(result.joinRecordId());
            }
            case DUPLICATE_NOTIFIED, DUPLICATE_TRACKED -> log.debug(
                "Dropped {} for {} in {} from {}",
                result.decision(),
                candidate.subjectId(),
                candidate.communityId(),
                candidate.source()
            );
            case STORE_UNAVAILABLE -> log.warn(
                "Join {} in {} not recorded; it will be picked up again on a later poll",
                candidate.subjectId(),
                candidate.communityId()
            );
        }
        return result;
    }

    public List<AdmissionResult> submitAll(List<JoinCandidate> candidates) {
        List<AdmissionResult> results = new ArrayList<>(candidates.size());
        for (JoinCandidate candidate : candidates) {
            results.add(submit(candidate));
        }
        return results;
    }
}
