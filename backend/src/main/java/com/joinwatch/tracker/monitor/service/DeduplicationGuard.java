package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.model.AdmissionDecision;
import com.joinwatch.tracker.monitor.model.AdmissionResult;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import com.joinwatch.tracker.monitor.persistence.JoinJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a join candidate becomes a tracked join record. Admission for one
 * (subject, community) pair is serialized in-process and checked against the store inside one
 * transaction, so concurrent producers of the same pair record it once.
 */
@Service
public class DeduplicationGuard {
    private static final Logger log = LoggerFactory.getLogger(DeduplicationGuard.class);
    private static final int LOCK_STRIPES = 64;

    private final JoinJdbcRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration window;
    private final Object[] stripes = new Object[LOCK_STRIPES];

    public DeduplicationGuard(
        JoinJdbcRepository repository,
        TransactionTemplate transactionTemplate,
        Clock clock,
        MonitorProperties properties
    ) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.window = Duration.ofHours(properties.getDedup().getWindowHours());
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new Object();
        }
    }

    public Duration getWindow() {
        return window;
    }

    public AdmissionResult admit(JoinCandidate candidate) {
        Object stripe = stripes[Math.floorMod(candidate.pairKey().hashCode(), LOCK_STRIPES)];
        synchronized (stripe) {
            try {
                AdmissionResult result = transactionTemplate.execute(status -> admitInTransaction(candidate));
                return result == null ? AdmissionResult.rejected(AdmissionDecision.STORE_UNAVAILABLE) : result;
            } catch (DataAccessException | TransactionException e) {
                log.warn(
                    "Store unavailable while admitting {} in {} from {}",
                    candidate.subjectId(),
                    candidate.communityId(),
                    candidate.source(),
                    e
                );
                return AdmissionResult.rejected(AdmissionDecision.STORE_UNAVAILABLE);
            }
        }
    }

    private AdmissionResult admitInTransaction(JoinCandidate candidate) {
        Instant since = candidate.observedAt().minus(window);
        if (repository.findMarkerSince(candidate.subjectId(), candidate.communityId(), since) != null) {
            return AdmissionResult.rejected(AdmissionDecision.DUPLICATE_NOTIFIED);
        }
        if (repository.existsJoinRecordSince(candidate.subjectId(), candidate.communityId(), since)) {
            return AdmissionResult.rejected(AdmissionDecision.DUPLICATE_TRACKED);
        }
        long id = repository.insertJoinRecord(candidate, clock.instant());
        return AdmissionResult.admitted(id);
    }
}
