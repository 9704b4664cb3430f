package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.PlatformClient;
import com.joinwatch.tracker.monitor.model.AdmissionDecision;
import com.joinwatch.tracker.monitor.model.AdmissionResult;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import com.joinwatch.tracker.monitor.persistence.JoinJdbcRepository;
import com.joinwatch.tracker.support.TestTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class DeduplicationGuardTest {

    @Autowired
    private DeduplicationGuard guard;

    @Autowired
    private JoinJdbcRepository repository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @MockBean
    private PlatformClient platformClient;

    private Instant now;

    @BeforeEach
    void setUp() {
        TestTables.clear(jdbcTemplate);
        now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    }

    @Test
    void samePairIsTrackedOnceWithinWindow() {
        AdmissionResult first = guard.admit(confirmed("111111111111111111", "c1", now));
        AdmissionResult second = guard.admit(confirmed("111111111111111111", "c1", now.plus(Duration.ofHours(2))));
        AdmissionResult otherCommunity = guard.admit(confirmed("111111111111111111", "c2", now));

        assertThat(first.isAdmitted()).isTrue();
        assertThat(first.joinRecordId()).isNotNull();
        assertThat(second.decision()).isEqualTo(AdmissionDecision.DUPLICATE_TRACKED);
        assertThat(otherCommunity.isAdmitted()).isTrue();
        assertThat(repository.findJoinsForPair("111111111111111111", "c1")).hasSize(1);
    }

    @Test
    void notifiedPairReportsMarker() {
        AdmissionResult first = guard.admit(confirmed("222222222222222222", "c1", now));
        repository.insertMarker("222222222222222222", "c1", now, first.joinRecordId());

        AdmissionResult again = guard.admit(confirmed("222222222222222222", "c1", now.plusSeconds(60)));

        assertThat(again.decision()).isEqualTo(AdmissionDecision.DUPLICATE_NOTIFIED);
    }

    @Test
    void pairIsAdmittedAgainOnceWindowHasPassed() {
        Instant longAgo = now.minus(guard.getWindow()).minus(Duration.ofHours(1));
        AdmissionResult old = guard.admit(confirmed("333333333333333333", "c1", longAgo));
        repository.insertMarker("333333333333333333", "c1", longAgo, old.joinRecordId());

        AdmissionResult fresh = guard.admit(confirmed("333333333333333333", "c1", now));

        assertThat(fresh.isAdmitted()).isTrue();
        assertThat(repository.findJoinsForPair("333333333333333333", "c1")).hasSize(2);
    }

    @Test
    void concurrentProducersRecordThePairOnce() throws Exception {
        int producers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<AdmissionResult>> futures = new ArrayList<>();
            for (int i = 0; i < producers; i++) {
                JoinCandidate candidate = i % 2 == 0
                    ? confirmed("444444444444444444", "c1", now)
                    : JoinCandidate.inferred(
                        "444444444444444444",
                        "c1",
                        "Guild",
                        "activity-pattern",
                        SubjectSnapshot.of("dana", null, now.minus(Duration.ofDays(3)), null),
                        now
                    );
                futures.add(pool.submit(() -> {
                    start.await();
                    return guard.admit(candidate);
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<AdmissionResult> future : futures) {
                AdmissionResult result = future.get();
                assertThat(result.decision()).isNotEqualTo(AdmissionDecision.STORE_UNAVAILABLE);
                if (result.isAdmitted()) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(1);
            assertThat(repository.findJoinsForPair("444444444444444444", "c1")).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void storeFailureIsReportedNotThrown() {
        JoinJdbcRepository failing = mock(JoinJdbcRepository.class);
        when(failing.findMarkerSince(anyString(), anyString(), any()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));
        DeduplicationGuard isolated = new DeduplicationGuard(
            failing,
            transactionTemplate,
            Clock.systemUTC(),
            new MonitorProperties()
        );

        AdmissionResult result = isolated.admit(confirmed("555555555555555555", "c1", now));

        assertThat(result.decision()).isEqualTo(AdmissionDecision.STORE_UNAVAILABLE);
        assertThat(result.joinRecordId()).isNull();
    }

    private JoinCandidate confirmed(String subjectId, String communityId, Instant observedAt) {
        return JoinCandidate.confirmed(
            subjectId,
            communityId,
            "Guild",
            SubjectSnapshot.of("user" + subjectId.charAt(0), null, observedAt.minus(Duration.ofDays(100)), null),
            observedAt
        );
    }
}
