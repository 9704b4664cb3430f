package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.detect.DetectionState;
import com.joinwatch.tracker.monitor.detect.HeuristicDetector;
import com.joinwatch.tracker.monitor.model.CommunityPollStatus;
import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import com.joinwatch.tracker.monitor.model.MonitoringMode;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import com.joinwatch.tracker.monitor.util.PlaceholderIds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DetectorDaemonServiceTest {
    private static final CommunityTarget ALPHA = new CommunityTarget("c1", "Alpha", MonitoringMode.HEURISTIC, false);

    private HeuristicDetector detector;
    private CommunityRegistryService registry;
    private JoinIntakeService intakeService;
    private DetectorDaemonService daemon;

    @BeforeEach
    void setUp() {
        detector = mock(HeuristicDetector.class);
        registry = mock(CommunityRegistryService.class);
        intakeService = mock(JoinIntakeService.class);
        MonitorProperties properties = new MonitorProperties();
        properties.getDetector().setPollIntervalSeconds(1);
        properties.getDetector().setWorkerThreads(2);
        daemon = new DetectorDaemonService(detector, registry, intakeService, properties);

        when(detector.loadState("c1")).thenReturn(new DetectionState("c1", Instant.now()));
        when(registry.pollTargets()).thenReturn(List.of(ALPHA));
    }

    @AfterEach
    void tearDown() {
        daemon.stop();
    }

    @Test
    void pollsWatchedCommunitiesAndHandsCandidatesToIntake() {
        Instant observedAt = Instant.now();
        JoinCandidate candidate = JoinCandidate.inferred(
            PlaceholderIds.forPopulationGrowth("c1", observedAt, 1),
            "c1",
            "Alpha",
            "count-delta",
            SubjectSnapshot.synthetic("new member 1 of 1"),
            observedAt
        );
        when(detector.poll(eq(ALPHA), any(DetectionState.class))).thenReturn(List.of(candidate));

        daemon.start();

        verify(registry, timeout(2000)).discover();
        verify(intakeService, timeout(3000).atLeastOnce()).submitAll(List.of(candidate));
        assertThat(daemon.isRunning()).isTrue();
        assertThat(daemon.pollStatuses()).extracting(CommunityPollStatus::communityId).containsExactly("c1");
    }

    @Test
    void failingPollKeepsTaskScheduled() {
        when(detector.poll(eq(ALPHA), any(DetectionState.class)))
            .thenThrow(new IllegalStateException("boom"))
            .thenReturn(List.of());

        daemon.start();

        verify(detector, timeout(4000).times(2)).poll(eq(ALPHA), any(DetectionState.class));
    }

    @Test
    void excludedCommunityStopsPolling() {
        when(detector.poll(eq(ALPHA), any(DetectionState.class))).thenReturn(List.of());
        when(registry.exclude("c1")).thenReturn(true);
        daemon.start();
        verify(detector, timeout(3000).atLeastOnce()).poll(eq(ALPHA), any(DetectionState.class));

        assertThat(daemon.excludeCommunity("c1")).isTrue();

        assertThat(daemon.pollStatuses()).isEmpty();
        verify(intakeService, never()).submitAll(anyList());
    }

    @Test
    void exclusionHoldsOffConcurrentResync() {
        when(detector.poll(eq(ALPHA), any(DetectionState.class))).thenReturn(List.of());
        daemon.start();
        verify(detector, timeout(3000).atLeastOnce()).poll(eq(ALPHA), any(DetectionState.class));
        AtomicReference<List<CommunityPollStatus>> statusesWhileExcluding = new AtomicReference<>();
        AtomicBoolean syncBlocked = new AtomicBoolean();
        when(registry.exclude("c1")).thenAnswer(invocation -> {
            statusesWhileExcluding.set(daemon.pollStatuses());
            Thread sync = new Thread(daemon::syncTasks);
            sync.start();
            sync.join(200);
            syncBlocked.set(sync.isAlive());
            return true;
        });

        assertThat(daemon.excludeCommunity("c1")).isTrue();

        assertThat(statusesWhileExcluding.get()).isEmpty();
        assertThat(syncBlocked).isTrue();
    }
}
