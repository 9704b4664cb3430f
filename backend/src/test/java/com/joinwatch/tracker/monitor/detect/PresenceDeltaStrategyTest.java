package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.PlatformClient;
import com.joinwatch.tracker.monitor.http.PlatformResponse;
import com.joinwatch.tracker.monitor.model.CommunityInfo;
import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import com.joinwatch.tracker.monitor.model.MonitoringMode;
import com.joinwatch.tracker.monitor.util.PlaceholderIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PresenceDeltaStrategyTest {
    private static final Instant NOW = Instant.parse("2026-10-01T12:00:00Z");
    private static final String FIELD = "approximate_presence_count";
    private static final CommunityTarget TARGET = new CommunityTarget("c1", "Guild", MonitoringMode.HEURISTIC, false);

    private PlatformClient platformClient;
    private PresenceDeltaStrategy strategy;
    private DetectionState state;

    @BeforeEach
    void setUp() {
        platformClient = mock(PlatformClient.class);
        strategy = new PresenceDeltaStrategy(new MonitorProperties());
        state = new DetectionState("c1", NOW);
        state.updateBaseline(PresenceDeltaStrategy.NAME, FIELD, 10L);
    }

    @Test
    void eachOnlineGainGetsItsOwnId() {
        presence(13L);

        List<JoinCandidate> candidates = strategy.detect(context(NOW));

        assertThat(candidates).extracting(JoinCandidate::subjectId).containsExactly(
            PlaceholderIds.forPresence("c1", NOW, 1),
            PlaceholderIds.forPresence("c1", NOW, 2),
            PlaceholderIds.forPresence("c1", NOW, 3)
        );
    }

    @Test
    void repeatedGainInALaterPollGetsFreshIds() {
        presence(11L);
        List<JoinCandidate> first = strategy.detect(context(NOW));
        presence(10L);
        strategy.detect(context(NOW.plusSeconds(7)));
        presence(11L);
        List<JoinCandidate> again = strategy.detect(context(NOW.plusSeconds(14)));

        assertThat(again).hasSize(1);
        assertThat(again.get(0).subjectId()).isNotEqualTo(first.get(0).subjectId());
    }

    @Test
    void silentWhenCountsAlreadyReportedThisRound() {
        presence(14L);
        PollContext context = context(NOW);
        context.recordEmitted(CountDeltaStrategy.NAME, 1);

        assertThat(strategy.detect(context)).isEmpty();
        assertThat(state.baseline(PresenceDeltaStrategy.NAME, FIELD)).isEqualTo(14L);
    }

    private void presence(long online) {
        when(platformClient.fetchCommunity("c1"))
            .thenReturn(PlatformResponse.ok(new CommunityInfo("c1", "Guild", Map.of(FIELD, online)), 200));
    }

    private PollContext context(Instant now) {
        return new PollContext(TARGET, state, platformClient, now);
    }
}
