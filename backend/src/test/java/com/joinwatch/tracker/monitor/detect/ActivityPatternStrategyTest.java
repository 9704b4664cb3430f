package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.PlatformClient;
import com.joinwatch.tracker.monitor.http.PlatformResponse;
import com.joinwatch.tracker.monitor.http.PlatformStatus;
import com.joinwatch.tracker.monitor.model.ChannelInfo;
import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import com.joinwatch.tracker.monitor.model.MessageView;
import com.joinwatch.tracker.monitor.model.MonitoringMode;
import com.joinwatch.tracker.support.Snowflakes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ActivityPatternStrategyTest {
    private static final Instant NOW = Instant.parse("2026-10-01T12:00:00Z");
    private static final Instant CREATED = NOW.minus(Duration.ofDays(3));
    private static final String NEWCOMER = Snowflakes.idCreatedAt(CREATED, 1);
    private static final CommunityTarget TARGET = new CommunityTarget("c1", "Guild", MonitoringMode.HEURISTIC, false);

    private MonitorProperties properties;
    private PlatformClient platformClient;
    private ActivityPatternStrategy strategy;

    @BeforeEach
    void setUp() {
        properties = new MonitorProperties();
        platformClient = mock(PlatformClient.class);
        strategy = new ActivityPatternStrategy(properties, new JoinMessageClassifier(properties));
    }

    @Test
    void prioritizesWelcomeChannelsAndSkipsNonText() {
        properties.getDetector().setMaxChannels(2);
        List<ChannelInfo> ordered = strategy.prioritize(List.of(
            new ChannelInfo("1", "memes", ChannelInfo.TEXT),
            new ChannelInfo("2", "welcome-voice", 2),
            new ChannelInfo("3", "Welcome", ChannelInfo.TEXT),
            new ChannelInfo("4", "off-topic", ChannelInfo.TEXT)
        ));

        assertThat(ordered).extracting(ChannelInfo::id).containsExactly("3", "1");
    }

    @Test
    void oneCandidatePerAuthorWithRealSnapshot() {
        channels(new ChannelInfo("ch-1", "welcome", ChannelInfo.TEXT));
        messages("ch-1",
            new MessageView("m1", MessageView.MEMBER_JOIN, "", NEWCOMER, "newbie", "New Bie", "abc", false, false, NOW),
            new MessageView("m2", MessageView.DEFAULT, "hello everyone", NEWCOMER, "newbie", "New Bie", "abc", false, false, NOW),
            new MessageView("m3", MessageView.MEMBER_JOIN, "", "777", "helper", null, null, true, false, NOW),
            new MessageView("m4", MessageView.MEMBER_JOIN, "", "webhook-user", "hook", null, null, false, false, NOW)
        );

        List<JoinCandidate> candidates = strategy.detect(context());

        assertThat(candidates).hasSize(1);
        JoinCandidate candidate = candidates.get(0);
        assertThat(candidate.subjectId()).isEqualTo(NEWCOMER);
        assertThat(candidate.source().value()).isEqualTo("heuristic:activity-pattern");
        assertThat(candidate.observedAt()).isEqualTo(NOW);
        assertThat(candidate.snapshot().username()).isEqualTo("newbie");
        assertThat(candidate.snapshot().accountCreatedAt()).isEqualTo(CREATED);
        assertThat(candidate.snapshot().avatarUrl()).isEqualTo("https://cdn.discordapp.com/avatars/" + NEWCOMER + "/abc.png");
        assertThat(candidate.snapshot().synthetic()).isFalse();
    }

    @Test
    void unreadableChannelIsSkipped() {
        channels(
            new ChannelInfo("locked", "welcome", ChannelInfo.TEXT),
            new ChannelInfo("open", "general", ChannelInfo.TEXT)
        );
        when(platformClient.fetchRecentMessages(eq("locked"), anyInt()))
            .thenReturn(PlatformResponse.failure(PlatformStatus.FORBIDDEN, 403, "Missing Access"));
        messages("open",
            new MessageView("m1", MessageView.MEMBER_JOIN, "", NEWCOMER, "newbie", null, null, false, false, NOW)
        );

        assertThat(strategy.detect(context())).hasSize(1);
    }

    @Test
    void noTextChannelsMeansNoReads() {
        channels(new ChannelInfo("v", "lobby", 2));

        assertThat(strategy.detect(context())).isEmpty();
        verify(platformClient, never()).fetchRecentMessages(eq("v"), anyInt());
    }

    private void channels(ChannelInfo... channels) {
        when(platformClient.listChannels("c1")).thenReturn(PlatformResponse.ok(List.of(channels), 200));
    }

    private void messages(String channelId, MessageView... messages) {
        when(platformClient.fetchRecentMessages(eq(channelId), anyInt()))
            .thenReturn(PlatformResponse.ok(List.of(messages), 200));
    }

    private PollContext context() {
        return new PollContext(TARGET, new DetectionState("c1", NOW), platformClient, NOW);
    }
}
