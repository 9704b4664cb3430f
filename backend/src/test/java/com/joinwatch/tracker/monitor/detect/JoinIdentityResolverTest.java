package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.PlatformClient;
import com.joinwatch.tracker.monitor.http.PlatformResponse;
import com.joinwatch.tracker.monitor.http.RateLimitedException;
import com.joinwatch.tracker.monitor.model.AuditEntryView;
import com.joinwatch.tracker.monitor.model.ChannelInfo;
import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.MemberView;
import com.joinwatch.tracker.monitor.model.MessageView;
import com.joinwatch.tracker.monitor.model.MonitoringMode;
import com.joinwatch.tracker.support.PlatformStubs;
import com.joinwatch.tracker.support.Snowflakes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JoinIdentityResolverTest {
    private static final Instant NOW = Instant.parse("2026-10-01T12:00:00Z");
    private static final CommunityTarget TARGET = new CommunityTarget("c1", "Guild", MonitoringMode.HEURISTIC, false);
    private static final String ALICE = Snowflakes.idCreatedAt(NOW.minus(Duration.ofDays(40)), 1);
    private static final String BOB = Snowflakes.idCreatedAt(NOW.minus(Duration.ofDays(41)), 2);
    private static final String CAROL = Snowflakes.idCreatedAt(NOW.minus(Duration.ofDays(42)), 3);

    private MonitorProperties properties;
    private PlatformClient platformClient;
    private JoinIdentityResolver resolver;
    private DetectionState state;

    @BeforeEach
    void setUp() {
        properties = new MonitorProperties();
        platformClient = mock(PlatformClient.class);
        resolver = new JoinIdentityResolver(
            properties,
            new ActivityPatternStrategy(properties, new JoinMessageClassifier(properties))
        );
        state = new DetectionState("c1", NOW);
        when(platformClient.listChannels("c1")).thenReturn(PlatformResponse.ok(List.of(), 200));
        PlatformStubs.denyMemberLookups(platformClient);
    }

    @Test
    void joinMessageNamesTheNewcomerWithoutListingMembers() {
        welcomeChannel(new MessageView(
            "m1", MessageView.MEMBER_JOIN, "", ALICE, "alice", "Alice", "hash", false, false, NOW.minusSeconds(4)
        ));

        List<JoinIdentityResolver.ResolvedMember> resolved = resolver.resolve(context(), 1);

        assertThat(resolved).extracting(JoinIdentityResolver.ResolvedMember::subjectId).containsExactly(ALICE);
        assertThat(resolved.get(0).snapshot().username()).isEqualTo("alice");
        assertThat(resolved.get(0).snapshot().synthetic()).isFalse();
        verify(platformClient, never()).listMembers(anyString(), anyInt());
    }

    @Test
    void evidenceFromBeforeThePreviousPollIsIgnored() {
        state.recordPoll(NOW.minusSeconds(7), 0);
        welcomeChannel(new MessageView(
            "m1", MessageView.MEMBER_JOIN, "", ALICE, "alice", null, null, false, false, NOW.minusSeconds(30)
        ));
        when(platformClient.listMembers(eq("c1"), anyInt())).thenReturn(PlatformResponse.ok(List.of(
            member(BOB, "bob", false, NOW.minusSeconds(20))
        ), 200));

        assertThat(resolver.resolve(context(), 2)).isEmpty();
    }

    @Test
    void memberListIsReadNewestFirstAndSkipsBots() {
        String helper = Snowflakes.idCreatedAt(NOW.minus(Duration.ofDays(400)), 9);
        when(platformClient.listMembers(eq("c1"), anyInt())).thenReturn(PlatformResponse.ok(List.of(
            member(CAROL, "carol", false, NOW.minus(Duration.ofHours(2))),
            member(ALICE, "alice", false, NOW.minusSeconds(40)),
            member(helper, "helper", true, NOW.minusSeconds(5)),
            member(BOB, "bob", false, NOW.minusSeconds(10))
        ), 200));

        List<JoinIdentityResolver.ResolvedMember> resolved = resolver.resolve(context(), 3);

        assertThat(resolved).extracting(JoinIdentityResolver.ResolvedMember::subjectId).containsExactly(BOB, ALICE);
    }

    @Test
    void resolvesNoMoreThanTheGrowth() {
        when(platformClient.listMembers(eq("c1"), anyInt())).thenReturn(PlatformResponse.ok(List.of(
            member(ALICE, "alice", false, NOW.minusSeconds(40)),
            member(BOB, "bob", false, NOW.minusSeconds(10))
        ), 200));

        assertThat(resolver.resolve(context(), 1))
            .extracting(JoinIdentityResolver.ResolvedMember::subjectId)
            .containsExactly(BOB);
        verify(platformClient, never()).fetchAuditLog(anyString(), anyInt(), anyInt());
    }

    @Test
    void auditLogFallbackLooksUpEachFreshTarget() {
        when(platformClient.fetchAuditLog(eq("c1"), eq(JoinIdentityResolver.MEMBER_ADD_ACTION), anyInt()))
            .thenReturn(PlatformResponse.ok(List.of(
                new AuditEntryView(Snowflakes.idCreatedAt(NOW.minusSeconds(15), 1), 1, ALICE),
                new AuditEntryView(Snowflakes.idCreatedAt(NOW.minus(Duration.ofHours(3)), 2), 1, BOB)
            ), 200));
        when(platformClient.fetchUser(ALICE))
            .thenReturn(PlatformResponse.ok(new MemberView(ALICE, "alice", "Alice", "a1", false, false, null), 200));

        List<JoinIdentityResolver.ResolvedMember> resolved = resolver.resolve(context(), 2);

        assertThat(resolved).extracting(JoinIdentityResolver.ResolvedMember::subjectId).containsExactly(ALICE);
        assertThat(resolved.get(0).snapshot().avatarUrl())
            .isEqualTo("https://cdn.discordapp.com/avatars/" + ALICE + "/a1.png");
        verify(platformClient, never()).fetchUser(BOB);
    }

    @Test
    void throttlingIsHandedBackToTheDetector() {
        when(platformClient.listMembers(eq("c1"), anyInt()))
            .thenReturn(PlatformResponse.rateLimited(429, Duration.ofSeconds(3), "slow down"));
        PollContext context = context();

        assertThat(resolver.resolve(context, 2)).isEmpty();
        assertThat(context.takeDeferredFailure()).isInstanceOf(RateLimitedException.class);
        verify(platformClient, never()).fetchAuditLog(anyString(), anyInt(), anyInt());
    }

    @Test
    void disabledLookupMakesNoCalls() {
        properties.getDetector().setIdentityLookup(false);

        assertThat(resolver.resolve(context(), 3)).isEmpty();
        verifyNoInteractions(platformClient);
    }

    private void welcomeChannel(MessageView... messages) {
        when(platformClient.listChannels("c1"))
            .thenReturn(PlatformResponse.ok(List.of(new ChannelInfo("ch", "welcome", ChannelInfo.TEXT)), 200));
        when(platformClient.fetchRecentMessages(eq("ch"), anyInt()))
            .thenReturn(PlatformResponse.ok(List.of(messages), 200));
    }

    private MemberView member(String id, String username, boolean bot, Instant joinedAt) {
        return new MemberView(id, username, null, null, bot, false, joinedAt);
    }

    private PollContext context() {
        return new PollContext(TARGET, state, platformClient, NOW);
    }
}
