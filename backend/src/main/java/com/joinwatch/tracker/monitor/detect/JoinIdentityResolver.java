package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.MalformedResponseException;
import com.joinwatch.tracker.monitor.http.PermissionDeniedException;
import com.joinwatch.tracker.monitor.http.TransientRemoteException;
import com.joinwatch.tracker.monitor.model.AuditEntryView;
import com.joinwatch.tracker.monitor.model.MemberView;
import com.joinwatch.tracker.monitor.model.MessageView;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import com.joinwatch.tracker.monitor.util.SnowflakeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks for the real accounts behind population growth before the growth is reported as
 * placeholders. Sources are tried in order: fresh join messages, the member list, then
 * member-add audit entries. Only evidence newer than the previous poll counts, so a join that
 * was already attributed is not attributed again.
 */
@Component
public class JoinIdentityResolver {
    static final int MEMBER_ADD_ACTION = 1;

    private static final Logger log = LoggerFactory.getLogger(JoinIdentityResolver.class);

    private final MonitorProperties properties;
    private final ActivityPatternStrategy activityStrategy;

    public JoinIdentityResolver(MonitorProperties properties, ActivityPatternStrategy activityStrategy) {
        this.properties = properties;
        this.activityStrategy = activityStrategy;
    }

    /**
     * @return at most {@code wanted} distinct accounts, newest evidence first within each source
     */
    public List<ResolvedMember> resolve(PollContext context, long wanted) {
        if (!properties.getDetector().isIdentityLookup() || wanted <= 0) {
            return List.of();
        }
        Instant since = evidenceCutoff(context);
        Map<String, ResolvedMember> found = new LinkedHashMap<>();
        try {
            fromJoinMessages(context, since, found, wanted);
            if (found.size() < wanted) {
                fromMemberList(context, since, found, wanted);
            }
            if (found.size() < wanted) {
                fromAuditLog(context, since, found, wanted);
            }
        } catch (TransientRemoteException e) {
            log.debug("Identity lookup for {} interrupted: {}", context.communityId(), e.getMessage());
            context.deferFailure(e);
        }
        if (!found.isEmpty()) {
            log.info("Resolved {} of {} new member(s) in {}", found.size(), wanted, context.communityId());
        }
        return new ArrayList<>(found.values());
    }

    private void fromJoinMessages(PollContext context, Instant since, Map<String, ResolvedMember> found, long wanted) {
        Map<String, MessageView> messages;
        try {
            messages = activityStrategy.joinMessagesByAuthor(context);
        } catch (PermissionDeniedException | MalformedResponseException e) {
            log.debug("No join messages readable in {}: {}", context.communityId(), e.getMessage());
            return;
        }
        for (MessageView message : messages.values()) {
            Instant sentAt = message.timestamp() != null ? message.timestamp() : SnowflakeUtils.creationTime(message.id());
            if (sentAt == null || !sentAt.isAfter(since) || message.authorSystem()) {
                continue;
            }
            add(found, wanted, new ResolvedMember(message.authorId(), ActivityPatternStrategy.snapshotOf(message)));
        }
    }

    private void fromMemberList(PollContext context, Instant since, Map<String, ResolvedMember> found, long wanted) {
        List<MemberView> members;
        try {
            members = context.platformClient()
                .listMembers(context.communityId(), properties.getDetector().getMemberLookupLimit())
                .payloadOrThrow();
        } catch (PermissionDeniedException | MalformedResponseException e) {
            log.debug("Member list unavailable for {}: {}", context.communityId(), e.getMessage());
            return;
        }
        if (members == null) {
            return;
        }
        List<MemberView> recent = members.stream()
            .filter(member -> member.joinedAt() != null && member.joinedAt().isAfter(since))
            .sorted(Comparator.comparing(MemberView::joinedAt).reversed())
            .toList();
        for (MemberView member : recent) {
            if (isHuman(member)) {
                add(found, wanted, toResolved(member));
            }
        }
    }

    private void fromAuditLog(PollContext context, Instant since, Map<String, ResolvedMember> found, long wanted) {
        List<AuditEntryView> entries;
        try {
            entries = context.platformClient()
                .fetchAuditLog(context.communityId(), MEMBER_ADD_ACTION, properties.getDetector().getAuditLogLimit())
                .payloadOrThrow();
        } catch (PermissionDeniedException | MalformedResponseException e) {
            log.debug("Audit log unavailable for {}: {}", context.communityId(), e.getMessage());
            return;
        }
        if (entries == null) {
            return;
        }
        for (AuditEntryView entry : entries) {
            if (found.size() >= wanted) {
                return;
            }
            Instant loggedAt = SnowflakeUtils.creationTime(entry.id());
            String targetId = entry.targetId();
            if (loggedAt == null || !loggedAt.isAfter(since) || !SnowflakeUtils.isSnowflake(targetId)) {
                continue;
            }
            if (found.containsKey(targetId)) {
                continue;
            }
            try {
                MemberView user = context.platformClient().fetchUser(targetId).payloadOrThrow();
                if (user != null && isHuman(user)) {
                    add(found, wanted, toResolved(user));
                }
            } catch (PermissionDeniedException | MalformedResponseException e) {
                log.debug("Unable to read account {}: {}", targetId, e.getMessage());
            }
        }
    }

    private Instant evidenceCutoff(PollContext context) {
        Instant windowStart = context.now().minusSeconds(properties.getDetector().getActivityWindowSeconds());
        Instant lastPoll = context.state().getLastPollAt();
        return lastPoll != null && lastPoll.isAfter(windowStart) ? lastPoll : windowStart;
    }

    private boolean isHuman(MemberView member) {
        return !member.bot() && !member.system() && SnowflakeUtils.isSnowflake(member.userId());
    }

    private void add(Map<String, ResolvedMember> found, long wanted, ResolvedMember member) {
        if (found.size() < wanted) {
            found.putIfAbsent(member.subjectId(), member);
        }
    }

    private ResolvedMember toResolved(MemberView member) {
        return new ResolvedMember(member.userId(), new SubjectSnapshot(
            member.username(),
            member.globalName(),
            SnowflakeUtils.creationTime(member.userId()),
            ActivityPatternStrategy.avatarUrl(member.userId(), member.avatar()),
            member.bot(),
            member.system(),
            false
        ));
    }

    public record ResolvedMember(String subjectId, SubjectSnapshot snapshot) {
    }
}
