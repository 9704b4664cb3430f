package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.MalformedResponseException;
import com.joinwatch.tracker.monitor.http.PermissionDeniedException;
import com.joinwatch.tracker.monitor.model.ChannelInfo;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import com.joinwatch.tracker.monitor.model.MessageView;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import com.joinwatch.tracker.monitor.util.SnowflakeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class ActivityPatternStrategy implements DetectionStrategy {
    public static final String NAME = "activity-pattern";
    private static final Logger log = LoggerFactory.getLogger(ActivityPatternStrategy.class);
    private static final String AVATAR_URL_TEMPLATE = "https://cdn.discordapp.com/avatars/%s/%s.png";

    private final MonitorProperties properties;
    private final JoinMessageClassifier classifier;

    public ActivityPatternStrategy(MonitorProperties properties, JoinMessageClassifier classifier) {
        this.properties = properties;
        this.classifier = classifier;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<JoinCandidate> detect(PollContext context) {
        List<JoinCandidate> candidates = new ArrayList<>();
        for (MessageView message : joinMessagesByAuthor(context).values()) {
            candidates.add(JoinCandidate.inferred(
                message.authorId(),
                context.communityId(),
                context.communityName(),
                NAME,
                snapshotOf(message),
                context.now()
            ));
        }
        return candidates;
    }

    /**
     * First fresh join signal per human author across the prioritized channels. Channels that
     * cannot be read are skipped.
     */
    Map<String, MessageView> joinMessagesByAuthor(PollContext context) {
        List<ChannelInfo> channels = prioritize(context.channels());
        int limit = properties.getDetector().getMessagesPerChannel();
        Map<String, MessageView> byAuthor = new LinkedHashMap<>();
        for (ChannelInfo channel : channels) {
            List<MessageView> messages;
            try {
                messages = context.recentMessages(channel.id(), limit);
            } catch (PermissionDeniedException | MalformedResponseException e) {
                log.debug("Skipping channel {} in community {}: {}", channel.id(), context.communityId(), e.getMessage());
                continue;
            }
            for (MessageView message : messages) {
                if (message.authorBot() || !SnowflakeUtils.isSnowflake(message.authorId())) {
                    continue;
                }
                if (byAuthor.containsKey(message.authorId()) || !classifier.isJoinSignal(message, context.now())) {
                    continue;
                }
                byAuthor.put(message.authorId(), message);
            }
        }
        return byAuthor;
    }

    /**
     * Text channels only, welcome-style channels first, capped at the configured channel count.
     */
    List<ChannelInfo> prioritize(List<ChannelInfo> channels) {
        List<ChannelInfo> preferred = new ArrayList<>();
        List<ChannelInfo> others = new ArrayList<>();
        for (ChannelInfo channel : channels) {
            if (!channel.isText()) {
                continue;
            }
            if (matchesKeyword(channel.name())) {
                preferred.add(channel);
            } else {
                others.add(channel);
            }
        }
        List<ChannelInfo> ordered = new ArrayList<>(preferred);
        ordered.addAll(others);
        int max = properties.getDetector().getMaxChannels();
        return ordered.size() <= max ? ordered : ordered.subList(0, max);
    }

    private boolean matchesKeyword(String channelName) {
        if (channelName == null) {
            return false;
        }
        String lower = channelName.toLowerCase(Locale.ROOT);
        for (String keyword : properties.getDetector().getPriorityChannelKeywords()) {
            if (keyword != null && !keyword.isBlank() && lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static SubjectSnapshot snapshotOf(MessageView message) {
        return new SubjectSnapshot(
            message.authorUsername(),
            message.authorGlobalName(),
            SnowflakeUtils.creationTime(message.authorId()),
            avatarUrl(message.authorId(), message.authorAvatar()),
            message.authorBot(),
            message.authorSystem(),
            false
        );
    }

    static String avatarUrl(String userId, String avatarHash) {
        return avatarHash == null ? null : String.format(AVATAR_URL_TEMPLATE, userId, avatarHash);
    }
}
