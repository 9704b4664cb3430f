package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.model.MessageView;
import com.joinwatch.tracker.monitor.util.SnowflakeUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a single channel message looks like a member joining. Depends only on the
 * message, the supplied clock reading and configuration.
 */
@Component
public class JoinMessageClassifier {
    static final List<String> JOIN_PHRASES = List.of(
        "joined the server",
        "joined the guild",
        "welcome to",
        "has joined",
        "new member",
        "member joined",
        "just joined",
        "welcome @",
        "joined us",
        "say hello to",
        "please welcome"
    );
    static final List<String> INTRODUCTION_PHRASES = List.of(
        "hello",
        "hi everyone",
        "hey",
        "new here",
        "first time",
        "nice to meet",
        "glad to be here",
        "excited to join",
        "thanks for having me",
        "happy to be here"
    );
    private static final int MAX_INTRODUCTION_LENGTH = 100;

    private final Duration activityWindow;
    private final Duration newAccountAge;

    public JoinMessageClassifier(MonitorProperties properties) {
        this.activityWindow = Duration.ofSeconds(properties.getDetector().getActivityWindowSeconds());
        this.newAccountAge = Duration.ofDays(properties.getDetector().getNewAccountDays());
    }

    public boolean isJoinSignal(MessageView message, Instant now) {
        if (message == null || !isRecent(message, now)) {
            return false;
        }
        if (message.type() == MessageView.MEMBER_JOIN) {
            return true;
        }
        if (message.type() != MessageView.DEFAULT) {
            return false;
        }
        String content = message.contentOrEmpty().toLowerCase(Locale.ROOT);
        if (containsAny(content, JOIN_PHRASES)) {
            return true;
        }
        return content.length() < MAX_INTRODUCTION_LENGTH
            && containsAny(content, INTRODUCTION_PHRASES)
            && isLowTenure(message.authorId(), now);
    }

    // Old messages stay in the recent-message page for a long time; only fresh ones count.
    private boolean isRecent(MessageView message, Instant now) {
        Instant sentAt = message.timestamp() != null ? message.timestamp() : SnowflakeUtils.creationTime(message.id());
        if (sentAt == null) {
            return false;
        }
        return !sentAt.isBefore(now.minus(activityWindow));
    }

    private boolean isLowTenure(String authorId, Instant now) {
        Instant createdAt = SnowflakeUtils.creationTime(authorId);
        return createdAt != null && createdAt.isAfter(now.minus(newAccountAge));
    }

    private boolean containsAny(String content, List<String> phrases) {
        for (String phrase : phrases) {
            if (content.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
