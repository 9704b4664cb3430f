package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.model.Confidence;
import com.joinwatch.tracker.monitor.model.JoinRecord;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

@Component
public class JoinNotificationFormatter {
    public static final int MAX_MESSAGE_LENGTH = 2000;
    private static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);
    private static final String UNKNOWN = "Unknown";
    private static final String TRUNCATION_SUFFIX = "\n...";

    private final MonitorProperties.Notifications notifications;

    public JoinNotificationFormatter(MonitorProperties properties) {
        this.notifications = properties.getNotifications();
    }

    public String format(JoinRecord record, Instant now) {
        String message = notifications.isDetailedFormat() ? formatDetailed(record, now) : formatBasic(record, now);
        return limit(message);
    }

    public String formatTestMessage(Instant now) {
        return "Test notification from join-watch at " + DATE_FORMAT.format(now) + ". Delivery is working.";
    }

    public String formatFailureNotice(JoinRecord record, int attempts, String reason) {
        String who = record.snapshot() != null && record.snapshot().hasUsername()
            ? record.snapshot().username()
            : record.subjectId();
        return limit(
            "Could not deliver join notification for " + who
                + " in " + communityLabel(record)
                + " after " + attempts + " attempt(s): " + (reason == null ? UNKNOWN : reason)
        );
    }

    String formatBasic(JoinRecord record, Instant now) {
        SubjectSnapshot snapshot = record.snapshot();
        String username = snapshot != null && snapshot.hasUsername() ? snapshot.username() : UNKNOWN;
        String age = snapshot == null || snapshot.accountCreatedAt() == null
            ? UNKNOWN
            : formatAccountAge(snapshot.accountCreatedAt(), now);
        return "user " + username + " with account age " + age + " has joined the server " + communityLabel(record);
    }

    String formatDetailed(JoinRecord record, Instant now) {
        MonitorProperties.UserDetails details = notifications.getUserDetails();
        SubjectSnapshot snapshot = record.snapshot();
        List<String> lines = new ArrayList<>();
        lines.add("**New Member Joined** (" + sourceLabel(record) + ")");
        lines.add("");
        lines.add("**Server:** " + communityLabel(record) + " (ID: " + record.communityId() + ")");
        lines.add("");
        if (details.isIncludeUsername()) {
            lines.add("**Username:** " + (snapshot.hasUsername() ? snapshot.username() : UNKNOWN));
        }
        if (details.isIncludeDisplayName()
            && snapshot.displayName() != null
            && !snapshot.displayName().isBlank()
            && !snapshot.displayName().equals(snapshot.username())) {
            lines.add("**Display Name:** " + snapshot.displayName());
        }
        if (details.isIncludeUserId()) {
            lines.add("**User ID:** " + record.subjectId());
        }
        if (details.isIncludeAccountAge() && snapshot.accountCreatedAt() != null) {
            lines.add("**Account Age:** " + formatAccountAge(snapshot.accountCreatedAt(), now));
            lines.add("**Created:** " + DATE_FORMAT.format(snapshot.accountCreatedAt()));
        }
        if (details.isIncludeJoinDate() && record.observedAt() != null) {
            lines.add("**Joined Server:** " + DATE_FORMAT.format(record.observedAt()));
        }

        List<String> status = new ArrayList<>();
        if (snapshot.bot()) {
            status.add("Bot");
        }
        if (snapshot.system()) {
            status.add("System");
        }
        String warning = accountWarning(snapshot.accountCreatedAt(), now);
        if (warning != null) {
            status.add(warning);
        }
        if (!status.isEmpty()) {
            lines.add("");
            lines.add("**Status:** " + String.join(" | ", status));
        }
        if (details.isIncludeAvatar() && snapshot.avatarUrl() != null) {
            lines.add("");
            lines.add("**Avatar:** " + snapshot.avatarUrl());
        }
        return String.join("\n", lines);
    }

    public String formatAccountAge(Instant createdAt, Instant now) {
        long totalDays = Math.max(0L, Duration.between(createdAt, now).toDays());
        long years = totalDays / 365;
        long remaining = totalDays % 365;
        return formatAge(years, remaining / 30, remaining % 30);
    }

    static String formatAge(long years, long months, long days) {
        List<String> parts = new ArrayList<>();
        if (years > 0) {
            parts.add(plural(years, "year"));
        }
        if (months > 0) {
            parts.add(plural(months, "month"));
        }
        if (days > 0 || parts.isEmpty()) {
            parts.add(plural(days, "day"));
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        if (parts.size() == 2) {
            return parts.get(0) + " and " + parts.get(1);
        }
        return String.join(", ", parts.subList(0, parts.size() - 1)) + ", and " + parts.get(parts.size() - 1);
    }

    static String accountWarning(Instant createdAt, Instant now) {
        if (createdAt == null) {
            return null;
        }
        long days = Duration.between(createdAt, now).toDays();
        if (days < 1) {
            return "Brand New Account";
        }
        if (days < 7) {
            return "Very New Account";
        }
        if (days < 30) {
            return "New Account";
        }
        return null;
    }

    private String sourceLabel(JoinRecord record) {
        if (record.confidence() == Confidence.CONFIRMED) {
            return "confirmed";
        }
        return "inferred via " + record.source();
    }

    private String communityLabel(JoinRecord record) {
        String name = record.communityName();
        return name == null || name.isBlank() ? record.communityId() : name;
    }

    private static String plural(long value, String unit) {
        return value + " " + unit + (value == 1 ? "" : "s");
    }

    private String limit(String message) {
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH - TRUNCATION_SUFFIX.length()) + TRUNCATION_SUFFIX;
    }
}
