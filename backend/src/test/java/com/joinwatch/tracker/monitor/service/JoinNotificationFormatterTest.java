package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.model.JoinRecord;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import com.joinwatch.tracker.support.JoinRecords;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JoinNotificationFormatterTest {
    private static final Instant NOW = Instant.parse("2026-10-01T12:00:00Z");

    private final MonitorProperties properties = new MonitorProperties();
    private final JoinNotificationFormatter formatter = new JoinNotificationFormatter(properties);

    @Test
    void basicFormatNamesUserAgeAndCommunity() {
        properties.getNotifications().setDetailedFormat(false);
        JoinRecord record = JoinRecords.pending(
            "123456789012345678",
            SubjectSnapshot.of("ann", "Ann", NOW.minus(Duration.ofDays(400)), null),
            NOW
        );

        assertThat(formatter.format(record, NOW))
            .isEqualTo("user ann with account age 1 year, 1 month, and 5 days has joined the server Guild");
    }

    @Test
    void detailedFormatCarriesConfiguredFieldsAndWarnings() {
        JoinRecord record = JoinRecords.pending(
            "123456789012345678",
            SubjectSnapshot.of("ann", "Annie", NOW.minus(Duration.ofDays(3)), "https://cdn.example/a.png"),
            NOW
        );

        String message = formatter.format(record, NOW);

        assertThat(message)
            .contains("**Server:** Guild (ID: c1)")
            .contains("**Username:** ann")
            .contains("**Display Name:** Annie")
            .contains("**User ID:** 123456789012345678")
            .contains("**Account Age:** 3 days")
            .contains("**Joined Server:** 2026-10-01 12:00 UTC")
            .contains("**Status:** Very New Account")
            .contains("**Avatar:** https://cdn.example/a.png");
    }

    @Test
    void disabledDetailsAreOmitted() {
        properties.getNotifications().getUserDetails().setIncludeUserId(false);
        properties.getNotifications().getUserDetails().setIncludeAvatar(false);
        JoinRecord record = JoinRecords.pending(
            "123456789012345678",
            SubjectSnapshot.of("ann", null, NOW.minus(Duration.ofDays(100)), "https://cdn.example/a.png"),
            NOW
        );

        String message = formatter.format(record, NOW);

        assertThat(message).doesNotContain("**User ID:**").doesNotContain("**Avatar:**").doesNotContain("**Status:**");
    }

    @Test
    void ageWording() {
        assertThat(JoinNotificationFormatter.formatAge(0, 0, 0)).isEqualTo("0 days");
        assertThat(JoinNotificationFormatter.formatAge(0, 0, 1)).isEqualTo("1 day");
        assertThat(JoinNotificationFormatter.formatAge(2, 0, 3)).isEqualTo("2 years and 3 days");
        assertThat(JoinNotificationFormatter.formatAge(1, 2, 3)).isEqualTo("1 year, 2 months, and 3 days");
    }

    @Test
    void accountWarnings() {
        assertThat(JoinNotificationFormatter.accountWarning(NOW.minus(Duration.ofHours(5)), NOW)).isEqualTo("Brand New Account");
        assertThat(JoinNotificationFormatter.accountWarning(NOW.minus(Duration.ofDays(10)), NOW)).isEqualTo("New Account");
        assertThat(JoinNotificationFormatter.accountWarning(NOW.minus(Duration.ofDays(31)), NOW)).isNull();
        assertThat(JoinNotificationFormatter.accountWarning(null, NOW)).isNull();
    }

    @Test
    void oversizedMessagesAreTruncated() {
        JoinRecord record = JoinRecords.pending(
            "123456789012345678",
            SubjectSnapshot.of("x".repeat(3000), null, NOW.minus(Duration.ofDays(100)), null),
            NOW
        );

        String message = formatter.format(record, NOW);

        assertThat(message).hasSize(JoinNotificationFormatter.MAX_MESSAGE_LENGTH).endsWith("\n...");
    }
}
