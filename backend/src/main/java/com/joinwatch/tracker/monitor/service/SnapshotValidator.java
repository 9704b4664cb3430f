package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.model.JoinRecord;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import com.joinwatch.tracker.monitor.util.SnowflakeUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
public class SnapshotValidator {
    private final MonitorProperties.Notifications notifications;

    public SnapshotValidator(MonitorProperties properties) {
        this.notifications = properties.getNotifications();
    }

    public void validate(JoinRecord record, Instant now) {
        SubjectSnapshot snapshot = record.snapshot();
        if (snapshot == null || snapshot.synthetic()) {
            throw new DataValidityException("synthetic identity");
        }
        if (!SnowflakeUtils.isSnowflake(record.subjectId())) {
            throw new DataValidityException("non-numeric subject id " + record.subjectId());
        }
        if (!snapshot.hasUsername()) {
            throw new DataValidityException("missing username");
        }
        if (snapshot.accountCreatedAt() == null) {
            throw new DataValidityException("unknown account age");
        }
        if (notifications.isIgnoreBots() && snapshot.bot()) {
            throw new DataValidityException("bot account");
        }
        if (notifications.isIgnoreSystem() && snapshot.system()) {
            throw new DataValidityException("system account");
        }
        int minimumDays = notifications.getMinimumAccountAgeDays();
        if (minimumDays > 0) {
            long ageDays = Duration.between(snapshot.accountCreatedAt(), now).toDays();
            if (ageDays < minimumDays) {
                throw new DataValidityException("account younger than " + minimumDays + " days");
            }
        }
    }
}
