package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.monitor.model.JoinRecord;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import com.joinwatch.tracker.monitor.persistence.JoinJdbcRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
public class JoinExportService {
    static final String[] HEADER = {
        "record_id",
        "observed_at",
        "community_id",
        "community_name",
        "subject_id",
        "username",
        "display_name",
        "account_created_at",
        "source",
        "confidence",
        "delivery_state",
        "attempts",
        "notified"
    };
    private static final int MAX_EXPORT_ROWS = 1000;

    private final JoinJdbcRepository repository;
    private final Clock clock;

    public JoinExportService(JoinJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public String exportCsv(Integer hours) {
        int safeHours = hours == null ? 24 * 7 : Math.max(1, Math.min(hours, 24 * 90));
        Instant since = clock.instant().minus(Duration.ofHours(safeHours));
        List<JoinRecord> records = repository.findRecentJoins(since, null, MAX_EXPORT_ROWS);
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .build();
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (JoinRecord record : records) {
                SubjectSnapshot snapshot = record.snapshot();
                printer.printRecord(
                    record.id(),
                    record.observedAt(),
                    record.communityId(),
                    record.communityName(),
                    record.subjectId(),
                    snapshot.username(),
                    snapshot.displayName(),
                    snapshot.accountCreatedAt(),
                    record.source(),
                    record.confidence(),
                    record.deliveryState(),
                    record.attempts(),
                    record.notified()
                );
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write join export", e);
        }
        return out.toString();
    }
}
