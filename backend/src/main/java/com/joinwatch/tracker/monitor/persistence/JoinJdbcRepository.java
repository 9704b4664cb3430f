package com.joinwatch.tracker.monitor.persistence;

import com.joinwatch.tracker.monitor.model.Confidence;
import com.joinwatch.tracker.monitor.model.DeliveryState;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import com.joinwatch.tracker.monitor.model.JoinRecord;
import com.joinwatch.tracker.monitor.model.JoinStats;
import com.joinwatch.tracker.monitor.model.NotificationMarker;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class JoinJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(JoinJdbcRepository.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final NamedParameterJdbcTemplate jdbc;
    private final RowMapper<JoinRecord> joinRecordMapper = (rs, rowNum) -> new JoinRecord(
        rs.getLong("id"),
        rs.getString("subject_id"),
        rs.getString("community_id"),
        rs.getString("community_name"),
        toInstant(rs.getTimestamp("observed_at")),
        rs.getString("source"),
        parseConfidence(rs.getString("confidence")),
        new SubjectSnapshot(
            rs.getString("username"),
            rs.getString("display_name"),
            toInstant(rs.getTimestamp("account_created_at")),
            rs.getString("avatar_url"),
            rs.getBoolean("is_bot"),
            rs.getBoolean("is_system"),
            rs.getBoolean("synthetic")
        ),
        parseDeliveryState(rs.getString("delivery_state")),
        rs.getInt("attempts"),
        toInstant(rs.getTimestamp("next_attempt_at")),
        rs.getBoolean("notified"),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("recorded_at"))
    );

    public JoinJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("communities", countTable("communities"));
        counts.put("join_records", countTable("join_records"));
        counts.put("notification_markers", countTable("notification_markers"));
        counts.put("detection_state", countTable("detection_state"));
        return counts;
    }

    public long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    public long insertJoinRecord(JoinCandidate candidate, Instant recordedAt) {
        SubjectSnapshot snapshot = candidate.snapshot();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("subjectId", candidate.subjectId())
            .addValue("communityId", candidate.communityId())
            .addValue("communityName", candidate.communityName())
            .addValue("observedAt", toTimestamp(candidate.observedAt()))
            .addValue("source", candidate.source().value())
            .addValue("confidence", candidate.confidence().name())
            .addValue("username", snapshot.username())
            .addValue("displayName", snapshot.displayName())
            .addValue("accountCreatedAt", toTimestamp(snapshot.accountCreatedAt()))
            .addValue("avatarUrl", snapshot.avatarUrl())
            .addValue("bot", snapshot.bot())
            .addValue("system", snapshot.system())
            .addValue("synthetic", snapshot.synthetic())
            .addValue("deliveryState", DeliveryState.PENDING.name())
            .addValue("nextAttemptAt", toTimestamp(recordedAt))
            .addValue("recordedAt", toTimestamp(recordedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO join_records (
                    subject_id, community_id, community_name, observed_at, source, confidence,
                    username, display_name, account_created_at, avatar_url, is_bot, is_system, synthetic,
                    delivery_state, attempts, next_attempt_at, notified, recorded_at
                )
                VALUES (
                    :subjectId, :communityId, :communityName, :observedAt, :source, :confidence,
                    :username, :displayName, :accountCreatedAt, :avatarUrl, :bot, :system, :synthetic,
                    :deliveryState, 0, :nextAttemptAt, FALSE, :recordedAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public JoinRecord findJoinRecord(long id) {
        List<JoinRecord> rows = jdbc.query(
            """
                SELECT *
                FROM join_records
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            joinRecordMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public boolean existsJoinRecordSince(String subjectId, String communityId, Instant since) {
        MapSqlParameterSource params = pairParams(subjectId, communityId)
            .addValue("since", toTimestamp(since));
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM join_records
                WHERE subject_id = :subjectId
                  AND community_id = :communityId
                  AND observed_at >= :since
                """,
            params,
            Long.class
        );
        return count != null && count > 0;
    }

    public NotificationMarker findMarkerSince(String subjectId, String communityId, Instant since) {
        MapSqlParameterSource params = pairParams(subjectId, communityId)
            .addValue("since", toTimestamp(since));
        List<NotificationMarker> rows = jdbc.query(
            """
                SELECT subject_id, community_id, sent_at, join_record_id
                FROM notification_markers
                WHERE subject_id = :subjectId
                  AND community_id = :communityId
                  AND sent_at >= :since
                ORDER BY sent_at DESC
                LIMIT 1
                """,
            params,
            (rs, rowNum) -> new NotificationMarker(
                rs.getString("subject_id"),
                rs.getString("community_id"),
                toInstant(rs.getTimestamp("sent_at")),
                rs.getLong("join_record_id")
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<NotificationMarker> findMarkers(String subjectId, String communityId) {
        return jdbc.query(
            """
                SELECT subject_id, community_id, sent_at, join_record_id
                FROM notification_markers
                WHERE subject_id = :subjectId
                  AND community_id = :communityId
                ORDER BY sent_at ASC
                """,
            pairParams(subjectId, communityId),
            (rs, rowNum) -> new NotificationMarker(
                rs.getString("subject_id"),
                rs.getString("community_id"),
                toInstant(rs.getTimestamp("sent_at")),
                rs.getLong("join_record_id")
            )
        );
    }

    public void insertMarker(String subjectId, String communityId, Instant sentAt, long joinRecordId) {
        MapSqlParameterSource params = pairParams(subjectId, communityId)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("joinRecordId", joinRecordId);
        jdbc.update(
            """
                INSERT INTO notification_markers (subject_id, community_id, sent_at, join_record_id)
                VALUES (:subjectId, :communityId, :sentAt, :joinRecordId)
                """,
            params
        );
    }

    public void markSent(long id, int attempts) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("attempts", Math.max(0, attempts))
            .addValue("state", DeliveryState.SENT.name());
        jdbc.update(
            """
                UPDATE join_records
                SET delivery_state = :state,
                    attempts = :attempts,
                    notified = TRUE,
                    next_attempt_at = NULL,
                    last_error = NULL
                WHERE id = :id
                """,
            params
        );
    }

    public void markFiltered(long id, String reason) {
        updateDelivery(id, DeliveryState.FILTERED, null, null, reason);
    }

    public void recordDeliveryFailure(long id, DeliveryState state, int attempts, Instant nextAttemptAt, String error) {
        updateDelivery(id, state, attempts, nextAttemptAt, error);
    }

    private void updateDelivery(long id, DeliveryState state, Integer attempts, Instant nextAttemptAt, String error) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("state", state.name())
            .addValue("attempts", attempts, Types.INTEGER)
            .addValue("nextAttemptAt", toTimestamp(nextAttemptAt))
            .addValue("lastError", truncate(error));
        jdbc.update(
            """
                UPDATE join_records
                SET delivery_state = :state,
                    attempts = COALESCE(:attempts, attempts),
                    next_attempt_at = :nextAttemptAt,
                    last_error = :lastError
                WHERE id = :id
                """,
            params
        );
    }

    public List<Long> findDispatchableIds(Instant now, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 1000));
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("limit", safeLimit)
            .addValue("states", List.of(DeliveryState.PENDING.name(), DeliveryState.RETRYING.name()));
        return jdbc.queryForList(
            """
                SELECT id
                FROM join_records
                WHERE delivery_state IN (:states)
                  AND (next_attempt_at IS NULL OR next_attempt_at <= :now)
                ORDER BY id ASC
                LIMIT :limit
                """,
            params,
            Long.class
        );
    }

    public List<JoinRecord> findRecentJoins(Instant since, String communityId, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 1000));
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("since", toTimestamp(since))
            .addValue("communityId", communityId)
            .addValue("limit", safeLimit);
        String communityFilter = communityId == null || communityId.isBlank()
            ? ""
            : "AND community_id = :communityId";
        return jdbc.query(
            """
                SELECT *
                FROM join_records
                WHERE observed_at >= :since
                %s
                ORDER BY observed_at DESC, id DESC
                LIMIT :limit
                """.formatted(communityFilter),
            params,
            joinRecordMapper
        );
    }

    public List<JoinRecord> findJoinsForPair(String subjectId, String communityId) {
        return jdbc.query(
            """
                SELECT *
                FROM join_records
                WHERE subject_id = :subjectId
                  AND community_id = :communityId
                ORDER BY id ASC
                """,
            pairParams(subjectId, communityId),
            joinRecordMapper
        );
    }

    public JoinStats fetchJoinStats(Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("since24h", toTimestamp(now.minus(Duration.ofHours(24))))
            .addValue("since7d", toTimestamp(now.minus(Duration.ofDays(7))))
            .addValue("since30d", toTimestamp(now.minus(Duration.ofDays(30))));
        List<JoinStats> rows = jdbc.query(
            """
                SELECT COUNT(*) AS total_joins,
                       SUM(CASE WHEN observed_at >= :since24h THEN 1 ELSE 0 END) AS joins_24h,
                       SUM(CASE WHEN observed_at >= :since7d THEN 1 ELSE 0 END) AS joins_7d,
                       SUM(CASE WHEN observed_at >= :since30d THEN 1 ELSE 0 END) AS joins_30d,
                       SUM(CASE WHEN delivery_state = 'SENT' THEN 1 ELSE 0 END) AS sent,
                       SUM(CASE WHEN delivery_state = 'FILTERED' THEN 1 ELSE 0 END) AS filtered,
                       SUM(CASE WHEN delivery_state = 'FAILED' THEN 1 ELSE 0 END) AS failed,
                       SUM(CASE WHEN delivery_state IN ('PENDING', 'RETRYING') THEN 1 ELSE 0 END) AS pending
                FROM join_records
                """,
            params,
            (rs, rowNum) -> new JoinStats(
                rs.getLong("total_joins"),
                rs.getLong("joins_24h"),
                rs.getLong("joins_7d"),
                rs.getLong("joins_30d"),
                rs.getLong("sent"),
                rs.getLong("filtered"),
                rs.getLong("failed"),
                rs.getLong("pending")
            )
        );
        return rows.isEmpty() ? new JoinStats(0, 0, 0, 0, 0, 0, 0, 0) : rows.get(0);
    }

    public int deleteJoinRecordsBefore(Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(cutoff))
            .addValue("states", List.of(DeliveryState.PENDING.name(), DeliveryState.RETRYING.name()));
        return jdbc.update(
            """
                DELETE FROM join_records
                WHERE observed_at < :cutoff
                  AND delivery_state NOT IN (:states)
                """,
            params
        );
    }

    public int deleteMarkersBefore(Instant cutoff) {
        return jdbc.update(
            "DELETE FROM notification_markers WHERE sent_at < :cutoff",
            new MapSqlParameterSource("cutoff", toTimestamp(cutoff))
        );
    }

    private MapSqlParameterSource pairParams(String subjectId, String communityId) {
        return new MapSqlParameterSource()
            .addValue("subjectId", subjectId)
            .addValue("communityId", communityId);
    }

    private String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private Confidence parseConfidence(String raw) {
        try {
            return Confidence.valueOf(raw);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Unknown confidence value in join_records: {}", raw);
            return Confidence.INFERRED;
        }
    }

    private DeliveryState parseDeliveryState(String raw) {
        try {
            return DeliveryState.valueOf(raw);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Unknown delivery_state value in join_records: {}", raw);
            return DeliveryState.FAILED;
        }
    }
}
