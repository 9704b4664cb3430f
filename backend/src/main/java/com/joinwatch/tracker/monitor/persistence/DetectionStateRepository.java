package com.joinwatch.tracker.monitor.persistence;

import com.joinwatch.tracker.monitor.model.DetectionBaseline;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

@Repository
public class DetectionStateRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public DetectionStateRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<DetectionBaseline> findBaselines(String communityId) {
        return jdbc.query(
            """
                SELECT community_id, strategy_name, field_name, last_value, updated_at
                FROM detection_state
                WHERE community_id = :communityId
                """,
            new MapSqlParameterSource("communityId", communityId),
            (rs, rowNum) -> {
                long value = rs.getLong("last_value");
                Long lastValue = rs.wasNull() ? null : value;
                Timestamp updatedAt = rs.getTimestamp("updated_at");
                return new DetectionBaseline(
                    rs.getString("community_id"),
                    rs.getString("strategy_name"),
                    rs.getString("field_name"),
                    lastValue,
                    updatedAt == null ? null : updatedAt.toInstant()
                );
            }
        );
    }

    public void saveBaseline(String communityId, String strategyName, String fieldName, Long value, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("communityId", communityId)
            .addValue("strategyName", strategyName)
            .addValue("fieldName", fieldName)
            .addValue("value", value, Types.BIGINT)
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE detection_state
                SET last_value = :value,
                    updated_at = :now
                WHERE community_id = :communityId
                  AND strategy_name = :strategyName
                  AND field_name = :fieldName
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO detection_state (community_id, strategy_name, field_name, last_value, updated_at)
                    VALUES (:communityId, :strategyName, :fieldName, :value, :now)
                    """,
                params
            );
        }
    }

    public int deleteByCommunity(String communityId) {
        return jdbc.update(
            "DELETE FROM detection_state WHERE community_id = :communityId",
            new MapSqlParameterSource("communityId", communityId)
        );
    }
}
