package com.joinwatch.tracker.monitor.persistence;

import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.MonitoringMode;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class CommunityRepository {
    private static final RowMapper<CommunityTarget> MAPPER = (rs, rowNum) -> new CommunityTarget(
        rs.getString("id"),
        rs.getString("display_name"),
        MonitoringMode.fromKey(rs.getString("monitoring_mode")),
        rs.getBoolean("excluded")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public CommunityRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<CommunityTarget> findAll() {
        return jdbc.query(
            """
                SELECT id, display_name, monitoring_mode, excluded
                FROM communities
                ORDER BY display_name ASC, id ASC
                """,
            MAPPER
        );
    }

    public CommunityTarget findById(String id) {
        List<CommunityTarget> rows = jdbc.query(
            """
                SELECT id, display_name, monitoring_mode, excluded
                FROM communities
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Inserts a newly discovered community or refreshes name and mode of a known one.
     * The stored exclusion flag of an existing row is left as is.
     */
    public void upsert(CommunityTarget target, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", target.id())
            .addValue("displayName", target.displayName())
            .addValue("mode", target.monitoringMode().name())
            .addValue("excluded", target.excluded())
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE communities
                SET display_name = :displayName,
                    monitoring_mode = :mode,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO communities (id, display_name, monitoring_mode, excluded, discovered_at, updated_at)
                    VALUES (:id, :displayName, :mode, :excluded, :now, :now)
                    """,
                params
            );
        }
    }

    public boolean setExcluded(String id, boolean excluded, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("excluded", excluded)
            .addValue("now", Timestamp.from(now));
        return jdbc.update(
            """
                UPDATE communities
                SET excluded = :excluded,
                    updated_at = :now
                WHERE id = :id
                  AND excluded <> :excluded
                """,
            params
        ) > 0;
    }
}
