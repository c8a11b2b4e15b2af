package com.kmg.exporter.repo;

import com.kmg.exporter.model.EventLevel;
import com.kmg.exporter.model.ExecutionEvent;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
public class ExecutionEventRepository {
    private final JdbcTemplate jdbcTemplate;

    public ExecutionEventRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<ExecutionEvent> MAPPER = new RowMapper<>() {
        @Override
        public ExecutionEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            long jobId = rs.getLong("job_id");
            Long job = rs.wasNull() ? null : jobId;
            long durationMs = rs.getLong("duration_ms");
            Long duration = rs.wasNull() ? null : durationMs;
            return new ExecutionEvent(
                    rs.getLong("id"),
                    SqlTime.parse(rs.getString("created_at")),
                    EventLevel.valueOf(rs.getString("level")),
                    job,
                    rs.getString("message"),
                    duration
            );
        }
    };

    public void insert(EventLevel level, Long jobId, String message, Long durationMs) {
        jdbcTemplate.update(
                """
                INSERT INTO execution_events(created_at, level, job_id, message, duration_ms)
                VALUES (?, ?, ?, ?, ?)
                """,
                SqlTime.nowText(),
                level.name(),
                jobId,
                message,
                durationMs
        );
    }

    public List<ExecutionEvent> findRecent(int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM execution_events ORDER BY id DESC LIMIT ?",
                MAPPER,
                limit
        );
    }
}
