package com.kmg.exporter.repo;

import com.kmg.exporter.model.EventualRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class EventualRequestRepository {
    private final JdbcTemplate jdbcTemplate;

    public EventualRequestRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<EventualRequest> MAPPER = (rs, rowNum) -> new EventualRequest(
            rs.getLong("id"),
            rs.getString("export_name"),
            rs.getString("sql_script"),
            SqlTime.parse(rs.getString("created_at"))
    );

    public List<EventualRequest> findAll() {
        return jdbcTemplate.query("SELECT * FROM eventual_requests ORDER BY id ASC", MAPPER);
    }

    public void insert(String exportName, String query) {
        jdbcTemplate.update(
                "INSERT INTO eventual_requests(export_name, sql_script, created_at) VALUES (?, ?, ?)",
                exportName,
                query,
                SqlTime.nowText()
        );
    }

    public void delete(long id) {
        jdbcTemplate.update("DELETE FROM eventual_requests WHERE id = ?", id);
    }
}
