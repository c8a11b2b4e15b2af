package com.kmg.exporter.repo;

import com.kmg.exporter.model.GatingParameter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class GatingParameterRepository {
    private final JdbcTemplate jdbcTemplate;

    public GatingParameterRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<GatingParameter> MAPPER = (rs, rowNum) -> new GatingParameter(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("sql_script")
    );

    public Optional<GatingParameter> findById(long id) {
        List<GatingParameter> rows = jdbcTemplate.query(
                "SELECT * FROM gating_parameters WHERE id = ?",
                MAPPER,
                id
        );
        return rows.stream().findFirst();
    }
}
