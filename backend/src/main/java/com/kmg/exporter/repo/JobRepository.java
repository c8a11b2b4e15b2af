package com.kmg.exporter.repo;

import com.kmg.exporter.model.AccumulationPolicy;
import com.kmg.exporter.model.JobDefinition;
import com.kmg.exporter.model.ScheduleEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class JobRepository {
    private static final Logger log = LoggerFactory.getLogger(JobRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public JobRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<JobDefinition> JOB_MAPPER = new RowMapper<>() {
        @Override
        public JobDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            long parameterId = rs.getLong("parameter_id");
            Long gatingParameterId = rs.wasNull() ? null : parameterId;
            return new JobDefinition(
                    rs.getLong("id"),
                    rs.getString("name"),
                    rs.getInt("active") == 1,
                    rs.getString("sql_script"),
                    rs.getString("export_path"),
                    rs.getString("export_name"),
                    AccumulationPolicy.parse(rs.getString("export_type")),
                    rs.getInt("days_offset"),
                    gatingParameterId,
                    rs.getString("primary_key_column"),
                    rs.getString("date_column"),
                    SqlTime.parse(rs.getString("last_execution")),
                    SqlTime.parseDate(rs.getString("last_processed_date"))
            );
        }
    };

    private static final RowMapper<ScheduleEntry> SCHEDULE_MAPPER = new RowMapper<>() {
        @Override
        public ScheduleEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ScheduleEntry(
                    rs.getLong("id"),
                    rs.getLong("job_id"),
                    rs.getString("day"),
                    rs.getInt("hour"),
                    rs.getInt("minute")
            );
        }
    };

    /**
     * Loads every active job. Rows that cannot be mapped (unknown export type, malformed dates) are
     * skipped with a warning so one bad definition does not hide the others.
     */
    public List<JobDefinition> findActiveJobs() {
        List<JobDefinition> jobs = new ArrayList<>();
        jdbcTemplate.query("SELECT * FROM jobs WHERE active = 1 ORDER BY id ASC", (RowCallbackHandler) rs -> {
            try {
                jobs.add(JOB_MAPPER.mapRow(rs, jobs.size()));
            } catch (IllegalArgumentException | DateTimeParseException e) {
                log.warn("Skipping malformed job row id={}: {}", rs.getLong("id"), e.getMessage());
            }
        });
        return jobs;
    }

    public Optional<JobDefinition> findActiveById(long id) {
        List<JobDefinition> rows = jdbcTemplate.query(
                "SELECT * FROM jobs WHERE id = ? AND active = 1",
                JOB_MAPPER,
                id
        );
        return rows.stream().findFirst();
    }

    public List<ScheduleEntry> findScheduleEntries(long jobId) {
        return jdbcTemplate.query(
                "SELECT * FROM job_schedules WHERE job_id = ? ORDER BY id ASC",
                SCHEDULE_MAPPER,
                jobId
        );
    }

    /**
     * Writes the bookkeeping columns of a successful run. A null {@code lastProcessedDate} keeps the
     * stored boundary.
     */
    public void updateLastExecution(long jobId, OffsetDateTime executedAt, LocalDate lastProcessedDate) {
        jdbcTemplate.update(
                """
                UPDATE jobs
                   SET last_execution = ?,
                       last_processed_date = COALESCE(?, last_processed_date)
                 WHERE id = ?
                """,
                executedAt.toString(),
                SqlTime.toText(lastProcessedDate),
                jobId
        );
    }
}
