package com.kmg.exporter.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the job store tables. Rows in {@code jobs}, {@code job_schedules},
 * {@code gating_parameters} and {@code eventual_requests} are written by the administration tool;
 * this service only updates bookkeeping columns and appends execution events.
 */
@Component
public class StoreSchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(StoreSchemaInitializer.class);

    private final JdbcTemplate jdbcTemplate;

    public StoreSchemaInitializer(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void initialize() {
        configureSqlitePragmas();

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS gating_parameters (
              id INTEGER PRIMARY KEY,
              name TEXT NOT NULL,
              sql_script TEXT
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS jobs (
              id INTEGER PRIMARY KEY,
              name TEXT NOT NULL,
              active INTEGER NOT NULL DEFAULT 1,
              export_type TEXT NOT NULL,
              export_path TEXT NOT NULL,
              export_name TEXT NOT NULL,
              days_offset INTEGER NOT NULL DEFAULT 0,
              parameter_id INTEGER,
              primary_key_column TEXT,
              date_column TEXT,
              sql_script TEXT,
              last_execution TEXT,
              last_processed_date TEXT,
              FOREIGN KEY (parameter_id) REFERENCES gating_parameters(id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS job_schedules (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              job_id INTEGER NOT NULL,
              day TEXT NOT NULL,
              hour INTEGER NOT NULL,
              minute INTEGER NOT NULL,
              FOREIGN KEY (job_id) REFERENCES jobs(id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS eventual_requests (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              export_name TEXT NOT NULL,
              sql_script TEXT,
              created_at TEXT NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS execution_events (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              created_at TEXT NOT NULL,
              level TEXT NOT NULL,
              job_id INTEGER,
              message TEXT NOT NULL,
              duration_ms INTEGER
            )
            """);
    }

    private void configureSqlitePragmas() {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            jdbcTemplate.execute("PRAGMA synchronous=NORMAL");
            jdbcTemplate.execute("PRAGMA foreign_keys=ON");
            jdbcTemplate.execute("PRAGMA busy_timeout=30000");
        } catch (Exception e) {
            log.warn("Failed to configure SQLite pragmas: {}", e.getMessage());
        }
    }
}
