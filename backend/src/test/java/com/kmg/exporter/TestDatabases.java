package com.kmg.exporter;

import com.kmg.exporter.repo.StoreSchemaInitializer;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * File-backed SQLite databases for tests: one playing the job store, one playing the analytical
 * source. The source binds {@code java.sql.Date} values as ISO text so range filters on TEXT date
 * columns behave like on a real date column.
 */
public final class TestDatabases {
    private TestDatabases() {
    }

    public static JdbcTemplate store(Path dir) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + dir.resolve("store.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        new StoreSchemaInitializer(jdbcTemplate).initialize();
        return jdbcTemplate;
    }

    public static DataSource source(Path dir) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:sqlite:" + dir.resolve("source.db") + "?date_class=TEXT&date_string_format=yyyy-MM-dd");
        dataSource.setDriverClassName("org.sqlite.JDBC");
        return dataSource;
    }

    public static void insertJob(JdbcTemplate store, long id, String name, String policy, String query,
                                 Path exportPath, String exportName, String dateColumn, Long parameterId) {
        store.update("""
                INSERT INTO jobs(id, name, active, export_type, export_path, export_name, days_offset,
                                 parameter_id, date_column, sql_script)
                VALUES (?, ?, 1, ?, ?, ?, 0, ?, ?, ?)
                """,
                id, name, policy, exportPath.toString(), exportName, parameterId, dateColumn, query);
    }
}
