package com.kmg.exporter.source;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Read-only check applied to every stored query right before it runs, whatever its origin.
 */
public final class QueryGuard {
    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\n]*(\\n|$)");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern READ_PREFIX = Pattern.compile("^(SELECT|WITH|SHOW|DESCRIBE|EXPLAIN)\\b");
    private static final Pattern MUTATING_KEYWORD = Pattern.compile(
            "\\b(INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|GRANT|REVOKE|MERGE)\\b");

    private QueryGuard() {
    }

    public static boolean isReadOnly(String sql) {
        if (sql == null || sql.isBlank()) {
            return false;
        }
        String normalized = normalize(sql);
        return READ_PREFIX.matcher(normalized).find() && !MUTATING_KEYWORD.matcher(normalized).find();
    }

    public static void requireReadOnly(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new ReadOnlyViolationException("Query is empty");
        }
        if (!isReadOnly(sql)) {
            throw new ReadOnlyViolationException("Only read-only queries (SELECT/WITH) are allowed");
        }
    }

    static String normalize(String sql) {
        String stripped = BLOCK_COMMENT.matcher(sql).replaceAll(" ");
        stripped = LINE_COMMENT.matcher(stripped).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim().toUpperCase(Locale.ROOT);
    }

    public static class ReadOnlyViolationException extends RuntimeException {
        public ReadOnlyViolationException(String message) {
            super(message);
        }
    }
}
