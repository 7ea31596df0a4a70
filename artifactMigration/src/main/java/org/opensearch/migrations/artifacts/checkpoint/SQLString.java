package org.opensearch.migrations.artifacts.checkpoint;

/**
 * One checkpoint statement.  The table name is spliced into the text, so a statement holding a
 * separator or comment marker is rejected rather than run.
 */
public record SQLString(String sql) {
    public SQLString {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("Checkpoint statement cannot be null or blank");
        }
        if (sql.contains(";") || sql.contains("--")) {
            throw new IllegalArgumentException("Checkpoint statement must be a single statement: " + sql);
        }
    }
}
