package org.opensearch.migrations.artifacts.checkpoint;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

class CheckpointSqlBuilder {
    private static final String TABLE_NAME_PATTERN = "^[a-zA-Z_][a-zA-Z0-9_]*$";
    private static final String COLUMNS =
        "artifact_id, state, attempt_count, last_attempt_at, last_error_class, last_error_detail, checksum, size_bytes, "
            + "lease_owner, lease_expires_at";
    static final int MAX_ERROR_DETAIL_LENGTH = 2000;

    private final String tableName;

    CheckpointSqlBuilder(String tableName) {
        if (!tableName.matches(TABLE_NAME_PATTERN)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        this.tableName = tableName;
    }

    Optional<TransferRecord> selectRecord(Connection conn, String runId, String identity) throws SQLException {
        var sql = new SQLString("SELECT " + COLUMNS + " FROM " + tableName + " WHERE run_id = ? AND artifact_id = ?");
        try (var stmt = conn.prepareStatement(sql.sql())) {
            stmt.setString(1, runId);
            stmt.setString(2, identity);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(toRecord(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Fails with a unique-key violation ({@link #isUniqueViolation}) if the record already exists.
     */
    boolean insertRecord(Connection conn, String runId, TransferRecord record) throws SQLException {
        var sql = new SQLString("INSERT INTO " + tableName + " (run_id, " + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)");
        try (var stmt = conn.prepareStatement(sql.sql())) {
            stmt.setString(1, runId);
            stmt.setString(2, record.getIdentity());
            stmt.setString(3, record.getState().name());
            stmt.setInt(4, record.getAttemptCount());
            setNullableLong(stmt, 5, epochMillis(record.getLastAttemptAt()));
            stmt.setString(6, record.getLastErrorClass());
            stmt.setString(7, truncate(record.getLastErrorDetail()));
            stmt.setString(8, record.getChecksum());
            setNullableLong(stmt, 9, record.getSizeBytes());
            stmt.setString(10, record.getLeaseOwner());
            setNullableLong(stmt, 11, epochMillis(record.getLeaseExpiresAt()));
            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * For an in-flight {@code expectedState} the stored lease owner must also match the record's.
     *
     * @return false if the stored record did not match
     */
    boolean updateRecordIfState(Connection conn, String runId, TransferRecord record, TransferState expectedState)
        throws SQLException {
        var ownerCondition = "";
        if (expectedState.isInFlight()) {
            ownerCondition = record.getLeaseOwner() == null ? " AND lease_owner IS NULL" : " AND lease_owner = ?";
        }
        var sql = new SQLString("UPDATE " + tableName + " SET state = ?, attempt_count = ?, last_attempt_at = ?, "
            + "last_error_class = ?, last_error_detail = ?, checksum = ?, size_bytes = ?, "
            + "lease_owner = ?, lease_expires_at = ? "
            + "WHERE run_id = ? AND artifact_id = ? AND state = ?" + ownerCondition);
        try (var stmt = conn.prepareStatement(sql.sql())) {
            stmt.setString(1, record.getState().name());
            stmt.setInt(2, record.getAttemptCount());
            setNullableLong(stmt, 3, epochMillis(record.getLastAttemptAt()));
            stmt.setString(4, record.getLastErrorClass());
            stmt.setString(5, truncate(record.getLastErrorDetail()));
            stmt.setString(6, record.getChecksum());
            setNullableLong(stmt, 7, record.getSizeBytes());
            stmt.setString(8, record.getLeaseOwner());
            setNullableLong(stmt, 9, epochMillis(record.getLeaseExpiresAt()));
            stmt.setString(10, runId);
            stmt.setString(11, record.getIdentity());
            stmt.setString(12, expectedState.name());
            if (expectedState.isInFlight() && record.getLeaseOwner() != null) {
                stmt.setString(13, record.getLeaseOwner());
            }
            return stmt.executeUpdate() > 0;
        }
    }

    Set<String> selectIdentitiesInState(Connection conn, String runId, TransferState state) throws SQLException {
        var sql = new SQLString("SELECT artifact_id FROM " + tableName + " WHERE run_id = ? AND state = ?");
        try (var stmt = conn.prepareStatement(sql.sql())) {
            stmt.setString(1, runId);
            stmt.setString(2, state.name());
            try (var rs = stmt.executeQuery()) {
                var identities = new HashSet<String>();
                while (rs.next()) {
                    identities.add(rs.getString(1));
                }
                return identities;
            }
        }
    }

    List<TransferRecord> selectRecords(Connection conn, String runId) throws SQLException {
        var sql = new SQLString("SELECT " + COLUMNS + " FROM " + tableName + " WHERE run_id = ? ORDER BY artifact_id");
        try (var stmt = conn.prepareStatement(sql.sql())) {
            stmt.setString(1, runId);
            try (var rs = stmt.executeQuery()) {
                var records = new ArrayList<TransferRecord>();
                while (rs.next()) {
                    records.add(toRecord(rs));
                }
                return records;
            }
        }
    }

    private static TransferRecord toRecord(ResultSet rs) throws SQLException {
        var lastAttempt = rs.getObject("last_attempt_at", Long.class);
        var leaseExpiry = rs.getObject("lease_expires_at", Long.class);
        return TransferRecord.builder()
            .identity(rs.getString("artifact_id"))
            .state(TransferState.valueOf(rs.getString("state")))
            .attemptCount(rs.getInt("attempt_count"))
            .lastAttemptAt(lastAttempt == null ? null : Instant.ofEpochMilli(lastAttempt))
            .lastErrorClass(rs.getString("last_error_class"))
            .lastErrorDetail(rs.getString("last_error_detail"))
            .checksum(rs.getString("checksum"))
            .sizeBytes(rs.getObject("size_bytes", Long.class))
            .leaseOwner(rs.getString("lease_owner"))
            .leaseExpiresAt(leaseExpiry == null ? null : Instant.ofEpochMilli(leaseExpiry))
            .build();
    }

    private static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value);
        }
    }

    private static Long epochMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_ERROR_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_ERROR_DETAIL_LENGTH);
    }

    static boolean isUniqueViolation(SQLException e) {
        return "23505".equals(e.getSQLState());
    }
}
