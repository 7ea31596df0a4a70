package org.opensearch.migrations.artifacts.checkpoint;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

/**
 * Checkpoint store on a relational database.  The single-writer guarantee comes from the database: a
 * first claim is an INSERT that loses on the primary key, every later transition is an UPDATE guarded by
 * {@code state = expectedPriorState} and, for in-flight records, by the lease owner.  Workers in different processes can share one table.
 */
@Slf4j
public class JdbcCheckpointStore implements CheckpointStore {
    public static final String DEFAULT_TABLE_NAME = "checkpoint_records";
    private static final String SCHEMA_RESOURCE = "/db/checkpoint_schema.sql";

    private final DatabaseClient dbClient;
    private final String tableName;
    private final CheckpointSqlBuilder sqlBuilder;

    public JdbcCheckpointStore(DatabaseClient dbClient) {
        this(dbClient, DEFAULT_TABLE_NAME);
    }

    public JdbcCheckpointStore(DatabaseClient dbClient, String tableName) {
        this.dbClient = dbClient;
        this.tableName = tableName;
        this.sqlBuilder = new CheckpointSqlBuilder(tableName);
    }

    @Override
    public void setup() throws CheckpointStoreException {
        var is = getClass().getResourceAsStream(SCHEMA_RESOURCE);
        if (is == null) {
            throw new CheckpointStoreException("setup", "N/A", "Schema file not found: " + SCHEMA_RESOURCE);
        }
        try (var reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            var schema = reader.lines().collect(Collectors.joining("\n")).replace(DEFAULT_TABLE_NAME, tableName);
            dbClient.executeInTransaction(conn -> {
                try (var stmt = conn.createStatement()) {
                    for (var statement : schema.split(";")) {
                        if (!statement.isBlank()) {
                            stmt.execute(statement);
                        }
                    }
                }
                return null;
            });
            log.atInfo().setMessage("Initialized checkpoint table {}").addArgument(tableName).log();
        } catch (SQLException | IOException e) {
            throw new CheckpointStoreException("setup", "N/A", "Failed to initialize schema", e);
        }
    }

    @Override
    public Optional<TransferRecord> getRecord(String runId, String identity) throws CheckpointStoreException {
        try {
            return dbClient.executeInTransaction(conn -> sqlBuilder.selectRecord(conn, runId, identity));
        } catch (SQLException e) {
            throw new CheckpointStoreException("getRecord", identity, "Database error", e);
        }
    }

    @Override
    public void putRecord(String runId, TransferRecord record, TransferState expectedPriorState)
        throws CheckpointStoreException {
        var identity = record.getIdentity();
        if (!TransferState.isAllowedTransition(expectedPriorState, record.getState())) {
            throw new IllegalArgumentException("Transition " + expectedPriorState + " -> " + record.getState()
                + " is not allowed for " + identity);
        }
        boolean written;
        try {
            written = dbClient.executeInTransaction(conn -> expectedPriorState == null
                ? sqlBuilder.insertRecord(conn, runId, record)
                : sqlBuilder.updateRecordIfState(conn, runId, record, expectedPriorState));
        } catch (SQLException e) {
            if (!CheckpointSqlBuilder.isUniqueViolation(e)) {
                throw new CheckpointStoreException("putRecord", identity, "Database error", e);
            }
            written = false;
        }
        if (!written) {
            var actual = getRecord(runId, identity).map(TransferRecord::getState).orElse(null);
            log.atDebug().setMessage("Conditional write of {} for {} lost, stored state is {}")
                .addArgument(record::getState).addArgument(identity).addArgument(actual).log();
            throw new CheckpointConflictException(identity, expectedPriorState, actual);
        }
    }

    @Override
    public Set<String> listByState(String runId, TransferState state) throws CheckpointStoreException {
        try {
            return dbClient.executeInTransaction(conn -> sqlBuilder.selectIdentitiesInState(conn, runId, state));
        } catch (SQLException e) {
            throw new CheckpointStoreException("listByState", "N/A", "Database error", e);
        }
    }

    @Override
    public List<TransferRecord> listRecords(String runId) throws CheckpointStoreException {
        try {
            return dbClient.executeInTransaction(conn -> sqlBuilder.selectRecords(conn, runId));
        } catch (SQLException e) {
            throw new CheckpointStoreException("listRecords", "N/A", "Database error", e);
        }
    }

    @Override
    public void close() throws Exception {
        dbClient.close();
    }
}
