package org.opensearch.migrations.artifacts.checkpoint;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection source for {@link JdbcCheckpointStore}.  Each call runs in its own transaction, committed
 * when the operation returns and rolled back when it throws.
 */
public interface DatabaseClient extends AutoCloseable {
    <T> T executeInTransaction(TransactionFunction<T> operation) throws SQLException;

    @FunctionalInterface
    interface TransactionFunction<T> {
        T apply(Connection conn) throws SQLException;
    }

    @Override
    void close();
}
