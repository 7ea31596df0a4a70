package org.opensearch.migrations.artifacts.checkpoint;

import java.sql.SQLException;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Pooled JDBC access for the checkpoint store.  Any database with a JDBC driver on the classpath works;
 * the statements issued by {@link CheckpointSqlBuilder} are plain SQL.
 */
@Slf4j
public class HikariDatabaseClient implements DatabaseClient {
    private final HikariDataSource dataSource;

    public HikariDatabaseClient(String jdbcUrl, String username, String password) {
        this(jdbcUrl, username, password, 20);
    }

    public HikariDatabaseClient(String jdbcUrl, String username, String password, int maxPoolSize) {
        log.atDebug().setMessage("Initializing checkpoint database client with jdbcUrl={}, username={}")
            .addArgument(jdbcUrl).addArgument(username).log();
        var config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(Math.min(2, maxPoolSize));
        config.setConnectionTimeout(30000);
        config.setPoolName("checkpoint-store");
        this.dataSource = new HikariDataSource(config);
    }

    @Override
    public <T> T executeInTransaction(TransactionFunction<T> operation) throws SQLException {
        return retryOnce(() -> {
            try (var conn = dataSource.getConnection()) {
                conn.setAutoCommit(false);
                try {
                    T result = operation.apply(conn);
                    conn.commit();
                    return result;
                } catch (SQLException e) {
                    log.atDebug().setMessage("Transaction failed, rolling back: {}").addArgument(e::getMessage).log();
                    conn.rollback();
                    throw e;
                }
            }
        });
    }

    private <T> T retryOnce(SqlOperation<T> operation) throws SQLException {
        try {
            return operation.execute();
        } catch (SQLException e) {
            if (isTransientError(e)) {
                log.atDebug().setMessage("Transient database error, retrying once: {}")
                    .addArgument(e::getMessage).log();
                return operation.execute();
            }
            throw e;
        }
    }

    static boolean isTransientError(SQLException e) {
        String sqlState = e.getSQLState();
        return sqlState != null && (
            sqlState.startsWith("08") ||  // connection exception
            sqlState.equals("40001") ||   // serialization failure
            sqlState.equals("40P01")      // deadlock detected
        );
    }

    @FunctionalInterface
    private interface SqlOperation<T> {
        T execute() throws SQLException;
    }

    @Override
    public void close() {
        log.debug("Closing checkpoint database connection pool");
        dataSource.close();
    }
}
