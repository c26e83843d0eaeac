package com.csvquery.service.table;

import com.csvquery.exception.QueryExecutionException;
import com.csvquery.exception.SchemaInferenceException;
import com.csvquery.util.IdentifierValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Stores each user's tables in a private DuckDB file at {@code {duckdb-dir}/{userId}/db.duckdb}.
 * Connections are opened for a single operation and closed before the namespace lock is
 * released, so no handle outlives an error.
 */
@Slf4j
@Component
public class DuckDbTableMaterializer implements TableMaterializer {

    static final String DATABASE_FILE = "db.duckdb";
    private static final String READ_ONLY_PROPERTY = "duckdb.read_only";

    private final Path duckdbRoot;
    private final UserNamespaceLocks locks;

    public DuckDbTableMaterializer(@Value("${app.storage.duckdb-dir}") String duckdbDir,
                                   UserNamespaceLocks locks) throws IOException {
        this.duckdbRoot = Path.of(duckdbDir);
        this.locks = locks;
        Files.createDirectories(this.duckdbRoot);
    }

    public Path databasePath(String userId) {
        return duckdbRoot.resolve(IdentifierValidator.requireSafeSegment("user_id", userId)).resolve(DATABASE_FILE);
    }

    @Override
    public void materialize(String userId, String datasetId, String versionId, Path source) {
        String table = TableMaterializer.tableName(datasetId, versionId);
        Path db = databasePath(userId);
        locks.withLock(userId, () -> {
            try {
                Files.createDirectories(db.getParent());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create namespace directory for user " + userId, e);
            }
            try (Connection conn = open(db, false)) {
                conn.setAutoCommit(false);
                try (Statement st = conn.createStatement()) {
                    st.execute("CREATE OR REPLACE TABLE " + quoteIdentifier(table)
                            + " AS SELECT * FROM read_csv_auto(" + quoteLiteral(source.toAbsolutePath().toString()) + ")");
                    conn.commit();
                } catch (SQLException e) {
                    conn.rollback();
                    throw e;
                }
                log.info("Materialized table {} for user {} from {}", table, userId, source);
                return null;
            } catch (SQLException e) {
                throw new SchemaInferenceException("Error creating table " + table + " from CSV: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public Optional<TableSchema> describe(String userId, String tableName) {
        Path db = databasePath(userId);
        return locks.withLock(userId, () -> {
            if (!Files.exists(db)) {
                return Optional.empty();
            }
            try (Connection conn = open(db, true)) {
                List<ColumnInfo> columns = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT column_name, data_type FROM information_schema.columns "
                                + "WHERE table_name = ? AND table_schema = 'main' ORDER BY ordinal_position")) {
                    ps.setString(1, tableName);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            columns.add(new ColumnInfo(rs.getString(1), rs.getString(2)));
                        }
                    }
                }
                if (columns.isEmpty()) {
                    return Optional.empty();
                }
                long rowCount;
                try (Statement st = conn.createStatement();
                     ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + quoteIdentifier(tableName))) {
                    rs.next();
                    rowCount = rs.getLong(1);
                }
                return Optional.of(new TableSchema(tableName, List.copyOf(columns), rowCount));
            } catch (SQLException e) {
                throw new QueryExecutionException("Error reading schema of " + tableName + ": " + e.getMessage(), e);
            }
        });
    }

    @Override
    public QueryResult query(String userId, String sql) {
        Path db = databasePath(userId);
        return locks.withLock(userId, () -> {
            if (!Files.exists(db)) {
                throw new QueryExecutionException("No tables exist for user " + userId);
            }
            try (Connection conn = open(db, true);
                 Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery(sql)) {
                ResultSetMetaData md = rs.getMetaData();
                List<String> columns = new ArrayList<>();
                for (int i = 1; i <= md.getColumnCount(); i++) {
                    columns.add(md.getColumnLabel(i));
                }
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columns.size(); i++) {
                        row.put(columns.get(i - 1), toJsonValue(rs.getObject(i)));
                    }
                    rows.add(row);
                }
                return new QueryResult(List.copyOf(columns), rows);
            } catch (SQLException e) {
                throw new QueryExecutionException("Error executing query: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public void drop(String userId, String tableName) {
        Path db = databasePath(userId);
        locks.withLock(userId, () -> {
            if (!Files.exists(db)) {
                return null;
            }
            try (Connection conn = open(db, false);
                 Statement st = conn.createStatement()) {
                st.execute("DROP TABLE IF EXISTS " + quoteIdentifier(tableName));
                log.info("Dropped table {} for user {}", tableName, userId);
                return null;
            } catch (SQLException e) {
                throw new QueryExecutionException("Error dropping table " + tableName + ": " + e.getMessage(), e);
            }
        });
    }

    @Override
    public List<String> listTables(String userId) {
        Path db = databasePath(userId);
        return locks.withLock(userId, () -> {
            if (!Files.exists(db)) {
                return List.of();
            }
            try (Connection conn = open(db, true);
                 Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery(
                         "SELECT table_name FROM information_schema.tables WHERE table_schema = 'main' ORDER BY table_name")) {
                List<String> tables = new ArrayList<>();
                while (rs.next()) {
                    tables.add(rs.getString(1));
                }
                return tables;
            } catch (SQLException e) {
                throw new QueryExecutionException("Error listing tables for user " + userId + ": " + e.getMessage(), e);
            }
        });
    }

    @Override
    public boolean namespaceExists(String userId) {
        return Files.exists(databasePath(userId));
    }

    private Connection open(Path db, boolean readOnly) throws SQLException {
        Properties props = new Properties();
        if (readOnly) {
            props.setProperty(READ_ONLY_PROPERTY, "true");
        }
        return DriverManager.getConnection("jdbc:duckdb:" + db.toAbsolutePath(), props);
    }

    static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static Object toJsonValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof Double || value instanceof Float
                || value instanceof BigDecimal || value instanceof BigInteger) {
            return value;
        }
        return value.toString();
    }
}
