package com.csvquery.service.table;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Per-user table storage. Each user owns an isolated namespace; a dataset version
 * lives in the table named by {@link #tableName(String, String)}.
 */
public interface TableMaterializer {

    static String tableName(String datasetId, String versionId) {
        return datasetId + "_v" + versionId;
    }

    /**
     * Loads {@code source} into {@code {datasetId}_v{versionId}}, inferring the schema from
     * the file. Calling it again for the same key replaces the table.
     *
     * @throws com.csvquery.exception.SchemaInferenceException if the file cannot be parsed
     */
    void materialize(String userId, String datasetId, String versionId, Path source);

    /** Column names, types and row count, or empty if the user has no such table. */
    Optional<TableSchema> describe(String userId, String tableName);

    /**
     * Runs a statement on a read-only handle.
     *
     * @throws com.csvquery.exception.QueryExecutionException on any engine error
     */
    QueryResult query(String userId, String sql);

    /** Removes the table if it exists; a missing namespace is a no-op. */
    void drop(String userId, String tableName);

    List<String> listTables(String userId);

    boolean namespaceExists(String userId);
}
