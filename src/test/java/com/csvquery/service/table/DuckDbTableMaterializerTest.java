package com.csvquery.service.table;

import com.csvquery.exception.QueryExecutionException;
import com.csvquery.exception.SchemaInferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DuckDbTableMaterializer Tests")
class DuckDbTableMaterializerTest {

    private static final String PEOPLE_CSV = "name,age,city\nAlice,30,Paris\nBob,25,Berlin\nCarol,41,Rome\n";

    @TempDir
    Path tempDir;

    private DuckDbTableMaterializer materializer;
    private Path csv;

    @BeforeEach
    void setUp() throws IOException {
        materializer = new DuckDbTableMaterializer(tempDir.resolve("duckdb").toString(), new UserNamespaceLocks());
        csv = tempDir.resolve("people.csv");
        Files.writeString(csv, PEOPLE_CSV);
    }

    @Test
    @DisplayName("Should create the versioned table with inferred columns and row count")
    void testMaterialize() {
        materializer.materialize("u1", "d1", "abc12345", csv);

        Optional<TableSchema> schema = materializer.describe("u1", "d1_vabc12345");

        assertTrue(schema.isPresent());
        assertEquals(List.of("name", "age", "city"), schema.get().columnNames());
        assertEquals(3, schema.get().rowCount());
        assertTrue(materializer.namespaceExists("u1"));
        assertTrue(Files.exists(materializer.databasePath("u1")));
    }

    @Test
    @DisplayName("Should replace the table when the same version is materialized twice")
    void testMaterialize_Idempotent() {
        materializer.materialize("u1", "d1", "v1", csv);
        TableSchema first = materializer.describe("u1", "d1_vv1").orElseThrow();

        materializer.materialize("u1", "d1", "v1", csv);
        TableSchema second = materializer.describe("u1", "d1_vv1").orElseThrow();

        assertEquals(first, second);
        assertEquals(List.of("d1_vv1"), materializer.listTables("u1"));
    }

    @Test
    @DisplayName("Should keep each user's tables in a separate namespace")
    void testMaterialize_TenantIsolation() {
        materializer.materialize("u1", "d1", "v1", csv);

        assertFalse(materializer.namespaceExists("u2"));
        assertTrue(materializer.describe("u2", "d1_vv1").isEmpty());
        assertEquals(List.of(), materializer.listTables("u2"));
        assertNotEquals(materializer.databasePath("u1"), materializer.databasePath("u2"));
    }

    @Test
    @DisplayName("Should keep the same dataset and version apart for two users")
    void testMaterialize_SameKeyTwoUsers() throws IOException {
        Path other = tempDir.resolve("other.csv");
        Files.writeString(other, "name,age,city\nZed,19,Oslo\n");

        materializer.materialize("u1", "d1", "v1", csv);
        materializer.materialize("u2", "d1", "v1", other);

        QueryResult u1Rows = materializer.query("u1", "SELECT name FROM \"d1_vv1\" ORDER BY name");
        QueryResult u2Rows = materializer.query("u2", "SELECT name FROM \"d1_vv1\" ORDER BY name");

        assertEquals(List.of("Alice", "Bob", "Carol"),
                u1Rows.rows().stream().map(r -> r.get("name")).toList());
        assertEquals(List.of("Zed"),
                u2Rows.rows().stream().map(r -> r.get("name")).toList());
        assertEquals(3, materializer.describe("u1", "d1_vv1").orElseThrow().rowCount());
        assertEquals(1, materializer.describe("u2", "d1_vv1").orElseThrow().rowCount());
    }

    @Test
    @DisplayName("Should keep older versions when a new version is added")
    void testMaterialize_VersionsCoexist() throws IOException {
        Path second = tempDir.resolve("second.csv");
        Files.writeString(second, "name,age\nDan,52\n");

        materializer.materialize("u1", "d1", "v1", csv);
        materializer.materialize("u1", "d1", "v2", second);

        assertEquals(List.of("d1_vv1", "d1_vv2"), materializer.listTables("u1"));
        assertEquals(3, materializer.describe("u1", "d1_vv1").orElseThrow().rowCount());
        assertEquals(1, materializer.describe("u1", "d1_vv2").orElseThrow().rowCount());
    }

    @Test
    @DisplayName("Should drop one table and leave the others")
    void testDrop() {
        materializer.materialize("u1", "d1", "v1", csv);
        materializer.materialize("u1", "d1", "v2", csv);

        materializer.drop("u1", "d1_vv1");
        materializer.drop("u1", "d1_vmissing");
        materializer.drop("ghost", "d1_vv1");

        assertEquals(List.of("d1_vv2"), materializer.listTables("u1"));
    }

    @Test
    @DisplayName("Should report an unreadable source as a schema inference failure")
    void testMaterialize_MissingSource() {
        Path missing = tempDir.resolve("nope.csv");

        assertThrows(SchemaInferenceException.class,
                () -> materializer.materialize("u1", "d1", "v1", missing));
    }

    @Test
    @DisplayName("Should return empty for an unknown table")
    void testDescribe_UnknownTable() {
        materializer.materialize("u1", "d1", "v1", csv);

        assertTrue(materializer.describe("u1", "d1_vother").isEmpty());
    }

    @Test
    @DisplayName("Should run a read query against the user's namespace")
    void testQuery() {
        materializer.materialize("u1", "d1", "v1", csv);

        QueryResult result = materializer.query("u1",
                "SELECT name, age FROM \"d1_vv1\" WHERE age > 26 ORDER BY name");

        assertEquals(List.of("name", "age"), result.columns());
        assertEquals(2, result.size());
        assertEquals("Alice", result.rows().get(0).get("name"));
        assertEquals("Carol", result.rows().get(1).get("name"));
    }

    @Test
    @DisplayName("Should reject writes on the read-only query handle")
    void testQuery_ReadOnly() {
        materializer.materialize("u1", "d1", "v1", csv);

        assertThrows(QueryExecutionException.class,
                () -> materializer.query("u1", "DROP TABLE \"d1_vv1\""));
        assertEquals(List.of("d1_vv1"), materializer.listTables("u1"));
    }

    @Test
    @DisplayName("Should fail a query for a user without tables")
    void testQuery_NoNamespace() {
        assertThrows(QueryExecutionException.class, () -> materializer.query("ghost", "SELECT 1"));
    }

    @Test
    @DisplayName("Should quote identifiers and literals")
    void testQuoting() {
        assertEquals("\"a\"\"b\"", DuckDbTableMaterializer.quoteIdentifier("a\"b"));
        assertEquals("'it''s'", DuckDbTableMaterializer.quoteLiteral("it's"));
    }
}
