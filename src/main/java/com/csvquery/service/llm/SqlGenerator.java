package com.csvquery.service.llm;

import com.csvquery.service.table.TableSchema;

import java.util.List;
import java.util.Map;

public interface SqlGenerator {

    /**
     * Translates a question into one DuckDB statement over {@code schema.tableName()}.
     *
     * @param sampleRows a few rows of the table, shown to the model as examples
     * @throws com.csvquery.exception.SqlGenerationException if no usable SQL comes back
     */
    String generate(String question, TableSchema schema, List<Map<String, Object>> sampleRows);
}
