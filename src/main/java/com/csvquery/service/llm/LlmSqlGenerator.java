package com.csvquery.service.llm;

import com.csvquery.config.LlmProperties;
import com.csvquery.exception.SqlGenerationException;
import com.csvquery.service.table.TableSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class LlmSqlGenerator implements SqlGenerator {

    static final int PROMPT_SAMPLE_ROWS = 5;

    private final LlmClient llmClient;
    private final LlmProperties properties;

    @Override
    public String generate(String question, TableSchema schema, List<Map<String, Object>> sampleRows) {
        String table = schema.tableName();
        String sql;
        try {
            sql = llmClient.complete(systemPrompt(schema, sampleRows), "Convert this to SQL: " + question,
                    0.0, properties.getSqlMaxTokens());
        } catch (RuntimeException e) {
            throw new SqlGenerationException("Failed to generate SQL: " + e.getMessage(), e);
        }
        sql = SqlText.removeCodeFences(sql);
        if (!SqlText.looksValid(sql, table)) {
            throw new SqlGenerationException("Generated SQL appears invalid: " + sql);
        }
        log.debug("Generated SQL for table {}: {}", table, sql);
        return sql;
    }

    static String systemPrompt(TableSchema schema, List<Map<String, Object>> sampleRows) {
        String columns = schema.columns().stream()
                .map(c -> "- " + c.name() + " (" + c.type() + ")")
                .collect(Collectors.joining("\n"));

        StringBuilder samples = new StringBuilder("Sample data (first few rows):\n");
        int n = Math.min(PROMPT_SAMPLE_ROWS, sampleRows.size());
        for (int i = 0; i < n; i++) {
            samples.append("\nRow ").append(i + 1).append(":\n");
            sampleRows.get(i).forEach((k, v) -> samples.append("  ").append(k).append(": ").append(v).append('\n'));
        }

        return """
                You convert natural language questions into DuckDB SQL queries.
                The table name is "%s" with these columns:

                %s

                %s
                Rules:
                1. Return only the SQL query, without explanations.
                2. Use the column names and types shown above, always in double quotes.
                3. Limit results to 1000 rows unless asked for more.
                4. Give aggregations meaningful column aliases.
                5. If the question is unclear, return SELECT * FROM "%s" LIMIT 10.
                """.formatted(schema.tableName(), columns, samples, schema.tableName());
    }
}
