package com.csvquery.service.llm;

import com.csvquery.config.LlmProperties;
import com.csvquery.dto.TablePreview;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Asks the model for a short analysis of a result; falls back to a count-based answer
 * when the model is unavailable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmResultSummarizer implements ResultSummarizer {

    private static final String ELLIPSIS = "...";

    private static final String SYSTEM_PROMPT = """
            You are a data analyst explaining query results to the person who asked the question.
            Answer clearly and concisely, focusing on what the question asked.
            Include key statistics, format numbers for readability and note trends in time series.
            If there are no results, suggest why. Stay under %d characters.
            """;

    private final LlmClient llmClient;
    private final LlmProperties properties;

    @Override
    public String summarize(String question, String sql, TablePreview preview) {
        int limit = properties.getSummaryMaxChars();
        try {
            String user = "Question: " + question + "\n\nSQL Query Used:\n" + sql
                    + "\n\nData Preview:\nColumns: " + String.join(", ", preview.columns())
                    + "\nTotal Rows: " + preview.totalRows()
                    + "\n\nSample Data:\n" + formatSampleData(preview.rows(), 5);
            String summary = llmClient.complete(SYSTEM_PROMPT.formatted(limit), user,
                    properties.getSummaryTemperature(), null);
            if (summary.isBlank()) {
                return fallbackSummary(preview.rows(), preview.totalRows());
            }
            return truncate(summary, limit);
        } catch (RuntimeException e) {
            log.warn("Result summarization failed, using fallback: {}", e.getMessage());
            return fallbackSummary(preview.rows(), preview.totalRows());
        }
    }

    static String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        if (limit <= ELLIPSIS.length()) {
            return text.substring(0, Math.max(0, limit));
        }
        return text.substring(0, limit - ELLIPSIS.length()) + ELLIPSIS;
    }

    static String formatSampleData(List<Map<String, Object>> rows, int maxRows) {
        if (rows.isEmpty()) {
            return "No data available";
        }
        return rows.stream()
                .limit(maxRows)
                .map(row -> "- " + row.entrySet().stream()
                        .map(e -> e.getKey() + ": " + e.getValue())
                        .collect(Collectors.joining(", ")))
                .collect(Collectors.joining("\n"));
    }

    static String fallbackSummary(List<Map<String, Object>> rows, int totalRows) {
        if (totalRows == 0) {
            return "No results found for your query.";
        }
        if (totalRows == 1 && rows.size() == 1 && rows.get(0).size() == 1) {
            Map.Entry<String, Object> cell = rows.get(0).entrySet().iterator().next();
            return cell.getKey() + ": " + cell.getValue();
        }
        return "Found " + totalRows + (totalRows == 1 ? " result." : " results.");
    }
}
