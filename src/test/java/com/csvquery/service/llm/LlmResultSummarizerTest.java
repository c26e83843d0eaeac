package com.csvquery.service.llm;

import com.csvquery.config.LlmProperties;
import com.csvquery.dto.TablePreview;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("LlmResultSummarizer Tests")
class LlmResultSummarizerTest {

    private LlmClient llmClient;
    private LlmProperties properties;
    private LlmResultSummarizer summarizer;

    @BeforeEach
    void setUp() {
        llmClient = mock(LlmClient.class);
        properties = new LlmProperties();
        summarizer = new LlmResultSummarizer(llmClient, properties);
    }

    private static TablePreview preview(List<Map<String, Object>> rows, int total) {
        return new TablePreview(List.of("total"), rows, total);
    }

    @Test
    @DisplayName("Should return the model's summary")
    void testSummarize() {
        when(llmClient.complete(anyString(), anyString(), anyDouble(), any())).thenReturn("There are 42 rows.");

        String answer = summarizer.summarize("How many?", "SELECT COUNT(*) AS total FROM t",
                preview(List.of(Map.of("total", 42)), 1));

        assertEquals("There are 42 rows.", answer);
    }

    @Test
    @DisplayName("Should truncate an overlong summary")
    void testSummarize_Truncates() {
        properties.setSummaryMaxChars(20);
        when(llmClient.complete(anyString(), anyString(), anyDouble(), any())).thenReturn("x".repeat(50));

        String answer = summarizer.summarize("q", "sql", preview(List.of(), 0));

        assertEquals(20, answer.length());
        assertTrue(answer.endsWith("..."));
    }

    @Test
    @DisplayName("Should cut without an ellipsis when the limit is too small for one")
    void testTruncate_TinyLimit() {
        assertEquals("ab", LlmResultSummarizer.truncate("abcdef", 2));
        assertEquals("abc", LlmResultSummarizer.truncate("abcdef", 3));
        assertEquals("", LlmResultSummarizer.truncate("abcdef", 0));
        assertEquals("", LlmResultSummarizer.truncate("abcdef", -5));
        assertEquals("a...", LlmResultSummarizer.truncate("abcdef", 4));
    }

    @Test
    @DisplayName("Should fall back when the model call fails")
    void testSummarize_Fallback() {
        when(llmClient.complete(anyString(), anyString(), anyDouble(), any()))
                .thenThrow(new IllegalStateException("LLM returned 503"));

        assertEquals("total: 42", summarizer.summarize("q", "sql", preview(List.of(Map.of("total", 42)), 1)));
        assertEquals("No results found for your query.", summarizer.summarize("q", "sql", preview(List.of(), 0)));
    }

    @Test
    @DisplayName("Should fall back when the model returns nothing")
    void testSummarize_Blank() {
        when(llmClient.complete(anyString(), anyString(), anyDouble(), any())).thenReturn("");

        assertEquals("Found 12 results.",
                summarizer.summarize("q", "sql", preview(List.of(Map.of("a", 1, "b", 2)), 12)));
    }

    @Test
    @DisplayName("Should use singular wording for a single multi-column row")
    void testFallbackSummary_SingleRow() {
        assertEquals("Found 1 result.", LlmResultSummarizer.fallbackSummary(List.of(Map.of("a", 1, "b", 2)), 1));
    }

    @Test
    @DisplayName("Should format at most the requested number of sample rows")
    void testFormatSampleData() {
        List<Map<String, Object>> rows = List.of(Map.of("a", 1), Map.of("a", 2), Map.of("a", 3));

        assertEquals("- a: 1\n- a: 2", LlmResultSummarizer.formatSampleData(rows, 2));
        assertEquals("No data available", LlmResultSummarizer.formatSampleData(List.of(), 5));
    }
}
