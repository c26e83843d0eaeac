package com.csvquery.service.llm;

import com.csvquery.dto.TablePreview;

public interface ResultSummarizer {

    String summarize(String question, String sql, TablePreview preview);
}
