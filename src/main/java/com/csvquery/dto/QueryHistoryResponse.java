package com.csvquery.dto;

import com.csvquery.entity.QueryLog;

import java.time.Instant;
import java.util.List;

public record QueryHistoryResponse(List<Entry> queries, int totalCount) {

    public record Entry(String datasetId, String versionId, String question, String generatedSql,
                        Integer rowCount, Instant createdAt) {
        public static Entry of(QueryLog log) {
            return new Entry(log.getDatasetId(), log.getVersionId(), log.getQuestion(), log.getGeneratedSql(),
                    log.getRowCount(), log.getCreatedAt());
        }
    }

    public static QueryHistoryResponse of(List<QueryLog> logs) {
        List<Entry> entries = logs.stream().map(Entry::of).toList();
        return new QueryHistoryResponse(entries, entries.size());
    }
}
