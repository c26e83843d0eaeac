package com.csvquery.service;

import com.csvquery.dto.QueryHistoryResponse;
import com.csvquery.dto.QueryRequest;
import com.csvquery.dto.QueryResponse;
import com.csvquery.dto.TablePreview;
import com.csvquery.entity.DatasetVersion;
import com.csvquery.entity.QueryLog;
import com.csvquery.exception.DatasetNotFoundException;
import com.csvquery.repo.QueryLogRepository;
import com.csvquery.service.llm.ResultSummarizer;
import com.csvquery.service.llm.SqlGenerator;
import com.csvquery.service.table.QueryResult;
import com.csvquery.service.table.TableMaterializer;
import com.csvquery.service.table.TableSchema;
import com.csvquery.util.IdentifierValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class QueryService {

    static final int PREVIEW_ROWS = 10;
    static final int SAMPLE_ROWS = 100;

    private final VersionRegistry versionRegistry;
    private final TableMaterializer materializer;
    private final SqlGenerator sqlGenerator;
    private final ResultSummarizer summarizer;
    private final QueryLogRepository queryLogs;

    public QueryResponse ask(QueryRequest req) {
        IdentifierValidator.requireSafeSegment("dataset_id", req.datasetId());
        IdentifierValidator.requireSafeSegment("user_id", req.userId());

        String versionId = resolveVersion(req);
        String table = TableMaterializer.tableName(req.datasetId(), versionId);
        TableSchema schema = materializer.describe(req.userId(), table)
                .orElseThrow(() -> new DatasetNotFoundException("Table " + table + " not found in user's database"));
        log.info("Found schema for table {}: {}", table, schema.columns());

        QueryResult sample = materializer.query(req.userId(),
                "SELECT * FROM \"" + table + "\" ORDER BY RANDOM() LIMIT " + SAMPLE_ROWS);
        String sql = sqlGenerator.generate(req.question(), schema, sample.rows());
        log.info("Generated SQL: {}", sql);

        QueryResult result = materializer.query(req.userId(), sql);
        TablePreview preview = new TablePreview(
                result.columns(),
                result.rows().subList(0, Math.min(PREVIEW_ROWS, result.size())),
                result.size());
        String rawAnswer = rawAnswer(result.rows());
        String answer = summarizer.summarize(req.question(), sql, preview);

        QueryLog entry = new QueryLog();
        entry.setDatasetId(req.datasetId());
        entry.setVersionId(versionId);
        entry.setUserId(req.userId());
        entry.setQuestion(req.question());
        entry.setGeneratedSql(sql);
        entry.setRowCount(result.size());
        queryLogs.save(entry);

        return new QueryResponse(answer, rawAnswer, sql, preview);
    }

    public QueryHistoryResponse history(String datasetId, String userId) {
        return QueryHistoryResponse.of(queryLogs.findByDatasetIdAndUserIdOrderByCreatedAtDescIdDesc(datasetId, userId));
    }

    private String resolveVersion(QueryRequest req) {
        String requested = req.versionOrLatest();
        if (!QueryRequest.LATEST.equals(requested)) {
            return IdentifierValidator.requireSafeSegment("version_id", requested);
        }
        return versionRegistry.findLatestReady(req.datasetId(), req.userId())
                .map(DatasetVersion::getVersionId)
                .orElseThrow(() -> new DatasetNotFoundException("Dataset not found: " + req.datasetId()));
    }

    static String rawAnswer(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return "No results found.";
        }
        if (rows.size() == 1 && rows.get(0).size() == 1) {
            Map.Entry<String, Object> cell = rows.get(0).entrySet().iterator().next();
            return cell.getKey() + ": " + cell.getValue();
        }
        return "Found " + rows.size() + " results.";
    }
}
