package com.csvquery.controller;

import com.csvquery.dto.QueryHistoryResponse;
import com.csvquery.dto.QueryRequest;
import com.csvquery.dto.QueryResponse;
import com.csvquery.service.QueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/query")
@RequiredArgsConstructor
public class QueryController {

    private final QueryService queryService;

    @PostMapping("/ask")
    public ResponseEntity<QueryResponse> ask(@Valid @RequestBody QueryRequest req) {
        log.info("Received query request user={} dataset={} version={}", req.userId(), req.datasetId(), req.versionOrLatest());
        return ResponseEntity.ok(queryService.ask(req));
    }

    @GetMapping("/history/{datasetId}")
    public ResponseEntity<QueryHistoryResponse> history(@PathVariable("datasetId") String datasetId,
                                                        @RequestParam("user_id") String userId) {
        return ResponseEntity.ok(queryService.history(datasetId, userId));
    }
}
