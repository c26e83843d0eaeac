package com.csvquery.service.table;

import java.util.List;
import java.util.Map;

/** Rows keep the column order of the result set. */
public record QueryResult(List<String> columns, List<Map<String, Object>> rows) {

    public int size() {
        return rows.size();
    }
}
