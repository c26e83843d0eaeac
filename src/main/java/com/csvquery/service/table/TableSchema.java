package com.csvquery.service.table;

import java.util.List;

public record TableSchema(String tableName, List<ColumnInfo> columns, long rowCount) {

    public List<String> columnNames() {
        return columns.stream().map(ColumnInfo::name).toList();
    }
}
