package com.csvquery.service.table;

public record ColumnInfo(String name, String type) {}
