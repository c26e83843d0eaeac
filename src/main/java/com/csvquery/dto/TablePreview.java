package com.csvquery.dto;

import java.util.List;
import java.util.Map;

public record TablePreview(List<String> columns, List<Map<String, Object>> rows, int totalRows) {}
