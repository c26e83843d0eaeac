package com.csvquery.service.llm;

import java.util.Arrays;
import java.util.List;

public final class SqlText {

    private SqlText() {}

    /** Strips a surrounding markdown fence (``` or ```sql) if the model added one. */
    public static String removeCodeFences(String sql) {
        if (sql == null || !sql.startsWith("```")) {
            return sql;
        }
        List<String> lines = Arrays.asList(sql.split("\\R", -1));
        int from = 0;
        int to = lines.size();
        if (to > 0 && lines.get(0).strip().startsWith("```")) {
            from = 1;
        }
        if (to > from && lines.get(to - 1).strip().equals("```")) {
            to--;
        }
        return String.join("\n", lines.subList(from, to)).strip();
    }

    /** The generated statement must select and must name the target table. */
    public static boolean looksValid(String sql, String tableName) {
        return sql != null && sql.toUpperCase().contains("SELECT") && sql.contains(tableName);
    }
}
