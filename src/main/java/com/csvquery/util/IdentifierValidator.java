package com.csvquery.util;

import com.csvquery.exception.InvalidUploadException;

import java.util.regex.Pattern;

/**
 * Checks user and dataset identifiers before they are used as directory names
 * and as part of DuckDB table names.
 */
public final class IdentifierValidator {

    private IdentifierValidator() {}

    /**
     * Letters, digits, underscore and hyphen; must not start with a separator so
     * that "." and ".." can never appear as a path segment.
     */
    private static final Pattern SAFE_SEGMENT = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,127}$");

    public static String requireSafeSegment(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidUploadException(field + " cannot be null or empty");
        }
        if (!SAFE_SEGMENT.matcher(value).matches()) {
            throw new InvalidUploadException(field + " contains unsupported characters: " + value);
        }
        return value;
    }

    public static void requireChunkPosition(int chunkIndex, int totalChunks) {
        if (totalChunks <= 0) {
            throw new InvalidUploadException("total_chunks must be greater than 0");
        }
        if (chunkIndex < 0) {
            throw new InvalidUploadException("chunk_index must be >= 0");
        }
        if (chunkIndex >= totalChunks) {
            throw new InvalidUploadException(
                    "chunk_index " + chunkIndex + " is out of range for total_chunks " + totalChunks);
        }
    }
}
