package com.csvquery.exception;

import lombok.Getter;

/** Assembly found a gap in the chunk sequence. */
@Getter
public class MissingChunkException extends AppException {

    private final int chunkIndex;

    public MissingChunkException(int chunkIndex) {
        super(ErrorCode.MISSING_CHUNK, "Missing chunk " + chunkIndex);
        this.chunkIndex = chunkIndex;
    }
}
