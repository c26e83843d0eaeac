package com.csvquery.exception;

/** Disk I/O failed while staging a chunk; the client should resend that chunk. */
public class ChunkWriteException extends AppException {

    public ChunkWriteException(String message) {
        super(ErrorCode.CHUNK_WRITE_FAILED, message);
    }

    public ChunkWriteException(String message, Throwable cause) {
        super(ErrorCode.CHUNK_WRITE_FAILED, message, cause);
    }
}
