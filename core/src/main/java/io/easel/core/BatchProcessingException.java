package io.easel.core;

/**
 * The downstream call behind a batch group failed, or returned fewer results
 * than the group had items. Delivered to the pending results of that group only.
 */
public final class BatchProcessingException extends RuntimeException {

    public BatchProcessingException(String message) {
        super(message);
    }

    public BatchProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
