package com.notiflow.notification.common.result;

/**
 * Outcome of processing one queued item.
 *
 * Batch consumers only look at {@link #isSuccess()} to decide between ack and nack.
 */
public interface MessageResult {
    /**
     * Check if the item was processed successfully.
     *
     * @return true if successful, false otherwise
     */
    boolean isSuccess();

    /**
     * Get error message if processing failed.
     *
     * @return Error message, or null if successful
     */
    default String getErrorMessage() {
        return null;
    }
}
