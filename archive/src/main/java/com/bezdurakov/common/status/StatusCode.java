package com.bezdurakov.common.status;

/**
 * Status codes for archive operations. The names follow the gRPC canonical codes so that a
 * caller exposing the archive over any transport can map them one to one.
 */
public enum StatusCode {
    OK,
    CANCELLED,
    UNKNOWN,
    INVALID_ARGUMENT,
    DEADLINE_EXCEEDED,
    NOT_FOUND,
    ALREADY_EXISTS,
    PERMISSION_DENIED,
    RESOURCE_EXHAUSTED,
    FAILED_PRECONDITION,
    ABORTED,
    OUT_OF_RANGE,
    UNIMPLEMENTED,
    INTERNAL,
    UNAVAILABLE,
    DATA_LOSS,
    UNAUTHENTICATED;

    /**
     * Returns whether a caller may reasonably repeat the whole operation after seeing this code.
     * Serialization conflicts and lost connections qualify; validation errors never do.
     */
    public boolean isRetryable() {
        return this == ABORTED || this == UNAVAILABLE;
    }
}
