package com.opendining.reservation.domain.storage;

import lombok.Getter;

/**
 * Storage failure tagged with its {@link StorageErrorKind}. The original driver or
 * Spring exception is always kept as the cause.
 */
@Getter
public class StorageException extends RuntimeException {

    private final StorageErrorKind kind;

    public StorageException(StorageErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
