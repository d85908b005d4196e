package com.bitaware.error;

import lombok.Getter;

/**
 * Exception thrown when a flag set declaration or a bit-aware value fails validation.
 */
@Getter
public class BitAwareException extends Exception {
    private final ErrorType errorType;

    public BitAwareException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public BitAwareException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    @Override
    public String toString() {
        return String.format("BitAwareException{type=%s, message='%s'}", errorType, getMessage());
    }
}
