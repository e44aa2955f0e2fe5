package com.sarcodec.error;

import lombok.Getter;

/**
 * Exception thrown by codec operations. The message always names the field, segment or
 * element path involved.
 */
@Getter
public class SarCodecException extends Exception {
    private final ErrorType errorType;

    public SarCodecException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public SarCodecException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    @Override
    public String toString() {
        return String.format("SarCodecException{type=%s, message='%s'}", errorType, getMessage());
    }
}
