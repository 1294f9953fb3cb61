package com.kickstack.realtime.common.exception;

import lombok.Getter;

/**
 * Failure raised by the relay or its client, tagged with an {@link ErrorCode}.
 */
@Getter
public class RelayException extends RuntimeException {

    private final ErrorCode errorCode;

    public RelayException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage(), null);
    }

    public RelayException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public RelayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getCode() {
        return errorCode.getCode();
    }
}
