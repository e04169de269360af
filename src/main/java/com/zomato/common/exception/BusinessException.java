package com.zomato.common.exception;

import lombok.Getter;

/**
 * Exception raised by the service layer for every expected failure.
 *
 * <p>The {@link ErrorCode} decides the HTTP status; the message is either the
 * code's default or a detail such as "Menu item 999 not found".</p>
 */
@Getter
public class BusinessException extends RuntimeException {
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }
}
