package com.riskrails.exception;

import java.util.Map;

/**
 * Raised for requests that are well-formed but cannot be served, such as an unknown venue name.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
