package com.tradingrisk.exception;

import java.util.Map;

/**
 * Thrown when caller-supplied input (answers, stats, trade details) has the wrong shape
 * or falls outside its allowed range.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
