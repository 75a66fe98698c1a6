package dev.careerpath.exception;

import dev.careerpath.result.ErrorCode;

public class ValidationException extends AdvisorException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
