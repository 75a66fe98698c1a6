package dev.careerpath.exception;

import dev.careerpath.result.ErrorCode;

/**
 * Expected, caller-facing failure of an advisor operation. The boundary turns it into
 * an error {@link dev.careerpath.result.Result} instead of letting it propagate.
 */
public class AdvisorException extends RuntimeException {

    private final ErrorCode errorCode;

    public AdvisorException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.errorCode = errorCode;
    }

    public AdvisorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
