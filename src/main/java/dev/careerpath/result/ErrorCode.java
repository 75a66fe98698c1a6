package dev.careerpath.result;

/**
 * Outcome codes carried by {@link Result}.
 */
public enum ErrorCode {

    SUCCESS(0, "ok"),

    /** Any failure that is not one of the expected categories below. */
    UNEXPECTED_ERROR(1, "An unexpected error occurred"),

    /** Caller input violates a documented bound. */
    VALIDATION_ERROR(1001, "Invalid request"),

    /** A referenced career, simulation or reality-check entry does not exist. */
    NOT_FOUND(1004, "Not found"),

    /** A reference file is absent; only ever logged, built-in defaults are served instead. */
    CONFIGURATION_MISSING(1005, "Reference data missing");

    private final int code;
    private final String msg;

    ErrorCode(int code, String msg) {
        this.code = code;
        this.msg = msg;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }
}
