package dev.careerpath.exception;

import dev.careerpath.result.ErrorCode;

import java.util.List;

public class NotFoundException extends AdvisorException {

    private final List<String> availableKeys;

    public NotFoundException(String message, List<String> availableKeys) {
        super(ErrorCode.NOT_FOUND, message);
        this.availableKeys = availableKeys == null ? List.of() : List.copyOf(availableKeys);
    }

    public List<String> getAvailableKeys() {
        return availableKeys;
    }
}
