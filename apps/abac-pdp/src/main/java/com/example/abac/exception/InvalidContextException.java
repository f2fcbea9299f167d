package com.example.abac.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Thrown when an evaluation context lacks one of subject, action, resource or environment.
 */
public class InvalidContextException extends AbacException {

    private final List<String> missingParts;

    public InvalidContextException(List<String> missingParts) {
        super("INVALID_CONTEXT", HttpStatus.BAD_REQUEST,
                "Invalid context. Missing: " + String.join(", ", missingParts));
        this.missingParts = List.copyOf(missingParts);
    }

    public List<String> getMissingParts() {
        return missingParts;
    }
}
