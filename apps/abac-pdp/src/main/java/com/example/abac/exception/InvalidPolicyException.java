package com.example.abac.exception;

import org.springframework.http.HttpStatus;

public class InvalidPolicyException extends AbacException {

    public InvalidPolicyException(String message) {
        super("INVALID_POLICY", HttpStatus.BAD_REQUEST, message);
    }
}
