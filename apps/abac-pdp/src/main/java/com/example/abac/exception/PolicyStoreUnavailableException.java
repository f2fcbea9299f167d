package com.example.abac.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the backing policy store cannot be reached within its timeout.
 */
public class PolicyStoreUnavailableException extends AbacException {

    public PolicyStoreUnavailableException(String message, Throwable cause) {
        super("STORE_UNAVAILABLE", HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
