package com.example.abac.exception;

import org.springframework.http.HttpStatus;

public class PolicyNotFoundException extends AbacException {

    private final String policyId;

    public PolicyNotFoundException(String policyId) {
        super("NOT_FOUND", HttpStatus.NOT_FOUND, String.format("Policy %s not found", policyId));
        this.policyId = policyId;
    }

    public PolicyNotFoundException(String policyId, String message) {
        super("NOT_FOUND", HttpStatus.NOT_FOUND, message);
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
