package com.example.abac.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a policy is created with a policyId that already exists.
 */
public class DuplicatePolicyException extends AbacException {

    private final String policyId;

    public DuplicatePolicyException(String policyId) {
        super("DUPLICATE_KEY", HttpStatus.CONFLICT, String.format("Policy %s already exists", policyId));
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
