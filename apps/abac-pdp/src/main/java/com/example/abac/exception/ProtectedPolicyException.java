package com.example.abac.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when deleting one of the core policies. Core policies can only be deactivated.
 */
public class ProtectedPolicyException extends AbacException {

    private final String policyId;

    public ProtectedPolicyException(String policyId) {
        super("PROTECTED_POLICY", HttpStatus.CONFLICT,
                String.format("Core policy %s cannot be deleted; deactivate it instead", policyId));
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
