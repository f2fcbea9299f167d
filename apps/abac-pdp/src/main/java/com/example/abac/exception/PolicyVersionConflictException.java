package com.example.abac.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a conditional write loses against a concurrent modification.
 */
public class PolicyVersionConflictException extends AbacException {

    private final String policyId;
    private final long expectedVersion;

    public PolicyVersionConflictException(String policyId, long expectedVersion) {
        super("CONFLICT", HttpStatus.CONFLICT,
                String.format("Policy %s was modified concurrently (expected version %d)", policyId, expectedVersion));
        this.policyId = policyId;
        this.expectedVersion = expectedVersion;
    }

    public String getPolicyId() {
        return policyId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
