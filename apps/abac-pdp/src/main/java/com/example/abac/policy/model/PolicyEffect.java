package com.example.abac.policy.model;

/**
 * The effect a policy has when all of its predicates match.
 */
public enum PolicyEffect {
    ALLOW,
    DENY
}
