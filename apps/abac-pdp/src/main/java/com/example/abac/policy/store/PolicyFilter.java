package com.example.abac.policy.store;

import com.example.abac.policy.model.Policy;
import com.example.abac.policy.model.PolicyScope;
import org.springframework.lang.Nullable;

/**
 * Optional listing filters. A null field does not restrict the result.
 */
public record PolicyFilter(@Nullable PolicyScope scope, @Nullable String category, @Nullable Boolean active) {

    public static PolicyFilter all() {
        return new PolicyFilter(null, null, null);
    }

    public boolean matches(Policy policy) {
        return (scope == null || scope == policy.scope())
                && (category == null || category.equals(policy.category()))
                && (active == null || active == policy.active());
    }
}
