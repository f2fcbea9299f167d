package com.example.abac.controller.dto;

import com.example.abac.common.util.StringSanitizer;
import com.example.abac.exception.InvalidPolicyException;
import com.example.abac.policy.model.AttributePredicate;
import com.example.abac.policy.model.PredicateOperator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.List;

public record PredicateRequest(
        @NotBlank @Size(max = 128) String attribute,
        @NotBlank @Size(max = 32) String operator,
        Object value
) {
    public AttributePredicate toPredicate() {
        PredicateOperator op = PredicateOperator.fromWireName(operator)
                .orElseThrow(() -> new InvalidPolicyException("Unknown operator: " + StringSanitizer.forLog(operator)));
        if (value instanceof List<?> list && list.contains(null)) {
            throw new InvalidPolicyException(StringSanitizer.forLog(attribute) + ": list values must not be null");
        }
        return new AttributePredicate(attribute, op, value);
    }

    static List<AttributePredicate> toPredicates(List<PredicateRequest> requests) {
        if (requests == null) {
            return null;
        }
        List<AttributePredicate> predicates = new ArrayList<>(requests.size());
        for (PredicateRequest request : requests) {
            if (request == null) {
                throw new InvalidPolicyException("Attribute conditions must not contain null entries");
            }
            predicates.add(request.toPredicate());
        }
        return predicates;
    }
}
