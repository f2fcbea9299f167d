package com.example.abac.controller.dto;

import com.example.abac.engine.EvaluationContext;

import java.util.Map;

/**
 * Body of an evaluation request: {@code {"context": {"subject": {...}, "action": {...}, ...}}}.
 * Missing parts are reported by the engine as an invalid context.
 */
public record EvaluateRequest(Context context) {

    public record Context(
            Map<String, Object> subject,
            Map<String, Object> action,
            Map<String, Object> resource,
            Map<String, Object> environment
    ) {
    }

    public EvaluationContext toContext() {
        if (context == null) {
            return new EvaluationContext(null, null, null, null);
        }
        return EvaluationContext.of(context.subject(), context.action(), context.resource(), context.environment());
    }
}
