package com.example.abac.policy;

import com.example.abac.policy.model.AttributePredicate;
import com.example.abac.policy.model.PolicyDraft;
import com.example.abac.policy.model.PolicyEffect;
import com.example.abac.policy.model.PolicyScope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.example.abac.policy.model.PredicateOperator.EQUALS;
import static com.example.abac.policy.model.PredicateOperator.GREATER_THAN;
import static com.example.abac.policy.model.PredicateOperator.IN;
import static com.example.abac.policy.model.PredicateOperator.NOT_EQUALS;

/**
 * The protected set of core policies and their built-in templates.
 * Core policies may be deactivated but never deleted.
 */
public final class CorePolicies {

    public static final String TENANT_ISOLATION = "TENANT_ISOLATION";
    public static final String READ_ONLY_ENFORCEMENT = "READ_ONLY_ENFORCEMENT";
    public static final String FINANCIAL_APPROVAL_LIMITS = "FINANCIAL_APPROVAL_LIMITS";
    public static final String BUSINESS_HOURS_PAYOUTS = "BUSINESS_HOURS_PAYOUTS";
    public static final String AUTOMATION_SCOPE_PROTECTION = "AUTOMATION_SCOPE_PROTECTION";
    public static final String NOTIFICATION_TENANT_SAFETY = "NOTIFICATION_TENANT_SAFETY";

    private static final Map<String, PolicyDraft> TEMPLATES = buildTemplates();

    /**
     * Core policy ids in template order.
     */
    public static final List<String> IDS = List.copyOf(TEMPLATES.keySet());

    private CorePolicies() {}

    public static boolean isCore(String policyId) {
        return policyId != null && TEMPLATES.containsKey(policyId);
    }

    public static Optional<PolicyDraft> template(String policyId) {
        return Optional.ofNullable(policyId).map(TEMPLATES::get);
    }

    private static Map<String, PolicyDraft> buildTemplates() {
        Map<String, PolicyDraft> templates = new LinkedHashMap<>();

        templates.put(TENANT_ISOLATION, PolicyDraft.builder()
                .policyId(TENANT_ISOLATION)
                .name("Tenant Isolation Policy")
                .description("Ensures users can only access resources within their tenant")
                .scope(PolicyScope.TENANT)
                .category("TENANT_ISOLATION")
                .effect(PolicyEffect.DENY)
                .priority(1000)
                .resourceAttributes(List.of(
                        AttributePredicate.of("tenantId", NOT_EQUALS, "${subject.tenantId}")))
                .build());

        templates.put(READ_ONLY_ENFORCEMENT, PolicyDraft.builder()
                .policyId(READ_ONLY_ENFORCEMENT)
                .name("Read-Only User Enforcement")
                .description("Prevents read-only users from performing write operations")
                .scope(PolicyScope.PLATFORM)
                .category("READ_ONLY_ENFORCEMENT")
                .effect(PolicyEffect.DENY)
                .priority(900)
                .subjectAttributes(List.of(
                        AttributePredicate.of("readOnly", EQUALS, true)))
                .actionAttributes(List.of(
                        AttributePredicate.of("action", IN, List.of("create", "update", "delete", "approve"))))
                .build());

        templates.put(FINANCIAL_APPROVAL_LIMITS, PolicyDraft.builder()
                .policyId(FINANCIAL_APPROVAL_LIMITS)
                .name("Financial Approval Limits")
                .description("Enforces approval limits for financial operations")
                .scope(PolicyScope.PLATFORM)
                .category("FINANCIAL_LIMITS")
                .effect(PolicyEffect.DENY)
                .priority(800)
                .actionAttributes(List.of(
                        AttributePredicate.of("action", EQUALS, "approve")))
                .resourceAttributes(List.of(
                        AttributePredicate.of("amount", GREATER_THAN, "${subject.approvalLimit}")))
                .build());

        templates.put(BUSINESS_HOURS_PAYOUTS, PolicyDraft.builder()
                .policyId(BUSINESS_HOURS_PAYOUTS)
                .name("Business Hours Payout Restriction")
                .description("Restricts payout approvals to business hours only")
                .scope(PolicyScope.PLATFORM)
                .category("TIME_BOUND_ACTIONS")
                .effect(PolicyEffect.DENY)
                .priority(700)
                .actionAttributes(List.of(
                        AttributePredicate.of("action", EQUALS, "approve")))
                .resourceAttributes(List.of(
                        AttributePredicate.of("resourceType", EQUALS, "payout")))
                .environmentAttributes(List.of(
                        AttributePredicate.of("businessHours", EQUALS, false)))
                .build());

        templates.put(AUTOMATION_SCOPE_PROTECTION, PolicyDraft.builder()
                .policyId(AUTOMATION_SCOPE_PROTECTION)
                .name("Automation Scope Protection")
                .description("Prevents tenant admins from accessing platform automation")
                .scope(PolicyScope.PLATFORM)
                .category("AUTOMATION_SCOPE")
                .effect(PolicyEffect.DENY)
                .priority(600)
                .subjectAttributes(List.of(
                        AttributePredicate.of("role", EQUALS, "TenantAdmin")))
                .resourceAttributes(List.of(
                        AttributePredicate.of("automationScope", EQUALS, "PLATFORM")))
                .build());

        templates.put(NOTIFICATION_TENANT_SAFETY, PolicyDraft.builder()
                .policyId(NOTIFICATION_TENANT_SAFETY)
                .name("Notification Tenant Safety")
                .description("Ensures notifications are only sent within tenant boundaries")
                .scope(PolicyScope.TENANT)
                .category("NOTIFICATION_SAFETY")
                .effect(PolicyEffect.DENY)
                .priority(500)
                .actionAttributes(List.of(
                        AttributePredicate.of("action", EQUALS, "notify")))
                .resourceAttributes(List.of(
                        AttributePredicate.of("eventTenantId", NOT_EQUALS, "${subject.tenantId}")))
                .build());

        return Collections.unmodifiableMap(templates);
    }
}
