package com.example.abac.engine;

import com.example.abac.policy.model.PolicyEffect;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Deny-overrides combining.
 *
 * <p>Applicable policies are ordered by priority (highest first), ties broken by ascending policyId.
 * The first DENY controls the result; failing that the first ALLOW; with nothing applicable the
 * result is DENY.
 */
@Component
public class DecisionCombiner {

    public static final String NO_APPLICABLE_POLICY = "no applicable policy";

    static final Comparator<PolicyEvaluation> ORDER =
            Comparator.comparingInt(PolicyEvaluation::priority).reversed()
                    .thenComparing(PolicyEvaluation::policyId);

    @NonNull
    public Outcome combine(@NonNull List<PolicyEvaluation> evaluations) {
        List<PolicyEvaluation> applicable = evaluations.stream()
                .filter(PolicyEvaluation::matched)
                .sorted(ORDER)
                .toList();

        return applicable.stream()
                .filter(e -> e.effect() == PolicyEffect.DENY)
                .findFirst()
                .or(() -> applicable.stream().filter(e -> e.effect() == PolicyEffect.ALLOW).findFirst())
                .map(Outcome::controlledBy)
                .orElseGet(Outcome::defaultDeny);
    }

    /**
     * Combined result and the policy that produced it.
     */
    public record Outcome(PolicyEffect effect, @Nullable String controllingPolicyId, String reason) {

        static Outcome controlledBy(PolicyEvaluation evaluation) {
            String verb = evaluation.effect() == PolicyEffect.DENY ? "Denied" : "Allowed";
            return new Outcome(evaluation.effect(), evaluation.policyId(),
                    String.format("%s by policy %s (%s)", verb, evaluation.policyId(), evaluation.policyName()));
        }

        static Outcome defaultDeny() {
            return new Outcome(PolicyEffect.DENY, null, NO_APPLICABLE_POLICY);
        }
    }
}
