package com.example.abac.engine;

import com.example.abac.policy.model.PolicyEffect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DecisionCombiner")
class DecisionCombinerTest {

    private final DecisionCombiner combiner = new DecisionCombiner();

    private static PolicyEvaluation applicable(String id, PolicyEffect effect, int priority) {
        return new PolicyEvaluation(id, id + " name", effect, priority, true, AttributeMatcher.ALL_MATCHED);
    }

    private static PolicyEvaluation notApplicable(String id, PolicyEffect effect, int priority) {
        return new PolicyEvaluation(id, id + " name", effect, priority, false, "Policy conditions not met: Subject: x");
    }

    @Test
    @DisplayName("should deny with the default reason when nothing applies")
    void shouldDenyByDefault() {
        DecisionCombiner.Outcome outcome = combiner.combine(List.of(
                notApplicable("A", PolicyEffect.ALLOW, 500)));

        assertThat(outcome.effect()).isEqualTo(PolicyEffect.DENY);
        assertThat(outcome.controllingPolicyId()).isNull();
        assertThat(outcome.reason()).isEqualTo("no applicable policy");
    }

    @Test
    @DisplayName("should let any applicable deny override higher-priority allows")
    void shouldLetDenyOverride() {
        DecisionCombiner.Outcome outcome = combiner.combine(List.of(
                applicable("ALLOW_HIGH", PolicyEffect.ALLOW, 1000),
                applicable("DENY_LOW", PolicyEffect.DENY, 1)));

        assertThat(outcome.effect()).isEqualTo(PolicyEffect.DENY);
        assertThat(outcome.controllingPolicyId()).isEqualTo("DENY_LOW");
    }

    @Test
    @DisplayName("should cite the highest-priority deny when several apply")
    void shouldCiteHighestDeny() {
        DecisionCombiner.Outcome outcome = combiner.combine(List.of(
                applicable("DENY_LOW", PolicyEffect.DENY, 10),
                applicable("DENY_HIGH", PolicyEffect.DENY, 900)));

        assertThat(outcome.controllingPolicyId()).isEqualTo("DENY_HIGH");
        assertThat(outcome.reason()).contains("DENY_HIGH");
    }

    @Test
    @DisplayName("should cite the highest-priority allow, ties broken by policy id")
    void shouldBreakTiesByPolicyId() {
        List<PolicyEvaluation> evaluations = List.of(
                applicable("B_ALLOW", PolicyEffect.ALLOW, 200),
                applicable("A_ALLOW", PolicyEffect.ALLOW, 200),
                applicable("C_ALLOW", PolicyEffect.ALLOW, 100));

        DecisionCombiner.Outcome outcome = combiner.combine(evaluations);

        assertThat(outcome.effect()).isEqualTo(PolicyEffect.ALLOW);
        assertThat(outcome.controllingPolicyId()).isEqualTo("A_ALLOW");
        assertThat(combiner.combine(List.of(evaluations.get(1), evaluations.get(0), evaluations.get(2))))
                .isEqualTo(outcome);
    }
}
