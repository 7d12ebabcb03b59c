package dumb.lambdamesh;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Ordered rewrite steps from a submitted expression to a canonical morphism.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Proof(List<Step> steps, String normalForm, String canonicalHash, String reasoning) {

    public static final String RULE_HASH = "content hash";
    public static final String RULE_SYNTAX = "syntactic form";
    public static final String RULE_EXPANSION = "definition expansion";
    public static final String RULE_BETA = "β-reduction";
    public static final String RULE_ALPHA = "structural/alpha equivalence";

    public Proof {
        steps = List.copyOf(steps);
        requireNonNull(normalForm);
        requireNonNull(canonicalHash);
        requireNonNull(reasoning);
    }

    public static Proof single(Step step, String normalForm, String canonicalHash, String reasoning) {
        return new Proof(List.of(step), normalForm, canonicalHash, reasoning);
    }

    public boolean usesRule(String rule) {
        return steps.stream().anyMatch(s -> s.rule().equals(rule));
    }

    public record Step(String rule, String from, String to, String explanation) {
        public Step {
            requireNonNull(rule);
            requireNonNull(from);
            requireNonNull(to);
            explanation = explanation == null ? "" : explanation;
        }
    }

    /** Accumulates steps while an equivalence is being established. */
    public static final class Builder {
        private final List<Step> steps = new ArrayList<>();

        public Builder add(String rule, String from, String to, String explanation) {
            steps.add(new Step(rule, from, to, explanation));
            return this;
        }

        public Builder addAll(List<Step> more) {
            steps.addAll(more);
            return this;
        }

        public Proof build(String normalForm, String canonicalHash, String reasoning) {
            return new Proof(steps, normalForm, canonicalHash, reasoning);
        }
    }
}
