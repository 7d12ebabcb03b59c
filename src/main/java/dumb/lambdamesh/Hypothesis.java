package dumb.lambdamesh;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A plausible but unproven equivalence, with a plan for proving it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Hypothesis(String candidateHash, String candidateName, double confidence, String reasoning,
                         List<String> requiredProof, String gap, List<ExplorationStep> steps,
                         double explorationValue) {

    public Hypothesis {
        requireNonNull(candidateHash);
        requireNonNull(candidateName);
        requiredProof = List.copyOf(requiredProof);
        steps = List.copyOf(steps);
    }

    public enum Effort {
        LOW, MEDIUM, HIGH
    }

    public record ExplorationStep(String phase, String description, Effort effort, List<String> blockers) {
        public ExplorationStep {
            blockers = List.copyOf(blockers);
        }
    }
}
