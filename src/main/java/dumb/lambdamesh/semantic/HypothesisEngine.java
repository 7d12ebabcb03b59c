package dumb.lambdamesh.semantic;

import dumb.lambdamesh.CanonicalMorphism;
import dumb.lambdamesh.Hypothesis;
import dumb.lambdamesh.Hypothesis.Effort;
import dumb.lambdamesh.Hypothesis.ExplorationStep;
import dumb.lambdamesh.MorphismRegistry;
import dumb.lambdamesh.Term;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import static java.util.Objects.requireNonNull;

/**
 * Proposes near-matches when no equivalence could be proven.
 * <p>
 * Similarity is positional AST overlap ({@code 2·common / (size₁ + size₂)}), blended with identifier
 * Jaccard overlap when identifiers are present, and maximized with the same measure on expanded normal
 * forms for pairs that can be safely reduced.
 */
public class HypothesisEngine {

    public static final double DEFAULT_THRESHOLD = 0.7;
    static final double EXPLORATION_FACTOR = 0.8;
    static final double IDENT_WEIGHT = 0.6;
    static final double SHAPE_WEIGHT = 0.4;

    private final MorphismRegistry registry;
    private final SemanticEquivalence semantic;
    private final double threshold;

    public HypothesisEngine(MorphismRegistry registry, SemanticEquivalence semantic, double threshold) {
        if (threshold < 0 || threshold > 1) throw new IllegalArgumentException("Threshold out of range: " + threshold);
        this.registry = requireNonNull(registry);
        this.semantic = requireNonNull(semantic);
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    public Optional<Hypothesis> explore(Term term, BooleanSupplier cancelled) {
        return explore(term, threshold, cancelled);
    }

    /** Best candidate scoring strictly above {@code threshold}, if any. */
    public Optional<Hypothesis> explore(Term term, double threshold, BooleanSupplier cancelled) {
        CanonicalMorphism best = null;
        Term bestTerm = null;
        var bestScore = -1.0;
        for (var c : registry.list()) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted())
                throw new CancellationException("Hypothesis search cancelled");
            var ct = registry.term(c.hash);
            if (ct.isEmpty()) continue;
            var score = similarity(term, ct.get(), cancelled);
            if (score > bestScore) {
                bestScore = score;
                best = c;
                bestTerm = ct.get();
            }
        }
        if (best == null || !(bestScore > threshold)) return Optional.empty();
        return Optional.of(hypothesis(term, best, bestTerm, bestScore));
    }

    public double similarity(Term a, Term b, BooleanSupplier cancelled) {
        var score = syntactic(a, b);
        var recursive = registry.knownRecursive();
        if (score < 1 && !RecursionDetector.nonTerminating(a, recursive) && !RecursionDetector.nonTerminating(b, recursive)) {
            var na = semantic.normalForm(a, cancelled);
            var nb = semantic.normalForm(b, cancelled);
            if (na.isPresent() && nb.isPresent()) score = Math.max(score, syntactic(na.get(), nb.get()));
        }
        return score;
    }

    public static double syntactic(Term a, Term b) {
        var shape = shape(a, b);
        var ia = a.idents();
        var ib = b.idents();
        if (ia.isEmpty() && ib.isEmpty()) return shape;
        return IDENT_WEIGHT * jaccard(ia, ib) + SHAPE_WEIGHT * shape;
    }

    static double shape(Term a, Term b) {
        return 2.0 * StructuralEquivalence.commonNodes(a, b) / (a.weight() + b.weight());
    }

    static double jaccard(Set<String> a, Set<String> b) {
        var union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) return 1;
        var inter = new HashSet<>(a);
        inter.retainAll(b);
        return (double) inter.size() / union.size();
    }

    private Hypothesis hypothesis(Term term, CanonicalMorphism c, Term ct, double score) {
        var recursive = registry.knownRecursive();
        var blocking = new ArrayList<String>();
        for (var id : term.idents()) if (recursive.contains(id)) blocking.add(id);
        for (var id : ct.idents()) if (recursive.contains(id) && !blocking.contains(id)) blocking.add(id);
        blocking.sort(null);

        var required = new ArrayList<>(List.of("Definition Expansion", "Deep β-reduction to normal form"));
        var ids = new HashSet<>(term.idents());
        ids.addAll(ct.idents());
        if (ids.contains("FOLD") && (ids.contains("MAP") || ids.contains("CONCAT")))
            required.add("FOLD-MAP fusion theorem");

        var reductionBlockers = blocking.isEmpty() ? List.<String>of() : List.of("recursive identifiers: " + String.join(", ", blocking));
        var steps = List.of(
                new ExplorationStep("Definition Expansion", "Inline the definitions both sides refer to", Effort.MEDIUM, List.of()),
                new ExplorationStep("Deep β-Reduction", "Reduce both sides past the step budget", Effort.MEDIUM, reductionBlockers),
                new ExplorationStep("Structural Comparison", "Compare the resulting forms up to α-renaming", Effort.LOW, List.of()),
                new ExplorationStep("Equivalence Theorem", "Prove the remaining gap by an algebraic law or induction", Effort.HIGH,
                        blocking.isEmpty() ? List.of() : List.of("induction over recursive structure")));

        var gap = blocking.isEmpty()
                ? "Normal forms differ in " + (term.weight() + ct.weight() - 2 * StructuralEquivalence.commonNodes(term, ct)) + " positions"
                : "Recursive definitions prevent reduction to a common normal form";
        var reasoning = String.format("Similar to %s (similarity %.0f%%)", c.name, score * 100);
        return new Hypothesis(c.hash, c.name, score, reasoning, required, gap, steps, score * EXPLORATION_FACTOR);
    }
}
