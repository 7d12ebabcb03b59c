package dumb.lambdamesh.semantic;

import dumb.lambdamesh.CanonicalMorphism;
import dumb.lambdamesh.LambdaExpression;
import dumb.lambdamesh.MorphismRegistry;
import dumb.lambdamesh.Proof;
import dumb.lambdamesh.Term;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import static dumb.lambdamesh.util.Log.debug;
import static java.util.Objects.requireNonNull;

/**
 * Decides whether a submitted expression is equivalent to a registered morphism. Cheapest checks run
 * first: content hash, syntactic form, then either structural comparison (for expressions at risk of
 * non-termination) or expansion plus reduction to normal form, and finally algebraic laws.
 */
public class SemanticEquivalence {

    private final MorphismRegistry registry;
    private final DefinitionExpansion expansion;
    private final BetaReduction reduction;

    public SemanticEquivalence(MorphismRegistry registry, DefinitionExpansion expansion, BetaReduction reduction) {
        this.registry = requireNonNull(registry);
        this.expansion = requireNonNull(expansion);
        this.reduction = requireNonNull(reduction);
    }

    public BetaReduction reduction() {
        return reduction;
    }

    /**
     * @param term the parsed form of {@code expr}
     * @throws CancellationException if cancelled; never reported as "no match"
     */
    public Optional<Match> findCanonical(LambdaExpression expr, Term term, BooleanSupplier cancelled) {
        var exact = registry.get(expr.hash());
        if (exact.isPresent()) {
            var c = exact.get();
            return Optional.of(new Match(c, Method.HASH, Proof.single(
                    new Proof.Step(Proof.RULE_HASH, expr.normalized(), c.definition, "identical normalized text"),
                    c.definition, c.hash, "Identical to " + c.name)));
        }

        var syntactic = registry.bySyntax(MorphismRegistry.syntaxHash(term));
        if (syntactic.isPresent()) {
            var c = syntactic.get();
            return Optional.of(new Match(c, Method.SYNTAX, Proof.single(
                    new Proof.Step(Proof.RULE_SYNTAX, expr.text(), term.toLambda(), "same canonical printing"),
                    term.toLambda(), c.hash, "Syntactically identical to " + c.name)));
        }

        var recursive = registry.knownRecursive();
        var found = RecursionDetector.nonTerminating(term, recursive)
                ? structural(term, cancelled)
                : reduced(term, recursive, cancelled);
        return found.isPresent() ? found : byLaws(term, cancelled);
    }

    private Optional<Match> structural(Term term, BooleanSupplier cancelled) {
        for (var c : registry.list()) {
            checkCancelled(cancelled);
            var ct = registry.term(c.hash);
            if (ct.isPresent() && StructuralEquivalence.alphaEquivalent(term, ct.get()))
                return Optional.of(alphaMatch(term, c, ct.get(), Method.STRUCTURAL));
        }
        return Optional.empty();
    }

    private Optional<Match> reduced(Term term, Set<String> recursive, BooleanSupplier cancelled) {
        var expanded = expansion.expand(term, registry::definition);
        BetaReduction.Result mine;
        try {
            mine = reduction.normalize(expanded, cancelled);
        } catch (ReductionLimitExceeded e) {
            debug("Submission has no normal form within budget: " + e.getMessage());
            return structural(term, cancelled);
        }

        for (var c : registry.list()) {
            checkCancelled(cancelled);
            var ct = registry.term(c.hash);
            if (ct.isEmpty()) continue;
            if (RecursionDetector.nonTerminating(ct.get(), recursive)) {
                if (StructuralEquivalence.alphaEquivalent(term, ct.get()))
                    return Optional.of(alphaMatch(term, c, ct.get(), Method.STRUCTURAL));
                continue;
            }
            BetaReduction.Result theirs;
            try {
                theirs = reduction.normalize(expansion.expand(ct.get(), registry::definition), cancelled);
            } catch (ReductionLimitExceeded e) {
                debug("Candidate " + c.name + " skipped: " + e.getMessage());
                continue;
            }
            if (StructuralEquivalence.alphaEquivalent(mine.normalForm(), theirs.normalForm())) {
                var proof = new Proof.Builder();
                if (expanded != term)
                    proof.add(Proof.RULE_EXPANSION, term.toLambda(), expanded.toLambda(), "inline known definitions");
                proof.addAll(mine.steps());
                proof.add(Proof.RULE_BETA, c.definition, theirs.normalForm().toLambda(),
                        c.name + " reduces in " + theirs.steps().size() + " steps");
                proof.add(Proof.RULE_ALPHA, mine.normalForm().toLambda(), theirs.normalForm().toLambda(), "normal forms coincide");
                return Optional.of(new Match(c, Method.REDUCTION, proof.build(theirs.normalForm().toLambda(), c.hash,
                        "Same normal form as " + c.name + " after " + mine.steps().size() + " β-steps")));
            }
        }
        return Optional.empty();
    }

    private Optional<Match> byLaws(Term term, BooleanSupplier cancelled) {
        var mine = AlgebraicLaws.rewrite(term);
        for (var c : registry.list()) {
            checkCancelled(cancelled);
            var ct = registry.term(c.hash);
            if (ct.isEmpty()) continue;
            var theirs = AlgebraicLaws.rewrite(ct.get());
            if (!mine.changed() && !theirs.changed()) continue;
            if (StructuralEquivalence.alphaEquivalent(mine.term(), theirs.term())) {
                var proof = new Proof.Builder().addAll(mine.steps()).addAll(theirs.steps())
                        .add(Proof.RULE_ALPHA, mine.term().toLambda(), theirs.term().toLambda(), "law normal forms coincide");
                return Optional.of(new Match(c, Method.LAWS, proof.build(theirs.term().toLambda(), c.hash,
                        "Equal to " + c.name + " by algebraic laws")));
            }
        }
        return Optional.empty();
    }

    /** Expanded normal form, or empty when the budget runs out. */
    public Optional<Term> normalForm(Term term, BooleanSupplier cancelled) {
        try {
            return Optional.of(reduction.normalize(expansion.expand(term, registry::definition), cancelled).normalForm());
        } catch (ReductionLimitExceeded e) {
            return Optional.empty();
        }
    }

    private static Match alphaMatch(Term term, CanonicalMorphism c, Term ct, Method method) {
        return new Match(c, method, Proof.single(
                new Proof.Step(Proof.RULE_ALPHA, term.toLambda(), ct.toLambda(), "binders correspond by position"),
                ct.toLambda(), c.hash, "Alpha-equivalent to " + c.name));
    }

    private static void checkCancelled(BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted())
            throw new CancellationException("Equivalence search cancelled");
    }

    public enum Method {
        HASH, SYNTAX, STRUCTURAL, REDUCTION, LAWS
    }

    public record Match(CanonicalMorphism canonical, Method method, Proof proof) {
    }
}
