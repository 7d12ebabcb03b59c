package dumb.lambdamesh.semantic;

import dumb.lambdamesh.Proof;
import dumb.lambdamesh.Term;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Normal-order (leftmost-outermost) beta reduction with capture-avoiding substitution.
 */
public class BetaReduction {

    public static final int DEFAULT_STEP_LIMIT = 1000;
    /** Terms growing past this many nodes are abandoned. */
    public static final int MAX_TERM_WEIGHT = 10_000;

    private final int stepLimit;
    private final AtomicLong runs = new AtomicLong();

    public BetaReduction() {
        this(DEFAULT_STEP_LIMIT);
    }

    public BetaReduction(int stepLimit) {
        if (stepLimit <= 0) throw new IllegalArgumentException("Step limit must be positive: " + stepLimit);
        this.stepLimit = stepLimit;
    }

    public int stepLimit() {
        return stepLimit;
    }

    /** How many times {@link #normalize} has been entered. */
    public long runs() {
        return runs.get();
    }

    public Result normalize(Term term) throws ReductionLimitExceeded {
        return normalize(term, () -> false);
    }

    /**
     * Reduces to normal form. The cancellation signal and the thread interrupt flag are polled before
     * every step.
     *
     * @throws ReductionLimitExceeded if the step budget runs out or the term grows too large
     * @throws CancellationException  if cancelled while reducing
     */
    public Result normalize(Term term, BooleanSupplier cancelled) throws ReductionLimitExceeded {
        runs.incrementAndGet();
        var steps = new ArrayList<Proof.Step>();
        var current = term;
        var count = 0;
        while (true) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted())
                throw new CancellationException("Reduction cancelled after " + count + " steps");

            var next = step(current, steps::add);
            if (next == null) return new Result(current, steps);

            if (++count > stepLimit)
                throw new ReductionLimitExceeded("No normal form within " + stepLimit + " steps", count, current);
            if (next.weight() > MAX_TERM_WEIGHT)
                throw new ReductionLimitExceeded("Term grew past " + MAX_TERM_WEIGHT + " nodes", count, next);
            current = next;
        }
    }

    /** One leftmost-outermost step, or null when the term is in normal form. */
    @Nullable
    static Term step(Term t, Consumer<Proof.Step> trace) {
        if (t instanceof Term.App app) {
            if (app.fn instanceof Term.Abs abs) {
                var contractum = substitute(abs.body, abs.param, app.arg);
                trace.accept(new Proof.Step(Proof.RULE_BETA, app.toLambda(), contractum.toLambda(),
                        "substitute " + app.arg.toLambda() + " for " + abs.param));
                return contractum;
            }
            var f = step(app.fn, trace);
            if (f != null) return new Term.App(f, app.arg);
            var a = step(app.arg, trace);
            return a != null ? new Term.App(app.fn, a) : null;
        }
        if (t instanceof Term.Abs abs) {
            var b = step(abs.body, trace);
            return b != null ? new Term.Abs(abs.param, b) : null;
        }
        return null;
    }

    /** {@code t[x := s]}, renaming binders that would capture free variables of {@code s}. */
    public static Term substitute(Term t, String x, Term s) {
        if (t instanceof Term.Var v) return v.name().equals(x) ? s : t;
        if (t instanceof Term.Ident) return t;
        if (t instanceof Term.App app) {
            if (!app.free().contains(x)) return t;
            return new Term.App(substitute(app.fn, x, s), substitute(app.arg, x, s));
        }
        var abs = (Term.Abs) t;
        if (abs.param.equals(x) || !abs.free().contains(x)) return abs;
        if (s.free().contains(abs.param)) {
            var avoid = new HashSet<>(s.free());
            avoid.addAll(abs.body.free());
            avoid.add(x);
            var fresh = fresh(abs.param, avoid);
            var renamed = substitute(abs.body, abs.param, Term.Var.of(fresh));
            return new Term.Abs(fresh, substitute(renamed, x, s));
        }
        return new Term.Abs(abs.param, substitute(abs.body, x, s));
    }

    static String fresh(String base, Set<String> avoid) {
        var stem = base.replaceAll("\\d+$", "");
        if (stem.isEmpty()) stem = "v";
        for (var i = 1; ; i++) {
            var candidate = stem + i;
            if (!avoid.contains(candidate)) return candidate;
        }
    }

    public record Result(Term normalForm, List<Proof.Step> steps) {
        public Result {
            steps = List.copyOf(steps);
        }
    }
}
