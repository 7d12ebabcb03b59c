package dumb.lambdamesh.semantic;

import dumb.lambdamesh.Proof;
import dumb.lambdamesh.Term;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Law-directed rewriting to a fixpoint: eta reduction, fold/map fusion and compose associativity.
 * Each law strictly shrinks or right-associates the term, so rewriting terminates; the iteration cap
 * is a backstop.
 */
public enum AlgebraicLaws {
    ;

    public static final String LAW_ETA = "η-reduction";
    public static final String LAW_FUSION = "fold/map fusion";
    public static final String LAW_ASSOC = "compose associativity";

    private static final int MAX_ITERATIONS = 100;
    private static final Term.Ident FOLD = Term.Ident.of("FOLD");
    private static final Term.Ident MAP = Term.Ident.of("MAP");
    private static final Term.Ident COMPOSE = Term.Ident.of("COMPOSE");

    public static Rewritten rewrite(Term t) {
        var steps = new ArrayList<Proof.Step>();
        var current = t;
        for (var i = 0; i < MAX_ITERATIONS; i++) {
            var next = rewriteOnce(current, steps::add);
            if (next == null) break;
            current = next;
        }
        return new Rewritten(current, steps);
    }

    /** Outermost position first; null when no law applies anywhere. */
    @Nullable
    static Term rewriteOnce(Term t, Consumer<Proof.Step> trace) {
        var r = atRoot(t);
        if (r != null) {
            trace.accept(new Proof.Step(r.law(), t.toLambda(), r.term().toLambda(), r.law()));
            return r.term();
        }
        if (t instanceof Term.Abs abs) {
            var b = rewriteOnce(abs.body, trace);
            return b != null ? new Term.Abs(abs.param, b) : null;
        }
        if (t instanceof Term.App app) {
            var f = rewriteOnce(app.fn, trace);
            if (f != null) return new Term.App(f, app.arg);
            var a = rewriteOnce(app.arg, trace);
            return a != null ? new Term.App(app.fn, a) : null;
        }
        return null;
    }

    @Nullable
    private static Applied atRoot(Term t) {
        var eta = eta(t);
        if (eta != null) return new Applied(LAW_ETA, eta);
        var fused = fusion(t);
        if (fused != null) return new Applied(LAW_FUSION, fused);
        var assoc = associate(t);
        if (assoc != null) return new Applied(LAW_ASSOC, assoc);
        return null;
    }

    /** {@code λx.M x → M} when x is not free in M. */
    @Nullable
    static Term eta(Term t) {
        if (t instanceof Term.Abs abs && abs.body instanceof Term.App app
                && app.arg instanceof Term.Var v && v.name().equals(abs.param) && !app.fn.free().contains(abs.param))
            return app.fn;
        return null;
    }

    /** {@code FOLD (λh.λacc.g (f h) acc) z xs → FOLD g z (MAP f xs)}. */
    @Nullable
    static Term fusion(Term t) {
        var args = spine(t, FOLD, 3);
        if (args == null) return null;
        if (!(args.get(0) instanceof Term.Abs outer) || !(outer.body instanceof Term.Abs inner)) return null;
        var h = outer.param;
        var acc = inner.param;
        if (h.equals(acc)) return null;
        if (!(inner.body instanceof Term.App body) || !(body.arg instanceof Term.Var accVar) || !accVar.name().equals(acc))
            return null;
        if (!(body.fn instanceof Term.App gApp) || !(gApp.arg instanceof Term.App fApp)) return null;
        if (!(fApp.arg instanceof Term.Var hVar) || !hVar.name().equals(h)) return null;
        var g = gApp.fn;
        var f = fApp.fn;
        if (g.free().contains(h) || g.free().contains(acc) || f.free().contains(h) || f.free().contains(acc))
            return null;
        return Term.app(FOLD, g, args.get(1), Term.app(MAP, f, args.get(2)));
    }

    /** {@code COMPOSE (COMPOSE f g) h → COMPOSE f (COMPOSE g h)}. */
    @Nullable
    static Term associate(Term t) {
        var args = spine(t, COMPOSE, 2);
        if (args == null) return null;
        var left = spine(args.get(0), COMPOSE, 2);
        if (left == null) return null;
        return Term.app(COMPOSE, left.get(0), Term.app(COMPOSE, left.get(1), args.get(1)));
    }

    /** Arguments of {@code head a1 .. an} when {@code t} has exactly that shape. */
    @Nullable
    private static List<Term> spine(Term t, Term head, int arity) {
        var args = new ArrayList<Term>(arity);
        var cur = t;
        while (cur instanceof Term.App app) {
            args.add(0, app.arg);
            cur = app.fn;
        }
        return cur.equals(head) && args.size() == arity ? args : null;
    }

    public record Rewritten(Term term, List<Proof.Step> steps) {
        public Rewritten {
            steps = List.copyOf(steps);
        }

        public boolean changed() {
            return !steps.isEmpty();
        }
    }

    private record Applied(String law, Term term) {
    }
}
