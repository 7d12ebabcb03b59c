package dumb.lambdamesh.semantic;

import dumb.lambdamesh.Term;

import java.util.HashMap;
import java.util.Map;

/**
 * Alpha-equivalence without expansion or reduction. Binders are paired by position: both sides map
 * their binder name to the same binding level, so {@code λx.x} and {@code λy.y} coincide.
 */
public enum StructuralEquivalence {
    ;

    public static boolean alphaEquivalent(Term a, Term b) {
        return equivalent(a, b, Map.of(), Map.of(), 0);
    }

    /**
     * Number of nodes that line up positionally, with binders paired the same way as
     * {@link #alphaEquivalent}. Equals {@code a.weight()} exactly when the terms are alpha-equivalent.
     */
    public static int commonNodes(Term a, Term b) {
        return common(a, b, Map.of(), Map.of(), 0);
    }

    private static boolean equivalent(Term a, Term b, Map<String, Integer> envA, Map<String, Integer> envB, int level) {
        if (a instanceof Term.Var va && b instanceof Term.Var vb) return sameVar(va, vb, envA, envB);
        if (a instanceof Term.Ident ia && b instanceof Term.Ident ib) return ia.name().equals(ib.name());
        if (a instanceof Term.Abs aa && b instanceof Term.Abs ab) {
            if (aa.weight() != ab.weight()) return false;
            return equivalent(aa.body, ab.body, bind(envA, aa.param, level), bind(envB, ab.param, level), level + 1);
        }
        if (a instanceof Term.App pa && b instanceof Term.App pb) {
            if (pa.weight() != pb.weight()) return false;
            return equivalent(pa.fn, pb.fn, envA, envB, level) && equivalent(pa.arg, pb.arg, envA, envB, level);
        }
        return false;
    }

    private static int common(Term a, Term b, Map<String, Integer> envA, Map<String, Integer> envB, int level) {
        if (a instanceof Term.Var va && b instanceof Term.Var vb) return sameVar(va, vb, envA, envB) ? 1 : 0;
        if (a instanceof Term.Ident ia && b instanceof Term.Ident ib) return ia.name().equals(ib.name()) ? 1 : 0;
        if (a instanceof Term.Abs aa && b instanceof Term.Abs ab)
            return 1 + common(aa.body, ab.body, bind(envA, aa.param, level), bind(envB, ab.param, level), level + 1);
        if (a instanceof Term.App pa && b instanceof Term.App pb)
            return 1 + common(pa.fn, pb.fn, envA, envB, level) + common(pa.arg, pb.arg, envA, envB, level);
        return 0;
    }

    private static boolean sameVar(Term.Var a, Term.Var b, Map<String, Integer> envA, Map<String, Integer> envB) {
        var la = envA.get(a.name());
        var lb = envB.get(b.name());
        if (la == null && lb == null) return a.name().equals(b.name());
        return la != null && la.equals(lb);
    }

    private static Map<String, Integer> bind(Map<String, Integer> env, String name, int level) {
        var m = new HashMap<>(env);
        m.put(name, level);
        return m;
    }
}
