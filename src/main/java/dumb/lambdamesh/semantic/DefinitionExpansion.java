package dumb.lambdamesh.semantic;

import dumb.lambdamesh.Term;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Inlines registry identifiers with their parsed definitions, to a bounded depth.
 * <p>
 * Identifiers whose definition reaches back to themselves are left in place, as are identifiers with
 * no known definition and definitions with free variables (inlining those under a binder could capture).
 */
public class DefinitionExpansion {

    public static final int DEFAULT_DEPTH = 10;

    private final int maxDepth;

    public DefinitionExpansion() {
        this(DEFAULT_DEPTH);
    }

    public DefinitionExpansion(int maxDepth) {
        if (maxDepth < 0) throw new IllegalArgumentException("Expansion depth must not be negative: " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * @param definitions identifier name to parsed definition
     * @return a new term, or {@code term} itself when nothing was expanded
     */
    public Term expand(Term term, Function<String, Optional<Term>> definitions) {
        return expand(term, definitions, 0, new HashSet<>(), new HashMap<>());
    }

    private Term expand(Term t, Function<String, Optional<Term>> definitions, int depth,
                        Set<String> expanding, Map<String, Boolean> cyclic) {
        if (t.idents().isEmpty()) return t;

        if (t instanceof Term.Ident id) {
            var name = id.name();
            if (depth >= maxDepth || expanding.contains(name)) return t;
            if (cyclic.computeIfAbsent(name, n -> selfReferential(n, definitions))) return t;
            var def = definitions.apply(name);
            if (def.isEmpty() || !def.get().free().isEmpty()) return t;
            expanding.add(name);
            try {
                return expand(def.get(), definitions, depth + 1, expanding, cyclic);
            } finally {
                expanding.remove(name);
            }
        }
        if (t instanceof Term.Abs abs) {
            var b = expand(abs.body, definitions, depth, expanding, cyclic);
            return b == abs.body ? abs : new Term.Abs(abs.param, b);
        }
        var app = (Term.App) t;
        var f = expand(app.fn, definitions, depth, expanding, cyclic);
        var a = expand(app.arg, definitions, depth, expanding, cyclic);
        return f == app.fn && a == app.arg ? app : new Term.App(f, a);
    }

    /** True if the definition of {@code name} transitively mentions {@code name}. */
    public static boolean selfReferential(String name, Function<String, Optional<Term>> definitions) {
        var seen = new HashSet<String>();
        var todo = new ArrayDeque<String>();
        definitions.apply(name).ifPresent(d -> todo.addAll(d.idents()));
        while (!todo.isEmpty()) {
            var next = todo.pop();
            if (next.equals(name)) return true;
            if (seen.add(next)) definitions.apply(next).ifPresent(d -> todo.addAll(d.idents()));
        }
        return false;
    }
}
