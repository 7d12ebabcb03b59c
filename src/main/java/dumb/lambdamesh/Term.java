package dumb.lambdamesh;

import org.json.JSONObject;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Immutable lambda-calculus AST. Terms are never mutated; every rewrite builds a new term.
 */
sealed public interface Term permits Term.Var, Term.Ident, Term.Abs, Term.App {

    String LAMBDA = "λ";

    /** Registry identifier convention: an unbound all-caps name. */
    Pattern IDENT_PATTERN = Pattern.compile("[A-Z][A-Z0-9_]*");

    static boolean isIdentName(String name) {
        return IDENT_PATTERN.matcher(name).matches();
    }

    /** Left-associative curried application: {@code app(f, a, b)} is {@code (f a) b}. */
    static Term app(Term fn, Term... args) {
        var t = fn;
        for (var a : args) t = new App(t, a);
        return t;
    }

    /** Nested abstraction: {@code abs(body, "x", "y")} is {@code λx.λy.body}. */
    static Term abs(Term body, String... params) {
        var t = body;
        for (var i = params.length - 1; i >= 0; i--) t = new Abs(params[i], t);
        return t;
    }

    /** Canonical printing: λ binders, single spaces, minimal parentheses. */
    String toLambda();

    /** Names of free variables. */
    Set<String> free();

    /** Names of registry identifiers occurring in this term. */
    Set<String> idents();

    /** Node count. */
    int weight();

    JSONObject toJson();

    record Var(String name) implements Term {
        public Var {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Variable name must not be empty");
        }

        public static Var of(String name) {
            return new Var(name);
        }

        @Override
        public String toLambda() {
            return name;
        }

        @Override
        public Set<String> free() {
            return Set.of(name);
        }

        @Override
        public Set<String> idents() {
            return Set.of();
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public String toString() {
            return "Var[" + name + ']';
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "var").put("name", name);
        }
    }

    record Ident(String name) implements Term {
        public Ident {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Identifier name must not be empty");
        }

        public static Ident of(String name) {
            return new Ident(name);
        }

        @Override
        public String toLambda() {
            return name;
        }

        @Override
        public Set<String> free() {
            return Set.of();
        }

        @Override
        public Set<String> idents() {
            return Set.of(name);
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public String toString() {
            return "Ident[" + name + ']';
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "ident").put("name", name);
        }
    }

    final class Abs implements Term {
        public final String param;
        public final Term body;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated;
        private volatile String stringCache;
        private volatile int weightCache = -1;
        private volatile Set<String> freeCache, identsCache;

        public Abs(String param, Term body) {
            this.param = requireNonNull(param);
            this.body = requireNonNull(body);
            if (param.isEmpty()) throw new IllegalArgumentException("Binder name must not be empty");
        }

        @Override
        public String toLambda() {
            if (stringCache == null) stringCache = LAMBDA + param + "." + body.toLambda();
            return stringCache;
        }

        @Override
        public Set<String> free() {
            if (freeCache == null) {
                var s = new HashSet<>(body.free());
                s.remove(param);
                freeCache = Set.copyOf(s);
            }
            return freeCache;
        }

        @Override
        public Set<String> idents() {
            if (identsCache == null) identsCache = body.idents();
            return identsCache;
        }

        @Override
        public int weight() {
            if (weightCache == -1) weightCache = 1 + body.weight();
            return weightCache;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Abs that && this.hashCode() == that.hashCode() && param.equals(that.param) && body.equals(that.body));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = 31 * param.hashCode() + body.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return "Abs[" + toLambda() + ']';
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "abs")
                    .put("param", param)
                    .put("body", body.toJson())
                    .put("lambda", toLambda());
        }
    }

    final class App implements Term {
        public final Term fn;
        public final Term arg;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated;
        private volatile String stringCache;
        private volatile int weightCache = -1;
        private volatile Set<String> freeCache, identsCache;

        public App(Term fn, Term arg) {
            this.fn = requireNonNull(fn);
            this.arg = requireNonNull(arg);
        }

        @Override
        public String toLambda() {
            if (stringCache == null) {
                var f = fn instanceof Abs ? "(" + fn.toLambda() + ")" : fn.toLambda();
                var a = arg instanceof Var || arg instanceof Ident ? arg.toLambda() : "(" + arg.toLambda() + ")";
                stringCache = f + " " + a;
            }
            return stringCache;
        }

        @Override
        public Set<String> free() {
            if (freeCache == null) freeCache = union(fn.free(), arg.free());
            return freeCache;
        }

        @Override
        public Set<String> idents() {
            if (identsCache == null) identsCache = union(fn.idents(), arg.idents());
            return identsCache;
        }

        private static Set<String> union(Set<String> a, Set<String> b) {
            if (a.isEmpty()) return b;
            if (b.isEmpty()) return a;
            var s = new HashSet<>(a);
            s.addAll(b);
            return Set.copyOf(s);
        }

        @Override
        public int weight() {
            if (weightCache == -1) weightCache = 1 + fn.weight() + arg.weight();
            return weightCache;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof App that && this.hashCode() == that.hashCode() && fn.equals(that.fn) && arg.equals(that.arg));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = 17 * fn.hashCode() + arg.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return "App[" + toLambda() + ']';
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "app")
                    .put("fn", fn.toJson())
                    .put("arg", arg.toJson())
                    .put("lambda", toLambda());
        }
    }
}
