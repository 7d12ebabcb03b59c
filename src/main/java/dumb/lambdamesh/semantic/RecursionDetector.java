package dumb.lambdamesh.semantic;

import dumb.lambdamesh.LambdaParser;
import dumb.lambdamesh.Term;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Flags expressions that risk non-termination under reduction. Routing only: a flagged expression is
 * compared structurally instead of being reduced.
 */
public enum RecursionDetector {
    ;

    private static final Pattern SELF_APPLICATION = Pattern.compile("\\(\\s*(\\w+)\\s+\\1\\s*\\)");

    public static boolean nonTerminating(Term t, Set<String> knownRecursive) {
        if (!knownRecursive.isEmpty()) {
            for (var id : t.idents()) if (knownRecursive.contains(id)) return true;
        }
        return selfApplicationShape(t);
    }

    /** Parses when possible; otherwise falls back to textual patterns. */
    public static boolean nonTerminating(String text, Set<String> knownRecursive) {
        try {
            return nonTerminating(LambdaParser.parse(text), knownRecursive);
        } catch (LambdaParser.ParseException e) {
            if (SELF_APPLICATION.matcher(text).find()) return true;
            for (var id : knownRecursive) {
                if (Pattern.compile("\\b" + Pattern.quote(id) + "\\b").matcher(text).find()) return true;
            }
            return false;
        }
    }

    /**
     * An application of one self-applying abstraction to another, as in
     * {@code (λx.g (x x)) (λx.g (x x))} or {@code (λx.x x) (λx.x x)}.
     */
    public static boolean selfApplicationShape(Term t) {
        if (t instanceof Term.App app) {
            if (app.fn instanceof Term.Abs f && app.arg instanceof Term.Abs a && selfApplying(f) && selfApplying(a))
                return true;
            return selfApplicationShape(app.fn) || selfApplicationShape(app.arg);
        }
        if (t instanceof Term.Abs abs) return selfApplicationShape(abs.body);
        return false;
    }

    static boolean selfApplying(Term.Abs abs) {
        return appliesToItself(abs.body, abs.param);
    }

    private static boolean appliesToItself(Term t, String name) {
        if (t instanceof Term.App app) {
            if (app.fn instanceof Term.Var f && app.arg instanceof Term.Var a && f.name().equals(name) && a.name().equals(name))
                return true;
            return appliesToItself(app.fn, name) || appliesToItself(app.arg, name);
        }
        if (t instanceof Term.Abs abs) return !abs.param.equals(name) && appliesToItself(abs.body, name);
        return false;
    }
}
