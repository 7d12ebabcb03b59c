package dumb.lambdamesh.semantic;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rule-based purity verdict over raw expression text.
 */
public enum PurityChecker {
    ;

    static final double PENALTY = 0.2;
    static final int MIN_LENGTH_FOR_ABSTRACTION = 10;

    private static final String REMOVE_STATE = "Remove mutable state";
    private static final String USE_RECURSION = "Convert loops to recursion (Y-combinator)";
    private static final String USE_MONADS = "Use monads for effects (IO, State, Either)";

    private static final Pattern BINDER = Pattern.compile("λ|\\\\|function\\s*\\(");

    private static final List<Rule> RULES = List.of(
            new Rule("Mutable binding (let mut)", Pattern.compile("\\blet\\b.*\\bmut\\b"), REMOVE_STATE),
            new Rule("Mutable variable (var)", Pattern.compile("\\bvar\\b"), REMOVE_STATE),
            new Rule("Increment/decrement (++ or --)", Pattern.compile("\\+\\+|--"), REMOVE_STATE),
            new Rule("State assignment (:=)", Pattern.compile(":="), REMOVE_STATE),
            new Rule("Assignment (=)", Pattern.compile("(?<![=!<>:])=(?![=>])"), REMOVE_STATE),
            new Rule("Loop (while/for)", Pattern.compile("\\bwhile\\b|\\bfor\\b"), USE_RECURSION),
            new Rule("Side-effecting call (console/window/document/print)",
                    Pattern.compile("\\bconsole\\.|\\bwindow\\.|\\bdocument\\.|\\bprint(ln)?\\s*\\("), USE_MONADS),
            new Rule("Exception control flow (throw/try/catch)", Pattern.compile("\\bthrow\\b|\\btry\\b|\\bcatch\\b"), USE_MONADS),
            new Rule("Suspension or concurrency (async/await/spawn/yield)",
                    Pattern.compile("\\basync\\b|\\bawait\\b|\\bspawn\\b|\\byield\\b"), USE_MONADS)
    );

    public static Result check(String text) {
        var violations = new ArrayList<String>();
        var suggestions = new LinkedHashSet<String>();
        for (var rule : RULES) {
            if (rule.pattern.matcher(text).find()) {
                violations.add(rule.violation);
                suggestions.add(rule.suggestion);
            }
        }
        var marked = !violations.isEmpty();
        if (text.strip().length() > MIN_LENGTH_FOR_ABSTRACTION && !BINDER.matcher(text).find()) {
            violations.add("Missing lambda abstraction");
            suggestions.add("Express the computation as a λ-abstraction");
        }
        var score = Math.max(0, 1 - PENALTY * violations.size());
        return new Result(violations.isEmpty(), marked, score, violations, List.copyOf(suggestions));
    }

    private record Rule(String violation, Pattern pattern, String suggestion) {
    }

    /**
     * @param marked the text carries a mutation or imperative marker. Such text is impure whatever it
     *               would otherwise reduce to.
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Result(boolean pure, boolean marked, double score, List<String> violations, List<String> suggestions) {
        public Result {
            violations = List.copyOf(violations);
            suggestions = List.copyOf(suggestions);
        }
    }
}
