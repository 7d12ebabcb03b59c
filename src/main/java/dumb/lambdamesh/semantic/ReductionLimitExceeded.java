package dumb.lambdamesh.semantic;

import dumb.lambdamesh.Term;

/**
 * Raised when a term does not reach normal form within the step budget, or grows past the size ceiling.
 */
public class ReductionLimitExceeded extends Exception {
    private final int steps;
    private final transient Term partial;

    public ReductionLimitExceeded(String message, int steps, Term partial) {
        super(message);
        this.steps = steps;
        this.partial = partial;
    }

    public int steps() {
        return steps;
    }

    /** The term as it stood when reduction gave up. */
    public Term partial() {
        return partial;
    }
}
