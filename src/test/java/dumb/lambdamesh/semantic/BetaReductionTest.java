package dumb.lambdamesh.semantic;

import dumb.lambdamesh.LambdaParser;
import dumb.lambdamesh.Proof;
import dumb.lambdamesh.Term;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BetaReductionTest {

    private final BetaReduction reduction = new BetaReduction();

    private static Term parse(String text) throws LambdaParser.ParseException {
        return LambdaParser.parse(text);
    }

    @Test
    void reducesSingleRedex() throws Exception {
        var r = reduction.normalize(parse("(λx.x) y"));
        assertEquals(Term.Var.of("y"), r.normalForm());
        assertEquals(1, r.steps().size());
        assertEquals(Proof.RULE_BETA, r.steps().get(0).rule());
    }

    @Test
    void normalFormIsLeftUntouched() throws Exception {
        var t = parse("λf.λx.f (f x)");
        var r = reduction.normalize(t);
        assertEquals(t, r.normalForm());
        assertTrue(r.steps().isEmpty());
    }

    @Test
    void successorOfOneIsTwo() throws Exception {
        var r = reduction.normalize(parse("(λn.λf.λx.f (n f x)) (λf.λx.f x)"));
        assertTrue(StructuralEquivalence.alphaEquivalent(parse("λf.λx.f (f x)"), r.normalForm()), r.normalForm().toLambda());
    }

    @Test
    void substitutionAvoidsCapture() throws Exception {
        var r = reduction.normalize(parse("(λx.λy.x) y"));
        var abs = assertInstanceOf(Term.Abs.class, r.normalForm());
        assertNotEquals("y", abs.param);
        assertEquals(Term.Var.of("y"), abs.body);
    }

    @Test
    void substituteRenamesOnlyWhenNeeded() throws Exception {
        assertEquals(parse("λz.a"), BetaReduction.substitute(parse("λz.x"), "x", Term.Var.of("a")));
        assertEquals(parse("λx.x"), BetaReduction.substitute(parse("λx.x"), "x", Term.Var.of("a")));
        assertEquals("v1", BetaReduction.fresh("v", Set.of("v")));
        assertEquals("y2", BetaReduction.fresh("y1", Set.of("y1", "y")));
    }

    @Test
    void normalOrderSkipsDivergentArgument() throws Exception {
        var r = reduction.normalize(parse("(λa.λb.b) ((λx.x x) (λx.x x))"));
        assertEquals(parse("λb.b"), r.normalForm());
    }

    @Test
    void omegaExceedsStepLimit() {
        var limited = new BetaReduction(50);
        var e = assertThrows(ReductionLimitExceeded.class, () -> limited.normalize(parse("(λx.x x) (λx.x x)")));
        assertTrue(e.steps() > 50);
        assertInstanceOf(Term.App.class, e.partial());
    }

    @Test
    void growingTermIsAbandoned() {
        assertThrows(ReductionLimitExceeded.class, () -> reduction.normalize(parse("(λx.x x x) (λx.x x x)")));
    }

    @Test
    void cancellationStopsReduction() {
        assertThrows(CancellationException.class, () -> reduction.normalize(parse("(λx.x) y"), () -> true));
    }

    @Test
    void runsAreCounted() throws Exception {
        var r = new BetaReduction(10);
        r.normalize(parse("λx.x"));
        r.normalize(parse("(λx.x) y"));
        assertEquals(2, r.runs());
        assertEquals(10, r.stepLimit());
        assertThrows(IllegalArgumentException.class, () -> new BetaReduction(0));
    }
}
