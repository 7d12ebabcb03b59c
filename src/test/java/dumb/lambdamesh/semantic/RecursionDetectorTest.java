package dumb.lambdamesh.semantic;

import dumb.lambdamesh.LambdaParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecursionDetectorTest {

    private static final Set<String> KNOWN = Set.of("FOLD", "MAP");

    @ParameterizedTest
    @ValueSource(strings = {
            "(λx.x x) (λx.x x)",
            "λg.(λx.g (x x)) (λx.g (x x))",
            "λf.λxs.FOLD f NIL xs",
            "MAP (λx.x)"
    })
    void flagsRiskyTerms(String text) throws LambdaParser.ParseException {
        assertTrue(RecursionDetector.nonTerminating(LambdaParser.parse(text), KNOWN));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "λx.x",
            "λx.x x",
            "λf.λx.f (f x)",
            "ADD ONE TWO",
            "(λx.x) (λy.y)"
    })
    void leavesOrdinaryTermsAlone(String text) throws LambdaParser.ParseException {
        assertFalse(RecursionDetector.nonTerminating(LambdaParser.parse(text), KNOWN));
    }

    @Test
    void textualFallbackForUnparseableInput() {
        assertTrue(RecursionDetector.nonTerminating("λx.(x x) +", Set.of()));
        assertTrue(RecursionDetector.nonTerminating("FOLD $ f", KNOWN));
        assertFalse(RecursionDetector.nonTerminating("FOLDER $ f", KNOWN));
        assertFalse(RecursionDetector.nonTerminating("λx.x $", KNOWN));
    }

    @Test
    void parsedTextUsesTheTermCheck() {
        assertTrue(RecursionDetector.nonTerminating("(λx.x x) (λx.x x)", Set.of()));
        assertFalse(RecursionDetector.nonTerminating("λx.x x", Set.of()));
    }
}
