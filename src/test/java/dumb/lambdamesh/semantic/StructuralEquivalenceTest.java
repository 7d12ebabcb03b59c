package dumb.lambdamesh.semantic;

import dumb.lambdamesh.LambdaParser;
import dumb.lambdamesh.Term;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StructuralEquivalenceTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "λx.x              | λy.y              | true",
            "λx.λy.x           | λa.λb.a           | true",
            "λx.λy.x           | λa.λb.b           | false",
            "λx.x y            | λz.z y            | true",
            "λx.x y            | λz.z w            | false",
            "FOLD f            | FOLD f            | true",
            "FOLD f            | MAP f             | false",
            "λx.λx.x           | λa.λb.b           | true",
            "λf.λx.f (f x)     | λf.λx.f x         | false"
    })
    void alphaEquivalence(String a, String b, boolean expected) throws LambdaParser.ParseException {
        assertEquals(expected, StructuralEquivalence.alphaEquivalent(LambdaParser.parse(a), LambdaParser.parse(b)));
        assertEquals(expected, StructuralEquivalence.alphaEquivalent(LambdaParser.parse(b), LambdaParser.parse(a)));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "λx.x              | λy.y",
            "λf.λx.f (f x)     | λs.λz.s (s z)",
            "λx.FOLD x NIL     | λq.FOLD q NIL"
    })
    void commonNodesCountWholeTermWhenEquivalent(String a, String b) throws LambdaParser.ParseException {
        Term ta = LambdaParser.parse(a);
        assertEquals(ta.weight(), StructuralEquivalence.commonNodes(ta, LambdaParser.parse(b)));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "λf.λx.f (f x)     | λf.λx.f x     | 4",
            "λx.x              | λx.λy.x       | 1",
            "a b               | c d           | 1"
    })
    void commonNodesCountsAlignedPrefix(String a, String b, int expected) throws LambdaParser.ParseException {
        assertEquals(expected, StructuralEquivalence.commonNodes(LambdaParser.parse(a), LambdaParser.parse(b)));
    }
}
