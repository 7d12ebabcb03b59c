package dumb.lambdamesh.semantic;

import dumb.lambdamesh.CanonicalMorphism;
import dumb.lambdamesh.Hypothesis;
import dumb.lambdamesh.LambdaParser;
import dumb.lambdamesh.MorphismRegistry;
import dumb.lambdamesh.Term;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HypothesisEngineTest {

    private static final String THREE = "λf.λx.f (f (f x))";

    private MorphismRegistry registry;
    private HypothesisEngine engine;

    @BeforeEach
    void setUp() {
        registry = new MorphismRegistry();
        engine = new HypothesisEngine(registry, new SemanticEquivalence(registry, new DefinitionExpansion(), new BetaReduction()),
                HypothesisEngine.DEFAULT_THRESHOLD);
    }

    private void define(String name, String text) {
        registry.insert(CanonicalMorphism.create(name, text, null, 1, List.of("t"), List.of(), 1));
    }

    private static Term parse(String text) throws LambdaParser.ParseException {
        return LambdaParser.parse(text);
    }

    @Test
    void emptyRegistryHasNoHypothesis() throws Exception {
        assertTrue(engine.explore(parse(THREE), () -> false).isEmpty());
    }

    @Test
    void nearMatchAboveThreshold() throws Exception {
        define("two", "λf.λx.f (f x)");
        var h = engine.explore(parse(THREE), () -> false).orElseThrow();
        assertEquals("two", h.candidateName());
        assertEquals(0.75, h.confidence(), 1e-9);
        assertEquals(0.6, h.explorationValue(), 1e-9);
        assertEquals(4, h.steps().size());
        assertTrue(h.reasoning().startsWith("Similar to two"), h.reasoning());
    }

    @Test
    void thresholdIsStrict() throws Exception {
        define("two", "λf.λx.f (f x)");
        assertTrue(engine.explore(parse(THREE), 0.75, () -> false).isEmpty());
        assertTrue(engine.explore(parse(THREE), 0.74, () -> false).isPresent());
    }

    @Test
    void raisingThresholdNeverAddsHypotheses() throws Exception {
        define("two", "λf.λx.f (f x)");
        define("pair", "λa.λb.λs.s a b");
        var t = parse(THREE);
        var previous = true;
        for (var threshold = 0.0; threshold <= 1.0; threshold += 0.05) {
            var present = engine.explore(t, threshold, () -> false).isPresent();
            assertTrue(previous || !present, "hypothesis reappeared at " + threshold);
            previous = present;
        }
    }

    @Test
    void similarityOfIdenticalTermsIsOne() throws Exception {
        var t = parse("λa.λb.a (b a)");
        assertEquals(1.0, engine.similarity(t, t, () -> false), 1e-9);
        assertEquals(1.0, HypothesisEngine.syntactic(t, parse("λx.λy.x (y x)")), 1e-9);
    }

    @Test
    void normalFormsRaiseSimilarity() throws Exception {
        define("one", "λf.λx.f x");
        var redex = parse("(λn.n) (λf.λx.f x)");
        assertTrue(HypothesisEngine.syntactic(redex, registry.term(registry.list().get(0).hash).orElseThrow()) < 1);
        assertEquals(1.0, engine.similarity(redex, parse("λf.λx.f x"), () -> false), 1e-9);
    }

    @Test
    void identifiersBlendWithShape() throws Exception {
        var score = HypothesisEngine.syntactic(parse("FOLD f NIL"), parse("MAP f NIL"));
        var jaccard = 1.0 / 3;
        var shape = 2.0 * 4 / 10;
        assertEquals(0.6 * jaccard + 0.4 * shape, score, 1e-9);
    }

    @Test
    void recursiveCandidatesNameTheirBlockers() throws Exception {
        define("mapfold", "λf.λxs.FOLD f NIL (MAP f xs)");
        var h = engine.explore(parse("λg.λys.FOLD g NIL (MAP g (TAIL ys))"), () -> false).orElseThrow();
        assertEquals("mapfold", h.candidateName());
        assertTrue(h.requiredProof().contains("FOLD-MAP fusion theorem"), h.requiredProof().toString());
        assertEquals("Recursive definitions prevent reduction to a common normal form", h.gap());
        Hypothesis.ExplorationStep reduction = h.steps().get(1);
        assertEquals(List.of("recursive identifiers: FOLD, MAP"), reduction.blockers());
    }

    @Test
    void thresholdMustBeAProbability() {
        assertThrows(IllegalArgumentException.class,
                () -> new HypothesisEngine(registry, new SemanticEquivalence(registry, new DefinitionExpansion(), new BetaReduction()), 1.5));
    }
}
