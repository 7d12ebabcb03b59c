package dumb.lambdamesh;

import dumb.lambdamesh.VerifyResponse.Status;
import dumb.lambdamesh.net.Message;
import dumb.lambdamesh.net.ScriptedTransport;
import dumb.lambdamesh.net.Transport;
import dumb.lambdamesh.semantic.BetaReduction;
import dumb.lambdamesh.semantic.DefinitionExpansion;
import dumb.lambdamesh.semantic.HypothesisEngine;
import dumb.lambdamesh.semantic.SemanticEquivalence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsensusTest {

    private MorphismRegistry registry;
    private CanonicalMorphism identity;

    @BeforeEach
    void setUp() {
        registry = new MorphismRegistry();
        identity = registry.insert(CanonicalMorphism.create("identity", "λx.x", null, 1, List.of("seed"), List.of(), 1)).morphism();
    }

    private Consensus consensus(Transport transport, double threshold, long timeoutMillis) {
        var semantic = new SemanticEquivalence(registry, new DefinitionExpansion(), new BetaReduction());
        var c = new Consensus("me", registry, semantic, new HypothesisEngine(registry, semantic, HypothesisEngine.DEFAULT_THRESHOLD),
                transport, threshold, timeoutMillis);
        transport.onMessage(m -> c.offer(((Message.VerifyVote) m).vote()));
        return c;
    }

    private static VerifyResponse run(Consensus c, String text) throws LambdaParser.ParseException {
        var requestId = Mesh.id("req-");
        var expr = LambdaExpression.of(text);
        var term = LambdaParser.parse(text);
        var local = c.opinion(requestId, expr, term, () -> false);
        var result = c.collect(requestId, expr, local.vote());
        return c.resolve(requestId, expr, term, local, result, () -> false);
    }

    @Test
    void tallySumsConfidencePerKind() {
        var r = Consensus.tally(List.of(
                Vote.pure("a", "r", 1, "novel"),
                Vote.pure("b", "r", 1, "novel"),
                Vote.impure("c", "r", 1, "loop")), false);
        assertEquals(Vote.Kind.PURE, r.majority());
        assertEquals(2.0 / 3, r.agreementScore(), 1e-9);
        assertEquals(List.of("c"), r.info().outliers());
        assertEquals(List.of("a", "b", "c"), r.participants());
    }

    @Test
    void tallyBreaksTiesInKindOrder() {
        var pureFirst = Consensus.tally(List.of(
                Vote.equivalent("a", "r", 0.5, "h", "eq", null),
                Vote.pure("b", "r", 0.5, "novel")), false);
        assertEquals(Vote.Kind.PURE, pureFirst.majority());
        assertEquals(0.5, pureFirst.agreementScore(), 1e-9);

        var equivalentBeforeImpure = Consensus.tally(List.of(
                Vote.impure("a", "r", 0.4, "var"),
                Vote.equivalent("b", "r", 0.4, "h", "eq", null)), false);
        assertEquals(Vote.Kind.EQUIVALENT, equivalentBeforeImpure.majority());
    }

    @Test
    void tallyOfZeroConfidenceHasNoAgreement() {
        var r = Consensus.tally(List.of(Vote.impure("a", "r", 0, "?")), true);
        assertEquals(0, r.agreementScore());
        assertTrue(r.outliers().isEmpty());
    }

    @Test
    void votesAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> Vote.pure("a", "r", 1.5, "x"));
        assertThrows(IllegalArgumentException.class, () -> Vote.pure("a", "r", Double.NaN, "x"));
        assertThrows(IllegalArgumentException.class, () -> new Vote("a", "r", Vote.Kind.EQUIVALENT, 1, null, "x", null));
    }

    @Test
    void soloResolvesFromLocalVote() throws Exception {
        var c = consensus(Transport.NONE, Consensus.DEFAULT_THRESHOLD, 1000);
        var r = run(c, "λy.y");
        assertEquals(Status.FOUND, r.status());
        assertEquals(identity, r.canonical());
        assertEquals(List.of("me"), r.consensus().participatingNodes());
        assertTrue(r.consensus().outliers().isEmpty());
        assertEquals(1, identity.usageCount());
    }

    @Test
    void twoThirdsMeetsDefaultThreshold() throws Exception {
        var transport = new ScriptedTransport()
                .peer("b", (rid, e) -> Vote.equivalent("b", rid, 1, identity.hash, "same", null))
                .peer("c", (rid, e) -> Vote.impure("c", rid, 1, "Mutable variable (var)"));
        var r = run(consensus(transport, 0.66, 1000), "λy.y");
        assertEquals(Status.FOUND, r.status());
        assertEquals(2.0 / 3, r.consensus().agreementScore(), 1e-9);
        assertEquals(List.of("c"), r.consensus().outliers());
        assertTrue(transport.sent.get(0) instanceof Message.VerifyRequest);
    }

    @Test
    void twoThirdsFailsStricterThreshold() throws Exception {
        var transport = new ScriptedTransport()
                .peer("b", (rid, e) -> Vote.equivalent("b", rid, 1, identity.hash, "same", null))
                .peer("c", (rid, e) -> Vote.impure("c", rid, 1, "Mutable variable (var)"));
        var r = run(consensus(transport, 0.7, 1000), "λy.y");
        assertEquals(Status.REJECTED, r.status());
        assertEquals("Consensus not reached", r.errors().get(0));
        assertEquals("Agreement: 66.7%", r.errors().get(1));
        assertEquals("Network disagreement (1 outliers)", r.impurityReason());
    }

    @Test
    void unknownCanonicalReferenceIsRejected() throws Exception {
        var unknown = "0".repeat(64);
        var transport = new ScriptedTransport()
                .peer("b", (rid, e) -> Vote.equivalent("b", rid, 1, unknown, "seen it", null))
                .peer("c", (rid, e) -> Vote.equivalent("c", rid, 1, unknown, "seen it", null));
        var r = run(consensus(transport, 0.66, 1000), "λa.λb.b a");
        assertEquals(Status.REJECTED, r.status());
        assertEquals(List.of("Unknown canonical reference: " + unknown), r.errors());
        assertFalse(registry.contains(LambdaExpression.hash("λa.λb.b a")));
    }

    @Test
    void impureMajorityCarriesReasons() throws Exception {
        var transport = new ScriptedTransport()
                .peer("b", (rid, e) -> Vote.impure("b", rid, 1, "Loop (while/for)"));
        var r = run(consensus(transport, 0.66, 1000), "λx.while x");
        assertEquals(Status.REJECTED, r.status());
        assertEquals(List.of("Loop (while/for)"), r.errors());
        assertEquals("Loop (while/for)", r.impurityReason());
    }

    @Test
    void silentPeerResolvesAtTimeout() throws Exception {
        var transport = new ScriptedTransport().peer("mute", (rid, e) -> null);
        var c = consensus(transport, 0.66, 100);
        var r = run(c, "λa.λb.b a");
        assertEquals(Status.CREATED, r.status());
        assertEquals(List.of("me"), r.consensus().participatingNodes());
        assertEquals(List.of("me"), r.created().contributors);
    }

    @Test
    void lateVotesAreDiscarded() throws Exception {
        var c = consensus(new ScriptedTransport().peer("b", (rid, e) -> null), 0.66, 50);
        var r = run(c, "λa.a a");
        assertFalse(c.offer(Vote.pure("b", r.requestId(), 1, "late")));
        assertNull(c.state(r.requestId()));
    }

    @Test
    void opinionPrefersEquivalenceThenImpurity() throws Exception {
        var c = consensus(Transport.NONE, 0.66, 1000);

        var eq = c.opinion("r1", LambdaExpression.of("λz.z"), LambdaParser.parse("λz.z"), () -> false);
        assertEquals(Vote.Kind.EQUIVALENT, eq.vote().kind());
        assertEquals(identity.hash, eq.vote().equivalentTo());
        assertEquals(1.0, eq.vote().confidence());

        var impure = c.opinion("r2", LambdaExpression.of("λx.while x"), LambdaParser.parse("λx.while x"), () -> false);
        assertEquals(Vote.Kind.IMPURE, impure.vote().kind());
        assertEquals(0.2, impure.vote().confidence(), 1e-9);
        assertEquals("Loop (while/for)", impure.vote().reasoning());

        var novel = c.opinion("r3", LambdaExpression.of("λa.λb.b"), LambdaParser.parse("λa.λb.b"), () -> false);
        assertEquals(Vote.Kind.PURE, novel.vote().kind());
        assertEquals("Novel pure expression", novel.vote().reasoning());
    }

    @Test
    void markersOutrankEquivalence() throws Exception {
        var c = consensus(Transport.NONE, 0.66, 1000);
        var o = c.opinion("r1", LambdaExpression.of("λvar.var"), LambdaParser.parse("λvar.var"), () -> false);
        assertEquals(Vote.Kind.IMPURE, o.vote().kind());
        assertNull(o.vote().equivalentTo());
        assertEquals("Mutable variable (var)", o.vote().reasoning());
    }

    @Test
    void unparseableTextGetsConfidentImpureVote() {
        var v = consensus(Transport.NONE, 0.66, 1000).unparseable("r", "Unexpected character");
        assertEquals(Vote.Kind.IMPURE, v.kind());
        assertEquals(1.0, v.confidence());
        assertEquals("Parse error: Unexpected character", v.reasoning());
    }

    @Test
    void namesFollowMetadata() {
        assertEquals("twice", Consensus.name(LambdaExpression.of("λf.λx.f (f x)", LambdaExpression.Metadata.named("twice"))));
        assertEquals("filter", Consensus.name(LambdaExpression.of("λp.p", LambdaExpression.Metadata.intent("Filter odd numbers"))));
        var e = LambdaExpression.of("λq.q");
        assertEquals("morphism_" + e.hash().substring(0, 8), Consensus.name(e));
    }
}
