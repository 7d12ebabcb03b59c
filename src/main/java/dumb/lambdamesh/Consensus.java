package dumb.lambdamesh;

import dumb.lambdamesh.VerifyResponse.ConsensusInfo;
import dumb.lambdamesh.net.Message;
import dumb.lambdamesh.net.Transport;
import dumb.lambdamesh.semantic.HypothesisEngine;
import dumb.lambdamesh.semantic.PurityChecker;
import dumb.lambdamesh.semantic.SemanticEquivalence;
import dumb.lambdamesh.semantic.SemanticEquivalence.Match;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static dumb.lambdamesh.util.Log.debug;
import static dumb.lambdamesh.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Turns a local opinion plus peer votes into one outcome.
 * <pre>
 *   IDLE → REQUEST_BROADCAST → COLLECTING_VOTES → RESOLVED
 * </pre>
 * With no peers the local vote resolves alone. Otherwise votes are gathered per request id until every
 * peer has answered or the timeout elapses; votes arriving after resolution are dropped.
 */
public class Consensus {

    public static final double DEFAULT_THRESHOLD = 0.66;
    public static final long DEFAULT_TIMEOUT_MILLIS = 5000;

    static final double PROVEN_CONFIDENCE = 1.0;
    static final double LAW_CONFIDENCE = 0.95;
    private static final List<String> INTENT_KEYWORDS = List.of("map", "filter", "fold", "reduce");

    private final String nodeId;
    private final MorphismRegistry registry;
    private final SemanticEquivalence semantic;
    private final HypothesisEngine hypotheses;
    private final Transport transport;
    private final double threshold;
    private final long timeoutMillis;
    private final ConcurrentMap<String, Round> rounds = new ConcurrentHashMap<>();

    public Consensus(String nodeId, MorphismRegistry registry, SemanticEquivalence semantic, HypothesisEngine hypotheses,
                     Transport transport, double threshold, long timeoutMillis) {
        if (threshold < 0 || threshold > 1) throw new IllegalArgumentException("Consensus threshold out of range: " + threshold);
        if (timeoutMillis <= 0) throw new IllegalArgumentException("Consensus timeout must be positive: " + timeoutMillis);
        this.nodeId = requireNonNull(nodeId);
        this.registry = requireNonNull(registry);
        this.semantic = requireNonNull(semantic);
        this.hypotheses = requireNonNull(hypotheses);
        this.transport = requireNonNull(transport);
        this.threshold = threshold;
        this.timeoutMillis = timeoutMillis;
    }

    public double threshold() {
        return threshold;
    }

    /**
     * This node's vote, by priority: equivalence, then impurity, then hypothesis, then novel pure.
     * Text with a mutation or imperative marker is voted impure before any equivalence search, so
     * {@code λvar.var} never matches {@code λx.x}.
     */
    public Opinion opinion(String requestId, LambdaExpression expr, Term term, BooleanSupplier cancelled) {
        var purity = PurityChecker.check(expr.text());
        if (purity.marked()) return impure(requestId, purity);
        var match = semantic.findCanonical(expr, term, cancelled);
        if (match.isPresent()) {
            var m = match.get();
            var confidence = m.method() == SemanticEquivalence.Method.LAWS ? LAW_CONFIDENCE : PROVEN_CONFIDENCE;
            return new Opinion(Vote.equivalent(nodeId, requestId, confidence, m.canonical().hash,
                    "Equivalent to " + m.canonical().name, m.proof()), m, purity, null);
        }
        if (!purity.pure()) return impure(requestId, purity);
        var hypothesis = hypotheses.explore(term, cancelled);
        if (hypothesis.isPresent()) {
            var h = hypothesis.get();
            return new Opinion(Vote.pure(nodeId, requestId, purity.score(), "Hypothesis: " + h.reasoning()), null, purity, h);
        }
        return new Opinion(Vote.pure(nodeId, requestId, purity.score(), "Novel pure expression"), null, purity, null);
    }

    private Opinion impure(String requestId, PurityChecker.Result purity) {
        return new Opinion(Vote.impure(nodeId, requestId, 1 - purity.score(), String.join("; ", purity.violations())),
                null, purity, null);
    }

    /** Vote for text that does not parse. */
    public Vote unparseable(String requestId, String reason) {
        return Vote.impure(nodeId, requestId, 1.0, "Parse error: " + reason);
    }

    /**
     * Broadcasts the request (unless solo) and gathers votes until all peers answered or time ran out.
     *
     * @throws CancellationException if interrupted while waiting
     */
    public ConsensusResult collect(String requestId, LambdaExpression expr, Vote local) {
        var peers = transport.peerCount();
        if (peers == 0) return tally(List.of(local), true);

        var round = new Round(requestId, peers + 1);
        if (rounds.putIfAbsent(requestId, round) != null)
            throw new IllegalStateException("Duplicate request id " + requestId);
        try {
            round.add(local);
            round.state = State.REQUEST_BROADCAST;
            transport.broadcast(new Message.VerifyRequest(nodeId, System.currentTimeMillis(), requestId, expr));
            round.state = State.COLLECTING_VOTES;
            try {
                round.complete.get(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                debug(requestId + ": resolving with " + round.size() + "/" + round.expected + " votes after timeout");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while collecting votes for " + requestId);
            } catch (ExecutionException e) {
                throw new IllegalStateException(e);
            }
            return tally(round.resolve(), false);
        } finally {
            rounds.remove(requestId, round);
        }
    }

    /** Accepts a peer vote for an open round. Returns false when the vote came too late or is unknown. */
    public boolean offer(Vote vote) {
        var round = rounds.get(vote.requestId());
        if (round == null) {
            debug("Discarding vote from " + vote.nodeId() + " for closed request " + vote.requestId());
            return false;
        }
        return round.add(vote);
    }

    @Nullable
    public State state(String requestId) {
        var round = rounds.get(requestId);
        return round == null ? null : round.state;
    }

    /**
     * Sums confidences per kind; the majority is the largest sum, ties broken in {@link Vote.Kind}
     * declaration order.
     */
    public static ConsensusResult tally(List<Vote> votes, boolean solo) {
        var sums = new EnumMap<Vote.Kind, Double>(Vote.Kind.class);
        var total = 0.0;
        for (var v : votes) {
            sums.merge(v.kind(), v.confidence(), Double::sum);
            total += v.confidence();
        }
        var majority = Vote.Kind.PURE;
        var best = -1.0;
        for (var kind : Vote.Kind.values()) {
            var s = sums.getOrDefault(kind, 0.0);
            if (s > best) {
                best = s;
                majority = kind;
            }
        }
        var agreement = total > 0 ? best / total : 0;
        var chosen = majority;
        var outliers = solo ? List.<Vote>of() : votes.stream().filter(v -> v.kind() != chosen).toList();
        var participants = votes.stream().map(Vote::nodeId).distinct().toList();
        return new ConsensusResult(agreement, majority, votes, outliers, participants, System.currentTimeMillis());
    }

    /**
     * Maps a tallied result to an outcome. A Created outcome has already been inserted into the registry;
     * losing the insertion race turns it into Found.
     */
    public VerifyResponse resolve(String requestId, LambdaExpression expr, Term term, Opinion local,
                                  ConsensusResult result, BooleanSupplier cancelled) {
        var info = result.info();
        if (result.agreementScore() < threshold) {
            return VerifyResponse.rejected(requestId,
                    List.of("Consensus not reached", String.format(Locale.ROOT, "Agreement: %.1f%%", result.agreementScore() * 100)),
                    "Network disagreement (" + result.outliers().size() + " outliers)", info);
        }
        return switch (result.majority()) {
            case EQUIVALENT -> found(requestId, local, result, info);
            case IMPURE -> {
                var reasons = result.votes().stream()
                        .filter(v -> v.kind() == Vote.Kind.IMPURE && v.reasoning() != null && !v.reasoning().isEmpty())
                        .map(Vote::reasoning).distinct().toList();
                yield VerifyResponse.rejected(requestId, reasons.isEmpty() ? List.of("Impure expression") : reasons,
                        reasons.isEmpty() ? "Impure expression" : reasons.get(0), info);
            }
            case PURE -> pure(requestId, expr, term, local, result, info, cancelled);
        };
    }

    private VerifyResponse found(String requestId, Opinion local, ConsensusResult result, ConsensusInfo info) {
        var equivalent = result.votes().stream().filter(v -> v.kind() == Vote.Kind.EQUIVALENT).toList();
        for (var v : equivalent) {
            var canonical = registry.get(v.equivalentTo());
            if (canonical.isEmpty()) continue;
            var c = canonical.get();
            registry.touch(c.hash, result.agreementScore());
            var proof = v.proof();
            if (proof == null && local.match() != null && local.match().canonical().equals(c)) proof = local.match().proof();
            return VerifyResponse.found(requestId, c, proof, info);
        }
        var refs = equivalent.stream().map(Vote::equivalentTo).distinct().collect(Collectors.joining(", "));
        return VerifyResponse.rejected(requestId, List.of("Unknown canonical reference: " + refs), null, info);
    }

    private VerifyResponse pure(String requestId, LambdaExpression expr, Term term, Opinion local,
                                ConsensusResult result, ConsensusInfo info, BooleanSupplier cancelled) {
        var meanwhile = registry.get(expr.hash());
        if (meanwhile.isPresent()) return concurrent(requestId, expr, meanwhile.get(), result, info);

        var hypothesis = hypotheses.explore(term, cancelled);
        if (hypothesis.isPresent()) return VerifyResponse.hypothetical(requestId, hypothesis.get(), info);

        var contributors = result.votes().stream()
                .filter(v -> v.kind() == Vote.Kind.PURE).map(Vote::nodeId).distinct().toList();
        var dependencies = term.idents().stream().sorted().toList();
        var morphism = CanonicalMorphism.create(name(expr), expr.text(),
                String.format(Locale.ROOT, "Accepted by %d node(s), agreement %.2f", contributors.size(), result.agreementScore()),
                local.purity().score(), contributors, dependencies, result.agreementScore());

        if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted())
            throw new CancellationException("Cancelled before canonicalization of " + requestId);
        var insertion = registry.insert(morphism);
        if (!insertion.created()) return concurrent(requestId, expr, insertion.morphism(), result, info);
        message(nodeId + ": canonicalized " + morphism.name + " = " + morphism.definition);
        return VerifyResponse.created(requestId, morphism, info);
    }

    /** The same text was canonicalized while this request was in flight. */
    private VerifyResponse concurrent(String requestId, LambdaExpression expr, CanonicalMorphism existing,
                                      ConsensusResult result, ConsensusInfo info) {
        registry.touch(existing.hash, result.agreementScore());
        return VerifyResponse.found(requestId, existing, Proof.single(
                new Proof.Step(Proof.RULE_HASH, expr.normalized(), existing.definition, "inserted concurrently"),
                existing.definition, existing.hash, "Identical to " + existing.name), info);
    }

    /** First contributed name, else an intent keyword, else a hash-derived name. */
    static String name(LambdaExpression expr) {
        var md = expr.metadata();
        if (!md.names().isEmpty() && !md.names().get(0).isBlank()) return md.names().get(0).strip();
        var intent = md.intent() == null ? "" : md.intent().toLowerCase(Locale.ROOT);
        for (var k : INTENT_KEYWORDS) if (intent.contains(k)) return k;
        return "morphism_" + expr.hash().substring(0, 8);
    }

    public enum State {
        IDLE, REQUEST_BROADCAST, COLLECTING_VOTES, RESOLVED
    }

    /** Local vote with the evidence behind it. */
    public record Opinion(Vote vote, @Nullable Match match, PurityChecker.Result purity,
                          @Nullable Hypothesis hypothesis) {
        public Opinion {
            requireNonNull(vote);
            requireNonNull(purity);
        }
    }

    public record ConsensusResult(double agreementScore, Vote.Kind majority, List<Vote> votes, List<Vote> outliers,
                                  List<String> participants, long timestamp) {
        public ConsensusResult {
            votes = List.copyOf(votes);
            outliers = List.copyOf(outliers);
            participants = List.copyOf(participants);
        }

        public ConsensusInfo info() {
            return new ConsensusInfo(agreementScore, participants, timestamp,
                    outliers.stream().map(Vote::nodeId).toList());
        }
    }

    private static final class Round {
        final String requestId;
        final int expected;
        final List<Vote> votes = new ArrayList<>();
        final CompletableFuture<Void> complete = new CompletableFuture<>();
        volatile State state = State.IDLE;

        Round(String requestId, int expected) {
            this.requestId = requestId;
            this.expected = expected;
        }

        synchronized boolean add(Vote v) {
            if (state == State.RESOLVED) return false;
            if (votes.stream().anyMatch(x -> x.nodeId().equals(v.nodeId()))) return false;
            votes.add(v);
            if (votes.size() >= expected) complete.complete(null);
            return true;
        }

        synchronized int size() {
            return votes.size();
        }

        synchronized List<Vote> resolve() {
            state = State.RESOLVED;
            return List.copyOf(votes);
        }
    }
}
