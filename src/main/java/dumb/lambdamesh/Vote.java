package dumb.lambdamesh;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One node's opinion on one verification request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Vote(String nodeId, String requestId, Kind kind, double confidence,
                   @Nullable String equivalentTo, @Nullable String reasoning, @Nullable Proof proof) {

    public Vote {
        requireNonNull(nodeId);
        requireNonNull(requestId);
        requireNonNull(kind);
        if (!(confidence >= 0 && confidence <= 1))
            throw new IllegalArgumentException("Vote confidence must be within [0,1]: " + confidence);
        if (kind == Kind.EQUIVALENT && equivalentTo == null)
            throw new IllegalArgumentException("An equivalence vote must name its canonical hash");
    }

    public static Vote pure(String nodeId, String requestId, double confidence, String reasoning) {
        return new Vote(nodeId, requestId, Kind.PURE, confidence, null, reasoning, null);
    }

    public static Vote impure(String nodeId, String requestId, double confidence, String reasoning) {
        return new Vote(nodeId, requestId, Kind.IMPURE, confidence, null, reasoning, null);
    }

    public static Vote equivalent(String nodeId, String requestId, double confidence, String canonicalHash,
                                  String reasoning, @Nullable Proof proof) {
        return new Vote(nodeId, requestId, Kind.EQUIVALENT, confidence, canonicalHash, reasoning, proof);
    }

    /** Declaration order is the majority tie-break order. */
    public enum Kind {
        PURE, EQUIVALENT, IMPURE
    }
}
