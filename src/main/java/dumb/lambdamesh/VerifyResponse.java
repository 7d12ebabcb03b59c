package dumb.lambdamesh;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Final outcome of one verification, shaped like an HTTP status with a body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerifyResponse(String requestId,
                             Status status,
                             @Nullable String location,
                             @Nullable CanonicalMorphism canonical,
                             @Nullable Proof proof,
                             @Nullable CanonicalMorphism created,
                             @Nullable Hypothesis hypothesis,
                             List<String> errors,
                             @Nullable String impurityReason,
                             ConsensusInfo consensus) {

    public VerifyResponse {
        requireNonNull(requestId);
        requireNonNull(status);
        errors = errors == null ? List.of() : List.copyOf(errors);
        requireNonNull(consensus);
    }

    public static VerifyResponse found(String requestId, CanonicalMorphism canonical, @Nullable Proof proof, ConsensusInfo consensus) {
        return new VerifyResponse(requestId, Status.FOUND, canonical.hash, canonical, proof, null, null, List.of(), null, consensus);
    }

    public static VerifyResponse created(String requestId, CanonicalMorphism created, ConsensusInfo consensus) {
        return new VerifyResponse(requestId, Status.CREATED, created.hash, null, null, created, null, List.of(), null, consensus);
    }

    public static VerifyResponse hypothetical(String requestId, Hypothesis hypothesis, ConsensusInfo consensus) {
        return new VerifyResponse(requestId, Status.HYPOTHETICAL, null, null, null, null, hypothesis, List.of(), null, consensus);
    }

    public static VerifyResponse rejected(String requestId, List<String> errors, @Nullable String impurityReason, ConsensusInfo consensus) {
        return new VerifyResponse(requestId, Status.REJECTED, null, null, null, null, null, errors, impurityReason, consensus);
    }

    @JsonProperty("code")
    public int code() {
        return status.code;
    }

    /** The canonical morphism this outcome points at, whether found or just created. */
    @JsonIgnore
    @Nullable
    public CanonicalMorphism morphism() {
        return canonical != null ? canonical : created;
    }

    public enum Status {
        FOUND(302), CREATED(201), HYPOTHETICAL(202), REJECTED(422);

        public final int code;

        Status(int code) {
            this.code = code;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ConsensusInfo(double agreementScore, List<String> participatingNodes, long timestamp, List<String> outliers) {
        public ConsensusInfo {
            participatingNodes = List.copyOf(participatingNodes);
            outliers = List.copyOf(outliers);
        }

        public static ConsensusInfo solo(String nodeId) {
            return new ConsensusInfo(1.0, List.of(nodeId), System.currentTimeMillis(), List.of());
        }
    }
}
