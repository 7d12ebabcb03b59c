package dumb.lambdamesh.net;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.lambdamesh.CanonicalMorphism;
import dumb.lambdamesh.LambdaExpression;
import dumb.lambdamesh.Vote;
import dumb.lambdamesh.util.Json;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Peer-to-peer wire messages, encoded as single-line JSON objects tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Message.VerifyRequest.class, name = "VERIFY_REQUEST"),
        @JsonSubTypes.Type(value = Message.VerifyVote.class, name = "VERIFY_VOTE"),
        @JsonSubTypes.Type(value = Message.Identity.class, name = "IDENTITY"),
        @JsonSubTypes.Type(value = Message.Ping.class, name = "PING"),
        @JsonSubTypes.Type(value = Message.Pong.class, name = "PONG"),
        @JsonSubTypes.Type(value = Message.MorphismAnnounce.class, name = "MORPHISM_ANNOUNCE"),
        @JsonSubTypes.Type(value = Message.MorphismSyncRequest.class, name = "MORPHISM_SYNC_REQUEST"),
        @JsonSubTypes.Type(value = Message.MorphismSyncResponse.class, name = "MORPHISM_SYNC_RESPONSE")
})
sealed public interface Message permits Message.VerifyRequest, Message.VerifyVote, Message.Identity, Message.Ping,
        Message.Pong, Message.MorphismAnnounce, Message.MorphismSyncRequest, Message.MorphismSyncResponse {

    String senderId();

    long timestamp();

    @JsonIgnore
    Type type();

    static String encode(Message m) throws JsonProcessingException {
        return Json.the.writeValueAsString(m);
    }

    static Message decode(String json) throws JsonProcessingException {
        return Json.the.readValue(json, Message.class);
    }

    enum Type {
        VERIFY_REQUEST, VERIFY_VOTE, IDENTITY, PING, PONG, MORPHISM_ANNOUNCE, MORPHISM_SYNC_REQUEST, MORPHISM_SYNC_RESPONSE
    }

    record VerifyRequest(String senderId, long timestamp, String requestId, LambdaExpression expr) implements Message {
        public VerifyRequest {
            requireNonNull(senderId);
            requireNonNull(requestId);
            requireNonNull(expr);
        }

        @Override
        public Type type() {
            return Type.VERIFY_REQUEST;
        }
    }

    record VerifyVote(String senderId, long timestamp, String requestId, Vote vote) implements Message {
        public VerifyVote {
            requireNonNull(senderId);
            requireNonNull(requestId);
            requireNonNull(vote);
        }

        @Override
        public Type type() {
            return Type.VERIFY_VOTE;
        }
    }

    /** First message on a new connection; tells the other side who is speaking. */
    record Identity(String senderId, long timestamp, int port) implements Message {
        @Override
        public Type type() {
            return Type.IDENTITY;
        }
    }

    record Ping(String senderId, long timestamp) implements Message {
        @Override
        public Type type() {
            return Type.PING;
        }
    }

    record Pong(String senderId, long timestamp) implements Message {
        @Override
        public Type type() {
            return Type.PONG;
        }
    }

    record MorphismAnnounce(String senderId, long timestamp, String hash, String name,
                            @Nullable String storageId) implements Message {
        @Override
        public Type type() {
            return Type.MORPHISM_ANNOUNCE;
        }
    }

    record MorphismSyncRequest(String senderId, long timestamp, String hash,
                               @Nullable String storageId) implements Message {
        @Override
        public Type type() {
            return Type.MORPHISM_SYNC_REQUEST;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record MorphismSyncResponse(String senderId, long timestamp, String hash, @Nullable String storageId,
                                @Nullable CanonicalMorphism morphism) implements Message {
        @Override
        public Type type() {
            return Type.MORPHISM_SYNC_RESPONSE;
        }
    }
}
