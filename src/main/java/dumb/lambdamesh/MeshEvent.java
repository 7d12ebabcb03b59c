package dumb.lambdamesh;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import static java.util.Objects.requireNonNull;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "eventType")
@JsonSubTypes({
        @Type(value = MeshEvent.Started.class, name = "Started"),
        @Type(value = MeshEvent.Stopped.class, name = "Stopped"),
        @Type(value = MeshEvent.MorphismCreated.class, name = "MorphismCreated"),
        @Type(value = MeshEvent.MorphismSynced.class, name = "MorphismSynced"),
        @Type(value = MeshEvent.Verified.class, name = "Verified")
})
public interface MeshEvent {

    String nodeId();

    record Started(String nodeId, int morphisms) implements MeshEvent {
    }

    record Stopped(String nodeId) implements MeshEvent {
    }

    record MorphismCreated(String nodeId, CanonicalMorphism morphism) implements MeshEvent {
        public MorphismCreated {
            requireNonNull(morphism);
        }
    }

    /** A morphism arrived from a peer or from storage rather than from a local verification. */
    record MorphismSynced(String nodeId, CanonicalMorphism morphism, String from) implements MeshEvent {
        public MorphismSynced {
            requireNonNull(morphism);
        }
    }

    record Verified(String nodeId, VerifyResponse response) implements MeshEvent {
        public Verified {
            requireNonNull(response);
        }
    }
}
