package dumb.lambdamesh.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.lambdamesh.CanonicalMorphism;
import dumb.lambdamesh.LambdaExpression;
import dumb.lambdamesh.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Content-addressed persistence for canonical morphisms. Ids are derived from the immutable part of
 * the stored content; storing the same morphism again refreshes its counters under the same id.
 */
public interface Storage {

    /** Fields that change after creation and so take no part in the id. */
    List<String> COUNTERS = List.of("usageCount", "lastUsed", "resonance");

    /** SHA-256 of the morphism's JSON without its counters. */
    static String contentId(CanonicalMorphism morphism) throws JsonProcessingException {
        ObjectNode node = Json.the.valueToTree(morphism);
        node.remove(COUNTERS);
        return LambdaExpression.sha256(Json.the.writeValueAsString(node));
    }

    /** @return the id under which the morphism can be retrieved */
    String store(CanonicalMorphism morphism) throws IOException;

    @Nullable
    CanonicalMorphism retrieve(String id) throws IOException;

    /** Ids of everything held locally. */
    List<String> listLocal() throws IOException;
}
