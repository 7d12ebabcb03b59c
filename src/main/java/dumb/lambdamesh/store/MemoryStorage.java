package dumb.lambdamesh.store;

import dumb.lambdamesh.CanonicalMorphism;
import dumb.lambdamesh.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps JSON snapshots in memory; what is retrieved is a copy as of the time it was stored.
 */
public class MemoryStorage implements Storage {

    private final Map<String, String> documents = new ConcurrentHashMap<>();

    @Override
    public String store(CanonicalMorphism morphism) throws IOException {
        var json = Json.the.writeValueAsString(morphism);
        var id = Storage.contentId(morphism);
        documents.put(id, json);
        return id;
    }

    @Override
    @Nullable
    public CanonicalMorphism retrieve(String id) throws IOException {
        var json = documents.get(id);
        return json == null ? null : Json.obj(json, CanonicalMorphism.class);
    }

    @Override
    public List<String> listLocal() {
        return List.copyOf(documents.keySet());
    }

    public int size() {
        return documents.size();
    }
}
