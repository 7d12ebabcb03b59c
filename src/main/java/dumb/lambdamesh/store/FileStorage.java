package dumb.lambdamesh.store;

import dumb.lambdamesh.CanonicalMorphism;
import dumb.lambdamesh.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static dumb.lambdamesh.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * One pretty-printed JSON file per morphism, named by its {@link Storage#contentId content id}. A repeated
 * store rewrites the file with the current counters.
 */
public class FileStorage implements Storage {

    private static final String SUFFIX = ".json";
    private static final Pattern ID = Pattern.compile("[0-9a-f]{64}");

    private final Path dir;

    public FileStorage(Path dir) throws IOException {
        this.dir = requireNonNull(dir);
        Files.createDirectories(dir);
        message("Morphism storage at " + dir.toAbsolutePath());
    }

    public Path dir() {
        return dir;
    }

    @Override
    public String store(CanonicalMorphism morphism) throws IOException {
        var json = Json.pretty.writeValueAsString(morphism);
        var id = Storage.contentId(morphism);
        var target = file(id);
        var tmp = Files.createTempFile(dir, "morphism-", ".tmp");
        try {
            Files.writeString(tmp, json);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
        return id;
    }

    @Override
    @Nullable
    public CanonicalMorphism retrieve(String id) throws IOException {
        if (!ID.matcher(id).matches()) throw new IllegalArgumentException("Not a storage id: " + id);
        var path = file(id);
        if (!Files.isReadable(path)) return null;
        return Json.obj(Files.readString(path), CanonicalMorphism.class);
    }

    @Override
    public List<String> listLocal() throws IOException {
        try (var files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(SUFFIX))
                    .map(n -> n.substring(0, n.length() - SUFFIX.length()))
                    .filter(n -> ID.matcher(n).matches())
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private Path file(String id) {
        return dir.resolve(id + SUFFIX);
    }
}
