package dumb.lambdamesh.store;

import dumb.lambdamesh.CanonicalMorphism;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileStorageTest {

    private static CanonicalMorphism morphism(String name, String text) {
        return CanonicalMorphism.create(name, text, "by test", 1, List.of("t"), List.of(), 1);
    }

    @Test
    void storesAndRetrievesByContentId(@TempDir Path dir) throws Exception {
        var storage = new FileStorage(dir.resolve("nested/morphisms"));
        var m = morphism("twice", "λf.λx.f (f x)");
        var id = storage.store(m);
        assertTrue(id.matches("[0-9a-f]{64}"));
        assertTrue(Files.exists(storage.dir().resolve(id + ".json")));

        var back = storage.retrieve(id);
        assertEquals(m, back);
        assertEquals("by test", back.proof);
        assertEquals(id, storage.store(m));
    }

    @Test
    void countersDoNotChangeTheId(@TempDir Path dir) throws Exception {
        var storage = new FileStorage(dir);
        var memory = new MemoryStorage();
        var m = morphism("twice", "λf.λx.f (f x)");
        var id = storage.store(m);
        assertEquals(id, memory.store(m));

        m.touch(1.0);
        assertEquals(id, storage.store(m));
        assertEquals(id, memory.store(m));
        assertEquals(List.of(id), storage.listLocal());
        assertEquals(1, memory.size());
        assertEquals(1, storage.retrieve(id).usageCount());
        assertEquals(1, memory.retrieve(id).usageCount());
    }

    @Test
    void listsOnlyMorphismFiles(@TempDir Path dir) throws Exception {
        var storage = new FileStorage(dir);
        var a = storage.store(morphism("a", "λa.a"));
        var b = storage.store(morphism("b", "λb.λc.b"));
        Files.writeString(dir.resolve("notes.txt"), "ignored");
        Files.writeString(dir.resolve("short.json"), "{}");
        var listed = storage.listLocal();
        assertEquals(2, listed.size());
        assertTrue(listed.containsAll(List.of(a, b)));
        assertEquals(listed.stream().sorted().toList(), listed);
    }

    @Test
    void missingAndMalformedIds(@TempDir Path dir) throws Exception {
        var storage = new FileStorage(dir);
        assertNull(storage.retrieve("0".repeat(64)));
        assertThrows(IllegalArgumentException.class, () -> storage.retrieve("../etc/passwd"));
    }

    @Test
    void memoryStorageBehavesAlike() throws Exception {
        var storage = new MemoryStorage();
        var m = morphism("k", "λa.λb.a");
        var id = storage.store(m);
        assertEquals(id, storage.store(m));
        assertEquals(1, storage.size());
        assertEquals(m, storage.retrieve(id));
        assertNull(storage.retrieve("nope"));
        assertEquals(List.of(id), storage.listLocal());
    }
}
