package dumb.lambdamesh;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import dumb.lambdamesh.semantic.DefinitionExpansion;
import dumb.lambdamesh.semantic.RecursionDetector;
import dumb.lambdamesh.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static dumb.lambdamesh.util.Log.message;
import static dumb.lambdamesh.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Append-only store of canonical morphisms, keyed by content hash. Entries are never removed; the only
 * mutation after insertion is {@link CanonicalMorphism#touch}.
 * <p>
 * Secondary indexes: syntactic-form hash, registry identifier, parsed definition, storage id, and the
 * set of identifiers known to recurse.
 */
public class MorphismRegistry {

    public static final String SEED_RESOURCE = "/seed-morphisms.json";
    public static final String SEED_CONTRIBUTOR = "seed";

    /** Identifiers treated as recursive even before their definitions are known. */
    public static final Set<String> RECURSIVE_BUILTINS = Set.of("FOLD", "MAP", "FILTER", "FLATMAP", "CONCAT");

    private final ConcurrentMap<String, CanonicalMorphism> byHash = new ConcurrentHashMap<>();
    private final List<CanonicalMorphism> ordered = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<String, String> bySyntax = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> byIdent = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Term> terms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> storageIds = new ConcurrentHashMap<>();
    private final Set<String> recursive = ConcurrentHashMap.newKeySet();

    public MorphismRegistry() {
        this(RECURSIVE_BUILTINS);
    }

    public MorphismRegistry(Collection<String> recursiveBuiltins) {
        recursive.addAll(recursiveBuiltins);
    }

    /** Hash of the canonical printing of a parsed term. */
    public static String syntaxHash(Term t) {
        return LambdaExpression.sha256(t.toLambda());
    }

    /**
     * The single insertion point. First writer wins: if the hash is already present the existing entry
     * is returned and nothing changes.
     */
    public synchronized Insertion insert(CanonicalMorphism m) {
        requireNonNull(m);
        var existing = byHash.get(m.hash);
        if (existing != null) return new Insertion(existing, false);

        byHash.put(m.hash, m);
        ordered.add(m);
        byIdent.putIfAbsent(m.identifier(), m.hash);
        try {
            var term = LambdaParser.parse(m.definition);
            terms.put(m.hash, term);
            bySyntax.putIfAbsent(syntaxHash(term), m.hash);
        } catch (LambdaParser.ParseException e) {
            warning("Morphism " + m.name + " has an unparseable definition; only exact hash lookups will find it: " + e.getMessage());
        }
        classifyRecursion();
        return new Insertion(m, true);
    }

    /** Grows the known-recursive set to a fixpoint over all parsed definitions. */
    private void classifyRecursion() {
        boolean changed;
        do {
            changed = false;
            for (var m : ordered) {
                var id = m.identifier();
                if (recursive.contains(id)) continue;
                var t = terms.get(m.hash);
                if (t == null) continue;
                if (RecursionDetector.nonTerminating(t, recursive) || DefinitionExpansion.selfReferential(id, this::definition)) {
                    recursive.add(id);
                    changed = true;
                }
            }
        } while (changed);
    }

    public Optional<CanonicalMorphism> get(String hash) {
        return Optional.ofNullable(byHash.get(hash));
    }

    public boolean contains(String hash) {
        return byHash.containsKey(hash);
    }

    public Optional<CanonicalMorphism> bySyntax(String syntaxHash) {
        return Optional.ofNullable(bySyntax.get(syntaxHash)).map(byHash::get);
    }

    public Optional<CanonicalMorphism> byIdentifier(String ident) {
        return Optional.ofNullable(byIdent.get(ident)).map(byHash::get);
    }

    /** Parsed definition of the morphism with this content hash. */
    public Optional<Term> term(String hash) {
        return Optional.ofNullable(terms.get(hash));
    }

    /** Parsed definition of the morphism named by a registry identifier. */
    public Optional<Term> definition(String ident) {
        return Optional.ofNullable(byIdent.get(ident)).map(terms::get);
    }

    public Set<String> knownRecursive() {
        return Set.copyOf(recursive);
    }

    public boolean isRecursive(String ident) {
        return recursive.contains(ident);
    }

    /** All morphisms in insertion order. */
    public List<CanonicalMorphism> list() {
        return List.copyOf(ordered);
    }

    public int size() {
        return byHash.size();
    }

    public void touch(String hash, double agreement) {
        get(hash).ifPresent(m -> m.touch(agreement));
    }

    public void storageId(String hash, String storageId) {
        storageIds.putIfAbsent(hash, storageId);
    }

    public Optional<String> storageId(String hash) {
        return Optional.ofNullable(storageIds.get(hash));
    }

    /** Loads the bundled seed morphisms; returns how many were new. */
    public int loadSeeds() {
        try (var in = MorphismRegistry.class.getResourceAsStream(SEED_RESOURCE)) {
            if (in == null) {
                warning("Seed resource " + SEED_RESOURCE + " not found");
                return 0;
            }
            List<Seed> seeds = Json.the.readValue(in, new TypeReference<>() {
            });
            var added = 0;
            for (var s : seeds) {
                var deps = List.<String>of();
                try {
                    deps = LambdaParser.parse(s.definition()).idents().stream().sorted().toList();
                } catch (LambdaParser.ParseException e) {
                    warning("Seed " + s.name() + " does not parse: " + e.getMessage());
                }
                var m = CanonicalMorphism.create(s.name(), s.definition(), s.proof(), s.purity(),
                        List.of(SEED_CONTRIBUTOR), deps, s.resonance());
                if (insert(m).created()) added++;
            }
            message("Loaded " + added + " seed morphisms");
            return added;
        } catch (IOException e) {
            warning("Could not load seed morphisms: " + e.getMessage());
            return 0;
        }
    }

    public record Insertion(CanonicalMorphism morphism, boolean created) {
    }

    record Seed(@JsonProperty("name") String name,
                @JsonProperty("definition") String definition,
                @JsonProperty("proof") @Nullable String proof,
                @JsonProperty("purity") double purity,
                @JsonProperty("resonance") double resonance) {
    }
}
