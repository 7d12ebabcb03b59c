package dumb.lambdamesh;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.lambdamesh.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * An accepted, canonical expression. Identity fields never change after creation; only the usage
 * counters and resonance move.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CanonicalMorphism {
    public final String name;
    public final String signature;
    public final String definition;
    @Nullable
    public final String proof;
    public final double purity;
    public final String hash;
    public final long birthDate;
    public final List<String> contributors;
    public final List<String> dependencies;

    private volatile long usageCount;
    private volatile long lastUsed;
    private volatile double resonance;

    @JsonCreator
    public CanonicalMorphism(@JsonProperty("name") String name,
                             @JsonProperty("signature") String signature,
                             @JsonProperty("definition") String definition,
                             @JsonProperty("proof") @Nullable String proof,
                             @JsonProperty("purity") double purity,
                             @JsonProperty("hash") String hash,
                             @JsonProperty("birthDate") long birthDate,
                             @JsonProperty("contributors") @Nullable List<String> contributors,
                             @JsonProperty("dependencies") @Nullable List<String> dependencies,
                             @JsonProperty("usageCount") long usageCount,
                             @JsonProperty("lastUsed") long lastUsed,
                             @JsonProperty("resonance") double resonance) {
        this.name = requireNonNull(name);
        this.signature = requireNonNull(signature);
        this.definition = requireNonNull(definition);
        this.proof = proof;
        this.purity = purity;
        this.hash = requireNonNull(hash);
        this.birthDate = birthDate;
        this.contributors = contributors == null ? List.of() : List.copyOf(contributors);
        this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        this.usageCount = usageCount;
        this.lastUsed = lastUsed;
        this.resonance = resonance;
    }

    /** A fresh morphism for {@code text}; signature and definition are its normalized form. */
    public static CanonicalMorphism create(String name, String text, @Nullable String proof, double purity,
                                           List<String> contributors, List<String> dependencies, double resonance) {
        var normalized = LambdaExpression.normalize(text);
        var now = System.currentTimeMillis();
        return new CanonicalMorphism(name, normalized, normalized, proof, purity, LambdaExpression.hash(text), now,
                contributors, dependencies, 0, now, resonance);
    }

    /** Registry identifier form of a morphism name: {@code flat_map} becomes {@code FLAT_MAP}. */
    public static String identifier(String name) {
        var id = name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_]", "_");
        return id.isEmpty() || !Character.isLetter(id.charAt(0)) ? "M_" + id : id;
    }

    @JsonIgnore
    public String identifier() {
        return identifier(name);
    }

    /** True when the hash still matches the definition. */
    @JsonIgnore
    public boolean intact() {
        return hash.equals(LambdaExpression.hash(definition));
    }

    /** Records one more use and folds {@code agreement} into the running resonance average. */
    public synchronized void touch(double agreement) {
        var n = usageCount + 1;
        resonance = resonance + (agreement - resonance) / (n + 1);
        usageCount = n;
        lastUsed = System.currentTimeMillis();
    }

    @JsonProperty("usageCount")
    public long usageCount() {
        return usageCount;
    }

    @JsonProperty("lastUsed")
    public long lastUsed() {
        return lastUsed;
    }

    @JsonProperty("resonance")
    public double resonance() {
        return resonance;
    }

    public JsonNode toJson() {
        return Json.node(this);
    }

    @Override
    public String toString() {
        return name + " = " + definition;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CanonicalMorphism m && hash.equals(m.hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }
}
