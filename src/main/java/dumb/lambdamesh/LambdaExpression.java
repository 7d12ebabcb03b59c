package dumb.lambdamesh;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A submitted expression: raw text plus the content hash of its normalized form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LambdaExpression(String text, String hash, Metadata metadata) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SPACE_AFTER_OPEN = Pattern.compile("\\( ");
    private static final Pattern SPACE_BEFORE_CLOSE = Pattern.compile(" \\)");
    private static final Pattern SPACE_AROUND_DOT = Pattern.compile(" ?\\. ?");
    private static final Pattern SPACE_AFTER_LAMBDA = Pattern.compile("λ ");

    public LambdaExpression {
        requireNonNull(text);
        requireNonNull(hash);
        metadata = metadata == null ? Metadata.EMPTY : metadata;
    }

    public static LambdaExpression of(String text, @Nullable Metadata metadata) {
        return new LambdaExpression(text, hash(text), metadata);
    }

    public static LambdaExpression of(String text) {
        return of(text, null);
    }

    public String normalized() {
        return normalize(text);
    }

    /**
     * Binder spellings become {@code λ}, {@code =>} becomes {@code .}, whitespace collapses and
     * spacing around grouping and binder punctuation is dropped.
     */
    public static String normalize(String text) {
        var s = WHITESPACE.matcher(spelling(text).strip()).replaceAll(" ");
        s = SPACE_AFTER_OPEN.matcher(s).replaceAll("(");
        s = SPACE_BEFORE_CLOSE.matcher(s).replaceAll(")");
        s = SPACE_AROUND_DOT.matcher(s).replaceAll(".");
        s = SPACE_AFTER_LAMBDA.matcher(s).replaceAll("λ");
        return s;
    }

    /** Rewrites the alternative binder spellings {@code \lambda}, {@code \} and {@code =>} to {@code λ} and {@code .}. */
    public static String spelling(String text) {
        return text.replace("\\lambda", "λ").replace('\\', 'λ').replace("=>", ".");
    }

    /** Lowercase hex SHA-256 of the normalized text. */
    public static String hash(String text) {
        return sha256(normalize(text));
    }

    public static String sha256(String s) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Metadata(@Nullable String intent, List<String> names, @Nullable String source, long timestamp) {
        public static final Metadata EMPTY = new Metadata(null, List.of(), null, 0);

        @JsonCreator
        public Metadata(@JsonProperty("intent") @Nullable String intent,
                        @JsonProperty("names") @Nullable List<String> names,
                        @JsonProperty("source") @Nullable String source,
                        @JsonProperty("timestamp") long timestamp) {
            this.intent = intent;
            this.names = names == null ? List.of() : List.copyOf(names);
            this.source = source;
            this.timestamp = timestamp;
        }

        public static Metadata named(String... names) {
            return new Metadata(null, List.of(names), null, System.currentTimeMillis());
        }

        public static Metadata intent(String intent) {
            return new Metadata(intent, List.of(), null, System.currentTimeMillis());
        }

        public Metadata withSource(String source) {
            return new Metadata(intent, names, source, timestamp == 0 ? System.currentTimeMillis() : timestamp);
        }
    }
}
