package dumb.lambdamesh;

import dumb.lambdamesh.semantic.BetaReduction;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads lambda-calculus text into a {@link Term}.
 * <pre>
 *   expr  := binder name+ '.' expr | app
 *   app   := atom atom* [binder-expr]
 *   atom  := '(' expr ')' | name
 * </pre>
 * The binder is {@code λ}; {@code \lambda}, {@code \} and {@code =>} are read as their
 * {@link LambdaExpression#spelling canonical spelling}. A name bound by an enclosing binder is a
 * {@link Term.Var}; an unbound all-caps name is a registry {@link Term.Ident}.
 * <p>
 * Terms deeper than {@link #MAX_DEPTH} or heavier than {@link BetaReduction#MAX_TERM_WEIGHT} nodes
 * are rejected, since every term walk recurses.
 */
public class LambdaParser {
    public static final int MAX_DEPTH = 1000;
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;
    private int nesting = 0;
    private int nodes = 0;

    private LambdaParser(Reader reader) {
        this.reader = reader;
    }

    public static Term parse(String text) throws ParseException {
        if (text == null || text.isBlank()) throw new ParseException("Empty expression");
        try (var reader = new StringReader(LambdaExpression.spelling(text))) {
            var parser = new LambdaParser(reader);
            var term = parser.parseExpr(new HashSet<>());
            parser.skipWhitespace();
            var c = parser.peek();
            if (c == ')') throw parser.createParseException("Unbalanced parentheses: unexpected ')'");
            if (c != -1) throw parser.createParseException("Unexpected character", "'" + (char) c + "'");
            if (depth(term) > MAX_DEPTH) throw tooDeep();
            return term;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    /** Height of the term tree, measured without recursion. */
    static int depth(Term term) {
        var max = 0;
        var terms = new ArrayDeque<Term>();
        var depths = new ArrayDeque<Integer>();
        terms.push(term);
        depths.push(1);
        while (!terms.isEmpty()) {
            var t = terms.pop();
            int d = depths.pop();
            max = Math.max(max, d);
            if (t instanceof Term.Abs abs) {
                terms.push(abs.body);
                depths.push(d + 1);
            } else if (t instanceof Term.App app) {
                terms.push(app.fn);
                depths.push(d + 1);
                terms.push(app.arg);
                depths.push(d + 1);
            }
        }
        return max;
    }

    private static ParseException tooDeep() {
        return new ParseException("Expression too deep (more than " + MAX_DEPTH + " levels)");
    }

    private void grow(int n) throws ParseException {
        nodes += n;
        if (nodes > BetaReduction.MAX_TERM_WEIGHT)
            throw createParseException("Expression too large (more than " + BetaReduction.MAX_TERM_WEIGHT + " nodes)");
    }

    static boolean isBinder(int c) {
        return c == 'λ' || c == '\\';
    }

    static boolean isNameChar(int c) {
        return c != 'λ' && (Character.isLetterOrDigit(c) || c == '_' || c == '\'');
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) {
                contextBuffer.deleteCharAt(0);
            }
            if (currentChar != -1) {
                contextBuffer.append((char) currentChar);
            }
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void skipWhitespace() throws IOException {
        while (peek() != -1 && Character.isWhitespace(peek())) consumeChar();
    }

    private Term parseExpr(Set<String> bound) throws IOException, ParseException {
        if (++nesting > MAX_DEPTH) throw tooDeep();
        try {
            skipWhitespace();
            var c = peek();
            if (c == -1) throw createParseException("Unexpected end of input");
            return isBinder(c) ? parseAbs(bound) : parseApp(bound);
        } finally {
            nesting--;
        }
    }

    private Term parseAbs(Set<String> bound) throws IOException, ParseException {
        consumeChar();
        var params = new ArrayList<String>();
        while (true) {
            skipWhitespace();
            var c = peek();
            if (c == '.') break;
            if (c == -1) throw createParseException(params.isEmpty() ? "Expected parameter after binder" : "Expected '.' after binder parameters", "EOF");
            if (!isNameChar(c)) {
                throw createParseException(params.isEmpty() ? "Expected parameter after binder" : "Expected '.' after binder parameters", "'" + (char) c + "'");
            }
            params.add(parseName());
        }
        if (params.isEmpty()) throw createParseException("Expected parameter after binder");
        grow(params.size());
        consumeChar();
        skipWhitespace();
        var c = peek();
        if (c == -1 || c == ')') throw createParseException("Missing body after binder");

        var inner = new HashSet<>(bound);
        inner.addAll(params);
        var body = parseExpr(inner);
        return Term.abs(body, params.toArray(String[]::new));
    }

    private Term parseApp(Set<String> bound) throws IOException, ParseException {
        var t = parseAtom(bound);
        while (true) {
            skipWhitespace();
            var c = peek();
            if (c == -1 || c == ')') return t;
            grow(1);
            if (isBinder(c)) return new Term.App(t, parseAbs(bound));
            t = new Term.App(t, parseAtom(bound));
        }
    }

    private Term parseAtom(Set<String> bound) throws IOException, ParseException {
        skipWhitespace();
        var c = peek();
        if (c == '(') {
            consumeChar();
            var inner = parseExpr(bound);
            skipWhitespace();
            if (peek() != ')') {
                throw createParseException("Unbalanced parentheses: expected ')'", peek() == -1 ? "EOF" : "'" + (char) peek() + "'");
            }
            consumeChar();
            return inner;
        }
        if (c == ')') throw createParseException("Unbalanced parentheses: unexpected ')'");
        if (c == -1) throw createParseException("Unexpected end of input");
        if (!isNameChar(c)) throw createParseException("Unexpected character", "'" + (char) c + "'");

        var name = parseName();
        grow(1);
        if (bound.contains(name)) return Term.Var.of(name);
        return Term.isIdentName(name) ? Term.Ident.of(name) : Term.Var.of(name);
    }

    private String parseName() throws IOException {
        var sb = new StringBuilder();
        while (peek() != -1 && isNameChar(peek())) sb.append((char) consumeChar());
        return sb.toString();
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, -1, -1, "");
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public String reason() {
            return super.getMessage();
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var ctx = context.isEmpty() ? "" : " near '" + context + "'";
            return super.getMessage() + location + ctx;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }
    }
}
