package com.example.acl.request.parser;

import com.example.acl.request.model.NQuad;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses RDF-style mutation text, one triple per statement:
 * <pre>
 * _:alice &lt;name&gt; "Alice" .
 * &lt;0x1&gt; &lt;friend&gt; _:bob .
 * &lt;0x1&gt; &lt;age&gt; * .
 * &lt;0x1&gt; * * .
 * </pre>
 * Typed literals ({@code "5"^^<xs:int>}) and language tags are accepted and the annotation dropped.
 * Lines starting with {@code #} are comments.
 */
public final class NQuadParser {

    private final String text;
    private int pos;
    private int line = 1;

    private NQuadParser(String text) {
        this.text = text;
    }

    /**
     * @throws IllegalArgumentException on malformed input, naming the line
     */
    @NonNull
    public static List<NQuad> parse(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return new NQuadParser(text).parseAll();
    }

    private List<NQuad> parseAll() {
        List<NQuad> quads = new ArrayList<>();
        skipSpaceAndComments();
        while (pos < text.length()) {
            quads.add(parseStatement());
            skipSpaceAndComments();
        }
        return quads;
    }

    private NQuad parseStatement() {
        String subject = parseSubject();
        skipSpace();
        String predicate = parsePredicate();
        skipSpace();

        NQuad quad;
        char c = peek();
        if (c == '"') {
            quad = NQuad.literal(subject, predicate, parseLiteral());
        } else if (c == '*') {
            pos++;
            quad = NQuad.wildcard(subject, predicate);
        } else if (c == '<') {
            quad = NQuad.node(subject, predicate, parseIri());
        } else if (c == '_') {
            quad = NQuad.node(subject, predicate, parseBlankNode());
        } else {
            throw error("expected object");
        }

        skipSpace();
        expect('.');
        if (quad.isWildcardPredicate() && quad.kind() != NQuad.ObjectKind.WILDCARD) {
            throw error("a wildcard predicate requires a wildcard object");
        }
        return quad;
    }

    private String parseSubject() {
        char c = peek();
        if (c == '<') {
            return parseIri();
        }
        if (c == '_') {
            return parseBlankNode();
        }
        throw error("expected subject");
    }

    private String parsePredicate() {
        char c = peek();
        if (c == '*') {
            pos++;
            return NQuad.WILDCARD;
        }
        if (c == '<') {
            return parseIri();
        }
        throw error("expected predicate");
    }

    private String parseIri() {
        expect('<');
        int start = pos;
        while (pos < text.length() && text.charAt(pos) != '>') {
            if (text.charAt(pos) == '\n') {
                throw error("unterminated <...>");
            }
            pos++;
        }
        if (pos >= text.length()) {
            throw error("unterminated <...>");
        }
        String value = text.substring(start, pos).trim();
        pos++;
        if (value.isEmpty()) {
            throw error("empty <>");
        }
        return value;
    }

    private String parseBlankNode() {
        if (!text.startsWith("_:", pos)) {
            throw error("expected blank node");
        }
        int start = pos;
        pos += 2;
        while (pos < text.length() && isLabelChar(text.charAt(pos))) {
            pos++;
        }
        if (pos == start + 2) {
            throw error("empty blank node label");
        }
        return text.substring(start, pos);
    }

    private String parseLiteral() {
        expect('"');
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= text.length()) {
                throw error("unterminated string literal");
            }
            char c = text.charAt(pos++);
            if (c == '"') {
                break;
            }
            if (c == '\\') {
                if (pos >= text.length()) {
                    throw error("unterminated escape");
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case '"', '\\' -> value.append(escaped);
                    default -> throw error("unknown escape \\" + escaped);
                }
            } else {
                if (c == '\n') {
                    line++;
                }
                value.append(c);
            }
        }
        if (text.startsWith("^^", pos)) {
            pos += 2;
            parseIri();
        } else if (pos < text.length() && text.charAt(pos) == '@') {
            pos++;
            while (pos < text.length() && isLabelChar(text.charAt(pos))) {
                pos++;
            }
        }
        return value.toString();
    }

    private static boolean isLabelChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private void skipSpace() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\n') {
                line++;
            } else if (!Character.isWhitespace(c)) {
                return;
            }
            pos++;
        }
    }

    private void skipSpaceAndComments() {
        skipSpace();
        while (pos < text.length() && text.charAt(pos) == '#') {
            while (pos < text.length() && text.charAt(pos) != '\n') {
                pos++;
            }
            skipSpace();
        }
    }

    private char peek() {
        if (pos >= text.length()) {
            throw error("unexpected end of input");
        }
        return text.charAt(pos);
    }

    private void expect(char c) {
        if (pos >= text.length() || text.charAt(pos) != c) {
            throw error("expected '" + c + "'");
        }
        pos++;
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException("malformed mutation at line " + line + ": " + message);
    }
}
