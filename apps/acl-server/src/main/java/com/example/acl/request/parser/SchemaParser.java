package com.example.acl.request.parser;

import com.example.acl.request.model.PredicateSchema;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses predicate schema statements of the form {@code name: string @index(exact) .}.
 * Statements end with {@code .}; several may share a line. The name may be written as
 * {@code <name>}. Blank lines and {@code #} comments are skipped.
 */
public final class SchemaParser {

    private SchemaParser() {
    }

    /**
     * @throws IllegalArgumentException on a statement without a name or type
     */
    @NonNull
    public static List<PredicateSchema> parse(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<PredicateSchema> schema = new ArrayList<>();
        for (String statement : splitStatements(stripComments(text))) {
            schema.add(parseStatement(statement));
        }
        return schema;
    }

    private static PredicateSchema parseStatement(String statement) {
        int colon = statement.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("malformed schema statement: missing ':' in \"" + statement + "\"");
        }
        String name = statement.substring(0, colon).trim();
        if (name.startsWith("<") && name.endsWith(">")) {
            name = name.substring(1, name.length() - 1).trim();
        }
        String definition = statement.substring(colon + 1).trim().replaceAll("\\s+", " ");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("malformed schema statement: missing predicate name");
        }
        if (definition.isEmpty()) {
            throw new IllegalArgumentException("malformed schema statement: missing type for " + name);
        }
        return new PredicateSchema(name, definition);
    }

    // A '.' ends a statement only outside parentheses, so @index(exact) and names like dgraph.xid survive.
    private static List<String> splitStatements(String text) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            }
            boolean terminator = c == '.' && depth == 0
                    && (i + 1 == text.length() || Character.isWhitespace(text.charAt(i + 1)));
            if (terminator) {
                addIfPresent(statements, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addIfPresent(statements, current);
        return statements;
    }

    private static void addIfPresent(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    private static String stripComments(String text) {
        StringBuilder out = new StringBuilder();
        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.startsWith("#")) {
                out.append(line).append('\n');
            }
        }
        return out.toString();
    }
}
