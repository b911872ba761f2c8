package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.io.parse.NumberParser;
import com.modflow.mf6io.io.parse.ast.LineNode;
import com.modflow.mf6io.io.value.RecordValue;
import com.modflow.mf6io.spec.CompositeExpansionException;
import com.modflow.mf6io.spec.FileDirection;
import com.modflow.mf6io.spec.Mf6Exception;
import com.modflow.mf6io.spec.Mf6ParseException;
import com.modflow.mf6io.spec.ParamKind;
import com.modflow.mf6io.spec.ParamSpec;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decodes the tokens of one line against a parameter specification: scalars, list-valued scalars,
 * file names, records, keystrings and table rows. Components are matched left to right in
 * declaration order; keyword components and tagged scalars are recognized by their name token,
 * untagged scalars take the next token as their value.
 */
final class RecordReader {
    private final DimensionContext context;

    RecordReader(DimensionContext context) {
        this.context = context;
    }

    /** Decodes a whole line holding a top-level record or keystring. */
    RecordValue readLine(ParamSpec composite, LineNode line) throws Mf6Exception {
        Tokens tokens = new Tokens(line);
        RecordValue value;
        if (composite.getKind() == ParamKind.KEYSTRING) {
            value = readKeystring(composite, tokens, true);
        } else {
            if (keyedByOwnName(composite)) {
                tokens.next();
            }
            value = readComponents(composite, tokens);
        }
        requireEnd(composite, tokens);
        return value;
    }

    /** Decodes a table row; columns start at the first token. */
    RecordValue readRow(ParamSpec table, LineNode line) throws Mf6Exception {
        Tokens tokens = new Tokens(line);
        RecordValue value = readComponents(table, tokens);
        requireEnd(table, tokens);
        return value;
    }

    /** Decodes the values after the name of a top-level list-valued scalar. */
    List<Object> readListLine(ParamSpec param, LineNode line) throws Mf6Exception {
        Tokens tokens = new Tokens(line);
        tokens.next();
        List<Object> values = readList(param, tokens, true);
        requireEnd(param, tokens);
        return values;
    }

    /**
     * Records whose first component is not a keyword are written with their own name first
     * ({@code NAME value ...}); the others start with that keyword.
     */
    static boolean keyedByOwnName(ParamSpec record) {
        if (record.getKind() != ParamKind.RECORD) {
            return false;
        }
        ParamSpec first = record.getComponents().get(0);
        return first.getKind() != ParamKind.KEYWORD;
    }

    private RecordValue readComponents(ParamSpec composite, Tokens tokens) throws Mf6Exception {
        Map<String, Object> values = new LinkedHashMap<>();
        List<ParamSpec> components = composite.getComponents();
        for (int i = 0; i < components.size(); i++) {
            ParamSpec component = components.get(i);
            if (!tokens.hasNext()) {
                if (!component.isOptional()) {
                    throw new Mf6ParseException(
                            "Missing '" + component.getName() + "' of '" + composite.getName() + "'",
                            tokens.line.getLocation(),
                            tokens.line.text());
                }
                continue;
            }
            Object value = readComponent(component, tokens, i == components.size() - 1);
            if (value != null) {
                values.put(component.getName(), value);
            }
        }
        return new RecordValue(values);
    }

    /** Returns {@code null} when an optional component is not present at the current position. */
    private Object readComponent(ParamSpec component, Tokens tokens, boolean last) throws Mf6Exception {
        switch (component.getKind()) {
            case KEYWORD:
                if (tokens.peekIs(component.getName())) {
                    tokens.next();
                    return Boolean.TRUE;
                }
                return absent(component, tokens);
            case INTEGER:
            case DOUBLE:
            case STRING:
                if (component.isTagged()) {
                    if (!tokens.peekIs(component.getName())) {
                        return absent(component, tokens);
                    }
                    tokens.next();
                }
                if (component.isList()) {
                    return readList(component, tokens, last);
                }
                return convert(component, component.getKind(), tokens.require(component), tokens.line);
            case FILENAME:
                if (component.isTagged()) {
                    if (!tokens.peekIs(component.getName())) {
                        return absent(component, tokens);
                    }
                    tokens.next();
                }
                if (tokens.hasNext() && FileDirection.fromToken(tokens.peek()) != null) {
                    tokens.next();
                }
                return Path.of(tokens.require(component));
            case KEYSTRING:
                return readKeystring(component, tokens, last);
            case RECORD:
                if (keyedByOwnName(component) && tokens.peekIs(component.getName())) {
                    tokens.next();
                }
                return readComponents(component, tokens);
            default:
                throw new Mf6ParseException(
                        "'" + component.getName() + "' cannot be read from a single line",
                        tokens.line.getLocation(),
                        tokens.peek());
        }
    }

    private RecordValue readKeystring(ParamSpec keystring, Tokens tokens, boolean last) throws Mf6Exception {
        String token = tokens.peek();
        if (token != null) {
            for (ParamSpec alternative : keystring.getComponents()) {
                if (alternative.getName().equalsIgnoreCase(token)) {
                    return RecordValue.of(alternative.getName(), readAlternative(alternative, tokens, last));
                }
                if (alternative.getKind() == ParamKind.RECORD
                        && alternative.getComponents().get(0).getKind() == ParamKind.KEYWORD
                        && alternative.getComponents().get(0).getName().equalsIgnoreCase(token)) {
                    return RecordValue.of(alternative.getName(), readComponents(alternative, tokens));
                }
            }
        }
        throw new CompositeExpansionException(
                "No alternative of '" + keystring.getName() + "' matches",
                tokens.line.getLocation(),
                token == null ? tokens.line.text() : token);
    }

    private Object readAlternative(ParamSpec alternative, Tokens tokens, boolean last) throws Mf6Exception {
        switch (alternative.getKind()) {
            case KEYWORD:
                tokens.next();
                return Boolean.TRUE;
            case INTEGER:
            case DOUBLE:
            case STRING:
                tokens.next();
                if (alternative.isList()) {
                    return readList(alternative, tokens, last);
                }
                return convert(alternative, alternative.getKind(), tokens.require(alternative), tokens.line);
            case RECORD:
                tokens.next();
                return readComponents(alternative, tokens);
            default:
                return readComponent(alternative, tokens, last);
        }
    }

    private List<Object> readList(ParamSpec param, Tokens tokens, boolean last) throws Mf6Exception {
        int[] extents = context.resolveIfKnown(param.getShape(), tokens.line.getLocation(), param.getName());
        List<Object> values = new ArrayList<>();
        if (extents == null) {
            if (!last) {
                context.resolve(param.getShape(), tokens.line.getLocation(), param.getName());
            }
            while (tokens.hasNext()) {
                values.add(convert(param, param.getElementKind(), tokens.next(), tokens.line));
            }
            return List.copyOf(values);
        }
        int count = 1;
        for (int extent : extents) {
            count = Math.multiplyExact(count, extent);
        }
        for (int i = 0; i < count; i++) {
            if (!tokens.hasNext()) {
                throw new ShapeMismatchException(
                        "Expected " + count + " values for '" + param.getName() + "', found " + i,
                        tokens.line.getLocation(),
                        tokens.line.text());
            }
            values.add(convert(param, param.getElementKind(), tokens.next(), tokens.line));
        }
        return List.copyOf(values);
    }

    private static Object absent(ParamSpec component, Tokens tokens) throws Mf6ParseException {
        if (component.isOptional()) {
            return null;
        }
        throw new Mf6ParseException(
                "Expected " + component.getName().toUpperCase(Locale.ROOT),
                tokens.line.getLocation(),
                tokens.peek());
    }

    private static void requireEnd(ParamSpec param, Tokens tokens) throws Mf6ParseException {
        if (tokens.hasNext()) {
            throw new Mf6ParseException(
                    "Unexpected text after '" + param.getName() + "'", tokens.line.getLocation(), tokens.peek());
        }
    }

    /** Converts one token to the Java type of the given kind. */
    static Object convert(ParamSpec param, ParamKind kind, String token, LineNode line) throws Mf6ParseException {
        try {
            switch (kind) {
                case INTEGER:
                    return NumberParser.parseInt(token);
                case DOUBLE:
                    return NumberParser.parseDouble(token);
                default:
                    break;
            }
        } catch (NumberFormatException ex) {
            throw new Mf6ParseException(
                    "Expected " + (kind == ParamKind.INTEGER ? "an integer" : "a number") + " for '"
                            + param.getName() + "'",
                    line.getLocation(),
                    token);
        }
        if (!param.getValid().isEmpty() && param.getValid().stream().noneMatch(token::equalsIgnoreCase)) {
            throw new Mf6ParseException(
                    "'" + param.getName() + "' must be one of " + param.getValid(), line.getLocation(), token);
        }
        return token;
    }

    /** Position within the tokens of one line. */
    private static final class Tokens {
        private final LineNode line;
        private int position;

        Tokens(LineNode line) {
            this.line = line;
        }

        boolean hasNext() {
            return position < line.size();
        }

        String peek() {
            return hasNext() ? line.token(position) : null;
        }

        boolean peekIs(String name) {
            return hasNext() && line.token(position).equalsIgnoreCase(name);
        }

        String next() {
            return line.token(position++);
        }

        String require(ParamSpec param) throws Mf6ParseException {
            if (!hasNext()) {
                throw new Mf6ParseException(
                        "Missing value for '" + param.getName() + "'", line.getLocation(), line.text());
            }
            return next();
        }
    }
}
