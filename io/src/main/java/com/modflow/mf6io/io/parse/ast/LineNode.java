package com.modflow.mf6io.io.parse.ast;

import com.modflow.mf6io.spec.SourceLocation;
import java.util.List;
import java.util.Locale;

/**
 * One logical line inside a block, after comments and separators were dropped. Quoted tokens are
 * stored without their quotes.
 */
public final class LineNode {
    private final List<String> tokens;
    private final List<TokenKind> kinds;
    private final SourceLocation location;

    public LineNode(List<String> tokens, List<TokenKind> kinds, SourceLocation location) {
        if (tokens.isEmpty() || tokens.size() != kinds.size()) {
            throw new IllegalArgumentException("Line needs one kind per token and at least one token");
        }
        this.tokens = List.copyOf(tokens);
        this.kinds = List.copyOf(kinds);
        this.location = location;
    }

    public List<String> getTokens() {
        return tokens;
    }

    public List<TokenKind> getKinds() {
        return kinds;
    }

    public int size() {
        return tokens.size();
    }

    public String token(int index) {
        return tokens.get(index);
    }

    public TokenKind kind(int index) {
        return kinds.get(index);
    }

    /** Lower-cased first token, the key the line is looked up by. */
    public String key() {
        return tokens.get(0).toLowerCase(Locale.ROOT);
    }

    /** Whether every token is a number. */
    public boolean isNumeric() {
        for (TokenKind kind : kinds) {
            if (!kind.isNumeric()) {
                return false;
            }
        }
        return true;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** Tokens joined by single blanks, for messages. */
    public String text() {
        return String.join(" ", tokens);
    }

    @Override
    public String toString() {
        return location + " " + text();
    }
}
