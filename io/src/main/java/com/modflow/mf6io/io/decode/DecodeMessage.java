package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.spec.SourceLocation;

/** A diagnostic produced while decoding, such as a skipped unknown parameter. */
public final class DecodeMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final SourceLocation location;

    public DecodeMessage(Level level, String message, SourceLocation location) {
        this.level = level;
        this.message = message;
        this.location = location;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return level + " " + location + ": " + message;
    }
}
