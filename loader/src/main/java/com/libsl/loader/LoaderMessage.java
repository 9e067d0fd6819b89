package com.libsl.loader;

import java.util.Locale;

/** Diagnostic produced while loading a LibSL specification. */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceFilename;
    private final int sourceLineno;
    private final int sourceColumn;

    public LoaderMessage(Level level, String message, String sourceFilename, int sourceLineno) {
        this(level, message, sourceFilename, sourceLineno, 0);
    }

    public LoaderMessage(Level level, String message, String sourceFilename, int sourceLineno, int sourceColumn) {
        this.level = level;
        this.message = message;
        this.sourceFilename = sourceFilename;
        this.sourceLineno = sourceLineno;
        this.sourceColumn = sourceColumn;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }

    public int getSourceLineno() {
        return sourceLineno;
    }

    public int getSourceColumn() {
        return sourceColumn;
    }

    /** {@code file:line:col}, omitting the parts that are unknown. */
    public String getLocation() {
        String location = sourceFilename == null ? "" : sourceFilename;
        if (sourceLineno > 0) {
            location = location + ":" + sourceLineno;
            if (sourceColumn > 0) {
                location = location + ":" + sourceColumn;
            }
        }
        return location;
    }

    @Override
    public String toString() {
        String location = getLocation();
        return level.name().toLowerCase(Locale.ROOT)
                + ": "
                + message
                + (location.isEmpty() ? "" : " (" + location + ")");
    }
}
