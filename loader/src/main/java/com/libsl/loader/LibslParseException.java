package com.libsl.loader;

/** Syntax error in a specification file; the message starts with {@code line L:C}. */
public final class LibslParseException extends Exception {
    public LibslParseException(String message) {
        super(message);
    }

    public LibslParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
