package com.libsl.loader;

/** Checked exception signalling that a LibSL specification could not be parsed, resolved or validated. */
public final class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
