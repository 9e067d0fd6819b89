package com.libsl.loader;

import com.libsl.asg.Library;
import java.util.List;

/** Resolved library plus every non-fatal diagnostic collected while loading it. */
public final class LoaderResult {
    private final Library library;
    private final List<LoaderMessage> messages;

    public LoaderResult(Library library, List<LoaderMessage> messages) {
        this.library = library;
        this.messages = List.copyOf(messages);
    }

    public Library getLibrary() {
        return library;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
