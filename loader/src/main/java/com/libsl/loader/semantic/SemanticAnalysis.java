package com.libsl.loader.semantic;

import com.libsl.asg.Library;
import com.libsl.asg.Node;
import com.libsl.loader.LoaderMessage;
import com.libsl.loader.ast.SourceLocation;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Outcome of analysing one specification. The library is only available when no error was reported. */
public final class SemanticAnalysis {
    private final String sourceName;
    private final Library library;
    private final List<LoaderMessage> messages;
    private final Map<Node, SourceLocation> declarations;

    public SemanticAnalysis(String sourceName, Library library, List<LoaderMessage> messages) {
        this(sourceName, library, messages, Map.of());
    }

    /**
     * @param declarations where automata and functions of the library were declared
     */
    public SemanticAnalysis(
            String sourceName,
            Library library,
            List<LoaderMessage> messages,
            Map<? extends Node, SourceLocation> declarations) {
        this.sourceName = sourceName;
        this.messages = List.copyOf(messages);
        this.library = hasErrors() ? null : library;
        this.declarations = Collections.unmodifiableMap(new IdentityHashMap<>(declarations));
    }

    public String getSourceName() {
        return sourceName;
    }

    public Optional<Library> getLibrary() {
        return Optional.ofNullable(library);
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public boolean hasErrors() {
        return messages.stream().anyMatch(message -> message.getLevel() == LoaderMessage.Level.ERROR);
    }

    public Optional<SourceLocation> declarationOf(Node node) {
        return Optional.ofNullable(declarations.get(node));
    }

    /** Diagnostic placed at the declaration of {@code node}, or at line 0 of the source when it is unknown. */
    public LoaderMessage message(LoaderMessage.Level level, Node node, String message) {
        return declarationOf(node)
                .map(
                        location ->
                                new LoaderMessage(
                                        level,
                                        message,
                                        location.getSourceName(),
                                        location.getLine(),
                                        location.getColumn()))
                .orElseGet(() -> new LoaderMessage(level, message, sourceName, 0));
    }
}
