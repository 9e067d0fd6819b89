package com.libsl.loader.semantic;

import com.libsl.asg.Node;
import com.libsl.loader.DebugFlags;
import com.libsl.loader.LibslAstBuilder;
import com.libsl.loader.LibslParseException;
import com.libsl.loader.LoaderException;
import com.libsl.loader.LoaderMessage;
import com.libsl.loader.ast.LibraryNode;
import com.libsl.loader.ast.SourceLocation;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Lowers a parsed specification into the semantic graph in two passes: {@link SymbolTableBuilder} declares every
 * name, then {@link ReferenceResolver} binds the references, so declarations may appear in any order.
 */
public final class SemanticAnalyzer {
    private static final Logger LOGGER = Logger.getLogger(SemanticAnalyzer.class.getName());

    private final LibslAstBuilder astBuilder = new LibslAstBuilder();

    public SemanticAnalysis analyze(Path specPath) throws LoaderException {
        Objects.requireNonNull(specPath, "specPath");
        Path file = specPath.toAbsolutePath().normalize();
        String contents;
        try {
            contents = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LoaderException("Failed to read specification: " + file, ex);
        }
        return analyze(file.toString(), contents);
    }

    public SemanticAnalysis analyze(String sourceName, String text) throws LoaderException {
        LibraryNode library;
        try {
            library = astBuilder.parse(sourceName, text);
        } catch (LibslParseException ex) {
            throw new LoaderException("Failed to parse " + sourceName + ": " + ex.getMessage(), ex);
        }
        List<LoaderMessage> debugMessages = new ArrayList<>();
        if (DebugFlags.isTokenDebugEnabled()) {
            for (String tokenLine : DebugFlags.drainCapturedTokens()) {
                debugMessages.add(new LoaderMessage(LoaderMessage.Level.INFO, "[tokens] " + tokenLine, sourceName, 0));
            }
        }
        if (DebugFlags.isParserTraceEnabled()) {
            for (String diagnostic : DebugFlags.drainCapturedDiagnostics()) {
                debugMessages.add(
                        new LoaderMessage(LoaderMessage.Level.INFO, "[diagnostic] " + diagnostic, sourceName, 0));
            }
        }
        return analyze(library, debugMessages);
    }

    public SemanticAnalysis analyze(LibraryNode library) {
        return analyze(library, List.of());
    }

    private SemanticAnalysis analyze(LibraryNode library, List<LoaderMessage> initialMessages) {
        Objects.requireNonNull(library, "library");
        AnalyzerState state = new AnalyzerState();
        state.messages.addAll(initialMessages);

        new SymbolTableBuilder(state).build(library);
        new ReferenceResolver(state).resolve();

        LOGGER.fine(
                () ->
                        "Analysed "
                                + library.getHeader().getName()
                                + ": "
                                + state.messages.size()
                                + " message(s), errors="
                                + state.hasErrors());
        Map<Node, SourceLocation> declarations = new IdentityHashMap<>();
        state.automata.forEach((node, automaton) -> declarations.put(automaton, node.getLocation()));
        state.functions.forEach((node, function) -> declarations.put(function, node.getLocation()));
        return new SemanticAnalysis(
                library.getHeader().getLocation().getSourceName(), state.library, state.messages, declarations);
    }
}
