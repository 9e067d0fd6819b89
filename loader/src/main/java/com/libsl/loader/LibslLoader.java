package com.libsl.loader;

import com.libsl.loader.semantic.SemanticAnalysis;
import com.libsl.loader.semantic.SemanticAnalyzer;
import com.libsl.loader.validation.ValidationRunner;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/** Entry point for loading LibSL specifications: parse, resolve, validate. */
public final class LibslLoader {
    private static final Logger LOGGER = Logger.getLogger(LibslLoader.class.getName());

    private final ValidationRunner validationRunner;

    public LibslLoader() {
        this(ValidationRunner.defaultRules());
    }

    public LibslLoader(ValidationRunner validationRunner) {
        this.validationRunner = validationRunner;
    }

    public LoaderResult load(Path specPath) throws LoaderException {
        return complete(new SemanticAnalyzer().analyze(specPath));
    }

    public LoaderResult load(String sourceName, String text) throws LoaderException {
        return complete(new SemanticAnalyzer().analyze(sourceName, text));
    }

    private LoaderResult complete(SemanticAnalysis analysis) throws LoaderException {
        List<LoaderMessage> messages = new ArrayList<>(analysis.getMessages());
        failOnFirstError(messages);

        messages.addAll(validationRunner.run(analysis));
        failOnFirstError(messages);

        LOGGER.fine(() -> "Loaded library " + analysis.getLibrary().orElseThrow().getMetadata().getName());
        return new LoaderResult(analysis.getLibrary().orElseThrow(), messages);
    }

    private static void failOnFirstError(List<LoaderMessage> messages) throws LoaderException {
        LoaderMessage firstError =
                messages.stream()
                        .filter(message -> message.getLevel() == LoaderMessage.Level.ERROR)
                        .findFirst()
                        .orElse(null);
        if (firstError == null) {
            return;
        }
        long errorCount = messages.stream().filter(m -> m.getLevel() == LoaderMessage.Level.ERROR).count();
        LOGGER.warning(() -> "Specification rejected with " + errorCount + " error(s), first: " + firstError);
        String location = firstError.getLocation();
        throw new LoaderException(
                "Validation failed: "
                        + firstError.getMessage()
                        + (location.isEmpty() ? "" : " (" + location + ")"));
    }
}
