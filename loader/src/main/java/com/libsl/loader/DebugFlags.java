package com.libsl.loader;

import com.libsl.loader.grammar.LibSLLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

public final class DebugFlags {
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());
    private static final String TOKENS_PROPERTY = "libsl.debugTokens";
    private static final String PARSER_PROPERTY = "libsl.debugParser";
    /** Environment fallback; system properties win when both are set. */
    private static final String TOKENS_ENV = "LIBSL_DEBUG_TOKENS";
    private static final String PARSER_ENV = "LIBSL_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return isEnabled(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isParserTraceEnabled() {
        return isEnabled(PARSER_PROPERTY, PARSER_ENV);
    }

    private static boolean isEnabled(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }

    public static void logTokens(CommonTokenStream tokens, LibSLLexer lexer) {
        LOGGER.fine("LibSL token dump:");
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-16s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText());
            LOGGER.fine(() -> "  " + line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    public static DebugDiagnosticErrorListener diagnosticListener() {
        return new DebugDiagnosticErrorListener();
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }

    public static void captureDiagnostic(String message) {
        LOGGER.fine(message);
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    public static List<String> drainCapturedDiagnostics() {
        List<String> captured = new ArrayList<>(CAPTURED_DIAGNOSTICS.get());
        CAPTURED_DIAGNOSTICS.get().clear();
        return captured;
    }
}
