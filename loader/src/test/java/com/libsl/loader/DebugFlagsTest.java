package com.libsl.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.libsl.loader.grammar.LibSLLexer;
import com.libsl.loader.grammar.LibSLParser;
import com.libsl.loader.semantic.SemanticAnalysis;
import com.libsl.loader.semantic.SemanticAnalyzer;
import java.util.BitSet;
import java.util.List;
import java.util.stream.Collectors;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.dfa.DFA;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DebugFlagsTest {

    @AfterEach
    void clearFlags() {
        System.clearProperty("libsl.debugTokens");
        System.clearProperty("libsl.debugParser");
        DebugFlags.drainCapturedTokens();
        DebugFlags.drainCapturedDiagnostics();
    }

    @Test
    void tokenDumpIsReportedAsInfoMessages() throws Exception {
        System.setProperty("libsl.debugTokens", "true");

        SemanticAnalysis analysis = new SemanticAnalyzer().analyze("debug.lsl", "library demo;");

        List<String> tokens = infoMessages(analysis, "[tokens] ");
        assertEquals(4, tokens.size(), tokens::toString);
        assertTrue(tokens.get(0).startsWith("[tokens] LIBRARY"), tokens.get(0));
        assertTrue(tokens.get(0).endsWith("-> library"), tokens.get(0));
        assertTrue(tokens.get(1).startsWith("[tokens] Identifier"), tokens.get(1));
        assertTrue(tokens.get(1).endsWith("-> demo"), tokens.get(1));
        assertTrue(tokens.get(3).endsWith("-> <EOF>"), tokens.get(3));
        assertTrue(analysis.getLibrary().isPresent());
    }

    @Test
    void tokensAreNotReportedWhenDisabled() throws Exception {
        SemanticAnalysis analysis = new SemanticAnalyzer().analyze("debug.lsl", "library demo;");

        assertTrue(analysis.getMessages().isEmpty(), () -> analysis.getMessages().toString());
    }

    @Test
    void capturedDiagnosticsAreReportedWhenParserTraceIsEnabled() throws Exception {
        System.setProperty("libsl.debugParser", "true");
        DebugFlags.captureDiagnostic("line 1:1 full-context prediction at decision 0 (file): 'library'");

        SemanticAnalysis analysis =
                new SemanticAnalyzer().analyze("debug.lsl", "library demo;\ntypes { Int(int32); }\nval X: Int = 1 + 2 * 3;");

        assertEquals(
                "[diagnostic] line 1:1 full-context prediction at decision 0 (file): 'library'",
                infoMessages(analysis, "[diagnostic] ").get(0));
        assertTrue(infoMessages(analysis, "[diagnostic] ").stream().allMatch(m -> m.startsWith("[diagnostic] line ")));
        assertTrue(DebugFlags.drainCapturedDiagnostics().isEmpty());
        assertTrue(analysis.getLibrary().isPresent());
    }

    @Test
    void listenerRecordsPredictionReportsWithPosition() {
        LibSLParser parser = parser("library demo;");
        DFA dfa = parser.getInterpreter().decisionToDFA[0];
        DebugDiagnosticErrorListener listener = new DebugDiagnosticErrorListener();

        listener.reportAttemptingFullContext(parser, dfa, 0, 1, null, null);
        BitSet alternatives = new BitSet();
        alternatives.set(1);
        alternatives.set(2);
        listener.reportAmbiguity(parser, dfa, 1, 2, true, alternatives, null);
        // Inexact ambiguities are ignored.
        listener.reportAmbiguity(parser, dfa, 1, 2, false, alternatives, null);
        listener.reportContextSensitivity(parser, dfa, 0, 0, 2, null);

        List<String> diagnostics = DebugFlags.drainCapturedDiagnostics();
        assertEquals(3, diagnostics.size(), diagnostics::toString);
        assertTrue(diagnostics.get(0).startsWith("line 1:1 full-context prediction at decision 0 ("), diagnostics.get(0));
        assertTrue(diagnostics.get(0).endsWith("): 'librarydemo'"), diagnostics.get(0));
        assertTrue(diagnostics.get(1).startsWith("line 1:9 ambiguity between alternatives {1, 2} at decision 0"), diagnostics.get(1));
        assertTrue(diagnostics.get(1).endsWith("): 'demo;'"), diagnostics.get(1));
        assertTrue(diagnostics.get(2).startsWith("line 1:1 context-sensitive choice of alternative 2"), diagnostics.get(2));
    }

    @Test
    void propertyOverridesEnvironment() {
        System.setProperty("libsl.debugTokens", "false");
        assertFalse(DebugFlags.isTokenDebugEnabled());
        System.setProperty("libsl.debugTokens", "true");
        assertTrue(DebugFlags.isTokenDebugEnabled());
    }

    private static LibSLParser parser(String text) {
        CommonTokenStream tokens = new CommonTokenStream(new LibSLLexer(CharStreams.fromString(text)));
        LibSLParser parser = new LibSLParser(tokens);
        parser.removeErrorListeners();
        parser.file();
        return parser;
    }

    private static List<String> infoMessages(SemanticAnalysis analysis, String prefix) {
        return analysis.getMessages().stream()
                .filter(message -> message.getLevel() == LoaderMessage.Level.INFO)
                .map(LoaderMessage::getMessage)
                .filter(message -> message.startsWith(prefix))
                .collect(Collectors.toList());
    }
}
