package com.libsl.loader;

import java.util.BitSet;
import java.util.Locale;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Records prediction reports of the LibSL parser as {@code line L:C <kind> at decision N (rule): 'input'}.
 *
 * <p>The stock {@link DiagnosticErrorListener} reports through {@link Parser#notifyErrorListeners(String)}, which
 * would reach {@link ThrowingErrorListener} and abort the parse. Reports go to {@link DebugFlags} instead.</p>
 */
final class DebugDiagnosticErrorListener extends DiagnosticErrorListener {

    DebugDiagnosticErrorListener() {
        super(true);
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (exactOnly && !exact) {
            return;
        }
        String alternatives = String.valueOf(getConflictingAlts(ambigAlts, configs));
        record(recognizer, dfa, startIndex, stopIndex, "ambiguity between alternatives " + alternatives);
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        record(recognizer, dfa, startIndex, stopIndex, "full-context prediction");
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        record(recognizer, dfa, startIndex, stopIndex, "context-sensitive choice of alternative " + prediction);
    }

    private void record(Parser recognizer, DFA dfa, int startIndex, int stopIndex, String kind) {
        TokenStream tokens = recognizer.getTokenStream();
        Token start = tokens.get(startIndex);
        DebugFlags.captureDiagnostic(
                String.format(
                        Locale.ROOT,
                        "line %d:%d %s at decision %s: '%s'",
                        start.getLine(),
                        start.getCharPositionInLine() + 1,
                        kind,
                        getDecisionDescription(recognizer, dfa),
                        tokens.getText(Interval.of(startIndex, stopIndex))));
    }
}
