package com.libsl.loader.validation;

import com.libsl.asg.Automaton;
import com.libsl.asg.Library;
import com.libsl.asg.StateKind;
import com.libsl.loader.LoaderMessage;
import com.libsl.loader.LoaderMessage.Level;
import com.libsl.loader.semantic.SemanticAnalysis;
import java.util.ArrayList;
import java.util.List;

/** An automaton that declares states should start in exactly one {@code initstate}. */
final class InitialStateValidationRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(SemanticAnalysis analysis) {
        List<LoaderMessage> messages = new ArrayList<>();
        if (analysis.getLibrary().isEmpty()) {
            return messages;
        }
        Library library = analysis.getLibrary().get();
        for (Automaton automaton : library.getAutomata()) {
            if (automaton.getStates().isEmpty()) {
                continue;
            }
            long initial = automaton.getStates().stream().filter(state -> state.getKind() == StateKind.INIT).count();
            if (initial == 0) {
                messages.add(
                        analysis.message(
                                Level.WARNING, automaton, "automaton " + automaton.getName() + " declares no initial state"));
            } else if (initial > 1) {
                messages.add(
                        analysis.message(
                                Level.WARNING,
                                automaton,
                                "automaton " + automaton.getName() + " declares " + initial + " initial states"));
            }
        }
        return messages;
    }
}
