package com.libsl.loader.validation;

import com.libsl.asg.Automaton;
import com.libsl.asg.Function;
import com.libsl.asg.FunctionArgument;
import com.libsl.loader.LoaderMessage;
import com.libsl.loader.LoaderMessage.Level;
import com.libsl.loader.semantic.SemanticAnalysis;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags functions of one automaton (local or extension) that share a name and argument types. Both declarations stay
 * in the graph; only the second and later ones are reported.
 */
final class DuplicateFunctionValidationRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(SemanticAnalysis analysis) {
        List<LoaderMessage> messages = new ArrayList<>();
        analysis.getLibrary()
                .ifPresent(
                        library -> {
                            for (Automaton automaton : library.getAutomata()) {
                                checkAutomaton(automaton, analysis, messages);
                            }
                        });
        return messages;
    }

    private static void checkAutomaton(Automaton automaton, SemanticAnalysis analysis, List<LoaderMessage> out) {
        Set<String> seen = new HashSet<>();
        for (Function function : automaton.getFunctions()) {
            String signature = signature(function);
            if (!seen.add(signature)) {
                out.add(
                        analysis.message(
                                Level.WARNING, function, "duplicate function " + automaton.getName() + "." + signature));
            }
        }
    }

    private static String signature(Function function) {
        return function.getArgs().stream()
                .map(FunctionArgument::getType)
                .map(type -> type.getFullName())
                .collect(Collectors.joining(", ", function.getName() + "(", ")"));
    }
}
