package com.libsl.loader.semantic;

import com.libsl.asg.Automaton;
import com.libsl.asg.Function;
import com.libsl.asg.FunctionArgument;
import com.libsl.asg.ResultVariable;
import com.libsl.asg.Variable;
import java.util.Optional;

/**
 * Names visible to an expression. Lookup order: function arguments, {@code result}, variables of the automaton,
 * then globals (resolved by the caller through the context).
 */
final class ResolutionScope {
    private final Automaton automaton;
    private final Function function;
    private final boolean oldAllowed;

    private ResolutionScope(Automaton automaton, Function function, boolean oldAllowed) {
        this.automaton = automaton;
        this.function = function;
        this.oldAllowed = oldAllowed;
    }

    static ResolutionScope global() {
        return new ResolutionScope(null, null, false);
    }

    static ResolutionScope automaton(Automaton automaton) {
        return new ResolutionScope(automaton, null, false);
    }

    static ResolutionScope function(Function function) {
        return new ResolutionScope(function.getAutomaton(), function, false);
    }

    /** Scope of an {@code ensures} clause, where {@code old(...)} is permitted. */
    static ResolutionScope postCondition(Function function) {
        return new ResolutionScope(function.getAutomaton(), function, true);
    }

    boolean isOldAllowed() {
        return oldAllowed;
    }

    Optional<FunctionArgument> argument(String name) {
        if (function == null) {
            return Optional.empty();
        }
        return function.getArgs().stream().filter(arg -> arg.getName().equals(name)).findFirst();
    }

    Optional<Variable> variable(String name) {
        Optional<FunctionArgument> argument = argument(name);
        if (argument.isPresent()) {
            return Optional.of(argument.get());
        }
        if (function != null && ResultVariable.NAME.equals(name) && function.getResultVariable() != null) {
            return Optional.of(function.getResultVariable());
        }
        if (automaton != null) {
            return automaton.findVariable(name);
        }
        return Optional.empty();
    }
}
