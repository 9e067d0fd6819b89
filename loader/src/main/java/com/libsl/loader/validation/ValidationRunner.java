package com.libsl.loader.validation;

import com.libsl.loader.LoaderMessage;
import com.libsl.loader.semantic.SemanticAnalysis;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Executes a list of validation rules and aggregates their diagnostics. */
public final class ValidationRunner {

    private final List<ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /**
     * Convenience factory that wires in the default rule set.
     */
    public static ValidationRunner defaultRules() {
        return new ValidationRunner(List.of(new InitialStateValidationRule(), new DuplicateFunctionValidationRule()));
    }

    /**
     * Run all configured rules against the provided analysis.
     *
     * @return All diagnostics produced by all rules, in rule order.
     */
    public List<LoaderMessage> run(SemanticAnalysis analysis) {
        List<LoaderMessage> diagnostics = new ArrayList<>();
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.validate(analysis));
        }
        return diagnostics;
    }
}
