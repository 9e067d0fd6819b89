package com.libsl.loader.validation;

import com.libsl.loader.LoaderMessage;
import com.libsl.loader.semantic.SemanticAnalysis;
import java.util.List;

/**
 * A consistency check over a resolved library. Rules are deterministic and report problems in declaration order.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule against the given analysis.
     *
     * @param analysis Resolved library and the diagnostics collected so far.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<LoaderMessage> validate(SemanticAnalysis analysis);
}
