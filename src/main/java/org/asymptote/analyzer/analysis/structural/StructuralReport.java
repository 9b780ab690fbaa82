package org.asymptote.analyzer.analysis.structural;

import org.asymptote.analyzer.model.ComplexityResult;

import java.util.Optional;

/**
 * The outcome of the structural pass over a whole program.
 *
 * @param result The cost of the entry point, recursion included.
 * @param residual The cost of the entry point with every call to a recursive procedure charged as
 *                 constant, i.e. the work a solved recurrence does not account for.
 * @param entry The scope analyzed: {@code main} or the name of the entry procedure.
 * @param recursiveProcedure The recursive procedure the program revolves around, if any.
 */
public record StructuralReport(
        ComplexityResult result,
        ComplexityResult residual,
        String entry,
        Optional<String> recursiveProcedure
) {
}
