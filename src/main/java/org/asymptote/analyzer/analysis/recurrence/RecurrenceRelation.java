package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.model.GrowthRate;

import java.util.List;

/**
 * A recurrence for the running time of one self-recursive procedure.
 *
 * @param procedure The owning procedure's name.
 * @param equation The canonical text form, e.g. {@code T(n) = 2T(n/2) + n}.
 * @param baseCase The smallest-input branch, e.g. {@code T(n) = 1 when n <= 1}.
 * @param explanation A sentence describing how the equation was derived.
 * @param notes Everything the extractor could not resolve.
 * @param terms The recursive terms, grouped by size transform, in order of first appearance.
 * @param nonRecursiveCost The cost of one invocation outside its self-calls.
 * @param callInsideLoop {@code true} if a self-call sits inside a loop of the procedure.
 */
public record RecurrenceRelation(
        String procedure,
        String equation,
        String baseCase,
        String explanation,
        List<String> notes,
        List<RecursiveTerm> terms,
        GrowthRate nonRecursiveCost,
        boolean callInsideLoop
) {

    public RecurrenceRelation {
        notes = notes == null ? List.of() : List.copyOf(notes);
        terms = terms == null ? List.of() : List.copyOf(terms);
    }

    /**
     * Builds the canonical equation text for the given terms and cost.
     * @param terms The recursive terms.
     * @param cost The non-recursive cost.
     * @return For example {@code T(n) = T(n-1) + T(n-2) + 1}.
     */
    public static String equationOf(List<RecursiveTerm> terms, GrowthRate cost) {
        StringBuilder out = new StringBuilder("T(n) = ");
        for (RecursiveTerm term : terms) {
            out.append(term.render()).append(" + ");
        }
        return out.append(cost.render()).toString();
    }

    /**
     * @return The total number of self-calls per invocation.
     */
    public int totalCalls() {
        return terms.stream().mapToInt(RecursiveTerm::coefficient).sum();
    }

    /**
     * @param type A transform class.
     * @return {@code true} if every term uses a transform of that class.
     */
    public boolean allTransformsAre(Class<? extends SizeTransform> type) {
        return !terms.isEmpty() && terms.stream().allMatch(t -> type.isInstance(t.transform()));
    }

    public boolean anyTransformIs(Class<? extends SizeTransform> type) {
        return terms.stream().anyMatch(t -> type.isInstance(t.transform()));
    }
}
