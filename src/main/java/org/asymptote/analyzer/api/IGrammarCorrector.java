package org.asymptote.analyzer.api;

import java.util.Optional;

/**
 * Seam for an external grammar-correction collaborator (for example an LLM-backed service).
 * The analyzer consults it at most once per request, after a {@link ParseException}.
 */
@FunctionalInterface
public interface IGrammarCorrector {

    /**
     * Attempts to rewrite source text that failed to parse.
     *
     * @param source The original source text.
     * @param error The parse error produced for {@code source}.
     * @return The rewritten source, or an empty optional if no correction is offered.
     */
    Optional<String> correct(String source, ParseException error);
}
