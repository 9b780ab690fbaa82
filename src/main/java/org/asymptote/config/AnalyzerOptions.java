package org.asymptote.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * The tunables of one analyzer instance.
 *
 * @param maxDepth The deepest recursion tree level to expand.
 * @param maxNodes The largest number of recursion tree nodes.
 * @param nominalSize The concrete input size at the recursion tree root.
 * @param substitutionSteps The number of substitution samples the solver tries before giving up.
 * @param grammarCorrectionEnabled {@code true} to retry once with corrected source after a parse error.
 */
public record AnalyzerOptions(
        int maxDepth,
        int maxNodes,
        int nominalSize,
        int substitutionSteps,
        boolean grammarCorrectionEnabled
) {

    public static final String CONFIG_PATH = "asymptote.analysis";

    public AnalyzerOptions {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("recursion-tree.max-depth must not be negative: " + maxDepth);
        }
        if (maxNodes < 1) {
            throw new IllegalArgumentException("recursion-tree.max-nodes must be positive: " + maxNodes);
        }
        if (nominalSize < 2) {
            throw new IllegalArgumentException("recursion-tree.nominal-size must be at least 2: " + nominalSize);
        }
        if (substitutionSteps < 1) {
            throw new IllegalArgumentException("solver.substitution-steps must be positive: " + substitutionSteps);
        }
    }

    /**
     * @return The options of {@code reference.conf}.
     */
    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions(6, 1024, 64, 10, true);
    }

    /**
     * Reads the options below {@code asymptote.analysis}.
     * @param config The application configuration.
     * @return The options.
     * @throws ConfigException if the section is missing or a value has the wrong type.
     */
    public static AnalyzerOptions fromConfig(Config config) {
        Config analysis = config.getConfig(CONFIG_PATH);
        return new AnalyzerOptions(
                analysis.getInt("recursion-tree.max-depth"),
                analysis.getInt("recursion-tree.max-nodes"),
                analysis.getInt("recursion-tree.nominal-size"),
                analysis.getInt("solver.substitution-steps"),
                analysis.getBoolean("grammar-correction.enabled"));
    }

    /**
     * @param depth A recursion tree depth.
     * @return A copy with that depth.
     */
    public AnalyzerOptions withMaxDepth(int depth) {
        return new AnalyzerOptions(depth, maxNodes, nominalSize, substitutionSteps, grammarCorrectionEnabled);
    }
}
