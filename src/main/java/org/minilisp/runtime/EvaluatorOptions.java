package org.minilisp.runtime;

import com.typesafe.config.Config;

/**
 * Tuning options for the {@link Evaluator}.
 *
 * @param maxDepth The maximum nesting depth of evaluation before it fails with
 *                 {@link org.minilisp.api.LispErrorCode#RESOURCE_EXHAUSTED}.
 */
public record EvaluatorOptions(int maxDepth) {

    /** The depth limit used when nothing is configured. */
    public static final int DEFAULT_MAX_DEPTH = 2_000;

    private static final String MAX_DEPTH_PATH = "max-depth";

    public EvaluatorOptions {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, but was " + maxDepth);
        }
    }

    /**
     * @return The options used when no configuration is available.
     */
    public static EvaluatorOptions defaults() {
        return new EvaluatorOptions(DEFAULT_MAX_DEPTH);
    }

    /**
     * Reads the options from the {@code minilisp.evaluator} block of the configuration.
     * @param evaluatorConfig The evaluator configuration block.
     * @return The options, with defaults for missing keys.
     */
    public static EvaluatorOptions fromConfig(Config evaluatorConfig) {
        int maxDepth = evaluatorConfig.hasPath(MAX_DEPTH_PATH)
                ? evaluatorConfig.getInt(MAX_DEPTH_PATH)
                : DEFAULT_MAX_DEPTH;
        return new EvaluatorOptions(maxDepth);
    }
}
