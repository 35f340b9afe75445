package com.raditha.cannibal.config;

/**
 * Configuration for cannibalization detection.
 *
 * @param threshold           Minimum share of the source page's keywords a candidate must also rank for (0.0-1.0)
 * @param minKeywords         Minimum keywords a page needs before it is used as a comparison source
 * @param parallelism         Worker threads for candidate matching (1 = sequential)
 * @param excludeFragmentUrls Drop landing pages containing '#' before analysis
 */
public record CannibalizationConfig(
        double threshold,
        int minKeywords,
        int parallelism,
        boolean excludeFragmentUrls) {

    public static final double DEFAULT_THRESHOLD = 0.80;
    public static final int DEFAULT_MIN_KEYWORDS = 10;

    /**
     * Validate configuration.
     */
    public CannibalizationConfig {
        if (!Double.isFinite(threshold)) {
            throw new IllegalArgumentException("threshold must be a finite number, got: " + threshold);
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, got: " + threshold);
        }
        if (minKeywords < 0) {
            throw new IllegalArgumentException("minKeywords must be >= 0, got: " + minKeywords);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
    }

    /**
     * Moderate preset: 80% keyword overlap. Good default for most sites.
     */
    public static CannibalizationConfig moderate() {
        return new CannibalizationConfig(DEFAULT_THRESHOLD, DEFAULT_MIN_KEYWORDS, defaultParallelism(), true);
    }

    /**
     * Strict preset: 90% overlap, only near-identical keyword sets.
     */
    public static CannibalizationConfig strict() {
        return new CannibalizationConfig(0.90, DEFAULT_MIN_KEYWORDS, defaultParallelism(), true);
    }

    /**
     * Lenient preset: 60% overlap. Surfaces more pairs, more of them worth
     * keeping apart.
     */
    public static CannibalizationConfig lenient() {
        return new CannibalizationConfig(0.60, DEFAULT_MIN_KEYWORDS, defaultParallelism(), true);
    }

    public static CannibalizationConfig fromPreset(String preset) {
        return switch (preset.toLowerCase()) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            case "moderate" -> moderate();
            default -> throw new IllegalArgumentException(
                    "Unknown preset: " + preset + ". Must be: strict, moderate, or lenient");
        };
    }

    public CannibalizationConfig withThreshold(double newThreshold) {
        return new CannibalizationConfig(newThreshold, minKeywords, parallelism, excludeFragmentUrls);
    }

    public CannibalizationConfig withMinKeywords(int newMinKeywords) {
        return new CannibalizationConfig(threshold, newMinKeywords, parallelism, excludeFragmentUrls);
    }

    public CannibalizationConfig withParallelism(int newParallelism) {
        return new CannibalizationConfig(threshold, minKeywords, newParallelism, excludeFragmentUrls);
    }

    static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
