package AutomataKit.Model;

/**
 * Caps for the searches that could otherwise run forever on epsilon cycles.
 * Hitting a cap rejects the word; it never raises an error.
 */
public final class SearchLimits {
    public static final int DEFAULT_EPSILON_STEPS = 1000;
    public static final int DEFAULT_SEARCH_DEPTH = 10000;
    public static final int DEFAULT_EXPANSIONS = 1_000_000;

    private static final SearchLimits DEFAULTS =
        new SearchLimits(DEFAULT_EPSILON_STEPS, DEFAULT_SEARCH_DEPTH, DEFAULT_EXPANSIONS);

    private final int maxEpsilonSteps;
    private final int maxSearchDepth;
    private final int maxExpansions;

    /**
     * @param maxEpsilonSteps - closure expansions plus consumed symbols allowed in one NFA run
     * @param maxSearchDepth - transitions allowed along one PDA branch
     * @param maxExpansions - PDA configurations expanded over the whole search
     */
    public SearchLimits(int maxEpsilonSteps, int maxSearchDepth, int maxExpansions) {
        if (maxEpsilonSteps <= 0 || maxSearchDepth <= 0 || maxExpansions <= 0) {
            throw new IllegalArgumentException("Search limits must be positive");
        }
        this.maxEpsilonSteps = maxEpsilonSteps;
        this.maxSearchDepth = maxSearchDepth;
        this.maxExpansions = maxExpansions;
    }

    public static SearchLimits defaults() {
        return DEFAULTS;
    }

    public int getMaxEpsilonSteps() {
        return maxEpsilonSteps;
    }

    public int getMaxSearchDepth() {
        return maxSearchDepth;
    }

    public int getMaxExpansions() {
        return maxExpansions;
    }

    public SearchLimits withMaxEpsilonSteps(int steps) {
        return new SearchLimits(steps, maxSearchDepth, maxExpansions);
    }

    public SearchLimits withMaxSearchDepth(int depth) {
        return new SearchLimits(maxEpsilonSteps, depth, maxExpansions);
    }

    public SearchLimits withMaxExpansions(int expansions) {
        return new SearchLimits(maxEpsilonSteps, maxSearchDepth, expansions);
    }

    @Override
    public String toString() {
        return "SearchLimits[eps=" + maxEpsilonSteps + ", depth=" + maxSearchDepth
            + ", expansions=" + maxExpansions + "]";
    }
}
