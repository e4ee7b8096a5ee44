package ai.coursedoc.transcoder.render;

/**
 * Policy deciding whether a summation sign with limits was really meant as an integral.
 *
 * <p>Word sometimes stores integrals as plain n-ary operators without a character, which reads back as a sum.
 * Integrals usually carry simple limits ({@code a}, {@code b}, {@code 0}, {@code 1}) while sums carry
 * expressions such as {@code i=1}. This is a guess, not a guarantee: a sum from {@code 0} to {@code n}
 * is rendered as an integral under both active policies.
 */
public enum SummationHeuristic {
    /** Integral when either limit renders empty or both limits are a single alphanumeric character. */
    PERMISSIVE,
    /** Integral only when both limits are a single alphanumeric character. */
    SIMPLE_LIMITS,
    /** Never re-classify. */
    DISABLED;

    public boolean treatAsIntegral(String lowerLimit, String upperLimit) {
        return switch (this) {
            case PERMISSIVE -> lowerLimit.isEmpty() || upperLimit.isEmpty()
                    || (isSimpleLimit(lowerLimit) && isSimpleLimit(upperLimit));
            case SIMPLE_LIMITS -> isSimpleLimit(lowerLimit) && isSimpleLimit(upperLimit);
            case DISABLED -> false;
        };
    }

    public static SummationHeuristic from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PERMISSIVE;
        }
        String normalized = raw.trim().replace('-', '_');
        for (SummationHeuristic heuristic : values()) {
            if (heuristic.name().equalsIgnoreCase(normalized)) {
                return heuristic;
            }
        }
        throw new IllegalArgumentException("Unsupported integral heuristic: " + raw);
    }

    private static boolean isSimpleLimit(String limit) {
        if (limit.codePointCount(0, limit.length()) != 1) {
            return false;
        }
        return Character.isLetterOrDigit(limit.codePointAt(0));
    }
}
