package registry;

/**
 * What the registry does when a log contains more than one block of the same kind.
 */
public enum DuplicateBlockPolicy {
    /** Keep the first occurrence and record an anomaly. */
    FIRST,
    /** Keep the last occurrence and record an anomaly. */
    LAST,
    /** Reject the log with a {@link DuplicateBlockException}. */
    FAIL;

    /**
     * Parses a policy name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a policy
     */
    public static DuplicateBlockPolicy parse(String name) {
        if (name == null || name.isBlank()) {
            return FIRST;
        }
        try {
            return valueOf(name.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                String.format("Unknown duplicate block policy: '%s'. Valid values: first, last, fail", name), e);
        }
    }
}
