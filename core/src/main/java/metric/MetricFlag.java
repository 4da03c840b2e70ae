package metric;

/**
 * Secondary marker attached to a metric value, rendered next to it.
 */
public enum MetricFlag {
    NONE(""),
    /** Solver version is recent enough. */
    CURRENT("current"),
    /** Solver version predates known performance fixes. */
    OUTDATED("outdated"),
    /** Version could not be determined, so it may be outdated. */
    STALE_WARNING("unknown version");

    private final String label;

    MetricFlag(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isWarning() {
        return this == OUTDATED || this == STALE_WARNING;
    }
}
