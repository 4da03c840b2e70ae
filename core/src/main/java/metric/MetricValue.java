package metric;

import java.util.Objects;

/**
 * Display-ready value of one metric.
 *
 * <p>A metric is always renderable: when its block is missing ({@link State#ABSENT})
 * or a field failed to parse ({@link State#UNAVAILABLE}) the display text is the
 * {@link #UNKNOWN_DISPLAY} sentinel, so presentation code never has to check for missing blocks.
 */
public final class MetricValue {

    public static final String UNKNOWN_DISPLAY = "N/A";

    public enum State {
        /** Value derived from the blocks. */
        PRESENT,
        /** A block or field the metric depends on does not exist. */
        ABSENT,
        /** The input exists but could not be interpreted. */
        UNAVAILABLE
    }

    private final State state;
    private final Object value;
    private final String display;
    private final MetricFlag flag;
    private final String reason;

    private MetricValue(State state, Object value, String display, MetricFlag flag, String reason) {
        this.state = state;
        this.value = value;
        this.display = display;
        this.flag = flag != null ? flag : MetricFlag.NONE;
        this.reason = reason;
    }

    public static MetricValue present(Object value, String display) {
        return present(value, display, MetricFlag.NONE);
    }

    public static MetricValue present(Object value, String display, MetricFlag flag) {
        Objects.requireNonNull(value, "Present metric value cannot be null");
        return new MetricValue(State.PRESENT, value, Objects.requireNonNull(display), flag, null);
    }

    public static MetricValue absent(String reason) {
        return absent(reason, MetricFlag.NONE);
    }

    public static MetricValue absent(String reason, MetricFlag flag) {
        return new MetricValue(State.ABSENT, null, UNKNOWN_DISPLAY, flag, reason);
    }

    public static MetricValue unavailable(String reason) {
        return new MetricValue(State.UNAVAILABLE, null, UNKNOWN_DISPLAY, MetricFlag.NONE, reason);
    }

    public State getState() {
        return state;
    }

    public boolean isKnown() {
        return state == State.PRESENT;
    }

    /**
     * @return the typed value, or null unless {@link #isKnown()}
     */
    public Object getValue() {
        return value;
    }

    public String getDisplay() {
        return display;
    }

    public MetricFlag getFlag() {
        return flag;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MetricValue that = (MetricValue) o;
        return state == that.state
            && Objects.equals(value, that.value)
            && display.equals(that.display)
            && flag == that.flag
            && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value, display, flag, reason);
    }

    @Override
    public String toString() {
        return "MetricValue{" + state + ", display='" + display + "'"
            + (flag != MetricFlag.NONE ? ", flag=" + flag : "")
            + (reason != null ? ", reason='" + reason + "'" : "") + '}';
    }
}
