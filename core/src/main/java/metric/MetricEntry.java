package metric;

import java.util.Objects;

/**
 * One labelled line of the overview: label, value and help text.
 */
public final class MetricEntry {
    private final MetricKey key;
    private final MetricValue value;

    public MetricEntry(MetricKey key, MetricValue value) {
        this.key = Objects.requireNonNull(key, "Key cannot be null");
        this.value = Objects.requireNonNull(value, "Value cannot be null");
    }

    public MetricKey getKey() {
        return key;
    }

    public String getLabel() {
        return key.getLabel();
    }

    public MetricValue getValue() {
        return value;
    }

    public String getHelp() {
        return key.getHelp();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MetricEntry that = (MetricEntry) o;
        return key == that.key && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key.getLabel() + ": " + value.getDisplay();
    }
}
