package metric;

import java.util.List;
import java.util.Objects;

/**
 * One named line of a chart: matching lists of x and y coordinates.
 */
public final class ChartTrace {
    private final String name;
    private final List<Double> x;
    private final List<Double> y;

    public ChartTrace(String name, List<Double> x, List<Double> y) {
        if (x.size() != y.size()) {
            throw new IllegalArgumentException("Trace '" + name + "' has " + x.size() + " x values but "
                + y.size() + " y values");
        }
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.x = List.copyOf(x);
        this.y = List.copyOf(y);
    }

    public String getName() {
        return name;
    }

    public List<Double> getX() {
        return x;
    }

    public List<Double> getY() {
        return y;
    }

    public boolean isEmpty() {
        return x.isEmpty();
    }

    public int size() {
        return x.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChartTrace that = (ChartTrace) o;
        return name.equals(that.name) && x.equals(that.x) && y.equals(that.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, x, y);
    }
}
