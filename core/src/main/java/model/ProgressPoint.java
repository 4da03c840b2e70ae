package model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One sample of the search trajectory: wall time plus the objective and bound known at that time.
 * Either value may be missing, e.g. a bound improvement logged before the first solution.
 */
public final class ProgressPoint {
    private final double time;
    private final Double objective;
    private final Double bound;

    public ProgressPoint(double time, Double objective, Double bound) {
        if (Double.isNaN(time) || time < 0) {
            throw new IllegalArgumentException("Progress time must be a non-negative number: " + time);
        }
        this.time = time;
        this.objective = objective;
        this.bound = bound;
    }

    public double getTime() {
        return time;
    }

    public OptionalDouble getObjective() {
        return objective != null ? OptionalDouble.of(objective) : OptionalDouble.empty();
    }

    public OptionalDouble getBound() {
        return bound != null ? OptionalDouble.of(bound) : OptionalDouble.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProgressPoint that = (ProgressPoint) o;
        return Double.compare(time, that.time) == 0
            && Objects.equals(objective, that.objective)
            && Objects.equals(bound, that.bound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, objective, bound);
    }

    @Override
    public String toString() {
        return "ProgressPoint{time=" + time + ", objective=" + objective + ", bound=" + bound + '}';
    }
}
