package metric;

import model.ProgressPoint;
import model.ProgressSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Chart model of the objective and bound trajectory over time.
 */
public final class SearchProgressChart {
    public static final String TITLE = "Search Progress";
    public static final String X_AXIS = "Time (s)";
    public static final String Y_AXIS = "Value";

    private final ChartTrace objective;
    private final ChartTrace bound;

    private SearchProgressChart(ChartTrace objective, ChartTrace bound) {
        this.objective = objective;
        this.bound = bound;
    }

    /**
     * Splits the series into an objective trace and a bound trace.
     *
     * @param series the progress series
     * @return the chart, empty if no sample carries an objective or a bound
     */
    public static Optional<SearchProgressChart> from(ProgressSeries series) {
        List<Double> objectiveX = new ArrayList<>();
        List<Double> objectiveY = new ArrayList<>();
        List<Double> boundX = new ArrayList<>();
        List<Double> boundY = new ArrayList<>();

        for (ProgressPoint point : series.getPoints()) {
            point.getObjective().ifPresent(value -> {
                objectiveX.add(point.getTime());
                objectiveY.add(value);
            });
            point.getBound().ifPresent(value -> {
                boundX.add(point.getTime());
                boundY.add(value);
            });
        }

        if (objectiveX.isEmpty() && boundX.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SearchProgressChart(
            new ChartTrace("Objective", objectiveX, objectiveY),
            new ChartTrace("Bound", boundX, boundY)));
    }

    public String getTitle() {
        return TITLE;
    }

    public String getXAxisLabel() {
        return X_AXIS;
    }

    public String getYAxisLabel() {
        return Y_AXIS;
    }

    public ChartTrace getObjective() {
        return objective;
    }

    public ChartTrace getBound() {
        return bound;
    }

    public List<ChartTrace> getTraces() {
        return List.of(objective, bound);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SearchProgressChart that = (SearchProgressChart) o;
        return objective.equals(that.objective) && bound.equals(that.bound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(objective, bound);
    }
}
