package model;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Time-ordered bound/objective trajectory of a search.
 */
public final class ProgressSeries {
    private static final ProgressSeries EMPTY = new ProgressSeries(Collections.emptyList());

    private final List<ProgressPoint> points;

    private ProgressSeries(List<ProgressPoint> points) {
        this.points = points;
    }

    public static ProgressSeries empty() {
        return EMPTY;
    }

    /**
     * Creates a series from samples in any order; samples are sorted by time.
     */
    public static ProgressSeries of(List<ProgressPoint> points) {
        if (points == null || points.isEmpty()) {
            return EMPTY;
        }
        return new ProgressSeries(points.stream()
            .sorted(Comparator.comparingDouble(ProgressPoint::getTime))
            .collect(Collectors.toUnmodifiableList()));
    }

    public List<ProgressPoint> getPoints() {
        return points;
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return points.equals(((ProgressSeries) o).points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }
}
