package model;

import java.util.Objects;

/**
 * Immutable {@link SearchProgressBlock} holding a pre-built progress series.
 */
public final class DefaultSearchProgressBlock implements SearchProgressBlock {
    private final double presolveTime;
    private final ProgressSeries series;

    public DefaultSearchProgressBlock(double presolveTime, ProgressSeries series) {
        this.presolveTime = presolveTime;
        this.series = series != null ? series : ProgressSeries.empty();
    }

    @Override
    public double getPresolveTime() {
        return presolveTime;
    }

    @Override
    public ProgressSeries getProgressSeries() {
        return series;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DefaultSearchProgressBlock that = (DefaultSearchProgressBlock) o;
        return Double.compare(presolveTime, that.presolveTime) == 0 && series.equals(that.series);
    }

    @Override
    public int hashCode() {
        return Objects.hash(presolveTime, series);
    }

    @Override
    public String toString() {
        return "SearchProgressBlock{presolveTime=" + presolveTime + ", points=" + series.size() + '}';
    }
}
