package model;

/**
 * Search progress section of the log: presolve timing and the objective/bound trajectory.
 */
public interface SearchProgressBlock extends LogBlock {

    @Override
    default BlockKind getKind() {
        return BlockKind.SEARCH_PROGRESS;
    }

    /**
     * @return time spent in presolve, in seconds
     */
    double getPresolveTime();

    /**
     * Builds the plottable bound/objective series.
     *
     * @return the series, empty if the log carries no progress events
     */
    ProgressSeries getProgressSeries();
}
