package metric;

import model.InitialModelBlock;
import model.ProgressSeries;
import model.SearchProgressBlock;
import model.SolverStatus;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Decides whether the search progress chart is shown and builds it.
 *
 * <p>A chart is produced only for an optimization model whose run ended OPTIMAL or
 * FEASIBLE and whose search progress block has at least one sample. A satisfaction
 * model has no objective/bound trajectory to plot. Any failed condition means no
 * chart, never an error.
 */
public final class SearchPlot {
    private static final Logger logger = Logger.getLogger(SearchPlot.class.getName());

    private SearchPlot() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean isEligible(ResponseSnapshot response,
                                     Optional<SearchProgressBlock> searchProgress,
                                     Optional<InitialModelBlock> initialModel) {
        return eligibleSeries(response, searchProgress, initialModel).isPresent();
    }

    public static Optional<SearchProgressChart> chart(ResponseSnapshot response,
                                                      Optional<SearchProgressBlock> searchProgress,
                                                      Optional<InitialModelBlock> initialModel) {
        return eligibleSeries(response, searchProgress, initialModel).flatMap(SearchProgressChart::from);
    }

    private static Optional<ProgressSeries> eligibleSeries(ResponseSnapshot response,
                                                           Optional<SearchProgressBlock> searchProgress,
                                                           Optional<InitialModelBlock> initialModel) {
        Optional<SolverStatus> status = response.getStatus();
        if (status.isEmpty() || !status.get().hasSolution()) {
            logger.fine("No search plot: run did not end OPTIMAL or FEASIBLE");
            return Optional.empty();
        }
        if (initialModel.isEmpty() || !initialModel.get().isOptimization()) {
            logger.fine("No search plot: not an optimization model");
            return Optional.empty();
        }
        if (searchProgress.isEmpty()) {
            logger.fine("No search plot: no search progress block");
            return Optional.empty();
        }
        ProgressSeries series = searchProgress.get().getProgressSeries();
        if (series == null || series.isEmpty()) {
            logger.fine("No search plot: search progress has no data points");
            return Optional.empty();
        }
        return Optional.of(series);
    }
}
