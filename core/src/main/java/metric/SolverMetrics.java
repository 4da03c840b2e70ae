package metric;

import model.SolverBlock;
import model.SolverVersion;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Metrics read from the solver header block: version staleness, worker count and parameters.
 */
public final class SolverMetrics {

    /** First release without the performance regressions of older 9.x versions. */
    public static final SolverVersion DEFAULT_OUTDATED_BEFORE = new SolverVersion(9, 10, 0);

    private SolverMetrics() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static MetricValue version(Optional<SolverBlock> solver) {
        return version(solver, DEFAULT_OUTDATED_BEFORE);
    }

    /**
     * Shows the raw version string, flagged {@link MetricFlag#OUTDATED} if it is older than
     * {@code outdatedBefore}. Without a solver block the version is unknown and flagged
     * {@link MetricFlag#STALE_WARNING}.
     */
    public static MetricValue version(Optional<SolverBlock> solver, SolverVersion outdatedBefore) {
        if (solver.isEmpty()) {
            return MetricValue.absent("no solver block", MetricFlag.STALE_WARNING);
        }
        SolverBlock block = solver.get();
        String raw = block.getVersion();
        if (raw == null) {
            return MetricValue.absent("solver block has no version", MetricFlag.STALE_WARNING);
        }

        SolverVersion parsed;
        try {
            parsed = block.getParsedVersion();
        } catch (IllegalArgumentException e) {
            return MetricValue.unavailable(e.getMessage());
        }
        MetricFlag flag = parsed.isOlderThan(outdatedBefore) ? MetricFlag.OUTDATED : MetricFlag.CURRENT;
        return MetricValue.present(raw, raw, flag);
    }

    public static MetricValue workers(Optional<SolverBlock> solver) {
        if (solver.isEmpty()) {
            return MetricValue.absent("no solver block");
        }
        return solver.get().getNumberOfWorkers()
            .map(workers -> MetricValue.present(workers, MetricFormat.integer(workers)))
            .orElseGet(() -> MetricValue.absent("worker count not logged"));
    }

    /**
     * @return the solver parameters; empty means "no parameters", whether the block is missing or
     *         the run used defaults only
     */
    public static Map<String, Object> parameters(Optional<SolverBlock> solver) {
        return solver
            .map(SolverBlock::getParameters)
            .filter(parameters -> !parameters.isEmpty())
            .orElse(Collections.emptyMap());
    }
}
