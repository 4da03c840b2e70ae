package metric;

import model.SolverVersion;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Binds every {@link MetricKey} to the deriver that computes it.
 */
public final class MetricCatalog {
    private final Map<MetricKey, MetricDeriver> derivers;

    private MetricCatalog(Map<MetricKey, MetricDeriver> derivers) {
        this.derivers = derivers;
    }

    /**
     * @param outdatedBefore solver versions older than this are flagged outdated
     */
    public static MetricCatalog standard(SolverVersion outdatedBefore) {
        Objects.requireNonNull(outdatedBefore, "outdatedBefore cannot be null");
        Map<MetricKey, MetricDeriver> derivers = new EnumMap<>(MetricKey.class);
        derivers.put(MetricKey.SOLVER_VERSION, blocks -> SolverMetrics.version(blocks.getSolver(), outdatedBefore));
        derivers.put(MetricKey.WORKERS, blocks -> SolverMetrics.workers(blocks.getSolver()));
        derivers.put(MetricKey.STATUS, blocks -> StatusMetrics.status(blocks.getResponse()));
        derivers.put(MetricKey.WALL_TIME, blocks -> StatusMetrics.wallTime(blocks.getResponse()));
        derivers.put(MetricKey.PRESOLVE_TIME, blocks -> StatusMetrics.presolveTime(blocks.getSearchProgress()));
        derivers.put(MetricKey.VARIABLES, blocks -> ModelMetrics.variables(blocks.getInitialModel()));
        derivers.put(MetricKey.CONSTRAINTS, blocks -> ModelMetrics.constraints(blocks.getInitialModel()));
        derivers.put(MetricKey.MODEL_TYPE, blocks -> ModelMetrics.modelType(blocks.getInitialModel()));
        derivers.put(MetricKey.OBJECTIVE, blocks -> ObjectiveMetrics.objective(blocks.getResponse()));
        derivers.put(MetricKey.BEST_BOUND, blocks -> ObjectiveMetrics.bestBound(blocks.getResponse()));
        derivers.put(MetricKey.GAP, blocks -> ObjectiveMetrics.gap(blocks.getResponse()));
        return new MetricCatalog(Collections.unmodifiableMap(derivers));
    }

    /**
     * @return derivers keyed in {@link MetricKey} declaration order
     */
    public Map<MetricKey, MetricDeriver> getDerivers() {
        return derivers;
    }
}
