package metric;

import model.InitialModelBlock;

import java.util.Optional;

/**
 * Size and type of the initial model.
 */
public final class ModelMetrics {

    private ModelMetrics() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static MetricValue variables(Optional<InitialModelBlock> model) {
        return model
            .map(m -> MetricValue.present(m.getNumVariables(), MetricFormat.integer(m.getNumVariables())))
            .orElseGet(() -> MetricValue.absent("no initial model block"));
    }

    public static MetricValue constraints(Optional<InitialModelBlock> model) {
        return model
            .map(m -> MetricValue.present(m.getNumConstraints(), MetricFormat.integer(m.getNumConstraints())))
            .orElseGet(() -> MetricValue.absent("no initial model block"));
    }

    public static MetricValue modelType(Optional<InitialModelBlock> model) {
        return model
            .map(m -> ModelType.of(m.isOptimization()))
            .map(type -> MetricValue.present(type, type.getDisplayName()))
            .orElseGet(() -> MetricValue.absent("no initial model block"));
    }
}
