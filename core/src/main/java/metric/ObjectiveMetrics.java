package metric;

import model.ResponseBlock;
import util.FieldValue;
import util.NumberParser;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/**
 * Objective, best bound and gap of the final response.
 *
 * <p>The gap is requested from the response block and not recomputed from objective
 * and bound: the solver's own gap definition is not a plain {@code |objective - bound|}.
 */
public final class ObjectiveMetrics {
    private static final Logger logger = Logger.getLogger(ObjectiveMetrics.class.getName());

    private ObjectiveMetrics() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static MetricValue objective(ResponseSnapshot response) {
        return decimalField(response, ResponseBlock.OBJECTIVE);
    }

    public static MetricValue bestBound(ResponseSnapshot response) {
        return decimalField(response, ResponseBlock.BEST_BOUND);
    }

    public static MetricValue gap(ResponseSnapshot response) {
        Optional<ResponseBlock> block = response.getBlock();
        if (block.isEmpty()) {
            return MetricValue.absent("no response block");
        }

        OptionalDouble gap;
        try {
            gap = block.get().getGap();
        } catch (NumberFormatException | ArithmeticException e) {
            logger.fine("Gap not computable: " + e.getMessage());
            return MetricValue.unavailable("gap: " + e.getMessage());
        }
        if (gap == null || gap.isEmpty()) {
            return MetricValue.absent("gap not reported");
        }
        double value = gap.getAsDouble();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return MetricValue.unavailable("gap is not a finite number");
        }
        return MetricValue.present(value, MetricFormat.percent(value));
    }

    private static MetricValue decimalField(ResponseSnapshot response, String field) {
        if (!response.isPresent()) {
            return MetricValue.absent("no response block");
        }
        Optional<String> token = response.field(field);
        if (token.isEmpty()) {
            return MetricValue.absent(field + " not reported");
        }
        FieldValue<Double> parsed = NumberParser.parseDecimal(token.get());
        if (parsed.isUnavailable()) {
            return MetricValue.unavailable(field + ": " + parsed.getReason());
        }
        return MetricValue.present(parsed.get(), MetricFormat.decimal(parsed.get()));
    }
}
