package metric;

import model.ResponseBlock;
import model.SearchProgressBlock;
import model.SolverStatus;
import util.FieldValue;
import util.NumberParser;

import java.util.Optional;

/**
 * Status, total wall time and presolve time of the run.
 */
public final class StatusMetrics {

    private StatusMetrics() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static MetricValue status(ResponseSnapshot response) {
        if (response.getStatus().isEmpty()) {
            return MetricValue.absent("no response block");
        }
        SolverStatus status = response.getStatus().get();
        return MetricValue.present(status, status.name());
    }

    public static MetricValue wallTime(ResponseSnapshot response) {
        if (!response.isPresent()) {
            return MetricValue.absent("no response block");
        }
        Optional<String> token = response.field(ResponseBlock.WALL_TIME);
        if (token.isEmpty()) {
            return MetricValue.absent("wall time not reported");
        }
        FieldValue<Double> seconds = NumberParser.parseDecimal(token.get());
        if (seconds.isUnavailable()) {
            return MetricValue.unavailable(ResponseBlock.WALL_TIME + ": " + seconds.getReason());
        }
        return MetricValue.present(seconds.get(), MetricFormat.seconds(seconds.get()));
    }

    public static MetricValue presolveTime(Optional<SearchProgressBlock> searchProgress) {
        if (searchProgress.isEmpty()) {
            return MetricValue.absent("no search progress block");
        }
        double seconds = searchProgress.get().getPresolveTime();
        if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            return MetricValue.unavailable("presolve time is not a finite number");
        }
        return MetricValue.present(seconds, MetricFormat.seconds(seconds));
    }
}
