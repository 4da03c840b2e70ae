package model;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Final {@code CpSolverResponse} summary.
 *
 * <p>Fields are exposed as a flat map of raw tokens. Numeric fields may hold
 * non-numeric text such as {@code "inf"} when the solver had no value to report.
 */
public interface ResponseBlock extends LogBlock {

    String STATUS = "status";
    String OBJECTIVE = "objective";
    String BEST_BOUND = "best_bound";
    String WALL_TIME = "walltime";

    @Override
    default BlockKind getKind() {
        return BlockKind.RESPONSE;
    }

    /**
     * @return an unmodifiable view of the response fields, keyed by field name
     */
    Map<String, String> toMap();

    /**
     * Returns the optimality gap in percent as the solver defines it.
     *
     * @return the gap, or empty if the response does not carry enough information
     * @throws NumberFormatException if a field the gap depends on is present but not numeric
     */
    OptionalDouble getGap();
}
