package model;

import java.util.Map;
import java.util.Optional;

/**
 * Solver header block: version banner, worker count and the parameters the run was started with.
 */
public interface SolverBlock extends LogBlock {

    @Override
    default BlockKind getKind() {
        return BlockKind.SOLVER;
    }

    /**
     * @return the raw version string as printed by the solver, e.g. {@code "9.10.4025"}
     */
    String getVersion();

    /**
     * @return the parsed semantic version
     * @throws IllegalArgumentException if the raw version string is not a dotted version
     */
    default SolverVersion getParsedVersion() {
        return SolverVersion.parse(getVersion());
    }

    Optional<Integer> getNumberOfWorkers();

    /**
     * @return parameter name to value, empty if the log did not list parameters
     */
    Map<String, Object> getParameters();
}
