package metric;

/**
 * Computes one metric from the blocks of a log.
 *
 * <p>Implementations are pure and total: every combination of present and absent
 * blocks yields a value, and soft failures come back as {@link MetricValue#unavailable(String)}
 * rather than exceptions. Derivers share no state, so they may run in any order or concurrently.
 */
@FunctionalInterface
public interface MetricDeriver {

    MetricValue derive(BlockSnapshot blocks);
}
