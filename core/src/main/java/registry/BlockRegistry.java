package registry;

import model.BlockKind;
import model.LogBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Lookup of zero-or-one block per {@link BlockKind} over the flat block list of one log.
 *
 * <p>Built once per overview and read-only afterwards. Duplicate kinds are resolved
 * by a {@link DuplicateBlockPolicy}. Blocks whose declared kind does not match the
 * contract they implement are skipped. Every tolerated problem is logged and kept as a
 * {@link BlockAnomaly} so the caller can surface it.
 */
public final class BlockRegistry {
    private static final Logger logger = Logger.getLogger(BlockRegistry.class.getName());

    private final Map<BlockKind, LogBlock> blocks;
    private final List<BlockAnomaly> anomalies;

    private BlockRegistry(Map<BlockKind, LogBlock> blocks, List<BlockAnomaly> anomalies) {
        this.blocks = blocks;
        this.anomalies = anomalies;
    }

    public static BlockRegistry empty() {
        return new BlockRegistry(new EnumMap<>(BlockKind.class), Collections.emptyList());
    }

    /**
     * Indexes blocks by kind.
     *
     * @param blocks parsed blocks in log order; null and mislabeled entries are skipped
     * @param policy how to resolve a kind that occurs more than once
     * @return the registry
     * @throws DuplicateBlockException if a kind repeats and the policy is {@link DuplicateBlockPolicy#FAIL}
     */
    public static BlockRegistry of(List<? extends LogBlock> blocks, DuplicateBlockPolicy policy)
            throws DuplicateBlockException {
        Objects.requireNonNull(policy, "policy cannot be null");
        if (blocks == null || blocks.isEmpty()) {
            return empty();
        }

        Map<BlockKind, List<LogBlock>> byKind = new EnumMap<>(BlockKind.class);
        List<BlockAnomaly> anomalies = new ArrayList<>();
        for (LogBlock block : blocks) {
            if (block == null) {
                logger.warning("Skipping null block in block collection");
                continue;
            }
            BlockKind kind = block.getKind();
            if (kind == null || !kind.getBlockType().isInstance(block)) {
                BlockAnomaly anomaly = BlockAnomaly.mislabeled(kind, block.getClass().getName());
                logger.warning(anomaly.describe());
                anomalies.add(anomaly);
                continue;
            }
            byKind.computeIfAbsent(kind, k -> new ArrayList<>()).add(block);
        }

        Map<BlockKind, LogBlock> resolved = new EnumMap<>(BlockKind.class);
        for (Map.Entry<BlockKind, List<LogBlock>> entry : byKind.entrySet()) {
            BlockKind kind = entry.getKey();
            List<LogBlock> occurrences = entry.getValue();
            if (occurrences.size() == 1) {
                resolved.put(kind, occurrences.get(0));
                continue;
            }

            if (policy == DuplicateBlockPolicy.FAIL) {
                throw new DuplicateBlockException(kind, occurrences.size());
            }
            int keptIndex = policy == DuplicateBlockPolicy.FIRST ? 0 : occurrences.size() - 1;
            BlockAnomaly anomaly = new BlockAnomaly(kind, occurrences.size(), keptIndex);
            logger.warning(anomaly.describe());
            anomalies.add(anomaly);
            resolved.put(kind, occurrences.get(keptIndex));
        }

        return new BlockRegistry(resolved, Collections.unmodifiableList(anomalies));
    }

    public Optional<LogBlock> lookup(BlockKind kind) {
        return Optional.ofNullable(blocks.get(kind));
    }

    /**
     * Typed lookup, e.g. {@code registry.lookup(SolverBlock.class)}.
     */
    public <T extends LogBlock> Optional<T> lookup(Class<T> type) {
        BlockKind kind = BlockKind.forType(type);
        return lookup(kind).map(type::cast);
    }

    public boolean contains(BlockKind kind) {
        return blocks.containsKey(kind);
    }

    public int size() {
        return blocks.size();
    }

    public List<BlockAnomaly> getAnomalies() {
        return anomalies;
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }
}
