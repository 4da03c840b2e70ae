package registry;

import model.BlockKind;

import java.util.Objects;

/**
 * A data-integrity problem the registry tolerated: a block kind that occurred more than once,
 * or a block whose declared kind does not match what it implements.
 */
public final class BlockAnomaly {

    public enum Type {
        /** The kind occurred more than once; one occurrence was kept. */
        DUPLICATE,
        /** The block declared no kind, or a kind whose contract it does not implement; it was skipped. */
        MISLABELED
    }

    private final Type type;
    private final BlockKind kind;
    private final int occurrences;
    private final int keptIndex;
    private final String blockType;

    private BlockAnomaly(Type type, BlockKind kind, int occurrences, int keptIndex, String blockType) {
        this.type = type;
        this.kind = kind;
        this.occurrences = occurrences;
        this.keptIndex = keptIndex;
        this.blockType = blockType;
    }

    public BlockAnomaly(BlockKind kind, int occurrences, int keptIndex) {
        this(Type.DUPLICATE, Objects.requireNonNull(kind, "Kind cannot be null"), occurrences, keptIndex, null);
    }

    /**
     * @param claimedKind kind the block declared, null if it declared none
     * @param blockType class name of the offending block
     */
    public static BlockAnomaly mislabeled(BlockKind claimedKind, String blockType) {
        return new BlockAnomaly(Type.MISLABELED, claimedKind, 1, -1,
            Objects.requireNonNull(blockType, "Block type cannot be null"));
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the duplicated kind, or the kind a mislabeled block claimed (null if it claimed none)
     */
    public BlockKind getKind() {
        return kind;
    }

    public int getOccurrences() {
        return occurrences;
    }

    /**
     * @return zero-based occurrence that was kept, -1 for a skipped mislabeled block
     */
    public int getKeptIndex() {
        return keptIndex;
    }

    public String describe() {
        if (type == Type.MISLABELED) {
            if (kind == null) {
                return String.format("Skipped a block of type %s that declares no block kind.", blockType);
            }
            return String.format("Skipped a block of type %s that claims to be '%s' but does not provide its fields.",
                blockType, kind.getDisplayName());
        }
        return String.format("Found %d '%s' blocks, using occurrence #%d. The log may be duplicated or malformed.",
            occurrences, kind.getDisplayName(), keptIndex + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BlockAnomaly that = (BlockAnomaly) o;
        return type == that.type
            && occurrences == that.occurrences
            && keptIndex == that.keptIndex
            && kind == that.kind
            && Objects.equals(blockType, that.blockType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, kind, occurrences, keptIndex, blockType);
    }

    @Override
    public String toString() {
        return describe();
    }
}
