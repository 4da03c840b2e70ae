package registry;

import model.BlockKind;
import model.StructuralInputException;

/**
 * Thrown by {@link BlockRegistry} under {@link DuplicateBlockPolicy#FAIL} when a block kind occurs more than once.
 */
public class DuplicateBlockException extends StructuralInputException {

    private final int occurrences;

    public DuplicateBlockException(BlockKind blockKind, int occurrences) {
        super(blockKind, null, "expected at most one block, found " + occurrences);
        this.occurrences = occurrences;
    }

    public int getOccurrences() {
        return occurrences;
    }
}
