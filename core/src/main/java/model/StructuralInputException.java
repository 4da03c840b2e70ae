package model;

/**
 * Thrown when a block that is present lacks a field the whole overview is anchored on,
 * e.g. a response block without a {@code status}. The overview is withheld as a whole:
 * the log is most likely truncated or was edited by hand.
 */
public class StructuralInputException extends Exception {

    private final BlockKind blockKind;
    private final String fieldName;

    public StructuralInputException(BlockKind blockKind, String fieldName, String message) {
        super(describe(blockKind, fieldName, message));
        this.blockKind = blockKind;
        this.fieldName = fieldName;
    }

    public StructuralInputException(BlockKind blockKind, String fieldName, String message, Throwable cause) {
        super(describe(blockKind, fieldName, message), cause);
        this.blockKind = blockKind;
        this.fieldName = fieldName;
    }

    public BlockKind getBlockKind() {
        return blockKind;
    }

    /**
     * @return name of the offending field, or null if the error concerns the block as a whole
     */
    public String getFieldName() {
        return fieldName;
    }

    private static String describe(BlockKind blockKind, String fieldName, String message) {
        if (fieldName == null) {
            return String.format("[%s] %s", blockKind.getDisplayName(), message);
        }
        return String.format("[%s] %s: %s", blockKind.getDisplayName(), fieldName, message);
    }
}
