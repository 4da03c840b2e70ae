package model;

/**
 * Presolve summary section of the log.
 */
public interface PresolveSummaryBlock extends LogBlock {

    @Override
    default BlockKind getKind() {
        return BlockKind.PRESOLVE_SUMMARY;
    }

    /**
     * @return true if presolve alone decided the instance and no search was needed
     */
    boolean isSolvedByPresolve();
}
