package metric;

import model.PresolveSummaryBlock;

import java.util.Optional;

/**
 * Whether presolve alone solved the instance. Not reported at all without a presolve summary.
 */
public final class PresolveOutcome {

    private PresolveOutcome() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static Optional<Boolean> solvedByPresolve(Optional<PresolveSummaryBlock> presolveSummary) {
        return presolveSummary.map(PresolveSummaryBlock::isSolvedByPresolve);
    }
}
