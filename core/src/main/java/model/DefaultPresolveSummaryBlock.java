package model;

/**
 * Immutable {@link PresolveSummaryBlock}.
 */
public final class DefaultPresolveSummaryBlock implements PresolveSummaryBlock {
    private final boolean solvedByPresolve;

    public DefaultPresolveSummaryBlock(boolean solvedByPresolve) {
        this.solvedByPresolve = solvedByPresolve;
    }

    @Override
    public boolean isSolvedByPresolve() {
        return solvedByPresolve;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return solvedByPresolve == ((DefaultPresolveSummaryBlock) o).solvedByPresolve;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(solvedByPresolve);
    }

    @Override
    public String toString() {
        return "PresolveSummaryBlock{solvedByPresolve=" + solvedByPresolve + '}';
    }
}
