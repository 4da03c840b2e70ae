package model;

import java.util.Objects;

/**
 * Immutable {@link InitialModelBlock}.
 */
public final class DefaultInitialModelBlock implements InitialModelBlock {
    private final int numVariables;
    private final int numConstraints;
    private final boolean optimization;

    public DefaultInitialModelBlock(int numVariables, int numConstraints, boolean optimization) {
        if (numVariables < 0 || numConstraints < 0) {
            throw new IllegalArgumentException("Model sizes must be non-negative");
        }
        this.numVariables = numVariables;
        this.numConstraints = numConstraints;
        this.optimization = optimization;
    }

    @Override
    public int getNumVariables() {
        return numVariables;
    }

    @Override
    public int getNumConstraints() {
        return numConstraints;
    }

    @Override
    public boolean isOptimization() {
        return optimization;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DefaultInitialModelBlock that = (DefaultInitialModelBlock) o;
        return numVariables == that.numVariables
            && numConstraints == that.numConstraints
            && optimization == that.optimization;
    }

    @Override
    public int hashCode() {
        return Objects.hash(numVariables, numConstraints, optimization);
    }

    @Override
    public String toString() {
        return "InitialModelBlock{variables=" + numVariables + ", constraints=" + numConstraints
            + ", optimization=" + optimization + '}';
    }
}
