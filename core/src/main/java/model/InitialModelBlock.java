package model;

/**
 * Statistics of the model as handed to the solver, before presolve.
 */
public interface InitialModelBlock extends LogBlock {

    @Override
    default BlockKind getKind() {
        return BlockKind.INITIAL_MODEL;
    }

    int getNumVariables();

    int getNumConstraints();

    /**
     * @return true if the model has an objective, false for a pure satisfaction model
     */
    boolean isOptimization();
}
