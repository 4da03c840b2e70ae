package metric;

import model.InitialModelBlock;
import model.PresolveSummaryBlock;
import model.ResponseBlock;
import model.SearchProgressBlock;
import model.SolverBlock;
import model.StructuralInputException;
import registry.BlockRegistry;

import java.util.Objects;
import java.util.Optional;

/**
 * The blocks of one log, looked up once per kind, as seen by the metric derivers.
 */
public final class BlockSnapshot {
    private final Optional<SolverBlock> solver;
    private final Optional<InitialModelBlock> initialModel;
    private final Optional<SearchProgressBlock> searchProgress;
    private final Optional<PresolveSummaryBlock> presolveSummary;
    private final ResponseSnapshot response;

    public BlockSnapshot(Optional<SolverBlock> solver,
                         Optional<InitialModelBlock> initialModel,
                         Optional<SearchProgressBlock> searchProgress,
                         Optional<PresolveSummaryBlock> presolveSummary,
                         ResponseSnapshot response) {
        this.solver = Objects.requireNonNull(solver);
        this.initialModel = Objects.requireNonNull(initialModel);
        this.searchProgress = Objects.requireNonNull(searchProgress);
        this.presolveSummary = Objects.requireNonNull(presolveSummary);
        this.response = Objects.requireNonNull(response);
    }

    /**
     * Looks up every block kind once and validates the response anchor.
     *
     * @throws StructuralInputException if the response block is present but has no readable status
     */
    public static BlockSnapshot from(BlockRegistry registry) throws StructuralInputException {
        return new BlockSnapshot(
            registry.lookup(SolverBlock.class),
            registry.lookup(InitialModelBlock.class),
            registry.lookup(SearchProgressBlock.class),
            registry.lookup(PresolveSummaryBlock.class),
            ResponseSnapshot.of(registry.lookup(ResponseBlock.class)));
    }

    public Optional<SolverBlock> getSolver() {
        return solver;
    }

    public Optional<InitialModelBlock> getInitialModel() {
        return initialModel;
    }

    public Optional<SearchProgressBlock> getSearchProgress() {
        return searchProgress;
    }

    public Optional<PresolveSummaryBlock> getPresolveSummary() {
        return presolveSummary;
    }

    public ResponseSnapshot getResponse() {
        return response;
    }
}
