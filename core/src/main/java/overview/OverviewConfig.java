package overview;

import metric.SolverMetrics;
import model.SolverVersion;
import registry.DuplicateBlockPolicy;

/**
 * Settings of {@link OverviewAssembler}.
 */
public final class OverviewConfig {
    private final DuplicateBlockPolicy duplicatePolicy;
    private final int maxParallelDerivers;
    private final SolverVersion outdatedBefore;

    private OverviewConfig(Builder builder) {
        this.duplicatePolicy = builder.duplicatePolicy != null ? builder.duplicatePolicy : DuplicateBlockPolicy.FIRST;
        this.maxParallelDerivers = builder.maxParallelDerivers > 0 ? builder.maxParallelDerivers : 1;
        this.outdatedBefore = builder.outdatedBefore != null
            ? builder.outdatedBefore
            : SolverMetrics.DEFAULT_OUTDATED_BEFORE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static OverviewConfig defaults() {
        return builder().build();
    }

    public DuplicateBlockPolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    /**
     * @return number of threads used to run metric derivers; 1 means sequential
     */
    public int getMaxParallelDerivers() {
        return maxParallelDerivers;
    }

    public SolverVersion getOutdatedBefore() {
        return outdatedBefore;
    }

    public boolean isParallel() {
        return maxParallelDerivers > 1;
    }

    public static final class Builder {
        private DuplicateBlockPolicy duplicatePolicy;
        private int maxParallelDerivers = 1;
        private SolverVersion outdatedBefore;

        private Builder() {
        }

        public Builder duplicatePolicy(DuplicateBlockPolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy;
            return this;
        }

        public Builder maxParallelDerivers(int maxParallelDerivers) {
            this.maxParallelDerivers = maxParallelDerivers;
            return this;
        }

        public Builder outdatedBefore(SolverVersion outdatedBefore) {
            this.outdatedBefore = outdatedBefore;
            return this;
        }

        public OverviewConfig build() {
            return new OverviewConfig(this);
        }
    }
}
