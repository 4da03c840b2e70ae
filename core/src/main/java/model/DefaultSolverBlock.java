package model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link SolverBlock} backed by already extracted values.
 */
public final class DefaultSolverBlock implements SolverBlock {
    private final String version;
    private final Integer numberOfWorkers;
    private final Map<String, Object> parameters;

    public DefaultSolverBlock(String version, Integer numberOfWorkers, Map<String, Object> parameters) {
        this.version = Objects.requireNonNull(version, "Version cannot be null");
        this.numberOfWorkers = numberOfWorkers;
        // insertion order is the order the log printed the parameters in
        this.parameters = parameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
            : Collections.emptyMap();
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public Optional<Integer> getNumberOfWorkers() {
        return Optional.ofNullable(numberOfWorkers);
    }

    @Override
    public Map<String, Object> getParameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DefaultSolverBlock that = (DefaultSolverBlock) o;
        return version.equals(that.version)
            && Objects.equals(numberOfWorkers, that.numberOfWorkers)
            && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, numberOfWorkers, parameters);
    }

    @Override
    public String toString() {
        return "SolverBlock{version='" + version + "', workers=" + numberOfWorkers
            + ", parameters=" + parameters.size() + '}';
    }
}
