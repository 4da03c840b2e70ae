package model;

import util.NumberParser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Immutable {@link ResponseBlock} over the raw {@code key: value} lines of the response section.
 */
public final class DefaultResponseBlock implements ResponseBlock {
    private final Map<String, String> fields;

    public DefaultResponseBlock(Map<String, String> fields) {
        this.fields = fields != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
            : Collections.emptyMap();
    }

    @Override
    public Map<String, String> toMap() {
        return fields;
    }

    /**
     * Relative gap {@code 100 * |objective - bound| / max(1, |objective|)}, the way the
     * solver reports it for its own progress lines.
     */
    @Override
    public OptionalDouble getGap() {
        String objectiveToken = fields.get(OBJECTIVE);
        String boundToken = fields.get(BEST_BOUND);
        if (objectiveToken == null || boundToken == null) {
            return OptionalDouble.empty();
        }
        double objective = NumberParser.requireDecimal(OBJECTIVE, objectiveToken);
        double bound = NumberParser.requireDecimal(BEST_BOUND, boundToken);
        return OptionalDouble.of(100.0 * Math.abs(objective - bound) / Math.max(1.0, Math.abs(objective)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((DefaultResponseBlock) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ResponseBlock" + fields;
    }
}
