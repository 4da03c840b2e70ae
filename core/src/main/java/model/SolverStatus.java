package model;

import java.util.Locale;
import java.util.Optional;

/**
 * Итоговые статусы решателя CP-SAT.
 * Определяет описание каждого статуса и признак наличия найденного решения.
 */
public enum SolverStatus {
    UNKNOWN("The solver timed out before finding a solution or proving infeasibility."),
    OPTIMAL("The solver found an optimal solution. This is the best possible status."),
    FEASIBLE("The solver found a feasible solution, but it is not guaranteed to be optimal."),
    INFEASIBLE("The solver proved that the problem is infeasible. This often indicates a bug in the model."),
    MODEL_INVALID("Definitely a bug. Should rarely happen.");

    private final String description;

    SolverStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return true if the run ended with a solution in hand
     */
    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }

    /**
     * Распознает статус по токену из лога, без учета регистра и пробелов по краям.
     *
     * @param token токен статуса
     * @return статус, либо пустое значение если токен не распознан
     */
    public static Optional<SolverStatus> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        for (SolverStatus status : values()) {
            if (status.name().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
