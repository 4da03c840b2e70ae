package metric;

import model.SolverStatus;

/**
 * Метрики обзора в порядке их вывода в отчете.
 *
 * <p>Каждая метрика несет подпись и справочный текст, которые показываются
 * рядом со значением независимо от того, известно ли само значение.
 */
public enum MetricKey {
    SOLVER_VERSION("CP-SAT Version",
        "CP-SAT has seen significant performance improvements over the last years. "
            + "Make sure to use the latest version."),
    WORKERS("Number of workers",
        "CP-SAT has different parallelization tiers, triggered by the number of workers. "
            + "More workers can improve performance. Find more information here: "
            + "https://github.com/google/or-tools/blob/main/ortools/sat/docs/troubleshooting.md"
            + "#improving-performance-with-multiple-workers"),
    STATUS("Status", statusHelp()),
    WALL_TIME("Time",
        "The total time spent by the solver. This includes the time spent in presolve "
            + "and the time spent in the search."),
    PRESOLVE_TIME("Presolve",
        "The time spent in presolve. This is usually a small fraction of the total time."),
    VARIABLES("Variables",
        "CP-SAT can handle (hundreds of) thousands of variables. This just gives a rough estimate "
            + "of the size of the problem. Check the initial optimization model for more information. "
            + "Many variables may also be removed during presolve, check the presolve summary."),
    CONSTRAINTS("Constraints",
        "CP-SAT can handle (hundreds of) thousands of constraints. More important than the number "
            + "is the type of constraints. Some constraints are more expensive than others. "
            + "Check the initial optimization model for more information."),
    MODEL_TYPE("Type", "Is the model an optimization or satisfaction model?"),
    OBJECTIVE("Objective", "Value of the best solution found."),
    BEST_BOUND("Best bound",
        "Bound on how good the best solution can be. If it matches the objective, the solution is optimal."),
    GAP("Gap",
        "The gap is the difference between the objective and the best bound. The smaller the better. "
            + "A gap of 0% means that the solution is optimal.");

    private final String label;
    private final String help;

    MetricKey(String label, String help) {
        this.label = label;
        this.help = help;
    }

    public String getLabel() {
        return label;
    }

    public String getHelp() {
        return help;
    }

    private static String statusHelp() {
        StringBuilder help = new StringBuilder("CP-SAT can have 5 different statuses:");
        for (SolverStatus status : SolverStatus.values()) {
            help.append("\n- ").append(status.name()).append(": ").append(status.getDescription());
        }
        return help.toString();
    }
}
