package metric;

/**
 * Classification of a model by whether it has an objective.
 */
public enum ModelType {
    OPTIMIZATION("Optimization"),
    SATISFACTION("Satisfaction");

    private final String displayName;

    ModelType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static ModelType of(boolean optimization) {
        return optimization ? OPTIMIZATION : SATISFACTION;
    }
}
