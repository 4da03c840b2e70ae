package overview;

import java.util.Objects;

/**
 * Advisory message shown below the metrics, e.g. that presolve alone solved the model.
 */
public final class Notice {

    public enum Level {
        INFO,
        WARNING
    }

    private final Level level;
    private final String message;

    public Notice(Level level, String message) {
        this.level = Objects.requireNonNull(level, "Level cannot be null");
        this.message = Objects.requireNonNull(message, "Message cannot be null");
    }

    public static Notice info(String message) {
        return new Notice(Level.INFO, message);
    }

    public static Notice warning(String message) {
        return new Notice(Level.WARNING, message);
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Notice notice = (Notice) o;
        return level == notice.level && message.equals(notice.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, message);
    }

    @Override
    public String toString() {
        return "[" + level + "] " + message;
    }
}
