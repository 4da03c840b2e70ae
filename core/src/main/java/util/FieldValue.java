package util;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Result of reading a field from a block: either {@code Parsed(value)} or {@code Unavailable(reason)}.
 *
 * <p>Absence is carried in the value itself instead of an exception, so callers
 * have to decide what an unavailable field means for them.
 *
 * @param <T> type of the parsed value
 */
public final class FieldValue<T> {
    private final T value;
    private final String reason;

    private FieldValue(T value, String reason) {
        this.value = value;
        this.reason = reason;
    }

    public static <T> FieldValue<T> parsed(T value) {
        return new FieldValue<>(Objects.requireNonNull(value, "Parsed value cannot be null"), null);
    }

    public static <T> FieldValue<T> unavailable(String reason) {
        return new FieldValue<>(null, reason != null ? reason : "unavailable");
    }

    public boolean isParsed() {
        return value != null;
    }

    public boolean isUnavailable() {
        return value == null;
    }

    /**
     * @throws NoSuchElementException if the field is unavailable
     */
    public T get() {
        if (value == null) {
            throw new NoSuchElementException("Field unavailable: " + reason);
        }
        return value;
    }

    public T orElse(T other) {
        return value != null ? value : other;
    }

    /**
     * @return why the field is unavailable, or null if it was parsed
     */
    public String getReason() {
        return reason;
    }

    public <R> FieldValue<R> map(Function<? super T, ? extends R> mapper) {
        if (value == null) {
            return unavailable(reason);
        }
        return parsed(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldValue<?> that = (FieldValue<?>) o;
        return Objects.equals(value, that.value) && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, reason);
    }

    @Override
    public String toString() {
        return value != null ? "Parsed(" + value + ")" : "Unavailable(" + reason + ")";
    }
}
