package model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Входной снимок одного лога: упорядоченный список разобранных блоков
 * и свободные строки комментариев, относящиеся к логу целиком.
 *
 * <p>Объект является неизменяемым (immutable).
 */
public final class LogDocument {
    private final List<LogBlock> blocks;
    private final List<String> comments;

    public LogDocument(List<? extends LogBlock> blocks, List<String> comments) {
        // List.copyOf rejects nulls; the registry is the place that reports null blocks
        this.blocks = blocks != null
            ? Collections.unmodifiableList(new ArrayList<>(blocks))
            : Collections.emptyList();
        this.comments = comments != null
            ? List.copyOf(comments)
            : Collections.emptyList();
    }

    public static LogDocument of(List<? extends LogBlock> blocks) {
        return new LogDocument(blocks, null);
    }

    public List<LogBlock> getBlocks() {
        return blocks;
    }

    public List<String> getComments() {
        return comments;
    }

    public boolean hasComments() {
        return !comments.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LogDocument that = (LogDocument) o;
        return blocks.equals(that.blocks) && comments.equals(that.comments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blocks, comments);
    }
}
