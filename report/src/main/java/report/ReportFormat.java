package report;

import java.util.Locale;

/**
 * Поддерживаемые форматы вывода обзора.
 *
 * <ul>
 *   <li>{@link #CONSOLE} - вывод в консоль с цветами для быстрого просмотра</li>
 *   <li>{@link #JSON} - структурированный формат для программной обработки</li>
 * </ul>
 *
 * @since 1.0
 */
public enum ReportFormat {
    /**
     * Консольный вывод с ANSI цветами и форматированием.
     */
    CONSOLE("Console output with colors"),

    /**
     * JSON формат для программной обработки результатов.
     */
    JSON("JSON format");

    private final String description;

    ReportFormat(String description) {
        this.description = description;
    }

    /**
     * Возвращает описание формата отчета.
     *
     * @return текстовое описание формата
     */
    public String getDescription() {
        return description;
    }

    /**
     * Распознает формат по имени без учета регистра. Null и пустая строка трактуются как консоль.
     *
     * @param name имя формата
     * @return формат
     * @throws IllegalArgumentException если формат не распознан
     */
    public static ReportFormat parse(String name) {
        if (name == null || name.isBlank()) {
            return CONSOLE;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "console":
            case "text":
                return CONSOLE;
            case "json":
                return JSON;
            default:
                throw new IllegalArgumentException(
                    String.format("Unknown report format: '%s'. Valid values: console, json", name));
        }
    }
}
