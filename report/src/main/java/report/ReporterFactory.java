package report;

/**
 * Фабрика для создания экземпляров генераторов отчетов.
 *
 * <p>Примеры использования:
 * <pre>{@code
 * // Консольный вывод с цветами
 * Reporter consoleReporter = ReporterFactory.createReporter(ReportFormat.CONSOLE, true);
 *
 * // JSON вывод
 * Reporter jsonReporter = ReporterFactory.createReporter(ReportFormat.JSON);
 * }</pre>
 *
 * @since 1.0
 */
public final class ReporterFactory {

    private ReporterFactory() {
        // Утилитный класс - конструктор закрыт
    }

    /**
     * Создает генератор отчетов для указанного формата.
     *
     * <p>Параметр {@code useColors} применяется только для консольного формата.
     *
     * @param format формат отчета из {@link ReportFormat}
     * @param useColors использовать ли ANSI цвета (применимо только для {@link ReportFormat#CONSOLE})
     * @return экземпляр генератора отчетов для указанного формата
     * @throws NullPointerException если {@code format} равен null
     */
    public static Reporter createReporter(ReportFormat format, boolean useColors) {
        return createReporter(format, useColors, false);
    }

    /**
     * Создает генератор отчетов с выводом справки под каждой метрикой.
     *
     * <p>JSON отчет всегда содержит справку, параметр {@code showHelp} влияет только на консоль.
     *
     * @param format формат отчета
     * @param useColors использовать ли ANSI цвета
     * @param showHelp выводить ли справочный текст метрик в консоль
     * @return экземпляр генератора отчетов
     */
    public static Reporter createReporter(ReportFormat format, boolean useColors, boolean showHelp) {
        return switch (format) {
            case CONSOLE -> new ConsoleReporter(useColors, showHelp);
            case JSON -> new JsonReporter();
        };
    }

    /**
     * Создает генератор отчетов с настройками по умолчанию (цвета включены).
     *
     * @param format формат отчета из {@link ReportFormat}
     * @return экземпляр генератора отчетов для указанного формата
     */
    public static Reporter createReporter(ReportFormat format) {
        return createReporter(format, true);
    }
}
