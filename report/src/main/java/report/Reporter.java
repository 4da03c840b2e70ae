package report;

import model.StructuralInputException;
import overview.OverviewReport;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Интерфейс для вывода обзора запуска решателя в различных форматах.
 *
 * <p>Каждая реализация этого интерфейса отвечает за вывод в конкретном формате
 * (консоль, JSON). Обзор формируется сборщиком {@link overview.OverviewAssembler}
 * и передается реализации целиком; реализации не обращаются к блокам лога напрямую.
 *
 * <p>Метрики с неизвестным значением выводятся так же, как и остальные:
 * их текст уже содержит признак {@code "N/A"}.
 *
 * <p>Пример использования:
 * <pre>{@code
 * OverviewReport report = assembler.assemble(document);
 * Reporter reporter = ReporterFactory.createReporter(ReportFormat.CONSOLE);
 * try (PrintWriter writer = new PrintWriter(System.out)) {
 *     reporter.generate(report, writer);
 * }
 * }</pre>
 *
 * @since 1.0
 * @see OverviewReport
 * @see ReporterFactory
 */
public interface Reporter {

    /**
     * Выводит обзор.
     *
     * @param report собранный обзор
     * @param writer поток вывода
     * @throws IOException если возникла ошибка при записи отчета
     * @throws NullPointerException если {@code report} или {@code writer} равны null
     */
    void generate(OverviewReport report, PrintWriter writer) throws IOException;

    /**
     * Выводит пояснение вместо обзора, когда лог не удалось собрать целиком.
     *
     * @param error структурная ошибка входных данных
     * @param writer поток вывода
     * @throws IOException если возникла ошибка при записи
     */
    void generateError(StructuralInputException error, PrintWriter writer) throws IOException;

    /**
     * Возвращает формат отчета, поддерживаемый данным генератором.
     *
     * @return формат отчета
     */
    ReportFormat getFormat();

    /**
     * Текст пояснения для неполного или измененного лога.
     *
     * @param error структурная ошибка входных данных
     * @return сообщение для пользователя
     */
    static String incompleteLogMessage(StructuralInputException error) {
        return "Error parsing information. Log seems to be incomplete: " + error.getMessage()
            + ". Make sure you enter the full log without any modifications."
            + " The parser is sensitive to new lines.";
    }
}
