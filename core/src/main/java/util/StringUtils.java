package util;

/**
 * Строковые утилиты обзора: нормализация пути к документу с блоками,
 * переданного в CLI, и сокращение длинных значений параметров решателя в консоли.
 *
 * @since 1.0
 */
public final class StringUtils {

    private static final String ELLIPSIS = "...";

    private StringUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Нормализует позиционный аргумент CLI с путем к JSON документу блоков.
     *
     * <p>Оболочки Windows и скрипты запуска часто передают путь с пробелами вместе
     * с кавычками. Снимается одна пара одинаковых кавычек ({@code "} или {@code '})
     * и пробелы по краям, поэтому {@code "  'C:/My Logs/run.json' "} превращается в
     * {@code C:/My Logs/run.json}.
     *
     * @param location путь к документу, может быть null
     * @return путь без кавычек и пробелов по краям, либо null
     */
    public static String cleanLocation(String location) {
        if (location == null) {
            return null;
        }
        String cleaned = location.trim();
        if (isWrappedIn(cleaned, '"') || isWrappedIn(cleaned, '\'')) {
            cleaned = cleaned.substring(1, cleaned.length() - 1).trim();
        }
        return cleaned;
    }

    /**
     * Сокращает значение параметра решателя для строки в консоли.
     *
     * <p>Параметры CP-SAT бывают длинными (списки стратегий подпоиска, хинты решения),
     * а строка отчета должна оставаться читаемой. Результат не длиннее {@code maxLength}
     * символов, включая многоточие, но не короче самого многоточия.
     *
     * @param value значение параметра, может быть null
     * @param maxLength максимальная длина результата
     * @return исходное значение, если оно укладывается в лимит, иначе сокращенное с {@code "..."}
     */
    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        int keep = Math.max(0, maxLength - ELLIPSIS.length());
        return value.substring(0, keep) + ELLIPSIS;
    }

    private static boolean isWrappedIn(String text, char quote) {
        return text.length() >= 2 && text.charAt(0) == quote && text.charAt(text.length() - 1) == quote;
    }
}
