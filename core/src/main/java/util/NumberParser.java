package util;

import java.util.regex.Pattern;

/**
 * Строгий разбор десятичных чисел из текстовых полей лога.
 *
 * <p>Принимает только обычную десятичную запись с необязательной экспонентой:
 * {@code 10}, {@code -3.5}, {@code .25}, {@code 1e-6}. Токены, которые
 * {@link Double#parseDouble(String)} принял бы, но которые не являются числами
 * в логе ({@code inf}, {@code Infinity}, {@code NaN}, {@code 0x1p3}, {@code 1d}),
 * считаются недоступными значениями.
 *
 * @since 1.0
 */
public final class NumberParser {

    private static final Pattern DECIMAL = Pattern.compile(
        "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private NumberParser() {
        // Утилитный класс - запретить создание экземпляров
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Разбирает токен как десятичное число.
     *
     * @param token текстовое значение поля (может быть null)
     * @return {@code Parsed(value)} или {@code Unavailable(reason)}
     *
     * @example
     * <pre>
     * parseDecimal("10")   → Parsed(10.0)
     * parseDecimal(" 1e3") → Parsed(1000.0)
     * parseDecimal("inf")  → Unavailable
     * parseDecimal(null)   → Unavailable
     * </pre>
     */
    public static FieldValue<Double> parseDecimal(String token) {
        if (token == null) {
            return FieldValue.unavailable("missing value");
        }
        String trimmed = token.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            return FieldValue.unavailable("not a number: '" + token + "'");
        }
        double value = Double.parseDouble(trimmed);
        if (Double.isInfinite(value)) {
            return FieldValue.unavailable("out of range: '" + token + "'");
        }
        return FieldValue.parsed(value);
    }

    /**
     * Разбирает токен как десятичное число, выбрасывая исключение при ошибке.
     *
     * @param fieldName имя поля для сообщения об ошибке
     * @param token текстовое значение поля
     * @return число
     * @throws NumberFormatException если токен не является числом
     */
    public static double requireDecimal(String fieldName, String token) {
        FieldValue<Double> parsed = parseDecimal(token);
        if (parsed.isUnavailable()) {
            throw new NumberFormatException(fieldName + ": " + parsed.getReason());
        }
        return parsed.get();
    }
}
