package metric;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Locale-independent display formatting of metric values.
 */
final class MetricFormat {

    private MetricFormat() {
        throw new UnsupportedOperationException("Utility class");
    }

    static String seconds(double seconds) {
        return String.format(Locale.ROOT, "%.3fs", seconds);
    }

    static String percent(double percent) {
        return String.format(Locale.ROOT, "%.2f%%", percent);
    }

    /**
     * Plain decimal without exponent or trailing zeros: {@code 10.0 -> "10"}, {@code 0.5 -> "0.5"}.
     */
    static String decimal(double value) {
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String integer(long value) {
        return Long.toString(value);
    }
}
