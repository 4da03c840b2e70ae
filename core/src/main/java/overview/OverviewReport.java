package overview;

import metric.MetricEntry;
import metric.MetricKey;
import metric.MetricValue;
import metric.SearchProgressChart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Сводный отчет о запуске решателя CP-SAT, собранный из блоков одного лога.
 *
 * <p>Отчет объединяет:
 * <ul>
 *   <li><b>Комментарии</b> - свободный текст, приложенный к логу</li>
 *   <li><b>Метрики</b> - упорядоченный список по {@link MetricKey}, каждая метрика присутствует всегда</li>
 *   <li><b>Параметры решателя</b> - пустые, если лог их не содержит</li>
 *   <li><b>График прогресса поиска</b> - только для завершившейся оптимизационной модели</li>
 *   <li><b>Уведомления</b> - например, что модель решена на этапе presolve</li>
 * </ul>
 *
 * <p>Отчет является неизменяемым (immutable) объектом, создаваемым через {@link Builder},
 * и сравнивается по значению: повторная сборка из тех же блоков дает равный отчет.
 *
 * <p>Пример использования:
 * <pre>{@code
 * OverviewReport report = new OverviewAssembler(OverviewConfig.defaults())
 *     .assemble(document);
 * MetricValue gap = report.getMetric(MetricKey.GAP).getValue();
 * }</pre>
 *
 * @since 1.0
 * @see OverviewAssembler
 */
public final class OverviewReport {
    private final List<String> comments;
    private final List<MetricEntry> metrics;
    private final Map<String, Object> parameters;
    private final SearchProgressChart searchProgressChart;
    private final Boolean solvedByPresolve;
    private final List<Notice> notices;

    private OverviewReport(Builder builder) {
        this.comments = List.copyOf(builder.comments);
        this.metrics = List.copyOf(builder.metrics);
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.searchProgressChart = builder.searchProgressChart;
        this.solvedByPresolve = builder.solvedByPresolve;
        this.notices = List.copyOf(builder.notices);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getComments() {
        return comments;
    }

    public boolean hasComments() {
        return !comments.isEmpty();
    }

    public List<MetricEntry> getMetrics() {
        return metrics;
    }

    /**
     * @throws NoSuchElementException if the report has no entry for the key
     */
    public MetricEntry getMetric(MetricKey key) {
        for (MetricEntry entry : metrics) {
            if (entry.getKey() == key) {
                return entry;
            }
        }
        throw new NoSuchElementException("No metric " + key + " in report");
    }

    public MetricValue getValue(MetricKey key) {
        return getMetric(key).getValue();
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public boolean hasParameters() {
        return !parameters.isEmpty();
    }

    public Optional<SearchProgressChart> getSearchProgressChart() {
        return Optional.ofNullable(searchProgressChart);
    }

    /**
     * @return empty if the log has no presolve summary
     */
    public Optional<Boolean> getSolvedByPresolve() {
        return Optional.ofNullable(solvedByPresolve);
    }

    public List<Notice> getNotices() {
        return notices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OverviewReport that = (OverviewReport) o;
        return comments.equals(that.comments)
            && metrics.equals(that.metrics)
            && parameters.equals(that.parameters)
            && Objects.equals(searchProgressChart, that.searchProgressChart)
            && Objects.equals(solvedByPresolve, that.solvedByPresolve)
            && notices.equals(that.notices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(comments, metrics, parameters, searchProgressChart, solvedByPresolve, notices);
    }

    public static final class Builder {
        private final List<String> comments = new ArrayList<>();
        private final List<MetricEntry> metrics = new ArrayList<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private SearchProgressChart searchProgressChart;
        private Boolean solvedByPresolve;
        private final List<Notice> notices = new ArrayList<>();

        private Builder() {
        }

        public Builder comments(List<String> comments) {
            this.comments.clear();
            if (comments != null) {
                this.comments.addAll(comments);
            }
            return this;
        }

        public Builder metric(MetricEntry entry) {
            this.metrics.add(Objects.requireNonNull(entry));
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters.clear();
            if (parameters != null) {
                this.parameters.putAll(parameters);
            }
            return this;
        }

        public Builder searchProgressChart(SearchProgressChart chart) {
            this.searchProgressChart = chart;
            return this;
        }

        public Builder solvedByPresolve(Boolean solvedByPresolve) {
            this.solvedByPresolve = solvedByPresolve;
            return this;
        }

        public Builder notice(Notice notice) {
            this.notices.add(Objects.requireNonNull(notice));
            return this;
        }

        public OverviewReport build() {
            return new OverviewReport(this);
        }
    }
}
