package report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import metric.ChartTrace;
import metric.MetricEntry;
import metric.MetricFlag;
import metric.MetricValue;
import metric.SearchProgressChart;
import model.StructuralInputException;
import overview.Notice;
import overview.OverviewReport;

import java.io.IOException;
import java.io.PrintWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Генератор обзора в формате JSON для программной обработки.
 *
 * <p>JSON документ включает:
 * <ul>
 *   <li>Время генерации в ISO-8601 формате</li>
 *   <li>Комментарии к логу</li>
 *   <li>Все метрики в порядке вывода: ключ, подпись, состояние, значение, текст, флаг и справка</li>
 *   <li>Параметры решателя, данные графика прогресса поиска и уведомления, если они есть</li>
 * </ul>
 *
 * <p>Неизвестные значения метрик выводятся как {@code null} с состоянием
 * {@code ABSENT} или {@code UNAVAILABLE} и причиной в поле {@code reason}.
 *
 * @since 1.0
 * @see Reporter
 * @see OverviewReport
 */
public final class JsonReporter implements Reporter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonReporter() {
        this(Clock.systemUTC());
    }

    public JsonReporter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void generate(OverviewReport report, PrintWriter writer) throws IOException {
        Map<String, Object> jsonReport = new LinkedHashMap<>();
        jsonReport.put("generatedAt", Instant.now(clock));
        jsonReport.put("comments", report.getComments());

        List<Map<String, Object>> metrics = new ArrayList<>();
        for (MetricEntry entry : report.getMetrics()) {
            metrics.add(buildMetric(entry));
        }
        jsonReport.put("metrics", metrics);
        jsonReport.put("parameters", report.getParameters());

        report.getSearchProgressChart()
            .ifPresent(chart -> jsonReport.put("searchProgress", buildChart(chart)));
        report.getSolvedByPresolve()
            .ifPresent(solved -> jsonReport.put("solvedByPresolve", solved));

        List<Map<String, Object>> notices = new ArrayList<>();
        for (Notice notice : report.getNotices()) {
            Map<String, Object> noticeMap = new LinkedHashMap<>();
            noticeMap.put("level", notice.getLevel().toString());
            noticeMap.put("message", notice.getMessage());
            notices.add(noticeMap);
        }
        jsonReport.put("notices", notices);

        writer.println(objectMapper.writeValueAsString(jsonReport));
        writer.flush();
    }

    @Override
    public void generateError(StructuralInputException error, PrintWriter writer) throws IOException {
        Map<String, Object> errorMap = new LinkedHashMap<>();
        errorMap.put("type", "STRUCTURAL_INPUT");
        errorMap.put("blockKind", error.getBlockKind().toString());
        errorMap.put("field", error.getFieldName());
        errorMap.put("message", Reporter.incompleteLogMessage(error));

        Map<String, Object> jsonReport = new LinkedHashMap<>();
        jsonReport.put("generatedAt", Instant.now(clock));
        jsonReport.put("error", errorMap);

        writer.println(objectMapper.writeValueAsString(jsonReport));
        writer.flush();
    }

    private Map<String, Object> buildMetric(MetricEntry entry) {
        MetricValue value = entry.getValue();
        Map<String, Object> metricMap = new LinkedHashMap<>();
        metricMap.put("key", entry.getKey().toString());
        metricMap.put("label", entry.getLabel());
        metricMap.put("state", value.getState().toString());
        metricMap.put("value", jsonValue(value.getValue()));
        metricMap.put("display", value.getDisplay());
        if (value.getFlag() != MetricFlag.NONE) {
            metricMap.put("flag", value.getFlag().toString());
        }
        if (value.getReason() != null) {
            metricMap.put("reason", value.getReason());
        }
        metricMap.put("help", entry.getHelp());
        return metricMap;
    }

    private Map<String, Object> buildChart(SearchProgressChart chart) {
        Map<String, Object> chartMap = new LinkedHashMap<>();
        chartMap.put("title", chart.getTitle());
        chartMap.put("xAxis", chart.getXAxisLabel());
        chartMap.put("yAxis", chart.getYAxisLabel());

        List<Map<String, Object>> traces = new ArrayList<>();
        for (ChartTrace trace : chart.getTraces()) {
            Map<String, Object> traceMap = new LinkedHashMap<>();
            traceMap.put("name", trace.getName());
            traceMap.put("x", trace.getX());
            traceMap.put("y", trace.getY());
            traces.add(traceMap);
        }
        chartMap.put("traces", traces);
        return chartMap;
    }

    private static Object jsonValue(Object value) {
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value;
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.JSON;
    }
}
