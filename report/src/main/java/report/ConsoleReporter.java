package report;

import metric.ChartTrace;
import metric.MetricEntry;
import metric.MetricFlag;
import metric.MetricKey;
import metric.MetricValue;
import metric.SearchProgressChart;
import model.StructuralInputException;
import overview.Notice;
import overview.OverviewReport;
import util.StringUtils;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Console-based reporter with colored output.
 */
public final class ConsoleReporter implements Reporter {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_BLUE = "\u001B[34m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_GRAY = "\u001B[90m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private static final int LABEL_WIDTH = 20;
    private static final int MAX_PARAMETER_LENGTH = 80;
    private static final int MAX_PROGRESS_ROWS = 20;

    private static final Map<String, List<MetricKey>> SECTIONS = new LinkedHashMap<>();

    static {
        SECTIONS.put("Solver", List.of(MetricKey.SOLVER_VERSION, MetricKey.WORKERS));
        SECTIONS.put("Status", List.of(MetricKey.STATUS, MetricKey.WALL_TIME, MetricKey.PRESOLVE_TIME));
        SECTIONS.put("Model", List.of(MetricKey.VARIABLES, MetricKey.CONSTRAINTS, MetricKey.MODEL_TYPE));
        SECTIONS.put("Objective", List.of(MetricKey.OBJECTIVE, MetricKey.BEST_BOUND, MetricKey.GAP));
    }

    private final boolean useColors;
    private final boolean showHelp;

    public ConsoleReporter(boolean useColors, boolean showHelp) {
        this.useColors = useColors;
        this.showHelp = showHelp;
    }

    public ConsoleReporter(boolean useColors) {
        this(useColors, false);
    }

    public ConsoleReporter() {
        this(true);
    }

    @Override
    public void generate(OverviewReport report, PrintWriter writer) throws IOException {
        printHeader(writer, "CP-SAT Log Overview");

        if (report.hasComments()) {
            printComments(writer, report.getComments());
        }

        for (Map.Entry<String, List<MetricKey>> section : SECTIONS.entrySet()) {
            printSection(writer, section.getKey());
            for (MetricKey key : section.getValue()) {
                printMetric(writer, report.getMetric(key));
            }
            if (section.getKey().equals("Solver") && report.hasParameters()) {
                printParameters(writer, report.getParameters());
            }
        }

        report.getSearchProgressChart().ifPresent(chart -> printProgress(writer, chart));

        if (!report.getNotices().isEmpty()) {
            printSection(writer, "Notices");
            for (Notice notice : report.getNotices()) {
                printNotice(writer, notice);
            }
        }

        writer.println();
        writer.flush();
    }

    @Override
    public void generateError(StructuralInputException error, PrintWriter writer) throws IOException {
        printHeader(writer, "CP-SAT Log Overview");
        printError(writer, Reporter.incompleteLogMessage(error));
        writer.flush();
    }

    private void printComments(PrintWriter writer, List<String> comments) {
        printSection(writer, "Comments");
        for (String comment : comments) {
            writer.println(colorize("  > ", ANSI_CYAN) + comment);
        }
    }

    private void printMetric(PrintWriter writer, MetricEntry entry) {
        MetricValue value = entry.getValue();
        StringBuilder line = new StringBuilder("  ")
            .append(padRight(entry.getLabel() + ":", LABEL_WIDTH))
            .append(value.isKnown() ? colorize(value.getDisplay(), ANSI_BOLD) : colorize(value.getDisplay(), ANSI_GRAY));

        if (value.getFlag() != MetricFlag.NONE) {
            String color = value.getFlag().isWarning() ? ANSI_YELLOW : ANSI_GREEN;
            line.append(' ').append(colorize("[" + value.getFlag().getLabel() + "]", color));
        }
        writer.println(line);

        if (showHelp) {
            for (String helpLine : entry.getHelp().split("\n")) {
                writer.println(colorize("      " + helpLine, ANSI_GRAY));
            }
        }
    }

    private void printParameters(PrintWriter writer, Map<String, Object> parameters) {
        writer.println();
        writer.println(colorize("  CP-SAT was set up with the following parameters:", ANSI_BOLD));
        for (Map.Entry<String, Object> parameter : parameters.entrySet()) {
            writer.println("    " + parameter.getKey() + ": "
                + StringUtils.truncate(String.valueOf(parameter.getValue()), MAX_PARAMETER_LENGTH));
        }
    }

    private void printProgress(PrintWriter writer, SearchProgressChart chart) {
        printSection(writer, chart.getTitle());

        // time -> {objective, bound}; a trace may lack a value at a given time
        TreeMap<Double, Double[]> rows = new TreeMap<>();
        collect(rows, chart.getObjective(), 0);
        collect(rows, chart.getBound(), 1);

        writer.println(colorize(String.format(Locale.ROOT, "  %12s  %16s  %16s",
            chart.getXAxisLabel(), chart.getObjective().getName(), chart.getBound().getName()), ANSI_BOLD));

        int index = 0;
        int total = rows.size();
        for (Map.Entry<Double, Double[]> row : rows.entrySet()) {
            boolean last = index == total - 1;
            if (index < MAX_PROGRESS_ROWS - 1 || last) {
                writer.println(String.format(Locale.ROOT, "  %12.3f  %16s  %16s",
                    row.getKey(), cell(row.getValue()[0]), cell(row.getValue()[1])));
            } else if (index == MAX_PROGRESS_ROWS - 1) {
                writer.println(colorize("  ... " + (total - MAX_PROGRESS_ROWS) + " more", ANSI_GRAY));
            }
            index++;
        }
    }

    private static void collect(TreeMap<Double, Double[]> rows, ChartTrace trace, int column) {
        for (int i = 0; i < trace.size(); i++) {
            rows.computeIfAbsent(trace.getX().get(i), time -> new Double[2])[column] = trace.getY().get(i);
        }
    }

    private static String cell(Double value) {
        return value != null ? String.format(Locale.ROOT, "%.6g", value) : "-";
    }

    private void printNotice(PrintWriter writer, Notice notice) {
        if (notice.getLevel() == Notice.Level.WARNING) {
            writer.println(colorize("  [WARN] ", ANSI_YELLOW) + notice.getMessage());
        } else {
            writer.println(colorize("  [INFO] ", ANSI_CYAN) + notice.getMessage());
        }
    }

    private void printHeader(PrintWriter writer, String title) {
        writer.println(colorize("=".repeat(60), ANSI_BOLD + ANSI_BLUE));
        writer.println(colorize(title, ANSI_BOLD + ANSI_BLUE));
        writer.println(colorize("=".repeat(60), ANSI_BOLD + ANSI_BLUE));
    }

    private void printSection(PrintWriter writer, String title) {
        writer.println();
        writer.println(colorize(title, ANSI_BOLD + ANSI_BLUE));
        writer.println(colorize("-".repeat(60), ANSI_BLUE));
    }

    private void printError(PrintWriter writer, String message) {
        writer.println();
        writer.println(colorize("ERROR: ", ANSI_RED) + message);
        writer.println();
    }

    private static String padRight(String text, int width) {
        if (text.length() >= width) {
            return text + " ";
        }
        return text + " ".repeat(width - text.length());
    }

    private String colorize(String text, String colorCode) {
        if (!useColors) {
            return text;
        }
        return colorCode + text + ANSI_RESET;
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.CONSOLE;
    }
}
