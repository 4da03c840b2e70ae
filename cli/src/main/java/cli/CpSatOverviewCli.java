package cli;

import loader.BlockDocumentLoader;
import model.StructuralInputException;
import overview.OverviewAssembler;
import overview.OverviewConfig;
import overview.OverviewReport;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import registry.DuplicateBlockPolicy;
import report.ReportFormat;
import report.Reporter;
import report.ReporterFactory;
import util.StringUtils;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Главная точка входа CLI для обзора лога CP-SAT.
 * Использует библиотеку picocli для парсинга аргументов командной строки.
 *
 * <p>На вход принимается JSON документ с уже разобранными блоками лога.
 * Команда собирает обзор и выводит его в консоль или в JSON.
 *
 * <p>Примеры использования:
 * <pre>
 * # Обзор в консоль
 * cpsat-log-overview run.json
 *
 * # JSON в файл
 * cpsat-log-overview -f json -o overview.json run.json
 *
 * # Отклонять логи с повторяющимися блоками
 * cpsat-log-overview --duplicate-policy fail run.json
 * </pre>
 *
 * <p>Коды возврата: 0 - обзор выведен, 1 - ошибка аргументов или документа,
 * 2 - лог неполный или изменен, 99 - непредвиденная ошибка.
 *
 * @since 1.0
 */
@Command(
    name = "cpsat-log-overview",
    description = "Сводка запуска решателя CP-SAT по разобранным блокам лога",
    mixinStandardHelpOptions = true,
    version = "1.0-SNAPSHOT"
)
public class CpSatOverviewCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_INCOMPLETE_LOG = 2;
    static final int EXIT_UNEXPECTED = 99;

    @Parameters(
        index = "0",
        description = "Path to the JSON document with parsed log blocks"
    )
    private String documentLocation;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: console, json (default: console)"
    )
    private String format;

    @Option(
        names = {"-nc", "--no-color"},
        description = "Disable colored output"
    )
    private boolean noColor;

    @Option(
        names = {"--explain"},
        description = "Print the help text of every metric (console format)"
    )
    private boolean explain;

    @Option(
        names = {"-o", "--output"},
        description = "Output file for the overview (optional, defaults to stdout)"
    )
    private String outputFile;

    @Option(
        names = {"--duplicate-policy"},
        description = "What to do when a block kind occurs more than once: first, last, fail (default: first)"
    )
    private String duplicatePolicy;

    @Option(
        names = {"--parallel"},
        description = "Number of threads used to derive metrics (default: 1)"
    )
    private Integer parallel;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output"
    )
    private boolean verbose;

    private final PrintWriter out;

    public CpSatOverviewCli() {
        this(new PrintWriter(System.out, true));
    }

    CpSatOverviewCli(PrintWriter out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        try {
            if (verbose) {
                enableVerboseLogging();
            }

            String location = StringUtils.cleanLocation(documentLocation);
            if (location == null || location.isEmpty()) {
                out.println("ERROR: Block document location is required.");
                out.println("Usage: cpsat-log-overview [OPTIONS] <blocks.json>");
                return EXIT_INPUT_ERROR;
            }

            ReportFormat reportFormat;
            OverviewConfig config;
            try {
                reportFormat = ReportFormat.parse(format);
                config = OverviewConfig.builder()
                    .duplicatePolicy(DuplicateBlockPolicy.parse(duplicatePolicy))
                    .maxParallelDerivers(parallel != null ? parallel : 1)
                    .build();
            } catch (IllegalArgumentException e) {
                out.println("ERROR: " + e.getMessage());
                return EXIT_INPUT_ERROR;
            }

            if (verbose) {
                out.println("Configuration:");
                out.println("  Document: " + location);
                out.println("  Format: " + reportFormat);
                out.println("  Duplicate policy: " + config.getDuplicatePolicy());
                out.println("  Parallel derivers: " + config.getMaxParallelDerivers());
                out.println();
            }

            Path path = Paths.get(location);
            BlockDocumentLoader.LoadResult loaded = new BlockDocumentLoader().load(path);
            if (!loaded.isSuccessful()) {
                for (String message : loaded.getMessages()) {
                    out.println("ERROR: " + message);
                }
                return EXIT_INPUT_ERROR;
            }
            if (verbose && loaded.hasMessages()) {
                for (String message : loaded.getMessages()) {
                    out.println("[WARN] " + message);
                }
            }

            Reporter reporter = ReporterFactory.createReporter(reportFormat, !noColor, explain);
            OverviewAssembler assembler = new OverviewAssembler(config);

            try {
                OverviewReport report = assembler.assemble(loaded.getDocument());
                write(reporter, report, null);
                return EXIT_OK;
            } catch (StructuralInputException e) {
                write(reporter, null, e);
                return EXIT_INCOMPLETE_LOG;
            }

        } catch (Exception e) {
            out.println("ERROR: Unexpected error occurred: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(out);
            }
            return EXIT_UNEXPECTED;
        }
    }

    private void write(Reporter reporter, OverviewReport report, StructuralInputException error) throws IOException {
        if (outputFile != null) {
            try (PrintWriter fileWriter = new PrintWriter(new FileWriter(outputFile))) {
                render(reporter, report, error, fileWriter);
            }
            out.println("Overview written to: " + outputFile);
        } else {
            render(reporter, report, error, out);
        }
    }

    private static void render(Reporter reporter, OverviewReport report, StructuralInputException error,
                               PrintWriter writer) throws IOException {
        if (error != null) {
            reporter.generateError(error, writer);
        } else {
            reporter.generate(report, writer);
        }
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CpSatOverviewCli()).execute(args);
        System.exit(exitCode);
    }
}
