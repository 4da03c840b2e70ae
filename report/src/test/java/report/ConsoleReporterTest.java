package report;

import metric.MetricFlag;
import model.BlockKind;
import model.StructuralInputException;
import org.junit.jupiter.api.Test;
import overview.OverviewReport;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest {

    private static String render(Reporter reporter, OverviewReport report) throws Exception {
        StringWriter out = new StringWriter();
        reporter.generate(report, new PrintWriter(out));
        return out.toString();
    }

    @Test
    void generate_shouldPrintSectionsAndValues() throws Exception {
        String output = render(new ConsoleReporter(false), ReportFixtures.feasibleRun());

        assertTrue(output.contains("CP-SAT Log Overview"));
        assertTrue(output.contains("CP-SAT Version:"));
        assertTrue(output.contains("9.9.3296 [outdated]"));
        assertTrue(output.contains("FEASIBLE"));
        assertTrue(output.contains("30.002s"));
        assertTrue(output.contains("50.00%"));
        assertTrue(output.contains("run 7"));
        assertFalse(output.contains("\u001B["), "colors must be off");
    }

    @Test
    void generate_shouldListParametersAndProgress() throws Exception {
        String output = render(new ConsoleReporter(false), ReportFixtures.feasibleRun());

        assertTrue(output.contains("CP-SAT was set up with the following parameters:"));
        assertTrue(output.contains("num_workers: 16"));
        assertTrue(output.contains("Search Progress"));
        assertTrue(output.contains("[INFO] The model was solved by presolve."));
    }

    @Test
    void generate_withEmptyRun_shouldShowPlaceholders() throws Exception {
        String output = render(new ConsoleReporter(false), ReportFixtures.emptyRun());

        assertTrue(output.contains("N/A"));
        assertTrue(output.contains("[" + MetricFlag.STALE_WARNING.getLabel() + "]"));
        assertFalse(output.contains("Search Progress"));
        assertFalse(output.contains("following parameters"));
    }

    @Test
    void generate_withHelp_shouldPrintExplanations() throws Exception {
        String output = render(new ConsoleReporter(false, true), ReportFixtures.emptyRun());

        assertTrue(output.contains("CP-SAT can have 5 different statuses:"));
        assertTrue(output.contains("- MODEL_INVALID: "));
    }

    @Test
    void generate_withColors_shouldEmitAnsiCodes() throws Exception {
        String output = render(new ConsoleReporter(true), ReportFixtures.emptyRun());

        assertTrue(output.contains("\u001B[0m"));
    }

    @Test
    void generateError_shouldExplainIncompleteLog() throws Exception {
        StructuralInputException error = new StructuralInputException(BlockKind.RESPONSE, "status", "field is missing");
        StringWriter out = new StringWriter();

        new ConsoleReporter(false).generateError(error, new PrintWriter(out));

        String output = out.toString();
        assertTrue(output.contains("ERROR: Error parsing information. Log seems to be incomplete"));
        assertTrue(output.contains("status: field is missing"));
        assertTrue(output.contains("The parser is sensitive to new lines."));
    }

    @Test
    void getFormat_shouldBeConsole() {
        assertEquals(ReportFormat.CONSOLE, new ConsoleReporter().getFormat());
    }
}
