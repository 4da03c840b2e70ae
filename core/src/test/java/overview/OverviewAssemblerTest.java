package overview;

import metric.MetricEntry;
import metric.MetricFlag;
import metric.MetricKey;
import metric.MetricValue;
import metric.SearchProgressChart;
import model.BlockKind;
import model.DefaultInitialModelBlock;
import model.DefaultPresolveSummaryBlock;
import model.DefaultResponseBlock;
import model.DefaultSearchProgressBlock;
import model.DefaultSolverBlock;
import model.LogBlock;
import model.LogDocument;
import model.ProgressPoint;
import model.ProgressSeries;
import model.ResponseBlock;
import model.SearchProgressBlock;
import model.SolverStatus;
import model.SolverVersion;
import model.StructuralInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import registry.DuplicateBlockException;
import registry.DuplicateBlockPolicy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OverviewAssemblerTest {

    @Mock
    private SearchProgressBlock brokenProgress;

    @Mock
    private ResponseBlock brokenResponse;

    private OverviewAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new OverviewAssembler();

        lenient().when(brokenProgress.getKind()).thenReturn(BlockKind.SEARCH_PROGRESS);
        lenient().when(brokenProgress.getPresolveTime()).thenThrow(new IllegalStateException("corrupt timing"));
        lenient().when(brokenProgress.getProgressSeries()).thenThrow(new IllegalStateException("corrupt events"));

        lenient().when(brokenResponse.getKind()).thenReturn(BlockKind.RESPONSE);
        lenient().when(brokenResponse.toMap()).thenReturn(Map.of(
            "status", "OPTIMAL", "objective", "10", "best_bound", "10", "walltime", "2.5"));
        lenient().when(brokenResponse.getGap()).thenThrow(new IllegalStateException("gap exploded"));
    }

    private static List<LogBlock> optimalRun() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("num_workers", 8);
        parameters.put("max_time_in_seconds", 60.0);

        List<LogBlock> blocks = new ArrayList<>();
        blocks.add(new DefaultSolverBlock("9.10.4067", 8, parameters));
        blocks.add(new DefaultInitialModelBlock(1000, 250, true));
        blocks.add(new DefaultSearchProgressBlock(0.125, ProgressSeries.of(List.of(
            new ProgressPoint(0.2, 120.0, 80.0),
            new ProgressPoint(1.4, 100.0, 100.0)))));
        blocks.add(new DefaultResponseBlock(Map.of(
            "status", "OPTIMAL",
            "objective", "100",
            "best_bound", "100",
            "walltime", "1.5")));
        return blocks;
    }

    @Test
    void assemble_withNoBlocks_shouldReportEveryMetricAsUnknown() throws Exception {
        OverviewReport report = assembler.assemble(List.of());

        assertEquals(MetricKey.values().length, report.getMetrics().size());
        for (MetricEntry entry : report.getMetrics()) {
            assertFalse(entry.getValue().isKnown(), entry.getKey() + " should be unknown");
            assertEquals(MetricValue.UNKNOWN_DISPLAY, entry.getValue().getDisplay());
        }
        assertTrue(report.getSearchProgressChart().isEmpty());
        assertTrue(report.getSolvedByPresolve().isEmpty());
        assertFalse(report.hasParameters());
        assertTrue(report.getNotices().isEmpty());
        assertEquals(MetricFlag.STALE_WARNING, report.getValue(MetricKey.SOLVER_VERSION).getFlag());
    }

    @Test
    void assemble_shouldKeepMetricOrder() throws Exception {
        OverviewReport report = assembler.assemble(optimalRun());

        for (int i = 0; i < MetricKey.values().length; i++) {
            assertEquals(MetricKey.values()[i], report.getMetrics().get(i).getKey());
        }
    }

    @Test
    void assemble_withOptimalRun_shouldDeriveAllMetrics() throws Exception {
        OverviewReport report = assembler.assemble(optimalRun());

        assertEquals("9.10.4067", report.getValue(MetricKey.SOLVER_VERSION).getDisplay());
        assertEquals(MetricFlag.CURRENT, report.getValue(MetricKey.SOLVER_VERSION).getFlag());
        assertEquals(8, report.getValue(MetricKey.WORKERS).getValue());
        assertEquals(SolverStatus.OPTIMAL, report.getValue(MetricKey.STATUS).getValue());
        assertEquals("1.500s", report.getValue(MetricKey.WALL_TIME).getDisplay());
        assertEquals("0.125s", report.getValue(MetricKey.PRESOLVE_TIME).getDisplay());
        assertEquals("1000", report.getValue(MetricKey.VARIABLES).getDisplay());
        assertEquals("250", report.getValue(MetricKey.CONSTRAINTS).getDisplay());
        assertEquals("Optimization", report.getValue(MetricKey.MODEL_TYPE).getDisplay());
        assertEquals("100", report.getValue(MetricKey.OBJECTIVE).getDisplay());
        assertEquals("0.00%", report.getValue(MetricKey.GAP).getDisplay());

        assertEquals(List.of("num_workers", "max_time_in_seconds"), new ArrayList<>(report.getParameters().keySet()));
        SearchProgressChart chart = report.getSearchProgressChart().orElseThrow();
        assertEquals(List.of(120.0, 100.0), chart.getObjective().getY());
    }

    @Test
    void assemble_withResponseMissingStatus_shouldThrowStructuralError() {
        List<LogBlock> blocks = new ArrayList<>(optimalRun());
        blocks.set(3, new DefaultResponseBlock(Map.of("objective", "100")));

        StructuralInputException e = assertThrows(StructuralInputException.class, () -> assembler.assemble(blocks));

        assertEquals(BlockKind.RESPONSE, e.getBlockKind());
        assertEquals("status", e.getFieldName());
    }

    @Test
    void assemble_withFailingSearchProgress_shouldIsolateFailure() throws Exception {
        List<LogBlock> blocks = new ArrayList<>(optimalRun());
        blocks.set(2, brokenProgress);

        OverviewReport report = assembler.assemble(blocks);

        assertEquals(MetricValue.State.UNAVAILABLE, report.getValue(MetricKey.PRESOLVE_TIME).getState());
        assertTrue(report.getSearchProgressChart().isEmpty());
        assertEquals("100", report.getValue(MetricKey.OBJECTIVE).getDisplay());
        assertEquals(SolverStatus.OPTIMAL, report.getValue(MetricKey.STATUS).getValue());
    }

    @Test
    void assemble_withFailingGap_shouldKeepOtherResponseMetrics() throws Exception {
        List<LogBlock> blocks = new ArrayList<>(optimalRun());
        blocks.set(3, brokenResponse);

        OverviewReport report = assembler.assemble(blocks);

        assertEquals(MetricValue.State.UNAVAILABLE, report.getValue(MetricKey.GAP).getState());
        assertEquals("10", report.getValue(MetricKey.OBJECTIVE).getDisplay());
        assertEquals("2.500s", report.getValue(MetricKey.WALL_TIME).getDisplay());
    }

    @Test
    void assemble_twice_shouldProduceEqualReports() throws Exception {
        List<LogBlock> blocks = optimalRun();

        assertEquals(assembler.assemble(blocks), assembler.assemble(blocks));
    }

    @Test
    void assemble_inParallel_shouldMatchSequential() throws Exception {
        OverviewAssembler parallel = new OverviewAssembler(OverviewConfig.builder()
            .maxParallelDerivers(4)
            .build());
        List<LogBlock> blocks = new ArrayList<>(optimalRun());
        blocks.set(2, brokenProgress);

        assertTrue(parallel.getConfig().isParallel());
        assertEquals(assembler.assemble(blocks), parallel.assemble(blocks));
    }

    @Test
    void assemble_withDuplicateBlocks_shouldWarn() throws Exception {
        List<LogBlock> blocks = new ArrayList<>(optimalRun());
        blocks.add(new DefaultSolverBlock("9.8.3296", 1, null));

        OverviewReport report = assembler.assemble(blocks);

        assertEquals("9.10.4067", report.getValue(MetricKey.SOLVER_VERSION).getDisplay());
        assertEquals(1, report.getNotices().size());
        assertEquals(Notice.Level.WARNING, report.getNotices().get(0).getLevel());
    }

    @Test
    void assemble_withDuplicateBlocksAndLastPolicy_shouldUseLastOccurrence() throws Exception {
        OverviewAssembler last = new OverviewAssembler(OverviewConfig.builder()
            .duplicatePolicy(DuplicateBlockPolicy.LAST)
            .build());
        List<LogBlock> blocks = new ArrayList<>(optimalRun());
        blocks.add(new DefaultSolverBlock("9.8.3296", 1, null));

        OverviewReport report = last.assemble(blocks);

        assertEquals(MetricFlag.OUTDATED, report.getValue(MetricKey.SOLVER_VERSION).getFlag());
        assertFalse(report.hasParameters());
    }

    @Test
    void assemble_withDuplicateBlocksAndFailPolicy_shouldThrow() {
        OverviewAssembler strict = new OverviewAssembler(OverviewConfig.builder()
            .duplicatePolicy(DuplicateBlockPolicy.FAIL)
            .build());
        List<LogBlock> blocks = new ArrayList<>(optimalRun());
        blocks.add(new DefaultResponseBlock(Map.of("status", "FEASIBLE")));

        assertThrows(DuplicateBlockException.class, () -> strict.assemble(blocks));
    }

    @Test
    void assemble_withMislabeledBlock_shouldSkipItWithWarning() throws Exception {
        List<LogBlock> blocks = new ArrayList<>(optimalRun());
        blocks.add(0, () -> BlockKind.SOLVER);
        blocks.add(() -> null);

        OverviewReport report = assembler.assemble(blocks);

        assertEquals("9.10.4067", report.getValue(MetricKey.SOLVER_VERSION).getDisplay());
        assertEquals(SolverStatus.OPTIMAL, report.getValue(MetricKey.STATUS).getValue());
        assertEquals(2, report.getNotices().size());
        for (Notice notice : report.getNotices()) {
            assertEquals(Notice.Level.WARNING, notice.getLevel());
        }
    }

    @Test
    void assemble_withOnlyMislabeledSolver_shouldReportSolverAsUnknown() throws Exception {
        List<LogBlock> blocks = List.of(
            new DefaultResponseBlock(Map.of("status", "OPTIMAL")),
            () -> BlockKind.SOLVER);

        OverviewReport report = assembler.assemble(blocks);

        assertEquals(MetricValue.State.ABSENT, report.getValue(MetricKey.SOLVER_VERSION).getState());
        assertEquals(SolverStatus.OPTIMAL, report.getValue(MetricKey.STATUS).getValue());
        assertTrue(report.getNotices().get(0).getMessage().contains("'Solver'"));
    }

    @Test
    void assemble_withPresolveSolvedModel_shouldAddInfoNotice() throws Exception {
        List<LogBlock> blocks = new ArrayList<>(optimalRun());
        blocks.add(new DefaultPresolveSummaryBlock(true));

        OverviewReport report = assembler.assemble(blocks);

        assertEquals(Optional.of(true), report.getSolvedByPresolve());
        assertEquals(List.of(Notice.info(OverviewAssembler.SOLVED_BY_PRESOLVE)), report.getNotices());
    }

    @Test
    void assemble_withPresolveNotSolving_shouldReportFalseWithoutNotice() throws Exception {
        List<LogBlock> blocks = new ArrayList<>(optimalRun());
        blocks.add(new DefaultPresolveSummaryBlock(false));

        OverviewReport report = assembler.assemble(blocks);

        assertEquals(Optional.of(false), report.getSolvedByPresolve());
        assertTrue(report.getNotices().isEmpty());
    }

    @Test
    void assemble_shouldCarryComments() throws Exception {
        LogDocument document = new LogDocument(optimalRun(), List.of("nightly benchmark", "instance 17"));

        OverviewReport report = assembler.assemble(document);

        assertEquals(List.of("nightly benchmark", "instance 17"), report.getComments());
    }

    @Test
    void assemble_withCustomThreshold_shouldFlagVersion() throws Exception {
        OverviewAssembler picky = new OverviewAssembler(OverviewConfig.builder()
            .outdatedBefore(SolverVersion.parse("9.11"))
            .build());

        OverviewReport report = picky.assemble(optimalRun());

        assertEquals(MetricFlag.OUTDATED, report.getValue(MetricKey.SOLVER_VERSION).getFlag());
    }

    @Test
    void getMetric_withUnknownKey_shouldThrow() {
        OverviewReport empty = OverviewReport.builder().build();

        assertThrows(NoSuchElementException.class, () -> empty.getMetric(MetricKey.GAP));
    }
}
