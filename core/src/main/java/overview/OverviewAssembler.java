package overview;

import metric.BlockSnapshot;
import metric.MetricCatalog;
import metric.MetricDeriver;
import metric.MetricEntry;
import metric.MetricKey;
import metric.MetricValue;
import metric.PresolveOutcome;
import metric.SearchPlot;
import metric.SearchProgressChart;
import metric.SolverMetrics;
import model.LogBlock;
import model.LogDocument;
import model.StructuralInputException;
import registry.BlockAnomaly;
import registry.BlockRegistry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Собирает {@link OverviewReport} из блоков одного лога.
 *
 * <p>Сборка выполняется за один проход:
 * <ol>
 *   <li>Блоки индексируются в {@link BlockRegistry}, каждый вид ищется ровно один раз</li>
 *   <li>Проверяется опорное поле {@code status} блока ответа</li>
 *   <li>Все метрики вычисляются независимо друг от друга</li>
 *   <li>Результаты складываются в отчет в порядке {@link MetricKey}</li>
 * </ol>
 *
 * <p>Ошибка в одной метрике не прерывает сборку: метрика получает состояние
 * {@link MetricValue.State#UNAVAILABLE}. Единственная ошибка, прерывающая сборку целиком,
 * это {@link StructuralInputException}.
 *
 * <p>Экземпляр не хранит состояния между вызовами и может использоваться из разных потоков.
 *
 * @since 1.0
 * @see OverviewReport
 * @see OverviewConfig
 */
public final class OverviewAssembler {
    private static final Logger logger = Logger.getLogger(OverviewAssembler.class.getName());

    static final String SOLVED_BY_PRESOLVE = "The model was solved by presolve.";

    private final OverviewConfig config;
    private final MetricCatalog catalog;

    public OverviewAssembler(OverviewConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.catalog = MetricCatalog.standard(config.getOutdatedBefore());
    }

    public OverviewAssembler() {
        this(OverviewConfig.defaults());
    }

    public OverviewReport assemble(List<? extends LogBlock> blocks) throws StructuralInputException {
        return assemble(LogDocument.of(blocks));
    }

    /**
     * Собирает отчет для одного лога.
     *
     * @param document блоки и комментарии лога
     * @return собранный отчет
     * @throws StructuralInputException если блок ответа присутствует, но не содержит читаемого статуса,
     *         либо политика дубликатов {@code FAIL} отклонила лог
     */
    public OverviewReport assemble(LogDocument document) throws StructuralInputException {
        Objects.requireNonNull(document, "document cannot be null");

        BlockRegistry registry = BlockRegistry.of(document.getBlocks(), config.getDuplicatePolicy());
        BlockSnapshot blocks = BlockSnapshot.from(registry);
        logger.fine("Assembling overview from " + registry.size() + " block kinds");

        Map<MetricKey, MetricValue> values = config.isParallel()
            ? deriveParallel(blocks)
            : deriveSequential(blocks);

        OverviewReport.Builder report = OverviewReport.builder()
            .comments(document.getComments());
        for (MetricKey key : MetricKey.values()) {
            report.metric(new MetricEntry(key, values.get(key)));
        }

        report.parameters(isolate("parameters",
            () -> SolverMetrics.parameters(blocks.getSolver()), Collections.emptyMap()));

        Optional<SearchProgressChart> chart = isolate("search progress chart",
            () -> SearchPlot.chart(blocks.getResponse(), blocks.getSearchProgress(), blocks.getInitialModel()),
            Optional.empty());
        chart.ifPresent(report::searchProgressChart);

        Optional<Boolean> solvedByPresolve = isolate("presolve summary",
            () -> PresolveOutcome.solvedByPresolve(blocks.getPresolveSummary()), Optional.empty());
        solvedByPresolve.ifPresent(solved -> {
            report.solvedByPresolve(solved);
            if (solved) {
                report.notice(Notice.info(SOLVED_BY_PRESOLVE));
            }
        });

        for (BlockAnomaly anomaly : registry.getAnomalies()) {
            report.notice(Notice.warning(anomaly.describe()));
        }

        return report.build();
    }

    private Map<MetricKey, MetricValue> deriveSequential(BlockSnapshot blocks) {
        Map<MetricKey, MetricValue> values = new EnumMap<>(MetricKey.class);
        for (Map.Entry<MetricKey, MetricDeriver> entry : catalog.getDerivers().entrySet()) {
            values.put(entry.getKey(), derive(entry.getKey(), entry.getValue(), blocks));
        }
        return values;
    }

    private Map<MetricKey, MetricValue> deriveParallel(BlockSnapshot blocks) {
        ExecutorService executor = Executors.newFixedThreadPool(config.getMaxParallelDerivers());
        try {
            Map<MetricKey, Future<MetricValue>> futures = new EnumMap<>(MetricKey.class);
            for (Map.Entry<MetricKey, MetricDeriver> entry : catalog.getDerivers().entrySet()) {
                MetricKey key = entry.getKey();
                MetricDeriver deriver = entry.getValue();
                futures.put(key, executor.submit(() -> derive(key, deriver, blocks)));
            }

            Map<MetricKey, MetricValue> values = new EnumMap<>(MetricKey.class);
            for (Map.Entry<MetricKey, Future<MetricValue>> entry : futures.entrySet()) {
                values.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
            }
            return values;
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private MetricValue await(MetricKey key, Future<MetricValue> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // derive() already isolates RuntimeException, so only Errors end up here
            logger.warning("Metric '" + key.getLabel() + "' failed: " + e.getCause());
            return MetricValue.unavailable(String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return MetricValue.unavailable("interrupted");
        }
    }

    private static MetricValue derive(MetricKey key, MetricDeriver deriver, BlockSnapshot blocks) {
        MetricValue value = isolate(key.getLabel(), () -> deriver.derive(blocks), null);
        if (value == null) {
            return MetricValue.unavailable("could not compute " + key.getLabel());
        }
        return value;
    }

    private static <T> T isolate(String what, Supplier<T> computation, T fallback) {
        try {
            return computation.get();
        } catch (RuntimeException e) {
            logger.warning("Could not compute " + what + ": " + e);
            return fallback;
        }
    }

    public OverviewConfig getConfig() {
        return config;
    }
}
