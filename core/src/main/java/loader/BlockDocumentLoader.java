package loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import model.DefaultInitialModelBlock;
import model.DefaultPresolveSummaryBlock;
import model.DefaultResponseBlock;
import model.DefaultSearchProgressBlock;
import model.DefaultSolverBlock;
import model.LogBlock;
import model.LogDocument;
import model.ProgressPoint;
import model.ProgressSeries;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Загрузчик документа с уже разобранными блоками лога CP-SAT в формате JSON.
 *
 * <p>Документ содержит массив {@code blocks}, где каждый элемент помечен полем {@code type}
 * ({@code solver}, {@code initial_model}, {@code search_progress}, {@code response},
 * {@code presolve_summary}), и необязательный массив строк {@code comments}.
 *
 * <p>Поддерживает:
 * <ul>
 *   <li>Загрузку из файла и из строки</li>
 *   <li>Пропуск блоков неизвестного типа с предупреждением</li>
 *   <li>Пропуск блоков без обязательных полей с предупреждением</li>
 * </ul>
 *
 * <p>Содержимое полей блока ответа не проверяется: отсутствие статуса обнаруживает
 * сборщик отчета, а не загрузчик.
 */
public final class BlockDocumentLoader {
    private static final Logger logger = Logger.getLogger(BlockDocumentLoader.class.getName());

    private final ObjectMapper objectMapper;

    public BlockDocumentLoader() {
        this(new ObjectMapper());
    }

    public BlockDocumentLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Результат загрузки документа.
     * Содержит документ с блоками, предупреждения и статус успешности.
     */
    public static final class LoadResult {
        private final LogDocument document;
        private final List<String> messages;
        private final boolean successful;

        private LoadResult(LogDocument document, List<String> messages, boolean successful) {
            this.document = document;
            this.messages = messages != null ? List.copyOf(messages) : List.of();
            this.successful = successful;
        }

        public static LoadResult success(LogDocument document, List<String> messages) {
            return new LoadResult(document, messages, true);
        }

        public static LoadResult failure(List<String> messages) {
            return new LoadResult(null, messages, false);
        }

        public LogDocument getDocument() {
            return document;
        }

        public List<String> getMessages() {
            return messages;
        }

        public boolean isSuccessful() {
            return successful;
        }

        public boolean hasMessages() {
            return !messages.isEmpty();
        }
    }

    /**
     * Загружает документ из файла.
     *
     * @param path путь к JSON файлу
     * @return результат загрузки
     */
    public LoadResult load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            return LoadResult.failure(List.of("Block document not found: " + path));
        }
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            return LoadResult.failure(List.of("Cannot read block document " + path + ": " + e.getMessage()));
        }
    }

    /**
     * Разбирает документ из JSON строки.
     *
     * @param json содержимое документа
     * @return результат загрузки
     */
    public LoadResult parse(String json) {
        Objects.requireNonNull(json, "json must not be null");

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return LoadResult.failure(List.of("Invalid JSON: " + e.getOriginalMessage()));
        }
        if (root == null || !root.isObject()) {
            return LoadResult.failure(List.of("Block document must be a JSON object"));
        }

        List<String> messages = new ArrayList<>();
        List<String> comments = readComments(root.path("comments"), messages);

        JsonNode blocksNode = root.path("blocks");
        if (!blocksNode.isMissingNode() && !blocksNode.isArray()) {
            return LoadResult.failure(List.of("'blocks' must be an array"));
        }

        List<LogBlock> blocks = new ArrayList<>();
        int index = 0;
        for (JsonNode blockNode : blocksNode) {
            try {
                LogBlock block = readBlock(blockNode);
                if (block != null) {
                    blocks.add(block);
                } else {
                    messages.add(String.format("Skipping block #%d: unknown type '%s'",
                        index, blockNode.path("type").asText()));
                }
            } catch (IllegalArgumentException e) {
                messages.add(String.format("Skipping block #%d: %s", index, e.getMessage()));
            }
            index++;
        }

        for (String message : messages) {
            logger.warning(message);
        }
        return LoadResult.success(new LogDocument(blocks, comments), messages);
    }

    private List<String> readComments(JsonNode node, List<String> messages) {
        List<String> comments = new ArrayList<>();
        if (node.isMissingNode() || node.isNull()) {
            return comments;
        }
        if (!node.isArray()) {
            messages.add("Ignoring 'comments': expected an array of strings");
            return comments;
        }
        for (JsonNode comment : node) {
            comments.add(comment.asText());
        }
        return comments;
    }

    private LogBlock readBlock(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("block must be a JSON object");
        }
        String type = node.path("type").asText("").trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "solver":
                return readSolver(node);
            case "initial_model":
                return new DefaultInitialModelBlock(
                    requireInt(node, "variables"),
                    requireInt(node, "constraints"),
                    requireBoolean(node, "optimization"));
            case "search_progress":
                return new DefaultSearchProgressBlock(
                    requireNumber(node, "presolve_time"),
                    readSeries(node.path("events")));
            case "response":
                return new DefaultResponseBlock(readFields(node.path("fields")));
            case "presolve_summary":
                return new DefaultPresolveSummaryBlock(requireBoolean(node, "solved_by_presolve"));
            default:
                return null;
        }
    }

    private LogBlock readSolver(JsonNode node) {
        JsonNode version = node.path("version");
        if (!version.isTextual() && !version.isNumber()) {
            throw new IllegalArgumentException("solver block requires 'version'");
        }
        Integer workers = null;
        JsonNode workersNode = node.path("workers");
        if (!workersNode.isMissingNode() && !workersNode.isNull()) {
            workers = requireInt(node, "workers");
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        JsonNode parametersNode = node.path("parameters");
        if (parametersNode.isObject()) {
            parameters = objectMapper.convertValue(parametersNode,
                new TypeReference<LinkedHashMap<String, Object>>() { });
        } else if (!parametersNode.isMissingNode() && !parametersNode.isNull()) {
            throw new IllegalArgumentException("'parameters' must be an object");
        }
        return new DefaultSolverBlock(version.asText(), workers, parameters);
    }

    private ProgressSeries readSeries(JsonNode events) {
        if (events.isMissingNode() || events.isNull()) {
            return ProgressSeries.empty();
        }
        if (!events.isArray()) {
            throw new IllegalArgumentException("'events' must be an array");
        }
        List<ProgressPoint> points = new ArrayList<>();
        for (JsonNode event : events) {
            points.add(new ProgressPoint(
                requireNumber(event, "time"),
                optionalNumber(event, "objective"),
                optionalNumber(event, "bound")));
        }
        return ProgressSeries.of(points);
    }

    private Map<String, String> readFields(JsonNode fields) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!fields.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> iterator = fields.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                result.put(field.getKey(), field.getValue().asText());
            }
        }
        return result;
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isIntegralNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be an integer");
        }
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException("'" + field + "' is out of int range: " + value.asText());
        }
        return value.intValue();
    }

    private static double requireNumber(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be a number");
        }
        return value.doubleValue();
    }

    private static Double optionalNumber(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.doubleValue() : null;
    }

    private static boolean requireBoolean(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isBoolean()) {
            throw new IllegalArgumentException("'" + field + "' must be true or false");
        }
        return value.booleanValue();
    }
}
