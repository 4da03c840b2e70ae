package model;

/**
 * Виды блоков, извлекаемых парсером из лога запуска CP-SAT.
 *
 * <p>Для каждого вида в логе может присутствовать не более одного блока.
 * Вид связан с типизированным интерфейсом блока, через который отчет читает поля.
 */
public enum BlockKind {
    SOLVER("Solver", SolverBlock.class),
    INITIAL_MODEL("Initial Optimization Model", InitialModelBlock.class),
    SEARCH_PROGRESS("Search Progress", SearchProgressBlock.class),
    RESPONSE("CpSolverResponse", ResponseBlock.class),
    PRESOLVE_SUMMARY("Presolve Summary", PresolveSummaryBlock.class);

    private final String displayName;
    private final Class<? extends LogBlock> blockType;

    BlockKind(String displayName, Class<? extends LogBlock> blockType) {
        this.displayName = displayName;
        this.blockType = blockType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Class<? extends LogBlock> getBlockType() {
        return blockType;
    }

    /**
     * Находит вид блока по типизированному интерфейсу.
     *
     * @param type интерфейс блока
     * @return вид блока
     * @throws IllegalArgumentException если интерфейс не соответствует ни одному виду
     */
    public static BlockKind forType(Class<? extends LogBlock> type) {
        for (BlockKind kind : values()) {
            if (kind.blockType.equals(type)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("No block kind for type " + type.getName());
    }
}
