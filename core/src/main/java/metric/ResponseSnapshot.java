package metric;

import model.BlockKind;
import model.ResponseBlock;
import model.SolverStatus;
import model.StructuralInputException;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * The response block together with its validated status, the anchor every other metric is read against.
 *
 * <p>An absent response block is a normal, soft case. A response block that is present
 * but has no readable status is a structural error.
 */
public final class ResponseSnapshot {
    private static final ResponseSnapshot ABSENT = new ResponseSnapshot(null, null, Collections.emptyMap());

    private final ResponseBlock block;
    private final SolverStatus status;
    private final Map<String, String> fields;

    private ResponseSnapshot(ResponseBlock block, SolverStatus status, Map<String, String> fields) {
        this.block = block;
        this.status = status;
        this.fields = fields;
    }

    public static ResponseSnapshot absent() {
        return ABSENT;
    }

    /**
     * Validates the response anchor.
     *
     * @param response the response block, if the log has one
     * @return the snapshot
     * @throws StructuralInputException if the block is present but its field map or status is missing or unknown
     */
    public static ResponseSnapshot of(Optional<ResponseBlock> response) throws StructuralInputException {
        if (response.isEmpty()) {
            return ABSENT;
        }
        ResponseBlock block = response.get();
        Map<String, String> fields = block.toMap();
        if (fields == null) {
            throw new StructuralInputException(BlockKind.RESPONSE, ResponseBlock.STATUS,
                "response block has no fields");
        }
        String token = fields.get(ResponseBlock.STATUS);
        if (token == null) {
            throw new StructuralInputException(BlockKind.RESPONSE, ResponseBlock.STATUS,
                "field is missing");
        }
        SolverStatus status = SolverStatus.fromToken(token)
            .orElseThrow(() -> new StructuralInputException(BlockKind.RESPONSE, ResponseBlock.STATUS,
                "unrecognized status '" + token + "'"));
        return new ResponseSnapshot(block, status, fields);
    }

    public boolean isPresent() {
        return block != null;
    }

    public Optional<ResponseBlock> getBlock() {
        return Optional.ofNullable(block);
    }

    public Optional<SolverStatus> getStatus() {
        return Optional.ofNullable(status);
    }

    /**
     * @return the raw token of a response field, empty if the block or the field is missing
     */
    public Optional<String> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }
}
