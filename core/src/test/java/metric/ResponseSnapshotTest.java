package metric;

import model.BlockKind;
import model.DefaultResponseBlock;
import model.ResponseBlock;
import model.SolverStatus;
import model.StructuralInputException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResponseSnapshotTest {

    private static Optional<ResponseBlock> block(Map<String, String> fields) {
        return Optional.of(new DefaultResponseBlock(fields));
    }

    @Test
    void of_withoutBlock_shouldBeAbsent() throws Exception {
        ResponseSnapshot snapshot = ResponseSnapshot.of(Optional.empty());

        assertFalse(snapshot.isPresent());
        assertTrue(snapshot.getStatus().isEmpty());
        assertTrue(snapshot.field("objective").isEmpty());
    }

    @Test
    void of_withStatus_shouldNormalizeToken() throws Exception {
        ResponseSnapshot snapshot = ResponseSnapshot.of(block(Map.of("status", " optimal ")));

        assertEquals(Optional.of(SolverStatus.OPTIMAL), snapshot.getStatus());
    }

    @Test
    void of_withMissingStatus_shouldThrowStructuralError() {
        StructuralInputException e = assertThrows(StructuralInputException.class,
            () -> ResponseSnapshot.of(block(Map.of("objective", "5"))));

        assertEquals(BlockKind.RESPONSE, e.getBlockKind());
        assertEquals("status", e.getFieldName());
    }

    @Test
    void of_withUnknownStatus_shouldThrowStructuralError() {
        StructuralInputException e = assertThrows(StructuralInputException.class,
            () -> ResponseSnapshot.of(block(Map.of("status", "SOLVED"))));

        assertTrue(e.getMessage().contains("SOLVED"));
    }

    @Test
    void of_withNullFieldMap_shouldThrowStructuralError() {
        ResponseBlock broken = mock(ResponseBlock.class);
        when(broken.toMap()).thenReturn(null);

        assertThrows(StructuralInputException.class, () -> ResponseSnapshot.of(Optional.of(broken)));
    }
}
