package metric;

import model.DefaultResponseBlock;
import model.ResponseBlock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObjectiveMetricsTest {

    private static ResponseSnapshot response(String objective, String bound) throws Exception {
        Map<String, String> fields = new HashMap<>();
        fields.put("status", "OPTIMAL");
        if (objective != null) {
            fields.put("objective", objective);
        }
        if (bound != null) {
            fields.put("best_bound", bound);
        }
        return ResponseSnapshot.of(Optional.<ResponseBlock>of(new DefaultResponseBlock(fields)));
    }

    @Test
    void objective_shouldParseAndFormat() throws Exception {
        MetricValue value = ObjectiveMetrics.objective(response("1234.0", "1200"));

        assertEquals(1234.0, (Double) value.getValue(), 0.0);
        assertEquals("1234", value.getDisplay());
    }

    @Test
    void objective_withInfinityToken_shouldBeUnavailable() throws Exception {
        MetricValue value = ObjectiveMetrics.objective(response("inf", "1200"));

        assertEquals(MetricValue.State.UNAVAILABLE, value.getState());
        assertEquals("N/A", value.getDisplay());
    }

    @Test
    void bestBound_withMissingField_shouldBeAbsent() throws Exception {
        MetricValue value = ObjectiveMetrics.bestBound(response("10", null));

        assertEquals(MetricValue.State.ABSENT, value.getState());
    }

    @Test
    void gap_withEqualObjectiveAndBound_shouldBeZeroPercent() throws Exception {
        MetricValue value = ObjectiveMetrics.gap(response("10", "10"));

        assertEquals("0.00%", value.getDisplay());
    }

    @Test
    void gap_shouldBeRelativeToObjective() throws Exception {
        MetricValue value = ObjectiveMetrics.gap(response("200", "150"));

        assertEquals(25.0, (Double) value.getValue(), 1e-9);
        assertEquals("25.00%", value.getDisplay());
    }

    @Test
    void gap_withUnparseableObjective_shouldBeUnavailable() throws Exception {
        MetricValue value = ObjectiveMetrics.gap(response("-inf", "10"));

        assertEquals(MetricValue.State.UNAVAILABLE, value.getState());
        assertTrue(value.getReason().contains("objective"));
    }

    @Test
    void gap_withoutObjective_shouldBeAbsent() throws Exception {
        assertEquals(MetricValue.State.ABSENT, ObjectiveMetrics.gap(response(null, "10")).getState());
    }

    @Test
    void gap_withoutResponse_shouldBeAbsent() {
        assertEquals(MetricValue.State.ABSENT, ObjectiveMetrics.gap(ResponseSnapshot.absent()).getState());
    }

    @Test
    void gap_shouldUseValueReportedByBlock() throws Exception {
        ResponseBlock block = mock(ResponseBlock.class);
        when(block.toMap()).thenReturn(Map.of("status", "FEASIBLE"));
        when(block.getGap()).thenReturn(OptionalDouble.of(1.5));

        MetricValue value = ObjectiveMetrics.gap(ResponseSnapshot.of(Optional.of(block)));

        assertEquals("1.50%", value.getDisplay());
    }

    @Test
    void gap_withNaNFromBlock_shouldBeUnavailable() throws Exception {
        ResponseBlock block = mock(ResponseBlock.class);
        when(block.toMap()).thenReturn(Map.of("status", "FEASIBLE"));
        when(block.getGap()).thenReturn(OptionalDouble.of(Double.NaN));

        MetricValue value = ObjectiveMetrics.gap(ResponseSnapshot.of(Optional.of(block)));

        assertEquals(MetricValue.State.UNAVAILABLE, value.getState());
    }
}
