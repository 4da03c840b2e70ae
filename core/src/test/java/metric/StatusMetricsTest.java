package metric;

import model.DefaultResponseBlock;
import model.DefaultSearchProgressBlock;
import model.ProgressSeries;
import model.ResponseBlock;
import model.SolverStatus;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StatusMetricsTest {

    private static ResponseSnapshot response(Map<String, String> fields) throws Exception {
        return ResponseSnapshot.of(Optional.<ResponseBlock>of(new DefaultResponseBlock(fields)));
    }

    @Test
    void status_shouldReadResponseStatus() throws Exception {
        MetricValue value = StatusMetrics.status(response(Map.of("status", "FEASIBLE")));

        assertEquals(SolverStatus.FEASIBLE, value.getValue());
        assertEquals("FEASIBLE", value.getDisplay());
    }

    @Test
    void status_withoutResponse_shouldBeAbsent() {
        MetricValue value = StatusMetrics.status(ResponseSnapshot.absent());

        assertEquals(MetricValue.State.ABSENT, value.getState());
    }

    @Test
    void wallTime_shouldFormatSeconds() throws Exception {
        MetricValue value = StatusMetrics.wallTime(response(Map.of("status", "OPTIMAL", "walltime", "1.23456")));

        assertEquals(1.23456, (Double) value.getValue(), 1e-12);
        assertEquals("1.235s", value.getDisplay());
    }

    @Test
    void wallTime_withMissingField_shouldBeAbsent() throws Exception {
        MetricValue value = StatusMetrics.wallTime(response(Map.of("status", "OPTIMAL")));

        assertEquals(MetricValue.State.ABSENT, value.getState());
    }

    @Test
    void wallTime_withGarbage_shouldBeUnavailable() throws Exception {
        MetricValue value = StatusMetrics.wallTime(response(Map.of("status", "OPTIMAL", "walltime", "n/a")));

        assertEquals(MetricValue.State.UNAVAILABLE, value.getState());
        assertTrue(value.getReason().contains("walltime"));
    }

    @Test
    void presolveTime_shouldComeFromSearchProgress() {
        MetricValue value = StatusMetrics.presolveTime(
            Optional.of(new DefaultSearchProgressBlock(0.0421, ProgressSeries.empty())));

        assertEquals("0.042s", value.getDisplay());
        assertFalse(StatusMetrics.presolveTime(Optional.empty()).isKnown());
    }
}
