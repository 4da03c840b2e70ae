package metric;

import model.DefaultInitialModelBlock;
import model.InitialModelBlock;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModelMetricsTest {

    private final Optional<InitialModelBlock> model =
        Optional.of(new DefaultInitialModelBlock(1200, 345, false));

    @Test
    void sizes_shouldComeFromInitialModel() {
        assertEquals("1200", ModelMetrics.variables(model).getDisplay());
        assertEquals(345, ModelMetrics.constraints(model).getValue());
    }

    @Test
    void modelType_shouldReportSatisfaction() {
        MetricValue value = ModelMetrics.modelType(model);

        assertEquals(ModelType.SATISFACTION, value.getValue());
        assertEquals("Satisfaction", value.getDisplay());
    }

    @Test
    void allMetrics_withoutInitialModel_shouldBeAbsent() {
        assertFalse(ModelMetrics.variables(Optional.empty()).isKnown());
        assertFalse(ModelMetrics.constraints(Optional.empty()).isKnown());
        assertEquals("N/A", ModelMetrics.modelType(Optional.empty()).getDisplay());
    }
}
