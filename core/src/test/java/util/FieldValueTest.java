package util;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class FieldValueTest {

    @Test
    void parsed_shouldExposeValue() {
        FieldValue<Double> value = FieldValue.parsed(2.0);

        assertTrue(value.isParsed());
        assertEquals(2.0, value.get());
        assertNull(value.getReason());
        assertEquals(FieldValue.parsed(4.0), value.map(v -> v * 2));
    }

    @Test
    void unavailable_shouldCarryReasonThroughMap() {
        FieldValue<Double> value = FieldValue.unavailable("not a number: 'inf'");

        assertTrue(value.isUnavailable());
        assertEquals(-1.0, value.orElse(-1.0));
        assertThrows(NoSuchElementException.class, value::get);

        FieldValue<String> mapped = value.map(String::valueOf);
        assertTrue(mapped.isUnavailable());
        assertEquals("not a number: 'inf'", mapped.getReason());
    }
}
