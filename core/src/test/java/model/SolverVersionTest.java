package model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SolverVersionTest {

    @Test
    void parse_withFullVersion_shouldReadAllComponents() {
        SolverVersion version = SolverVersion.parse("9.10.4025");

        assertEquals(9, version.getMajor());
        assertEquals(10, version.getMinor());
        assertEquals(4025, version.getPatch());
    }

    @Test
    void parse_withShortVersionAndPrefix_shouldDefaultMissingComponents() {
        assertEquals(new SolverVersion(9, 8, 0), SolverVersion.parse(" v9.8 "));
        assertEquals(new SolverVersion(10, 0, 0), SolverVersion.parse("10"));
    }

    @Test
    void parse_withGarbage_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> SolverVersion.parse("nine.ten"));
        assertThrows(IllegalArgumentException.class, () -> SolverVersion.parse(""));
        assertThrows(IllegalArgumentException.class, () -> SolverVersion.parse(null));
    }

    @Test
    void isOlderThan_shouldCompareMinorNumerically() {
        SolverVersion threshold = new SolverVersion(9, 10, 0);

        assertTrue(new SolverVersion(9, 9, 3296).isOlderThan(threshold));
        assertTrue(new SolverVersion(8, 2, 0).isOlderThan(threshold));
        assertFalse(new SolverVersion(9, 10, 0).isOlderThan(threshold));
        assertFalse(new SolverVersion(9, 11, 0).isOlderThan(threshold));
        assertFalse(new SolverVersion(10, 0, 0).isOlderThan(threshold));
    }
}
