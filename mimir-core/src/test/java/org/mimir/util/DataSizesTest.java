package org.mimir.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DataSizesTest {

    @Test
    void evaluate_units() {
        assertEquals(1024L, DataSizes.evaluate("1KB"));
        assertEquals(1048576L, DataSizes.evaluate("1MB"));
        assertEquals(1073741824L, DataSizes.evaluate("1GB"));
        assertEquals(1099511627776L, DataSizes.evaluate("1TB"));
        assertEquals(512L * 1024 * 1024, DataSizes.evaluate("512MiB"));
        assertEquals(10L * 1024 * 1024 * 1024, DataSizes.evaluate("10GiB"));
        assertEquals(42L, DataSizes.evaluate("42B"));
    }

    @Test
    void evaluate_products_and_fractions() {
        assertEquals(10737418240L, DataSizes.evaluate("1024*1024*1024*10"));
        assertEquals(1610612736L, DataSizes.evaluate("1.5GB"));
        assertEquals(1024L, DataSizes.evaluate(" 1 kb "));
    }

    @Test
    void evaluate_invalid_throws() {
        assertThrows(NumberFormatException.class, () -> DataSizes.evaluate("ABC"));
        assertThrows(NumberFormatException.class, () -> DataSizes.evaluate("1PB"));
        assertThrows(NumberFormatException.class, () -> DataSizes.evaluate(""));
    }

    @Test
    void parseBytes_rejectsZero() {
        assertThrows(IllegalArgumentException.class, () -> DataSizes.parseBytes("0"));
        assertEquals(2048L, DataSizes.parseBytes("2KiB"));
    }
}
