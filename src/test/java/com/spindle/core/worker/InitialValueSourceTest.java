package com.spindle.core.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InitialValueSourceTest {

    @Test
    @DisplayName("seeded source produces non-negative values")
    void nonNegative() {
        var source = InitialValueSource.seeded(1234L);
        for (int i = 0; i < 1_000; i++) {
            long value = source.nextInitialValue();
            assertTrue(value >= 0 && value < Integer.MAX_VALUE, "value out of range: " + value);
        }
    }

    @Test
    @DisplayName("the same seed produces the same sequence")
    void repeatable() {
        var a = InitialValueSource.seeded(42L);
        var b = InitialValueSource.seeded(42L);
        for (int i = 0; i < 10; i++) {
            assertEquals(a.nextInitialValue(), b.nextInitialValue());
        }
    }
}
