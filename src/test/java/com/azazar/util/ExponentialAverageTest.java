package com.azazar.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ExponentialAverageTest {

    @Test
    void firstSampleInitializesAverage() {
        ExponentialAverage avg = new ExponentialAverage(4);
        Assertions.assertTrue(Double.isNaN(avg.value()), "Expected NaN before any sample");

        avg.add(10);
        Assertions.assertEquals(10.0, avg.value());

        avg.add(20);
        Assertions.assertEquals(12.5, avg.value());
        Assertions.assertEquals(2, avg.samples());
    }

    @Test
    void defaultPeriod() {
        Assertions.assertEquals(100, new ExponentialAverage().period());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ExponentialAverage(0));
    }

}
