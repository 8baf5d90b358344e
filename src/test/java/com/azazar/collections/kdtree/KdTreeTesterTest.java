package com.azazar.collections.kdtree;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class KdTreeTesterTest {

    @Test
    void runChecksTreeAgainstLinearScan() {
        KdTreeTester.Report report = KdTreeTester.run(5000, 10000, 2, 0, 300);

        Assertions.assertEquals(5000, report.inserted());
        Assertions.assertEquals(301, report.queries(), "The fixed query is checked too");
        Assertions.assertEquals(Point.of(1111, 3234), report.fixedQuery());
        Assertions.assertNotNull(report.fixedQueryNearest());
        Assertions.assertFalse(Double.isNaN(report.averageQueryNanos()));
    }

    @Test
    void runWorksInHigherDimensions() {
        KdTreeTester.Report report = KdTreeTester.run(2000, 50, 4, 7, 100);

        Assertions.assertEquals(4, report.fixedQuery().dimensions());
        Assertions.assertEquals(4, report.fixedQueryNearest().dimensions());
    }

    @Test
    void fixedQueryIsPaddedOrTruncated() {
        Assertions.assertEquals(Point.of(1111, 3234, 0), KdTreeTester.fixedQuery(3));
        Assertions.assertEquals(Point.of(1111), KdTreeTester.fixedQuery(1));
    }

    @Test
    void rejectsBadArguments() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> KdTreeTester.run(0, 10, 2, 0, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> KdTreeTester.run(10, 0, 2, 0, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> KdTreeTester.run(10, 10, 0, 0, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> KdTreeTester.run(10, 10, 2, 0, -1));
    }

}
