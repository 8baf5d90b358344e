package com.azazar.collections.kdtree;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PointTest {

    @Test
    void equalityIsComponentwise() {
        Assertions.assertEquals(Point.of(2, 3), Point.of(2, 3));
        Assertions.assertEquals(Point.of(2, 3).hashCode(), Point.of(2, 3).hashCode());
        Assertions.assertNotEquals(Point.of(2, 3), Point.of(3, 2), "Coordinate order matters");
        Assertions.assertNotEquals(Point.of(2, 3), Point.of(2, 3, 0));
    }

    @Test
    void signedZeroCoordinatesAreEqual() {
        Point negative = Point.of(-0.0, 5);
        Point positive = Point.of(0.0, 5);

        Assertions.assertEquals(positive, negative, "-0.0 and 0.0 are the same coordinate");
        Assertions.assertEquals(positive.hashCode(), negative.hashCode());
        Assertions.assertEquals("(0, 5)", negative.toString());
    }

    @Test
    void squaredDistanceSumsSquaredDifferences() {
        Point a = Point.of(9, 2);
        Point b = Point.of(8, 1);

        Assertions.assertEquals(2.0, Point.squaredDistance(a, b));
        Assertions.assertEquals(Point.squaredDistance(a, b), Point.squaredDistance(b, a));
        Assertions.assertEquals(0.0, Point.squaredDistance(a, a));
        Assertions.assertEquals(50.0, Point.squaredDistance(Point.of(0, 0, 0), Point.of(3, 4, 5)));
    }

    @Test
    void axisSquaredDistanceUsesSingleCoordinate() {
        Point a = Point.of(1, 10);
        Point b = Point.of(4, -2);

        Assertions.assertEquals(9.0, a.axisSquaredDistance(b, 0));
        Assertions.assertEquals(144.0, a.axisSquaredDistance(b, 1));
    }

    @Test
    void coordinatesAreCopied() {
        double[] source = {1, 2};
        Point p = new Point(source);
        source[0] = 100;

        Assertions.assertEquals(1.0, p.get(0), "Point must not share the caller's array");
        Assertions.assertEquals(2, p.dimensions());
    }

    @Test
    void toStringPrintsWholeNumbersWithoutFraction() {
        Assertions.assertEquals("(2, 3)", Point.of(2, 3).toString());
        Assertions.assertEquals("(1.5, -2)", Point.of(1.5, -2).toString());
    }

    @Test
    void rejectsInvalidCoordinates() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Point.of());
        Assertions.assertThrows(IllegalArgumentException.class, () -> Point.of(1, Double.NaN));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Point.of(Double.POSITIVE_INFINITY));
        Assertions.assertThrows(NullPointerException.class, () -> new Point(null));
    }

}
