package com.hellblazer.spectra.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Coordinate Tests")
class CoordinateTest {

    @Test
    @DisplayName("Create 2D coordinate")
    void testCreate2D() {
        var coord = Coordinate.of(3.5, 7.2);

        assertEquals(2, coord.dimensions());
        assertEquals(3.5, coord.x(), 1e-10);
        assertEquals(7.2, coord.y(), 1e-10);
        assertEquals(0.0, coord.z(), 1e-10);
    }

    @Test
    @DisplayName("Create 3D coordinate")
    void testCreate3D() {
        var coord = Coordinate.of(1.0, 2.5, -3.7);

        assertEquals(3, coord.dimensions());
        assertArrayEquals(new double[] { 1.0, 2.5, -3.7 }, coord.values(), 1e-10);
        assertEquals(-3.7, coord.z(), 1e-10);
    }

    @Test
    @DisplayName("Values are defensively copied")
    void testDefensiveCopy() {
        var values = new double[] { 1.1, 2.2 };
        var coord = new Coordinate(values);

        values[0] = 999.0;
        assertEquals(1.1, coord.get(0), 1e-10);

        coord.values()[1] = 999.0;
        assertEquals(2.2, coord.get(1), 1e-10);
    }

    @Test
    @DisplayName("Reject null or empty values")
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new Coordinate(null));
        assertThrows(IllegalArgumentException.class, () -> new Coordinate(new double[0]));
    }

    @Test
    @DisplayName("Arithmetic and distance")
    void testArithmetic() {
        var a = Coordinate.of(5.0, 8.0);
        var b = Coordinate.of(2.0, 4.0);

        assertEquals(Coordinate.of(7.0, 12.0), a.add(b));
        assertEquals(Coordinate.of(3.0, 4.0), a.subtract(b));
        assertEquals(5.0, a.distance(b), 1e-10);
        assertEquals(5.0, Coordinate.of(3.0, 4.0).magnitude(), 1e-10);
    }

    @Test
    @DisplayName("Mismatched dimensions are rejected")
    void testDimensionMismatch() {
        var a = Coordinate.of(1.0, 2.0);
        var b = Coordinate.of(1.0, 2.0, 3.0);

        assertThrows(IllegalArgumentException.class, () -> a.add(b));
        assertThrows(IllegalArgumentException.class, () -> a.distance(b));
        assertThrows(IllegalArgumentException.class, () -> a.get(2));
    }

    @Test
    @DisplayName("Approximate equality and validity")
    void testApproximateEquality() {
        var a = Coordinate.of(1.0, 2.0);

        assertTrue(a.isApproximatelyEqual(Coordinate.of(1.0 + 1e-12, 2.0), 1e-9));
        assertFalse(a.isApproximatelyEqual(Coordinate.of(1.1, 2.0), 1e-9));
        assertThrows(IllegalArgumentException.class, () -> a.isApproximatelyEqual(a, -1.0));
        assertTrue(a.isValid());
        assertFalse(Coordinate.of(Double.NaN, 1.0).isValid());
    }

    @Test
    @DisplayName("Equality is by value")
    void testEquality() {
        assertEquals(Coordinate.of(1.0, 2.0), Coordinate.of(1.0, 2.0));
        assertEquals(Coordinate.of(1.0, 2.0).hashCode(), Coordinate.of(1.0, 2.0).hashCode());
        assertNotEquals(Coordinate.of(1.0, 2.0), Coordinate.of(1.0, 2.0, 0.0));
    }
}
