package com.hellblazer.spectra.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeometryFactory Tests")
class GeometryFactoryTest {

    private static final List<Coordinate> SQUARE = List.of(Coordinate.of(0.0, 0.0), Coordinate.of(0.0, 10.0),
                                                           Coordinate.of(10.0, 10.0), Coordinate.of(10.0, 0.0));

    @Test
    @DisplayName("Create polygon with shell only")
    void testCreatePolygon() {
        var factory = new GeometryFactory();
        var polygon = factory.createPolygon(SQUARE);

        assertSame(factory, polygon.factory());
        assertEquals(SQUARE, polygon.shell());
        assertEquals(0, polygon.holeCount());
        assertTrue(polygon.metadata().isEmpty());
        assertFalse(polygon.isEmpty());
        assertEquals(new Envelope(new double[] { 0.0, 0.0 }, new double[] { 10.0, 10.0 }),
                     polygon.envelope().orElseThrow());
    }

    @Test
    @DisplayName("Rings and metadata are copied")
    void testCopies() {
        var shell = new ArrayList<>(SQUARE);
        var hole = new ArrayList<>(List.of(Coordinate.of(2.0, 2.0), Coordinate.of(2.0, 4.0), Coordinate.of(4.0, 4.0)));
        var metadata = new HashMap<String, Object>();
        metadata.put("name", "field 7");
        metadata.put("owner", null);

        var polygon = new GeometryFactory().createPolygon(shell, List.of(hole), metadata);
        shell.clear();
        hole.clear();
        metadata.put("name", "changed");

        assertEquals(4, polygon.shell().size());
        assertEquals(3, polygon.hole(0).size());
        assertEquals("field 7", polygon.metadata("name"));
        assertTrue(polygon.metadata().containsKey("owner"));
        assertNull(polygon.metadata("owner"));
        assertNull(polygon.metadata(null));
        assertThrows(UnsupportedOperationException.class, () -> polygon.metadata().put("x", 1));
    }

    @Test
    @DisplayName("Empty shell yields empty polygon")
    void testEmptyPolygon() {
        var polygon = new GeometryFactory().createPolygon(List.of());

        assertTrue(polygon.isEmpty());
        assertTrue(polygon.envelope().isEmpty());
    }

    @Test
    @DisplayName("Polygons are equal by value")
    void testEquality() {
        var factory = new GeometryFactory();

        assertEquals(factory.createPolygon(SQUARE), factory.createPolygon(SQUARE, null, null));
        assertNotEquals(factory.createPolygon(SQUARE), factory.createPolygon(SQUARE.subList(0, 3)));
    }

    @Test
    @DisplayName("Register, look up and remove extensions")
    void testExtensions() {
        var factory = new GeometryFactory();

        assertTrue(factory.getExtension(String.class).isEmpty());
        assertTrue(factory.registerExtension(String.class, "first").isEmpty());
        assertEquals("first", factory.registerExtension(String.class, "second").orElseThrow());
        assertEquals("second", factory.getExtension(String.class).orElseThrow());
        assertTrue(factory.removeExtension(String.class));
        assertFalse(factory.removeExtension(String.class));
        assertThrows(NullPointerException.class, () -> factory.registerExtension(String.class, null));
    }

    @Test
    @DisplayName("Extension is created once under contention")
    void testComputeExtensionIfAbsent() throws Exception {
        var factory = new GeometryFactory();
        var created = new AtomicInteger();
        var executor = Executors.newFixedThreadPool(8);
        var seen = ConcurrentHashMap.<Object>newKeySet();
        try {
            var futures = new ArrayList<Future<?>>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> seen.add(factory.computeExtensionIfAbsent(StringBuilder.class, f -> {
                    created.incrementAndGet();
                    return new StringBuilder("extension");
                }))));
            }
            for (var future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, created.get());
        assertEquals(1, seen.size());
    }
}
