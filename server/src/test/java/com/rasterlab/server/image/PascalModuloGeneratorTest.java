package com.rasterlab.server.image;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class PascalModuloGeneratorTest {

    @Test
    public void testModTwoRows() {
        int[][] rows = PascalModuloGenerator.triangle(2, 5);
        assertArrayEquals(new int[] { 1 }, rows[0]);
        assertArrayEquals(new int[] { 1, 1 }, rows[1]);
        assertArrayEquals(new int[] { 1, 0, 1 }, rows[2]);
        assertArrayEquals(new int[] { 1, 1, 1, 1 }, rows[3]);
        assertArrayEquals(new int[] { 1, 0, 0, 0, 1 }, rows[4]);
    }

    @Test
    public void testLargeModulusMatchesBinomials() {
        int[][] rows = PascalModuloGenerator.triangle(1_000_000, 8);
        assertArrayEquals(new int[] { 1, 7, 21, 35, 35, 21, 7, 1 }, rows[7]);
    }

    @Test
    public void testModThreeWrapsAround() {
        // Row 4 is 1 4 6 4 1
        assertArrayEquals(new int[] { 1, 1, 0, 1, 1 }, PascalModuloGenerator.triangle(3, 5)[4]);
    }

    @Test
    public void testGenerateMapsAndPads() {
        Pixel one = new Pixel(1, 1, 1);
        Pixel zero = new Pixel(9, 9, 9);
        Raster image = PascalModuloGenerator.generate(2, v -> v == 1 ? one : zero, 5);

        assertEquals(5, image.getHeight());
        assertEquals(5, image.getWidth());
        assertEquals(one, image.get(0, 0));
        assertEquals(zero, image.get(2, 1));
        assertEquals(one, image.get(3, 3));
        assertEquals(zero, image.get(4, 2));

        for (int i = 0; i < 5; i++) {
            int trailing = 0;
            for (int j = i + 1; j < 5; j++) {
                assertEquals(Pixel.BLACK, image.get(i, j));
                trailing++;
            }
            assertEquals(5 - (i + 1), trailing);
        }
    }

    @Test
    public void testAlwaysSquare() {
        for (int size : new int[] { 1, 2, 17, 64 }) {
            Raster image = PascalModuloGenerator.generate(7, v -> Pixel.WHITE, size);
            assertEquals(size, image.getHeight());
            assertEquals(size, image.getWidth());
        }
    }

    @Test
    public void testModulusOneKeepsEdgeOnes() {
        int[][] rows = PascalModuloGenerator.triangle(1, 4);
        assertArrayEquals(new int[] { 1, 0, 0, 1 }, rows[3]);
    }

    @Test
    public void testPreconditions() {
        assertThrows(IllegalArgumentException.class, () -> PascalModuloGenerator.generate(0, v -> Pixel.WHITE, 3));
        assertThrows(IllegalArgumentException.class, () -> PascalModuloGenerator.generate(-2, v -> Pixel.WHITE, 3));
        assertThrows(IllegalArgumentException.class, () -> PascalModuloGenerator.generate(2, v -> Pixel.WHITE, 0));
        assertThrows(IllegalArgumentException.class, () -> PascalModuloGenerator.generate(2, null, 3));
        assertThrows(IllegalArgumentException.class, () -> PascalModuloGenerator.generate(2, v -> null, 3));
    }
}
