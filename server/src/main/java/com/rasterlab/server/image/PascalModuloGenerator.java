package com.rasterlab.server.image;

import java.util.Arrays;
import java.util.function.IntFunction;

/**
 * Renders Pascal's triangle reduced modulo m as a square image.
 */
public final class PascalModuloGenerator {

    private PascalModuloGenerator() {
    }

    /**
     * Row i has i + 1 entries mapped through toPixel, then black padding up to size.
     *
     * @throws IllegalArgumentException if modulus or size is not positive, or toPixel is null
     */
    public static Raster generate(int modulus, IntFunction<Pixel> toPixel, int size) {
        if (toPixel == null) {
            throw new IllegalArgumentException("Pixel mapping is required");
        }
        int[][] triangle = triangle(modulus, size);

        Pixel[][] rows = new Pixel[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j <= i; j++) {
                Pixel p = toPixel.apply(triangle[i][j]);
                if (p == null) {
                    throw new IllegalArgumentException("Pixel mapping returned null for " + triangle[i][j]);
                }
                rows[i][j] = p;
            }
            Arrays.fill(rows[i], i + 1, size, Pixel.BLACK);
        }
        return Raster.wrap(rows);
    }

    /**
     * The first size rows. Edge entries are always 1, inner entries are
     * (above-left + above) mod modulus.
     */
    public static int[][] triangle(int modulus, int size) {
        if (modulus <= 0) {
            throw new IllegalArgumentException("Modulus must be positive, got " + modulus);
        }
        if (size <= 0) {
            throw new IllegalArgumentException("Size must be positive, got " + size);
        }

        int[][] rows = new int[size][];
        rows[0] = new int[] { 1 };
        for (int i = 1; i < size; i++) {
            int[] prev = rows[i - 1];
            int[] row = new int[i + 1];
            row[0] = 1;
            for (int j = 1; j < i; j++) {
                // both operands are < modulus so the sum cannot overflow an int
                row[j] = (int) (((long) prev[j - 1] + prev[j]) % modulus);
            }
            row[i] = 1;
            rows[i] = row;
        }
        return rows;
    }
}
