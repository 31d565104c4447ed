package com.rasterlab.server.image;

import java.util.Arrays;

/**
 * Immutable rectangular matrix of doubles used inside the convolution pipeline.
 */
public final class GrayscaleMatrix {

    private static final GrayscaleMatrix EMPTY = new GrayscaleMatrix(new double[0][0]);

    private final double[][] values;
    private final int height;
    private final int width;

    private GrayscaleMatrix(double[][] values) {
        this.values = values;
        this.height = values.length;
        this.width = values.length == 0 ? 0 : values[0].length;
    }

    /**
     * Builds a matrix from a defensive copy of the given rows.
     *
     * @throws IllegalArgumentException if the rows are ragged
     */
    public static GrayscaleMatrix of(double[][] rows) {
        double[][] copy = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            copy[r] = rows[r].clone();
        }
        return wrap(copy);
    }

    public static GrayscaleMatrix empty() {
        return EMPTY;
    }

    // No copy, the array must not be touched after this call.
    static GrayscaleMatrix wrap(double[][] values) {
        if (values.length == 0 || values[0].length == 0) {
            for (double[] row : values) {
                if (row.length != 0) {
                    throw new IllegalArgumentException("Rows must all have the same length");
                }
            }
            return EMPTY;
        }
        int width = values[0].length;
        for (int r = 1; r < values.length; r++) {
            if (values[r].length != width) {
                throw new IllegalArgumentException(
                        "Row " + r + " has length " + values[r].length + ", expected " + width);
            }
        }
        return new GrayscaleMatrix(values);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public boolean isEmpty() {
        return height == 0;
    }

    public double get(int row, int col) {
        return values[row][col];
    }

    public double[][] toArray() {
        double[][] copy = new double[height][];
        for (int r = 0; r < height; r++) {
            copy[r] = values[r].clone();
        }
        return copy;
    }

    /**
     * Copies the square window of the given side whose top-left corner is (top, left).
     */
    GrayscaleMatrix window(int top, int left, int side) {
        double[][] sub = new double[side][];
        for (int r = 0; r < side; r++) {
            sub[r] = Arrays.copyOfRange(values[top + r], left, left + side);
        }
        return new GrayscaleMatrix(sub);
    }

    /**
     * Sum of the elementwise products with a matrix of the same shape, accumulated in row-major order.
     */
    public double frobeniusProduct(GrayscaleMatrix other) {
        if (other.height != height || other.width != width) {
            throw new IllegalArgumentException("Shape mismatch: " + height + "x" + width + " vs "
                    + other.height + "x" + other.width);
        }
        double sum = 0.0;
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                sum += values[r][c] * other.values[r][c];
            }
        }
        return sum;
    }

    public GrayscaleMatrix abs() {
        double[][] out = new double[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                out[r][c] = Math.abs(values[r][c]);
            }
        }
        return wrap(out);
    }

    /**
     * Elementwise sum with a matrix of the same shape.
     */
    public GrayscaleMatrix plus(GrayscaleMatrix other) {
        if (other.height != height || other.width != width) {
            throw new IllegalArgumentException("Shape mismatch: " + height + "x" + width + " vs "
                    + other.height + "x" + other.width);
        }
        double[][] out = new double[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                out[r][c] = values[r][c] + other.values[r][c];
            }
        }
        return wrap(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GrayscaleMatrix))
            return false;
        return Arrays.deepEquals(values, ((GrayscaleMatrix) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "GrayscaleMatrix(" + height + "x" + width + ")";
    }
}
