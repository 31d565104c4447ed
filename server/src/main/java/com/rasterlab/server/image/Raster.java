package com.rasterlab.server.image;

import java.util.Arrays;

/**
 * Immutable rectangular matrix of pixels. pixels[row][col], row 0 is the top.
 */
public final class Raster {

    private static final Raster EMPTY = new Raster(new Pixel[0][0]);

    private final Pixel[][] pixels;
    private final int height;
    private final int width;

    // Takes ownership of rows, callers must not keep a reference.
    private Raster(Pixel[][] rows) {
        this.pixels = rows;
        this.height = rows.length;
        this.width = rows.length == 0 ? 0 : rows[0].length;
    }

    /**
     * Builds a raster from a defensive copy of the given rows.
     *
     * @throws IllegalArgumentException if the rows are ragged or contain nulls
     */
    public static Raster of(Pixel[][] rows) {
        Pixel[][] copy = copyRows(rows);
        return copy.length == 0 ? EMPTY : new Raster(copy);
    }

    public static Raster empty() {
        return EMPTY;
    }

    // No copy, for arrays built inside this package only.
    static Raster wrap(Pixel[][] rows) {
        if (rows.length == 0) {
            return EMPTY;
        }
        checkRectangular(rows);
        return rows[0].length == 0 ? EMPTY : new Raster(rows);
    }

    public static Raster filled(int height, int width, Pixel pixel) {
        if (height < 0 || width < 0) {
            throw new IllegalArgumentException("Dimensions must be non-negative: " + height + "x" + width);
        }
        Pixel[][] rows = new Pixel[height][width];
        for (Pixel[] row : rows) {
            Arrays.fill(row, pixel);
        }
        return wrap(rows);
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

    public Pixel get(int row, int col) {
        return pixels[row][col];
    }

    public Pixel[] getRow(int row) {
        return pixels[row].clone();
    }

    public Pixel[][] toArray() {
        Pixel[][] copy = new Pixel[height][];
        for (int r = 0; r < height; r++) {
            copy[r] = pixels[r].clone();
        }
        return copy;
    }

    /**
     * Applies the converter to every pixel.
     */
    public GrayscaleMatrix toGrayscale(GrayscaleConverter converter) {
        double[][] values = new double[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                values[r][c] = converter.toGray(pixels[r][c]);
            }
        }
        return GrayscaleMatrix.wrap(values);
    }

    private static Pixel[][] copyRows(Pixel[][] rows) {
        if (rows.length == 0 || rows[0].length == 0) {
            for (Pixel[] row : rows) {
                if (row.length != 0) {
                    throw new IllegalArgumentException("Rows must all have the same length");
                }
            }
            return new Pixel[0][0];
        }
        Pixel[][] copy = new Pixel[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            copy[r] = rows[r].clone();
        }
        checkRectangular(copy);
        return copy;
    }

    private static void checkRectangular(Pixel[][] rows) {
        int width = rows[0].length;
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length != width) {
                throw new IllegalArgumentException(
                        "Row " + r + " has length " + rows[r].length + ", expected " + width);
            }
            for (Pixel p : rows[r]) {
                if (p == null) {
                    throw new IllegalArgumentException("Null pixel in row " + r);
                }
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Raster))
            return false;
        return Arrays.deepEquals(pixels, ((Raster) o).pixels);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(pixels);
    }

    @Override
    public String toString() {
        return "Raster(" + height + "x" + width + ")";
    }
}
