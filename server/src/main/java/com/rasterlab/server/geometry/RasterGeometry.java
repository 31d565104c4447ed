package com.rasterlab.server.geometry;

import com.rasterlab.server.image.Pixel;
import com.rasterlab.server.image.Raster;

/**
 * Concatenation and quarter-turn rotation of rasters.
 */
public final class RasterGeometry {

    private RasterGeometry() {
    }

    /**
     * Stacks bottom under top. An empty raster on either side returns the other one.
     */
    public static Raster verticalConcat(Raster top, Raster bottom) {
        if (top.isEmpty()) {
            return bottom;
        }
        if (bottom.isEmpty()) {
            return top;
        }
        if (top.getWidth() != bottom.getWidth()) {
            throw new IllegalArgumentException("Vertical concatenation needs equal widths: "
                    + top.getWidth() + " vs " + bottom.getWidth());
        }
        Pixel[][] rows = new Pixel[top.getHeight() + bottom.getHeight()][];
        for (int r = 0; r < top.getHeight(); r++) {
            rows[r] = top.getRow(r);
        }
        for (int r = 0; r < bottom.getHeight(); r++) {
            rows[top.getHeight() + r] = bottom.getRow(r);
        }
        return Raster.of(rows);
    }

    /**
     * Places right next to left. An empty raster on either side returns the other one.
     */
    public static Raster horizontalConcat(Raster left, Raster right) {
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        if (left.getHeight() != right.getHeight()) {
            throw new IllegalArgumentException("Horizontal concatenation needs equal heights: "
                    + left.getHeight() + " vs " + right.getHeight());
        }
        int width = left.getWidth() + right.getWidth();
        Pixel[][] rows = new Pixel[left.getHeight()][width];
        for (int r = 0; r < rows.length; r++) {
            System.arraycopy(left.getRow(r), 0, rows[r], 0, left.getWidth());
            System.arraycopy(right.getRow(r), 0, rows[r], left.getWidth(), right.getWidth());
        }
        return Raster.of(rows);
    }

    /**
     * Rotates counter-clockwise by degrees; negative angles turn clockwise.
     *
     * @throws IllegalArgumentException if degrees is not a multiple of 90
     */
    public static Raster rotate(Raster image, int degrees) {
        if (degrees % 90 != 0) {
            throw new IllegalArgumentException("Rotation must be a multiple of 90 degrees, got " + degrees);
        }
        int turns = Math.floorMod(degrees, 360) / 90;
        Raster result = image;
        for (int i = 0; i < turns; i++) {
            result = rotate90(result);
        }
        return result;
    }

    // Reverse each row, then transpose.
    private static Raster rotate90(Raster image) {
        int height = image.getHeight();
        int width = image.getWidth();
        Pixel[][] rows = new Pixel[width][height];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                rows[width - 1 - c][r] = image.get(r, c);
            }
        }
        return Raster.of(rows);
    }
}
