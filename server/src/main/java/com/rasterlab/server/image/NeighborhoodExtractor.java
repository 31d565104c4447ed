package com.rasterlab.server.image;

/**
 * Cuts a matrix into the square windows centered on every cell whose full window fits.
 */
public final class NeighborhoodExtractor {

    private NeighborhoodExtractor() {
    }

    /**
     * Returns windows[r][c], the (2*radius+1)-sided window centered on input cell
     * (r + radius, c + radius). Border cells whose window would fall outside the matrix are
     * dropped, so the result is (height - 2*radius) x (width - 2*radius). A matrix smaller
     * than one window yields an empty array.
     *
     * @throws IllegalArgumentException if radius is negative
     */
    public static GrayscaleMatrix[][] extract(GrayscaleMatrix matrix, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative, got " + radius);
        }
        int side = 2 * radius + 1;
        if (matrix.getHeight() < side || matrix.getWidth() < side) {
            return new GrayscaleMatrix[0][0];
        }

        int outHeight = matrix.getHeight() - 2 * radius;
        int outWidth = matrix.getWidth() - 2 * radius;
        GrayscaleMatrix[][] windows = new GrayscaleMatrix[outHeight][outWidth];
        for (int r = 0; r < outHeight; r++) {
            for (int c = 0; c < outWidth; c++) {
                // (r, c) is the window's top-left corner in input coordinates
                windows[r][c] = matrix.window(r, c, side);
            }
        }
        return windows;
    }
}
