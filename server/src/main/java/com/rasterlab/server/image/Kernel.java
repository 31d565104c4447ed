package com.rasterlab.server.image;

/**
 * Square convolution kernel with an odd side length.
 */
public final class Kernel {

    private final GrayscaleMatrix weights;

    private Kernel(GrayscaleMatrix weights) {
        this.weights = weights;
    }

    /**
     * @throws IllegalArgumentException if the weights are empty, not square or have an even side
     */
    public static Kernel of(double[][] weights) {
        if (weights.length == 0) {
            throw new IllegalArgumentException("Kernel must not be empty");
        }
        if (weights.length % 2 == 0) {
            throw new IllegalArgumentException("Kernel side must be odd, got " + weights.length);
        }
        for (int r = 0; r < weights.length; r++) {
            if (weights[r].length != weights.length) {
                throw new IllegalArgumentException("Kernel must be square: row " + r + " has length "
                        + weights[r].length + ", expected " + weights.length);
            }
        }
        return new Kernel(GrayscaleMatrix.of(weights));
    }

    /**
     * Builds a kernel whose weights are the given integers divided by their sum.
     */
    public static Kernel normalized(int[][] weights) {
        long sum = 0;
        for (int[] row : weights) {
            for (int w : row) {
                sum += w;
            }
        }
        if (sum == 0) {
            throw new IllegalArgumentException("Kernel weights sum to zero, cannot normalize");
        }
        double[][] scaled = new double[weights.length][];
        for (int r = 0; r < weights.length; r++) {
            scaled[r] = new double[weights[r].length];
            for (int c = 0; c < weights[r].length; c++) {
                scaled[r][c] = weights[r][c] / (double) sum;
            }
        }
        return of(scaled);
    }

    public int getSide() {
        return weights.getHeight();
    }

    public int getRadius() {
        return weights.getHeight() / 2;
    }

    public double get(int row, int col) {
        return weights.get(row, col);
    }

    public GrayscaleMatrix getWeights() {
        return weights;
    }

    @Override
    public String toString() {
        return "Kernel(" + getSide() + "x" + getSide() + ")";
    }
}
