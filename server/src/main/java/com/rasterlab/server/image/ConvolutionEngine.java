package com.rasterlab.server.image;

/**
 * Valid-mode 2D cross-correlation: the kernel is not flipped and border cells are dropped.
 */
public final class ConvolutionEngine {

    private ConvolutionEngine() {
    }

    /**
     * Output is 2*radius smaller than the input on each axis. Inputs smaller than the kernel
     * give an empty matrix.
     */
    public static GrayscaleMatrix convolve(GrayscaleMatrix matrix, Kernel kernel) {
        GrayscaleMatrix[][] windows = NeighborhoodExtractor.extract(matrix, kernel.getRadius());
        if (windows.length == 0) {
            return GrayscaleMatrix.empty();
        }

        GrayscaleMatrix weights = kernel.getWeights();
        double[][] out = new double[windows.length][windows[0].length];
        for (int r = 0; r < out.length; r++) {
            for (int c = 0; c < out[r].length; c++) {
                out[r][c] = windows[r][c].frobeniusProduct(weights);
            }
        }
        return GrayscaleMatrix.wrap(out);
    }
}
