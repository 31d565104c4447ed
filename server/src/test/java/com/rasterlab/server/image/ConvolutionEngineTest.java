package com.rasterlab.server.image;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class ConvolutionEngineTest {

    @Test
    public void testShrinkLaw() {
        int[][] sizes = { { 3, 3 }, { 5, 7 }, { 8, 4 }, { 10, 10 } };
        Kernel[] kernels = { Kernels.IDENTITY, Kernels.GX, Kernels.GAUSSIAN_BLUR };
        for (int[] hw : sizes) {
            GrayscaleMatrix m = NeighborhoodExtractorTest.counting(hw[0], hw[1]);
            for (Kernel k : kernels) {
                if (hw[0] < k.getSide() || hw[1] < k.getSide()) {
                    continue;
                }
                GrayscaleMatrix out = ConvolutionEngine.convolve(m, k);
                assertEquals(hw[0] - 2 * k.getRadius(), out.getHeight(), "height for " + k + " on " + m);
                assertEquals(hw[1] - 2 * k.getRadius(), out.getWidth(), "width for " + k + " on " + m);
            }
        }
    }

    @Test
    public void testIdentityKernel() {
        GrayscaleMatrix m = GrayscaleMatrix.of(new double[][] { { 1.5, -2.0, 3.0 }, { 0.0, 7.25, 9.0 } });
        assertEquals(m, ConvolutionEngine.convolve(m, Kernels.IDENTITY));
    }

    @Test
    public void testCrossCorrelationDoesNotFlipKernel() {
        // Columns increase by 1 left to right, so Gx responds with +(1+2+1)*2 = 8
        double[][] ramp = new double[3][3];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                ramp[r][c] = c;
            }
        }
        GrayscaleMatrix out = ConvolutionEngine.convolve(GrayscaleMatrix.of(ramp), Kernels.GX);
        assertEquals(1, out.getHeight());
        assertEquals(8.0, out.get(0, 0), 1e-12);

        // Rows decrease downwards: Gy gives positive response
        double[][] down = new double[3][3];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                down[r][c] = 2 - r;
            }
        }
        assertEquals(8.0, ConvolutionEngine.convolve(GrayscaleMatrix.of(down), Kernels.GY).get(0, 0), 1e-12);
    }

    @Test
    public void testGaussianPreservesConstant() {
        double[][] flat = new double[6][6];
        for (double[] row : flat) {
            java.util.Arrays.fill(row, 100.0);
        }
        GrayscaleMatrix out = ConvolutionEngine.convolve(GrayscaleMatrix.of(flat), Kernels.GAUSSIAN_BLUR);
        assertEquals(2, out.getHeight());
        assertEquals(2, out.getWidth());
        assertEquals(100.0, out.get(1, 1), 1e-9);
    }

    @Test
    public void testSmallerThanKernelIsEmpty() {
        GrayscaleMatrix out = ConvolutionEngine.convolve(NeighborhoodExtractorTest.counting(4, 10), Kernels.GAUSSIAN_BLUR);
        assertTrue(out.isEmpty());
        assertEquals(0, out.getWidth());
    }
}
