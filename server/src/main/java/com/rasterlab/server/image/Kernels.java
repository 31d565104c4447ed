package com.rasterlab.server.image;

public final class Kernels {

    /** 5x5 Gaussian, integer weights over 273. */
    public static final Kernel GAUSSIAN_BLUR = Kernel.normalized(new int[][] {
            { 1, 4, 7, 4, 1 },
            { 4, 16, 26, 16, 4 },
            { 7, 26, 41, 26, 7 },
            { 4, 16, 26, 16, 4 },
            { 1, 4, 7, 4, 1 }
    });

    // Sobel operators, not normalized
    public static final Kernel GX = Kernel.of(new double[][] {
            { -1, 0, 1 },
            { -2, 0, 2 },
            { -1, 0, 1 }
    });

    public static final Kernel GY = Kernel.of(new double[][] {
            { 1, 2, 1 },
            { 0, 0, 0 },
            { -1, -2, -1 }
    });

    public static final Kernel IDENTITY = Kernel.of(new double[][] { { 1 } });

    private Kernels() {
    }
}
