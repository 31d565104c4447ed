package com.rasterlab.server.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gaussian blur followed by Sobel gradient magnitude and a binary threshold.
 */
public class EdgeDetector {
    private static final Logger logger = LoggerFactory.getLogger(EdgeDetector.class);

    private final GrayscaleConverter converter;
    private final Kernel blurKernel;

    public EdgeDetector(GrayscaleConverter converter) {
        this(converter, Kernels.GAUSSIAN_BLUR);
    }

    public EdgeDetector(GrayscaleConverter converter, Kernel blurKernel) {
        if (converter == null || blurKernel == null) {
            throw new IllegalArgumentException("Converter and blur kernel are required");
        }
        this.converter = converter;
        this.blurKernel = blurKernel;
    }

    /**
     * Each stage shrinks the previous one: the blur drops 2 pixels per side and the Sobel
     * pass 1 more, so a HxW image becomes (H-6)x(W-6). Smaller images give an empty raster.
     *
     * @param threshold magnitudes below it become black, the rest white
     */
    public Raster detect(Raster image, double threshold) {
        if (Double.isNaN(threshold)) {
            throw new IllegalArgumentException("Threshold must be a number");
        }

        GrayscaleMatrix gray = image.toGrayscale(converter);
        GrayscaleMatrix blurred = ConvolutionEngine.convolve(gray, blurKernel);
        GrayscaleMatrix magnitude = gradientMagnitude(blurred);

        if (logger.isDebugEnabled()) {
            logger.debug("Edge stages: input={}x{}, blurred={}x{}, magnitude={}x{}",
                    image.getHeight(), image.getWidth(),
                    blurred.getHeight(), blurred.getWidth(),
                    magnitude.getHeight(), magnitude.getWidth());
        }

        return binarize(magnitude, threshold);
    }

    /**
     * L1 approximation |Gx| + |Gy|.
     */
    public static GrayscaleMatrix gradientMagnitude(GrayscaleMatrix matrix) {
        GrayscaleMatrix mx = ConvolutionEngine.convolve(matrix, Kernels.GX).abs();
        GrayscaleMatrix my = ConvolutionEngine.convolve(matrix, Kernels.GY).abs();
        return mx.plus(my);
    }

    public static Raster binarize(GrayscaleMatrix values, double threshold) {
        Pixel[][] out = new Pixel[values.getHeight()][values.getWidth()];
        for (int r = 0; r < out.length; r++) {
            for (int c = 0; c < out[r].length; c++) {
                out[r][c] = values.get(r, c) < threshold ? Pixel.BLACK : Pixel.WHITE;
            }
        }
        return Raster.wrap(out);
    }
}
