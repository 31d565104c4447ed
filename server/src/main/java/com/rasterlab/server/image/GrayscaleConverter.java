package com.rasterlab.server.image;

/**
 * Maps an RGB pixel to a luminance value. Implementations must be deterministic.
 */
public interface GrayscaleConverter {
    double toGray(Pixel pixel);
}
