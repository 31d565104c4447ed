package com.rasterlab.server.image;

/**
 * Weighted sum of the three channels.
 */
public class LuminanceConverter implements GrayscaleConverter {

    public static final double DEFAULT_RED_WEIGHT = 0.21;
    public static final double DEFAULT_GREEN_WEIGHT = 0.72;
    public static final double DEFAULT_BLUE_WEIGHT = 0.07;

    private final double redWeight;
    private final double greenWeight;
    private final double blueWeight;

    public LuminanceConverter() {
        this(DEFAULT_RED_WEIGHT, DEFAULT_GREEN_WEIGHT, DEFAULT_BLUE_WEIGHT);
    }

    public LuminanceConverter(double redWeight, double greenWeight, double blueWeight) {
        if (Double.isNaN(redWeight) || Double.isNaN(greenWeight) || Double.isNaN(blueWeight)) {
            throw new IllegalArgumentException("Grayscale weights must be numbers");
        }
        this.redWeight = redWeight;
        this.greenWeight = greenWeight;
        this.blueWeight = blueWeight;
    }

    @Override
    public double toGray(Pixel pixel) {
        return redWeight * pixel.getRed() + greenWeight * pixel.getGreen() + blueWeight * pixel.getBlue();
    }

    public double getRedWeight() {
        return redWeight;
    }

    public double getGreenWeight() {
        return greenWeight;
    }

    public double getBlueWeight() {
        return blueWeight;
    }
}
