package com.rasterlab.server.image;

/**
 * An RGB pixel. Channels are conceptually in [0, 255] but are not range checked.
 */
public final class Pixel {

    public static final Pixel BLACK = new Pixel(0, 0, 0);
    public static final Pixel WHITE = new Pixel(255, 255, 255);

    private final int red;
    private final int green;
    private final int blue;

    public Pixel(int red, int green, int blue) {
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Pixel))
            return false;
        Pixel other = (Pixel) o;
        return red == other.red && green == other.green && blue == other.blue;
    }

    @Override
    public int hashCode() {
        return (red * 31 + green) * 31 + blue;
    }

    @Override
    public String toString() {
        return "Pixel(" + red + ", " + green + ", " + blue + ")";
    }
}
