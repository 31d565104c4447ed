package com.rasterlab.server.image;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Cyclic color lookup: value v maps to colors[v mod n].
 */
public class PixelPalette implements IntFunction<Pixel> {

    private final String name;
    private final List<Pixel> colors;

    public PixelPalette(String name, List<Pixel> colors) {
        if (colors == null || colors.isEmpty()) {
            throw new IllegalArgumentException("Palette '" + name + "' has no colors");
        }
        this.name = name;
        this.colors = Collections.unmodifiableList(new ArrayList<>(colors));
    }

    /**
     * @param rgb rows of [red, green, blue]
     */
    public static PixelPalette fromRgb(String name, List<int[]> rgb) {
        if (rgb == null) {
            throw new IllegalArgumentException("Palette '" + name + "' has no colors");
        }
        List<Pixel> colors = new ArrayList<>();
        for (int[] c : rgb) {
            if (c == null || c.length != 3) {
                throw new IllegalArgumentException("Palette '" + name + "' entries must be [r, g, b]");
            }
            colors.add(new Pixel(c[0], c[1], c[2]));
        }
        return new PixelPalette(name, colors);
    }

    @Override
    public Pixel apply(int value) {
        return colors.get(Math.floorMod(value, colors.size()));
    }

    public String getName() {
        return name;
    }

    public List<Pixel> getColors() {
        return colors;
    }
}
