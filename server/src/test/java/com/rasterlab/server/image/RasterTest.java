package com.rasterlab.server.image;

import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

public class RasterTest {

    @Test
    public void testDefensiveCopy() {
        Pixel[][] rows = { { Pixel.WHITE, Pixel.BLACK } };
        Raster raster = Raster.of(rows);
        rows[0][0] = Pixel.BLACK;
        assertEquals(Pixel.WHITE, raster.get(0, 0));

        Pixel[] row = raster.getRow(0);
        row[1] = Pixel.WHITE;
        assertEquals(Pixel.BLACK, raster.get(0, 1));
    }

    @Test
    public void testRaggedRejected() {
        Pixel[][] rows = { { Pixel.WHITE, Pixel.BLACK }, { Pixel.WHITE } };
        assertThrows(IllegalArgumentException.class, () -> Raster.of(rows));
        assertThrows(IllegalArgumentException.class,
                () -> GrayscaleMatrix.of(new double[][] { { 1, 2 }, { 3 } }));
    }

    @Test
    public void testEmpty() {
        Raster empty = Raster.of(new Pixel[0][0]);
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.getWidth());
        assertEquals(Raster.empty(), empty);
        assertTrue(Raster.of(new Pixel[3][0]).isEmpty());
    }

    @Test
    public void testToGrayscale() {
        Raster raster = Raster.of(new Pixel[][] { { new Pixel(100, 0, 0), new Pixel(0, 100, 0) } });
        GrayscaleMatrix gray = raster.toGrayscale(new LuminanceConverter());
        assertEquals(21.0, gray.get(0, 0), 1e-9);
        assertEquals(72.0, gray.get(0, 1), 1e-9);
    }

    @Test
    public void testUncopiedFactoryNotPublic() throws NoSuchMethodException {
        int modifiers = Raster.class.getDeclaredMethod("wrap", Pixel[][].class).getModifiers();
        assertFalse(Modifier.isPublic(modifiers));
        assertFalse(Modifier.isProtected(modifiers));
    }

    @Test
    public void testNullPixelRejected() {
        assertThrows(IllegalArgumentException.class, () -> Raster.wrap(new Pixel[][] { { Pixel.WHITE, null } }));
        assertThrows(IllegalArgumentException.class, () -> Raster.of(new Pixel[][] { { null } }));
    }
}
