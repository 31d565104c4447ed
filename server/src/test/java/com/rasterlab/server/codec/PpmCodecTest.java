package com.rasterlab.server.codec;

import com.rasterlab.server.image.Pixel;
import com.rasterlab.server.image.Raster;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PpmCodecTest {

    private static final String TWO_BY_ONE = "P3\n2 1\n255\n255 0 0\n0 0 255\n";

    @Test
    public void testEncodeLayout() {
        Raster image = Raster.of(new Pixel[][] { { new Pixel(255, 0, 0), new Pixel(0, 0, 255) } });
        assertEquals(TWO_BY_ONE, PpmCodec.encode(image));
    }

    @Test
    public void testDecode() {
        Raster image = PpmCodec.decode(TWO_BY_ONE);
        assertEquals(1, image.getHeight());
        assertEquals(2, image.getWidth());
        assertEquals(new Pixel(0, 0, 255), image.get(0, 1));
        assertEquals(TWO_BY_ONE, PpmCodec.encode(image));
    }

    @Test
    public void testDecodeRowMajor() {
        Raster image = PpmCodec.decode("P3 2 2 255  1 1 1  2 2 2  3 3 3  4 4 4");
        assertEquals(new Pixel(2, 2, 2), image.get(0, 1));
        assertEquals(new Pixel(3, 3, 3), image.get(1, 0));
    }

    @Test
    public void testCommentsAndLooseWhitespace() {
        String text = "P3\n# made by hand\n2 1 # width height\n255\n\n255 0 0   0 0 255\r\n";
        assertEquals(PpmCodec.decode(TWO_BY_ONE), PpmCodec.decode(text));
    }

    @Test
    public void testEmptyImage() {
        Raster empty = PpmCodec.decode("P3\n0 0\n255\n");
        assertTrue(empty.isEmpty());
        assertEquals("P3\n0 0\n255\n", PpmCodec.encode(Raster.empty()));
    }

    @Test
    public void testMalformedRejected() {
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode(""));
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P6\n1 1\n255\n0 0 0\n"));
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P3\n1 1\n255\n0 0\n"));
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P3\n1 1\n255\n0 x 0\n"));
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P3\n1 1\n255\n0 -1 0\n"));
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P3\n1 1\n255\n0 0 0\n7\n"));
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P3\n1 1\n0\n0 0 0\n"));
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P3\n1 1\n255\n0 256 0\n"));
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P3\n1"));
        assertThrows(IllegalArgumentException.class, () -> PpmCodec.decode(null));
    }

    @Test
    public void testHugeHeaderWithShortBodyRejected() {
        PpmFormatException e = assertThrows(PpmFormatException.class,
                () -> PpmCodec.decode("P3\n46000 46000\n255\n0 0 0\n"));
        assertTrue(e.getMessage().contains("46000x46000"));
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P3\n2 1\n255\n0 0 0\n"));
    }

    @Test
    public void testOnlyMaxValue255Accepted() {
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P3\n1 1\n1\n1 1 1\n"));
        assertThrows(PpmFormatException.class, () -> PpmCodec.decode("P3\n1 1\n65535\n0 0 0\n"));
        assertEquals(Pixel.WHITE, PpmCodec.decode("P3\n1 1\n255\n255 255 255\n").get(0, 0));
    }

    @Test
    public void testDecodedRasterIsDetachedFromParser() {
        Raster image = PpmCodec.decode(TWO_BY_ONE);
        Pixel[] row = image.getRow(0);
        row[0] = Pixel.BLACK;
        assertEquals(new Pixel(255, 0, 0), image.get(0, 0));
    }
}
