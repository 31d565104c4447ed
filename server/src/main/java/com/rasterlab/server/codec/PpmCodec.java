package com.rasterlab.server.codec;

import com.rasterlab.server.image.Pixel;
import com.rasterlab.server.image.Raster;

/**
 * Plain-text (P3) pixel map reader and writer.
 * <p>
 * Output layout: {@code P3}, then {@code width height}, then {@code 255}, then one
 * {@code r g b} line per pixel in row-major order. The reader accepts any whitespace
 * between tokens and {@code #} comments, and only a max value of 255.
 */
public final class PpmCodec {

    public static final String MAGIC = "P3";
    public static final int MAX_VALUE = 255;

    private PpmCodec() {
    }

    public static String encode(Raster image) {
        long hint = 16L + (long) image.getHeight() * image.getWidth() * 12;
        StringBuilder sb = new StringBuilder((int) Math.min(hint, 1 << 20));
        sb.append(MAGIC).append('\n');
        sb.append(image.getWidth()).append(' ').append(image.getHeight()).append('\n');
        sb.append(MAX_VALUE).append('\n');
        for (int r = 0; r < image.getHeight(); r++) {
            for (int c = 0; c < image.getWidth(); c++) {
                Pixel p = image.get(r, c);
                sb.append(p.getRed()).append(' ')
                        .append(p.getGreen()).append(' ')
                        .append(p.getBlue()).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * @throws PpmFormatException if the header is wrong, the max value is not 255, a token is not
     *                            a non-negative integer, a sample exceeds 255, or the sample count is off
     */
    public static Raster decode(CharSequence text) {
        if (text == null) {
            throw new PpmFormatException("No input");
        }
        Tokenizer tokens = new Tokenizer(text);

        String magic = tokens.next();
        if (!MAGIC.equals(magic)) {
            throw new PpmFormatException("Expected magic '" + MAGIC + "', found "
                    + (magic == null ? "end of input" : "'" + magic + "'"));
        }
        int width = tokens.nextInt("width");
        int height = tokens.nextInt("height");
        int maxValue = tokens.nextInt("max value");
        if (maxValue != MAX_VALUE) {
            throw new PpmFormatException("Max value must be " + MAX_VALUE + ", got " + maxValue);
        }
        if (width == 0 || height == 0) {
            tokens.expectEnd();
            return Raster.empty();
        }
        // every sample takes at least one digit, all but the last also a separator
        long samples = 3L * width * height;
        if (samples > (tokens.remaining() + 1) / 2) {
            throw new PpmFormatException("Header declares " + width + "x" + height + " pixels but the input is too short"
                    + " to hold " + samples + " samples");
        }

        Pixel[][] rows = new Pixel[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                int red = tokens.nextSample(maxValue);
                int green = tokens.nextSample(maxValue);
                int blue = tokens.nextSample(maxValue);
                rows[r][c] = new Pixel(red, green, blue);
            }
        }
        tokens.expectEnd();
        return Raster.of(rows);
    }

    private static final class Tokenizer {
        private final CharSequence text;
        private int pos;
        private int samples;

        Tokenizer(CharSequence text) {
            this.text = text;
        }

        String next() {
            skipSeparators();
            if (pos >= text.length()) {
                return null;
            }
            int start = pos;
            while (pos < text.length() && !Character.isWhitespace(text.charAt(pos)) && text.charAt(pos) != '#') {
                pos++;
            }
            return text.subSequence(start, pos).toString();
        }

        int nextInt(String what) {
            String token = next();
            if (token == null) {
                throw new PpmFormatException("Unexpected end of input, expected " + what);
            }
            for (int i = 0; i < token.length(); i++) {
                if (token.charAt(i) < '0' || token.charAt(i) > '9') {
                    throw new PpmFormatException("Expected non-negative integer for " + what + ", found '" + token + "'");
                }
            }
            try {
                return Integer.parseInt(token);
            } catch (NumberFormatException e) {
                throw new PpmFormatException("Number out of range for " + what + ": " + token, e);
            }
        }

        int nextSample(int maxValue) {
            int value = nextInt("sample " + samples);
            if (value > maxValue) {
                throw new PpmFormatException("Sample " + samples + " is " + value + ", above max value " + maxValue);
            }
            samples++;
            return value;
        }

        int remaining() {
            return text.length() - pos;
        }

        void expectEnd() {
            String extra = next();
            if (extra != null) {
                throw new PpmFormatException("Unexpected data after last pixel: '" + extra + "'");
            }
        }

        private void skipSeparators() {
            while (pos < text.length()) {
                char ch = text.charAt(pos);
                if (ch == '#') {
                    while (pos < text.length() && text.charAt(pos) != '\n') {
                        pos++;
                    }
                } else if (Character.isWhitespace(ch)) {
                    pos++;
                } else {
                    return;
                }
            }
        }
    }
}
