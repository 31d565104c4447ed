package com.rasterlab.server.codec;

/**
 * Thrown when text is not a well-formed P3 pixel map.
 */
public class PpmFormatException extends IllegalArgumentException {

    public PpmFormatException(String message) {
        super(message);
    }

    public PpmFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
