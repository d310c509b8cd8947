package com.snapimg.server.img;

/**
 * Thrown when encoded image data cannot be parsed, or when no codec exists
 * for the requested format.
 */
public class ImageFormatException extends ImageException {

    public ImageFormatException(String message) {
        super(message);
    }

    public ImageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
