package com.snapimg.server.img;

/**
 * Base type for failures caused by bad image input or an invalid request
 * against an image.
 */
public class ImageException extends RuntimeException {

    public ImageException(String message) {
        super(message);
    }

    public ImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
