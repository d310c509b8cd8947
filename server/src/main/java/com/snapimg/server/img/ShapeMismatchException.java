package com.snapimg.server.img;

public class ShapeMismatchException extends ImageException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}
