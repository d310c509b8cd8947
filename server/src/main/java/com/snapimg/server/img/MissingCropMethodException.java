package com.snapimg.server.img;

public class MissingCropMethodException extends ImageException {

    public MissingCropMethodException(String axis) {
        super("Crop method for the " + axis + "-axis needed for this resize");
    }
}
