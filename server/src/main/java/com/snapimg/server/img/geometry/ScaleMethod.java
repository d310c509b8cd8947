package com.snapimg.server.img.geometry;

import java.util.Locale;

/**
 * Resampling used when scaling an image up.
 */
public enum ScaleMethod {
    /** Copies the source pixel at floor(dst * srcSize / dstSize). */
    NEAREST,
    /** Interpolates the four surrounding source pixels, x first, then y. */
    BILINEAR;

    public static ScaleMethod fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Scale method name is required");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "nearest":
            case "linear":
                return NEAREST;
            case "bilinear":
                return BILINEAR;
            default:
                throw new IllegalArgumentException("Unknown scale method '" + name + "'");
        }
    }
}
