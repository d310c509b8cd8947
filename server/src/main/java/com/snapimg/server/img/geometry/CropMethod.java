package com.snapimg.server.img.geometry;

import java.util.Locale;

/**
 * Which side(s) of the image a crop removes pixels from.
 *
 * LEFT trims the left edge (keeping the rightmost columns), RIGHT trims the
 * right edge, and so on. The two-sided variants split the trim evenly, with
 * the extra pixel going to the right or bottom side. RECTANGULAR cuts out a
 * window at an arbitrary offset.
 */
public enum CropMethod {
    LEFT,
    RIGHT,
    LEFT_RIGHT,

    TOP,
    BOTTOM,
    TOP_BOTTOM,

    LEFT_TOP,
    LEFT_BOTTOM,

    RIGHT_TOP,
    RIGHT_BOTTOM,

    RECTANGULAR;

    /**
     * Parses kebab-case ("left-right") or enum-style ("LEFT_RIGHT") names.
     */
    public static CropMethod fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Crop method name is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (CropMethod method : values()) {
            if (method.name().equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown crop method '" + name + "'");
    }

    public boolean isHorizontal() {
        return this == LEFT || this == RIGHT || this == LEFT_RIGHT;
    }

    public boolean isVertical() {
        return this == TOP || this == BOTTOM || this == TOP_BOTTOM;
    }
}
