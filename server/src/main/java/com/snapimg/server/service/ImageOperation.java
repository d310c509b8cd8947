package com.snapimg.server.service;

import java.util.Locale;

/**
 * The operations offered by both the command-line tool and the HTTP API.
 */
public enum ImageOperation {
    INFO("info"),
    RESIZE("resize"),
    SCALE("scale"),
    CROP("crop"),
    SEAM_CARVE("seam-carve", "sc"),
    SCALE_RGB("scale-rgb", "tint"),
    HUE_SHIFT("hue-shift", "hue"),
    ROTATE_LEFT("rotate-left"),
    ROTATE_RIGHT("rotate-right"),
    FLIP("flip"),
    MIRROR_X("mirror-x"),
    MIRROR_Y("mirror-y"),
    TRANSPOSE("transpose"),
    CONVERT("convert", "save");

    private final String name;
    private final String alias;

    ImageOperation(String name) {
        this(name, null);
    }

    ImageOperation(String name, String alias) {
        this.name = name;
        this.alias = alias;
    }

    public String commandName() {
        return name;
    }

    public static ImageOperation fromName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Operation name is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ImageOperation op : values()) {
            if (op.name.equals(v) || v.equals(op.alias)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operation '" + value + "'");
    }
}
