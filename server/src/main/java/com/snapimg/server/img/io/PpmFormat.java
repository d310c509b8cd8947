package com.snapimg.server.img.io;

import java.util.Locale;

/**
 * The two PPM flavours: P3 stores samples as ASCII integers, P6 as raw bytes.
 */
public enum PpmFormat {
    P3,
    P6;

    public static PpmFormat fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("PPM format name is required");
        }
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "P3":
            case "ASCII":
                return P3;
            case "P6":
            case "BINARY":
                return P6;
            default:
                throw new IllegalArgumentException("Unknown PPM format '" + name + "'");
        }
    }
}
