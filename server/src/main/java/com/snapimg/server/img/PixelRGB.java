package com.snapimg.server.img;

import java.util.Objects;

/**
 * One pixel read across the three channels of an {@link ImageBuffer}.
 * Pixels are never stored in this form, only passed around.
 */
public final class PixelRGB {
    public final int r;
    public final int g;
    public final int b;

    public PixelRGB(int r, int g, int b) {
        this.r = r;
        this.g = g;
        this.b = b;
    }

    /**
     * Squared Euclidean distance between two colors in RGB space.
     */
    public long squaredDifference(PixelRGB other) {
        long dr = r - other.r;
        long dg = g - other.g;
        long db = b - other.b;
        return dr * dr + dg * dg + db * db;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PixelRGB)) return false;
        PixelRGB other = (PixelRGB) obj;
        return r == other.r && g == other.g && b == other.b;
    }

    @Override
    public int hashCode() {
        return Objects.hash(r, g, b);
    }

    @Override
    public String toString() {
        return "PixelRGB(" + r + ", " + g + ", " + b + ")";
    }
}
