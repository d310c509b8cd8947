package com.snapimg.server.img.color;

import com.snapimg.server.img.ImageBuffer;
import com.snapimg.server.img.PixelRGB;

/**
 * Per-pixel color adjustments.
 */
public final class ColorOps {

    private ColorOps() {
    }

    /**
     * Multiplies every pixel's channels by the given factors, each clamped to
     * [0, 1]. Results are truncated toward zero.
     */
    public static void scaleRgb(ImageBuffer image, double rScale, double gScale, double bScale) {
        double rs = clamp(rScale, 0.0, 1.0);
        double gs = clamp(gScale, 0.0, 1.0);
        double bs = clamp(bScale, 0.0, 1.0);

        for (int row = 0; row < image.getHeight(); row++) {
            for (int col = 0; col < image.getWidth(); col++) {
                PixelRGB p = image.pixelAt(row, col);
                image.setPixel(row, col, new PixelRGB((int) (p.r * rs), (int) (p.g * gs), (int) (p.b * bs)));
            }
        }
    }

    /**
     * Rotates the hue of every pixel by {@code degrees}, wrapping around the
     * color wheel. Saturation and lightness are kept.
     */
    public static void hueShift(ImageBuffer image, double degrees) {
        for (int row = 0; row < image.getHeight(); row++) {
            for (int col = 0; col < image.getWidth(); col++) {
                PixelRGB p = image.pixelAt(row, col);
                double[] hsl = rgbToHsl(p.r, p.g, p.b);
                double hue = (hsl[0] + degrees) % 360.0;
                if (hue < 0) {
                    hue += 360.0;
                }
                image.setPixel(row, col, hslToRgb(hue, hsl[1], hsl[2]));
            }
        }
    }

    /**
     * @return {hue in [0, 360), saturation in [0, 1], lightness in [0, 1]}
     */
    public static double[] rgbToHsl(double r, double g, double b) {
        r /= 255.0;
        g /= 255.0;
        b /= 255.0;

        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double delta = max - min;

        double l = (max + min) / 2.0;
        double s = delta == 0.0 ? 0.0 : delta / (1.0 - Math.abs(2.0 * l - 1.0));

        double h;
        if (delta == 0.0) {
            h = 0.0;
        } else if (max == r) {
            h = 60.0 * (((g - b) / delta) % 6.0);
        } else if (max == g) {
            h = 60.0 * (((b - r) / delta) + 2.0);
        } else {
            h = 60.0 * (((r - g) / delta) + 4.0);
        }
        if (h < 0.0) {
            h += 360.0;
        }
        return new double[] { h, s, l };
    }

    public static PixelRGB hslToRgb(double h, double s, double l) {
        double c = (1.0 - Math.abs(2.0 * l - 1.0)) * s;
        double x = c * (1.0 - Math.abs((h / 60.0) % 2.0 - 1.0));
        double m = l - c / 2.0;

        double r1;
        double g1;
        double b1;
        if (h < 60.0) {
            r1 = c; g1 = x; b1 = 0.0;
        } else if (h < 120.0) {
            r1 = x; g1 = c; b1 = 0.0;
        } else if (h < 180.0) {
            r1 = 0.0; g1 = c; b1 = x;
        } else if (h < 240.0) {
            r1 = 0.0; g1 = x; b1 = c;
        } else if (h < 300.0) {
            r1 = x; g1 = 0.0; b1 = c;
        } else {
            r1 = c; g1 = 0.0; b1 = x;
        }

        return new PixelRGB(to255(r1 + m), to255(g1 + m), to255(b1 + m));
    }

    private static int to255(double v) {
        return (int) clamp(Math.round(v * 255.0), 0.0, 255.0);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(v, hi));
    }
}
