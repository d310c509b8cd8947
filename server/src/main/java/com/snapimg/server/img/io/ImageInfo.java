package com.snapimg.server.img.io;

import com.snapimg.server.img.ImageBuffer;

/**
 * Summary of an image, as reported by the info command and endpoint.
 */
public class ImageInfo {
    public int width;
    public int height;
    public int maxIntensity;
    public String format;
    public long pixelCount;

    public ImageInfo() {
    }

    public ImageInfo(int width, int height, int maxIntensity, String format, long pixelCount) {
        this.width = width;
        this.height = height;
        this.maxIntensity = maxIntensity;
        this.format = format;
        this.pixelCount = pixelCount;
    }

    public static ImageInfo of(ImageBuffer image) {
        return new ImageInfo(image.getWidth(), image.getHeight(), image.getMaxIntensity(),
                image.getFormat().name(), image.getPixelCount());
    }

    @Override
    public String toString() {
        return "Width: " + width + "\nHeight: " + height + "\nMax intensity: " + maxIntensity
                + "\nFormat: " + format + "\nPixels: " + pixelCount;
    }
}
