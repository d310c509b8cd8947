package com.snapimg.server.img;

import com.snapimg.server.img.io.PpmFormat;

import java.util.Optional;

/**
 * An RGB image held as three equally shaped channel matrices.
 *
 * All three channels share the same width and height whenever the buffer is
 * observable. Every whole-image transform builds its replacement channels
 * first and commits them together through {@link #replaceChannels}, so a
 * failure part way through leaves the previous image intact.
 *
 * Instances are mutated in place and are not thread safe.
 */
public final class ImageBuffer {

    private int width;
    private int height;
    private final int maxIntensity;
    private PixelMatrix<Integer> red;
    private PixelMatrix<Integer> green;
    private PixelMatrix<Integer> blue;
    private PpmFormat format;

    public ImageBuffer(PixelMatrix<Integer> red, PixelMatrix<Integer> green, PixelMatrix<Integer> blue,
            int maxIntensity) {
        this(red, green, blue, maxIntensity, PpmFormat.P6);
    }

    public ImageBuffer(PixelMatrix<Integer> red, PixelMatrix<Integer> green, PixelMatrix<Integer> blue,
            int maxIntensity, PpmFormat format) {
        checkShapes(red, green, blue);
        if (maxIntensity < 0) {
            throw new IllegalArgumentException("Max intensity must not be negative: " + maxIntensity);
        }
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.width = red.getWidth();
        this.height = red.getHeight();
        this.maxIntensity = maxIntensity;
        this.format = format != null ? format : PpmFormat.P6;
    }

    /**
     * An all-black image of the given size.
     */
    public static ImageBuffer blank(int width, int height, int maxIntensity) {
        return new ImageBuffer(
                PixelMatrix.filled(width, height, 0),
                PixelMatrix.filled(width, height, 0),
                PixelMatrix.filled(width, height, 0),
                maxIntensity);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getMaxIntensity() {
        return maxIntensity;
    }

    public long getPixelCount() {
        return (long) width * height;
    }

    public PpmFormat getFormat() {
        return format;
    }

    public void setFormat(PpmFormat format) {
        this.format = format;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    public Optional<PixelRGB> getPixel(int row, int col) {
        if (!contains(row, col)) {
            return Optional.empty();
        }
        return Optional.of(readPixel(row, col));
    }

    /**
     * Writes all three channels of one pixel.
     *
     * @return false when (row, col) is outside the image and nothing was written
     */
    public boolean setPixel(int row, int col, PixelRGB color) {
        if (!contains(row, col)) {
            return false;
        }
        red.put(row, col, color.r);
        green.put(row, col, color.g);
        blue.put(row, col, color.b);
        return true;
    }

    /**
     * Reads a pixel that the caller knows to be inside the image. Used by
     * transform loops, where an out-of-range read means a bug in the
     * transform itself.
     *
     * @throws IllegalStateException if (row, col) is out of range
     */
    public PixelRGB pixelAt(int row, int col) {
        if (!contains(row, col)) {
            throw new IllegalStateException(
                    "Pixel (" + row + ", " + col + ") outside " + width + "x" + height + " image");
        }
        return readPixel(row, col);
    }

    public PixelMatrix<Integer> channelCopy(Channel channel) {
        switch (channel) {
            case RED:
                return red.copy();
            case GREEN:
                return green.copy();
            case BLUE:
                return blue.copy();
            default:
                throw new IllegalArgumentException("Unknown channel " + channel);
        }
    }

    public void fill(PixelRGB color) {
        red.fill(color.r);
        green.fill(color.g);
        blue.fill(color.b);
    }

    /**
     * Swaps in three new channels at once. Width and height follow the new
     * channels.
     *
     * @throws ShapeMismatchException if the channels differ in shape; the
     *                                buffer is left untouched
     */
    public void replaceChannels(PixelMatrix<Integer> newRed, PixelMatrix<Integer> newGreen,
            PixelMatrix<Integer> newBlue) {
        checkShapes(newRed, newGreen, newBlue);
        this.red = newRed;
        this.green = newGreen;
        this.blue = newBlue;
        this.width = newRed.getWidth();
        this.height = newRed.getHeight();
    }

    /**
     * Deletes the pixel at (row, col) by moving every pixel to its right one
     * column left, in all three channels. The last column of the row is left
     * holding a stale copy until the width is trimmed.
     */
    public void shiftRowLeft(int row, int col) {
        if (!contains(row, col)) {
            throw new IllegalStateException(
                    "Cannot remove pixel (" + row + ", " + col + ") from " + width + "x" + height + " image");
        }
        for (int c = col; c < width - 1; c++) {
            red.put(row, c, red.at(row, c + 1));
            green.put(row, c, green.at(row, c + 1));
            blue.put(row, c, blue.at(row, c + 1));
        }
    }

    /**
     * Keeps the leftmost {@code newWidth} columns.
     */
    public void trimWidth(int newWidth) {
        if (newWidth < 0 || newWidth > width) {
            throw new IllegalArgumentException("Cannot trim width " + width + " to " + newWidth);
        }
        PixelMatrix<Integer> r = red.copy();
        PixelMatrix<Integer> g = green.copy();
        PixelMatrix<Integer> b = blue.copy();
        r.trimWidth(newWidth);
        g.trimWidth(newWidth);
        b.trimWidth(newWidth);
        replaceChannels(r, g, b);
    }

    /**
     * Keeps the topmost {@code newHeight} rows.
     */
    public void trimHeight(int newHeight) {
        if (newHeight < 0 || newHeight > height) {
            throw new IllegalArgumentException("Cannot trim height " + height + " to " + newHeight);
        }
        PixelMatrix<Integer> r = red.copy();
        PixelMatrix<Integer> g = green.copy();
        PixelMatrix<Integer> b = blue.copy();
        r.trimHeight(newHeight);
        g.trimHeight(newHeight);
        b.trimHeight(newHeight);
        replaceChannels(r, g, b);
    }

    /**
     * Rotates 90 degrees counter-clockwise; width and height swap.
     */
    public void rotateLeft() {
        PixelMatrix<Integer> newRed = PixelMatrix.filled(height, width, 0);
        PixelMatrix<Integer> newGreen = PixelMatrix.filled(height, width, 0);
        PixelMatrix<Integer> newBlue = PixelMatrix.filled(height, width, 0);

        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int newRow = width - 1 - col;
                newRed.put(newRow, row, red.at(row, col));
                newGreen.put(newRow, row, green.at(row, col));
                newBlue.put(newRow, row, blue.at(row, col));
            }
        }
        replaceChannels(newRed, newGreen, newBlue);
    }

    /**
     * Rotates 90 degrees clockwise; width and height swap.
     */
    public void rotateRight() {
        PixelMatrix<Integer> newRed = PixelMatrix.filled(height, width, 0);
        PixelMatrix<Integer> newGreen = PixelMatrix.filled(height, width, 0);
        PixelMatrix<Integer> newBlue = PixelMatrix.filled(height, width, 0);

        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int newCol = height - 1 - row;
                newRed.put(col, newCol, red.at(row, col));
                newGreen.put(col, newCol, green.at(row, col));
                newBlue.put(col, newCol, blue.at(row, col));
            }
        }
        replaceChannels(newRed, newGreen, newBlue);
    }

    public void rotate180() {
        PixelMatrix<Integer> r = red.copy();
        PixelMatrix<Integer> g = green.copy();
        PixelMatrix<Integer> b = blue.copy();
        r.mirrorX();
        g.mirrorX();
        b.mirrorX();
        r.mirrorY();
        g.mirrorY();
        b.mirrorY();
        replaceChannels(r, g, b);
    }

    /**
     * Mirrors about the horizontal axis (top and bottom swap).
     */
    public void mirrorX() {
        PixelMatrix<Integer> r = red.copy();
        PixelMatrix<Integer> g = green.copy();
        PixelMatrix<Integer> b = blue.copy();
        r.mirrorX();
        g.mirrorX();
        b.mirrorX();
        replaceChannels(r, g, b);
    }

    /**
     * Mirrors about the vertical axis (left and right swap).
     */
    public void mirrorY() {
        PixelMatrix<Integer> r = red.copy();
        PixelMatrix<Integer> g = green.copy();
        PixelMatrix<Integer> b = blue.copy();
        r.mirrorY();
        g.mirrorY();
        b.mirrorY();
        replaceChannels(r, g, b);
    }

    public void transpose() {
        PixelMatrix<Integer> r = red.copy();
        PixelMatrix<Integer> g = green.copy();
        PixelMatrix<Integer> b = blue.copy();
        r.transpose();
        g.transpose();
        b.transpose();
        replaceChannels(r, g, b);
    }

    public ImageBuffer copy() {
        return new ImageBuffer(red.copy(), green.copy(), blue.copy(), maxIntensity, format);
    }

    private PixelRGB readPixel(int row, int col) {
        return new PixelRGB(red.at(row, col), green.at(row, col), blue.at(row, col));
    }

    private static void checkShapes(PixelMatrix<Integer> red, PixelMatrix<Integer> green,
            PixelMatrix<Integer> blue) {
        if (red == null || green == null || blue == null) {
            throw new ShapeMismatchException("All three channels are required");
        }
        if (!red.sameShape(green) || !red.sameShape(blue)) {
            throw new ShapeMismatchException("Channel shapes differ: red " + red.getWidth() + "x" + red.getHeight()
                    + ", green " + green.getWidth() + "x" + green.getHeight()
                    + ", blue " + blue.getWidth() + "x" + blue.getHeight());
        }
    }

    @Override
    public String toString() {
        return "ImageBuffer(" + width + "x" + height + ", max=" + maxIntensity + ", " + format + ")";
    }
}
