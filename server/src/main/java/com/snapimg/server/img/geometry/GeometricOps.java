package com.snapimg.server.img.geometry;

import com.snapimg.server.img.ImageBuffer;
import com.snapimg.server.img.MissingCropMethodException;
import com.snapimg.server.img.PixelMatrix;
import com.snapimg.server.img.PixelRGB;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scaling, cropping and plain resizing of an {@link ImageBuffer}, in place.
 * Cropping only reslices pixels; scaling resamples.
 */
public final class GeometricOps {

    private static final Logger logger = LoggerFactory.getLogger(GeometricOps.class);

    private GeometricOps() {
    }

    /**
     * Grows each axis by scaling and shrinks it by cropping, width first.
     *
     * @throws MissingCropMethodException if an axis must shrink and no crop
     *                                    method was given for it
     */
    public static void resize(ImageBuffer image, int targetWidth, int targetHeight, ScaleMethod method,
            CropMethod cropX, CropMethod cropY) {
        checkDimensions(targetWidth, targetHeight);
        logger.info("Resizing {}x{} -> {}x{}", image.getWidth(), image.getHeight(), targetWidth, targetHeight);

        if (targetWidth > image.getWidth()) {
            scale(image, targetWidth, image.getHeight(), requireScaleMethod(method));
        } else if (targetWidth < image.getWidth()) {
            if (cropX == null) {
                throw new MissingCropMethodException("x");
            }
            cropWidth(image, targetWidth, cropX);
        }

        if (targetHeight > image.getHeight()) {
            scale(image, image.getWidth(), targetHeight, requireScaleMethod(method));
        } else if (targetHeight < image.getHeight()) {
            if (cropY == null) {
                throw new MissingCropMethodException("y");
            }
            cropHeight(image, targetHeight, cropY);
        }
    }

    /**
     * Resamples the image to the new size. Does nothing if the image or the
     * target has a zero dimension.
     */
    public static void scale(ImageBuffer image, int newWidth, int newHeight, ScaleMethod method) {
        checkDimensions(newWidth, newHeight);
        if (image.getWidth() == 0 || image.getHeight() == 0 || newWidth == 0 || newHeight == 0) {
            return;
        }

        switch (requireScaleMethod(method)) {
            case NEAREST:
                nearestScale(image, newWidth, newHeight);
                break;
            case BILINEAR:
                bilinearScale(image, newWidth, newHeight);
                break;
            default:
                throw new IllegalArgumentException("Unsupported scale method " + method);
        }
    }

    static void nearestScale(ImageBuffer image, int newWidth, int newHeight) {
        int width = image.getWidth();
        int height = image.getHeight();
        PixelMatrix<Integer> red = PixelMatrix.filled(newWidth, newHeight, 0);
        PixelMatrix<Integer> green = PixelMatrix.filled(newWidth, newHeight, 0);
        PixelMatrix<Integer> blue = PixelMatrix.filled(newWidth, newHeight, 0);

        for (int newRow = 0; newRow < newHeight; newRow++) {
            for (int newCol = 0; newCol < newWidth; newCol++) {
                int srcRow = (int) ((long) newRow * height / newHeight);
                int srcCol = (int) ((long) newCol * width / newWidth);
                PixelRGB p = image.pixelAt(srcRow, srcCol);
                red.put(newRow, newCol, p.r);
                green.put(newRow, newCol, p.g);
                blue.put(newRow, newCol, p.b);
            }
        }
        image.replaceChannels(red, green, blue);
    }

    /**
     * Bilinear resampling. On the last source row or column the second sample
     * is clamped onto the first, so the edge pixel is repeated rather than
     * extrapolated.
     */
    static void bilinearScale(ImageBuffer image, int newWidth, int newHeight) {
        int width = image.getWidth();
        int height = image.getHeight();
        int max = image.getMaxIntensity();
        PixelMatrix<Integer> red = PixelMatrix.filled(newWidth, newHeight, 0);
        PixelMatrix<Integer> green = PixelMatrix.filled(newWidth, newHeight, 0);
        PixelMatrix<Integer> blue = PixelMatrix.filled(newWidth, newHeight, 0);

        for (int newY = 0; newY < newHeight; newY++) {
            double srcY = (double) newY * height / newHeight;
            int y0 = (int) Math.floor(srcY);
            int y1 = Math.min(Math.min(y0, height - 1) + 1, height - 1);
            double dy = srcY - y0;

            for (int newX = 0; newX < newWidth; newX++) {
                double srcX = (double) newX * width / newWidth;
                int x0 = (int) Math.floor(srcX);
                int x1 = Math.min(Math.min(x0, width - 1) + 1, width - 1);
                double dx = srcX - x0;

                PixelRGB p00 = image.pixelAt(y0, x0);
                PixelRGB p10 = image.pixelAt(y0, x1);
                PixelRGB p01 = image.pixelAt(y1, x0);
                PixelRGB p11 = image.pixelAt(y1, x1);

                red.put(newY, newX, clamp(interpolate(
                        interpolate(p00.r, p10.r, dx), interpolate(p01.r, p11.r, dx), dy), max));
                green.put(newY, newX, clamp(interpolate(
                        interpolate(p00.g, p10.g, dx), interpolate(p01.g, p11.g, dx), dy), max));
                blue.put(newY, newX, clamp(interpolate(
                        interpolate(p00.b, p10.b, dx), interpolate(p01.b, p11.b, dx), dy), max));
            }
        }
        image.replaceChannels(red, green, blue);
    }

    private static int interpolate(int a, int b, double t) {
        return (int) Math.round(a * (1.0 - t) + b * t);
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    /**
     * Crops to the new size. Does nothing if a target dimension is zero or
     * larger than the image.
     *
     * @param xOffset left edge of a {@link CropMethod#RECTANGULAR} window, centred when null
     * @param yOffset top edge of a {@link CropMethod#RECTANGULAR} window, centred when null
     */
    public static void crop(ImageBuffer image, int newWidth, int newHeight, CropMethod method,
            Integer xOffset, Integer yOffset) {
        checkDimensions(newWidth, newHeight);
        int width = image.getWidth();
        int height = image.getHeight();
        if (newWidth == 0 || newHeight == 0 || newWidth > width || newHeight > height) {
            logger.warn("Ignoring crop of {}x{} image to {}x{}", width, height, newWidth, newHeight);
            return;
        }
        if (method == null) {
            throw new IllegalArgumentException("Crop method is required");
        }

        int wDiff = width - newWidth;
        int hDiff = height - newHeight;

        switch (method) {
            case LEFT:
                cropLeft(image, newWidth);
                break;
            case RIGHT:
                cropRight(image, newWidth);
                break;
            case LEFT_RIGHT:
                cropRight(image, width - (wDiff - wDiff / 2));
                cropLeft(image, newWidth);
                break;
            case TOP:
                cropTop(image, newHeight);
                break;
            case BOTTOM:
                cropBottom(image, newHeight);
                break;
            case TOP_BOTTOM:
                cropBottom(image, height - (hDiff - hDiff / 2));
                cropTop(image, newHeight);
                break;
            case LEFT_TOP:
                cropLeft(image, newWidth);
                cropTop(image, newHeight);
                break;
            case LEFT_BOTTOM:
                cropLeft(image, newWidth);
                cropBottom(image, newHeight);
                break;
            case RIGHT_TOP:
                cropRight(image, newWidth);
                cropTop(image, newHeight);
                break;
            case RIGHT_BOTTOM:
                cropRight(image, newWidth);
                cropBottom(image, newHeight);
                break;
            case RECTANGULAR:
                int x = xOffset != null ? xOffset : wDiff / 2;
                int y = yOffset != null ? yOffset : hDiff / 2;
                cropRect(image, newWidth, newHeight, x, y);
                break;
            default:
                throw new IllegalArgumentException("Unsupported crop method " + method);
        }
    }

    /**
     * Trims the width using a horizontal crop method.
     */
    public static void cropWidth(ImageBuffer image, int newWidth, CropMethod method) {
        if (method == null || !method.isHorizontal()) {
            throw new IllegalArgumentException("Invalid crop method for width: " + method);
        }
        switch (method) {
            case LEFT:
                cropLeft(image, newWidth);
                break;
            case RIGHT:
                cropRight(image, newWidth);
                break;
            case LEFT_RIGHT:
                int leftTrim = Math.max(image.getWidth() - newWidth, 0) / 2;
                cropRect(image, newWidth, image.getHeight(), leftTrim, 0);
                break;
            default:
                throw new IllegalArgumentException("Invalid crop method for width: " + method);
        }
    }

    /**
     * Trims the height using a vertical crop method.
     */
    public static void cropHeight(ImageBuffer image, int newHeight, CropMethod method) {
        if (method == null || !method.isVertical()) {
            throw new IllegalArgumentException("Invalid crop method for height: " + method);
        }
        switch (method) {
            case TOP:
                cropTop(image, newHeight);
                break;
            case BOTTOM:
                cropBottom(image, newHeight);
                break;
            case TOP_BOTTOM:
                int topTrim = Math.max(image.getHeight() - newHeight, 0) / 2;
                cropRect(image, image.getWidth(), newHeight, 0, topTrim);
                break;
            default:
                throw new IllegalArgumentException("Invalid crop method for height: " + method);
        }
    }

    /** Removes columns from the left, keeping the rightmost {@code newWidth}. */
    public static void cropLeft(ImageBuffer image, int newWidth) {
        if (newWidth >= image.getWidth() || newWidth <= 0) {
            return;
        }
        cropRect(image, newWidth, image.getHeight(), image.getWidth() - newWidth, 0);
    }

    /** Removes columns from the right, keeping the leftmost {@code newWidth}. */
    public static void cropRight(ImageBuffer image, int newWidth) {
        if (newWidth >= image.getWidth() || newWidth <= 0) {
            return;
        }
        image.trimWidth(newWidth);
    }

    /** Removes rows from the top, keeping the bottom {@code newHeight}. */
    public static void cropTop(ImageBuffer image, int newHeight) {
        if (newHeight >= image.getHeight() || newHeight <= 0) {
            return;
        }
        cropRect(image, image.getWidth(), newHeight, 0, image.getHeight() - newHeight);
    }

    /** Removes rows from the bottom, keeping the top {@code newHeight}. */
    public static void cropBottom(ImageBuffer image, int newHeight) {
        if (newHeight >= image.getHeight() || newHeight <= 0) {
            return;
        }
        image.trimHeight(newHeight);
    }

    /**
     * Keeps the {@code newWidth x newHeight} window whose top-left corner is
     * at ({@code yOffset}, {@code xOffset}).
     */
    public static void cropRect(ImageBuffer image, int newWidth, int newHeight, int xOffset, int yOffset) {
        checkDimensions(newWidth, newHeight);
        if (xOffset < 0 || yOffset < 0 || xOffset + newWidth > image.getWidth()
                || yOffset + newHeight > image.getHeight()) {
            throw new IllegalArgumentException("Crop window " + newWidth + "x" + newHeight + " at (" + xOffset
                    + ", " + yOffset + ") does not fit a " + image.getWidth() + "x" + image.getHeight() + " image");
        }

        PixelMatrix<Integer> red = PixelMatrix.filled(newWidth, newHeight, 0);
        PixelMatrix<Integer> green = PixelMatrix.filled(newWidth, newHeight, 0);
        PixelMatrix<Integer> blue = PixelMatrix.filled(newWidth, newHeight, 0);
        for (int row = 0; row < newHeight; row++) {
            for (int col = 0; col < newWidth; col++) {
                PixelRGB p = image.pixelAt(yOffset + row, xOffset + col);
                red.put(row, col, p.r);
                green.put(row, col, p.g);
                blue.put(row, col, p.b);
            }
        }
        image.replaceChannels(red, green, blue);
    }

    private static ScaleMethod requireScaleMethod(ScaleMethod method) {
        if (method == null) {
            throw new IllegalArgumentException("Scale method is required to grow the image");
        }
        return method;
    }

    private static void checkDimensions(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Dimensions must not be negative: " + width + "x" + height);
        }
    }
}
