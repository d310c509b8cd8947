package com.snapimg.server.img.seam;

import com.snapimg.server.img.ImageBuffer;
import com.snapimg.server.img.PixelMatrix;
import com.snapimg.server.img.PixelRGB;
import com.snapimg.server.img.RowMinimum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Content-aware resizing by repeated removal of minimal-energy seams.
 *
 * Image -> dual-gradient energy -> cumulative vertical cost -> cheapest
 * top-to-bottom seam -> removal. The whole chain is recomputed for every
 * seam since each removal changes the neighbours of the pixels left behind.
 *
 * Nothing is kept between calls; every method works only on the image it is
 * given.
 */
public final class SeamCarver {

    private static final Logger logger = LoggerFactory.getLogger(SeamCarver.class);

    private SeamCarver() {
    }

    /**
     * Dual-gradient energy of every pixel.
     *
     * Interior pixels get |N - S|^2 + |E - W|^2 summed over the RGB channels.
     * The border is then set to the largest interior energy, or to 1 if that
     * is zero, so the edge is never cheaper than the interior. Images thinner
     * than 3 pixels have no interior and come back as all border.
     */
    public static PixelMatrix<Long> energy(ImageBuffer image) {
        int width = image.getWidth();
        int height = image.getHeight();
        PixelMatrix<Long> energy = PixelMatrix.filled(width, height, 0L);
        long maxEnergy = 0;

        for (int row = 1; row < height - 1; row++) {
            for (int col = 1; col < width - 1; col++) {
                PixelRGB n = image.pixelAt(row - 1, col);
                PixelRGB s = image.pixelAt(row + 1, col);
                PixelRGB e = image.pixelAt(row, col + 1);
                PixelRGB w = image.pixelAt(row, col - 1);

                long value = n.squaredDifference(s) + e.squaredDifference(w);
                energy.put(row, col, value);
                if (value > maxEnergy) {
                    maxEnergy = value;
                }
            }
        }

        if (maxEnergy == 0) {
            maxEnergy = 1;
        }
        energy.fillBorder(maxEnergy);
        return energy;
    }

    /**
     * Cheapest cost of any connected path from the top row down to each cell.
     * Row 0 is the energy itself; below that each cell adds its energy to the
     * smallest of its up to three upper neighbours.
     */
    public static PixelMatrix<Long> verticalCost(ImageBuffer image) {
        return cumulativeCost(energy(image));
    }

    static PixelMatrix<Long> cumulativeCost(PixelMatrix<Long> energy) {
        int width = energy.getWidth();
        int height = energy.getHeight();
        PixelMatrix<Long> cost = PixelMatrix.filled(width, height, 0L);

        for (int col = 0; col < width; col++) {
            cost.put(0, col, energy.at(0, col));
        }

        for (int row = 1; row < height; row++) {
            for (int col = 0; col < width; col++) {
                long minPrev = cost.at(row - 1, col);
                if (col > 0) {
                    minPrev = Math.min(minPrev, cost.at(row - 1, col - 1));
                }
                if (col < width - 1) {
                    minPrev = Math.min(minPrev, cost.at(row - 1, col + 1));
                }
                cost.put(row, col, energy.at(row, col) + minPrev);
            }
        }
        return cost;
    }

    /**
     * The cheapest top-to-bottom seam, as one column index per row.
     */
    public static int[] minimalVerticalSeam(ImageBuffer image) {
        return traceSeam(verticalCost(image));
    }

    /**
     * Walks up from the cheapest bottom cell, each step choosing among the
     * three cells above the previous pick. Ties go to the leftmost column at
     * every step.
     */
    static int[] traceSeam(PixelMatrix<Long> cost) {
        int width = cost.getWidth();
        int height = cost.getHeight();
        int[] seam = new int[height];
        if (height == 0) {
            return seam;
        }

        int current = cost.minInRow(height - 1)
                .map(m -> m.column)
                .orElseThrow(() -> new IllegalStateException("Bottom row of a " + width + "x" + height
                        + " cost matrix is empty"));
        seam[height - 1] = current;

        for (int row = height - 2; row >= 0; row--) {
            int start = Math.max(current - 1, 0);
            int end = Math.min(current + 2, width);
            RowMinimum<Long> min = cost.minInRowRange(row, start, end)
                    .orElseThrow(() -> new IllegalStateException("No columns to trace in row"));
            current = min.column;
            seam[row] = current;
        }
        return seam;
    }

    /**
     * Removes the cheapest vertical seam; the image loses one column.
     */
    public static void removeVerticalSeam(ImageBuffer image) {
        removeSeam(image, minimalVerticalSeam(image));
    }

    static void removeSeam(ImageBuffer image, int[] seam) {
        int width = image.getWidth();
        int height = image.getHeight();
        if (seam.length != height) {
            throw new IllegalStateException("Seam has " + seam.length + " entries for an image of height " + height);
        }

        for (int row = 0; row < height; row++) {
            int col = seam[row];
            if (col < 0 || col >= width) {
                throw new IllegalStateException(
                        "Invalid seam column " + col + " at row " + row + ", image width is " + width);
            }
        }
        for (int row = 0; row < height; row++) {
            image.shiftRowLeft(row, seam[row]);
        }
        image.trimWidth(width - 1);
    }

    /**
     * Narrows the image to {@code targetWidth} one seam at a time.
     *
     * @throws IllegalArgumentException if the target is negative or wider than the image
     */
    public static void seamCarveWidth(ImageBuffer image, int targetWidth) {
        int width = image.getWidth();
        if (targetWidth == width) {
            return;
        }
        if (targetWidth < 0 || targetWidth > width) {
            throw new IllegalArgumentException(
                    "Seam carving can only shrink: width " + width + " -> " + targetWidth);
        }

        int seams = width - targetWidth;
        long start = System.currentTimeMillis();
        for (int i = 0; i < seams; i++) {
            removeVerticalSeam(image);
            if (logger.isDebugEnabled()) {
                logger.debug("Removed seam {}/{}, width now {}", i + 1, seams, image.getWidth());
            }
        }
        logger.debug("Carved {} seams in {} ms", seams, System.currentTimeMillis() - start);
    }

    /**
     * Shortens the image by carving its rotated copy along the width.
     *
     * @throws IllegalArgumentException if the target is negative or taller than the image
     */
    public static void seamCarveHeight(ImageBuffer image, int targetHeight) {
        int height = image.getHeight();
        if (targetHeight == height) {
            return;
        }
        if (targetHeight < 0 || targetHeight > height) {
            throw new IllegalArgumentException(
                    "Seam carving can only shrink: height " + height + " -> " + targetHeight);
        }

        image.rotateLeft();
        seamCarveWidth(image, targetHeight);
        image.rotateRight();
    }

    /**
     * Carves the width first and then the height. The order matters: the
     * height pass computes its energy on the already narrowed image, so
     * swapping the passes gives a different result.
     */
    public static void seamCarve(ImageBuffer image, int targetWidth, int targetHeight) {
        if (targetWidth < 0 || targetWidth > image.getWidth() || targetHeight < 0
                || targetHeight > image.getHeight()) {
            throw new IllegalArgumentException("Seam carving can only shrink: " + image.getWidth() + "x"
                    + image.getHeight() + " -> " + targetWidth + "x" + targetHeight);
        }
        logger.info("Seam carving {}x{} -> {}x{}", image.getWidth(), image.getHeight(), targetWidth, targetHeight);
        long start = System.currentTimeMillis();
        seamCarveWidth(image, targetWidth);
        seamCarveHeight(image, targetHeight);
        logger.info("Seam carving done in {} ms", System.currentTimeMillis() - start);
    }
}
