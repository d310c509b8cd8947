package com.snapimg.server.img;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A generic 2D grid stored row-major in a single backing array of exactly
 * {@code width * height} elements. Cells are addressed as (row, col).
 *
 * The checked accessors ({@link #get}, {@link #set}) tolerate out-of-range
 * coordinates; {@link #at} and {@link #put} do not and are meant for loops
 * whose bounds are already known.
 */
public final class PixelMatrix<T extends Comparable<? super T>> {

    private int width;
    private int height;
    private Object[] data;

    public PixelMatrix(int width, int height, T fillValue) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Matrix dimensions must not be negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.data = new Object[width * height];
        Arrays.fill(this.data, fillValue);
    }

    private PixelMatrix(int width, int height, Object[] data) {
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public static <T extends Comparable<? super T>> PixelMatrix<T> filled(int width, int height, T value) {
        return new PixelMatrix<>(width, height, value);
    }

    /**
     * Builds a matrix from values laid out row-major.
     *
     * @throws ShapeMismatchException if the number of values is not width * height
     */
    public static <T extends Comparable<? super T>> PixelMatrix<T> fromList(int width, int height, List<T> values) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Matrix dimensions must not be negative: " + width + "x" + height);
        }
        if (values.size() != width * height) {
            throw new ShapeMismatchException("Expected " + (width * height) + " values for a " + width + "x"
                    + height + " matrix, got " + values.size());
        }
        return new PixelMatrix<>(width, height, values.toArray());
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int size() {
        return data.length;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    public Optional<T> get(int row, int col) {
        if (!contains(row, col)) {
            return Optional.empty();
        }
        return Optional.ofNullable(at(row, col));
    }

    /**
     * Writes a value if (row, col) lies inside the matrix.
     *
     * @return false when the coordinate was out of range and nothing was written
     */
    public boolean set(int row, int col, T value) {
        if (!contains(row, col)) {
            return false;
        }
        put(row, col, value);
        return true;
    }

    @SuppressWarnings("unchecked")
    public T at(int row, int col) {
        return (T) data[row * width + col];
    }

    public void put(int row, int col, T value) {
        data[row * width + col] = value;
    }

    public void fill(T value) {
        Arrays.fill(data, value);
    }

    /**
     * Overwrites the first and last row and the first and last column.
     */
    public void fillBorder(T value) {
        if (width == 0 || height == 0) {
            return;
        }
        for (int col = 0; col < width; col++) {
            put(0, col, value);
            put(height - 1, col, value);
        }
        for (int row = 0; row < height; row++) {
            put(row, 0, value);
            put(row, width - 1, value);
        }
    }

    @SuppressWarnings("unchecked")
    public Optional<T> min() {
        T best = null;
        for (Object o : data) {
            T v = (T) o;
            if (best == null || v.compareTo(best) < 0) {
                best = v;
            }
        }
        return Optional.ofNullable(best);
    }

    @SuppressWarnings("unchecked")
    public Optional<T> max() {
        T best = null;
        for (Object o : data) {
            T v = (T) o;
            if (best == null || v.compareTo(best) > 0) {
                best = v;
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<RowMinimum<T>> minInRow(int row) {
        return minInRowRange(row, 0, width);
    }

    /**
     * Finds the minimum of {@code row} over columns [start, end), scanning left
     * to right. Only a strictly smaller value replaces the current best, so
     * ties go to the smallest column.
     */
    public Optional<RowMinimum<T>> minInRowRange(int row, int start, int end) {
        if (row < 0 || row >= height || start < 0 || start >= end || end > width) {
            return Optional.empty();
        }

        T minValue = at(row, start);
        int minColumn = start;
        for (int col = start + 1; col < end; col++) {
            T value = at(row, col);
            if (value.compareTo(minValue) < 0) {
                minValue = value;
                minColumn = col;
            }
        }
        return Optional.of(new RowMinimum<>(minColumn, minValue));
    }

    /**
     * Keeps the first {@code newWidth} columns of every row.
     */
    public void trimWidth(int newWidth) {
        if (newWidth < 0 || newWidth > width) {
            throw new IllegalArgumentException("Cannot trim width " + width + " to " + newWidth);
        }
        Object[] trimmed = new Object[newWidth * height];
        for (int row = 0; row < height; row++) {
            System.arraycopy(data, row * width, trimmed, row * newWidth, newWidth);
        }
        data = trimmed;
        width = newWidth;
    }

    /**
     * Keeps the first {@code newHeight} rows.
     */
    public void trimHeight(int newHeight) {
        if (newHeight < 0 || newHeight > height) {
            throw new IllegalArgumentException("Cannot trim height " + height + " to " + newHeight);
        }
        data = Arrays.copyOf(data, newHeight * width);
        height = newHeight;
    }

    /**
     * Swaps width and height so that new (c, r) holds old (r, c).
     */
    public void transpose() {
        Object[] transposed = new Object[data.length];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                transposed[col * height + row] = data[row * width + col];
            }
        }
        int oldWidth = width;
        width = height;
        height = oldWidth;
        data = transposed;
    }

    /**
     * Reverses the order of the rows (mirror about the horizontal axis).
     */
    public void mirrorX() {
        for (int col = 0; col < width; col++) {
            for (int row = 0; row < height / 2; row++) {
                swap(row * width + col, (height - 1 - row) * width + col);
            }
        }
    }

    /**
     * Reverses every row (mirror about the vertical axis).
     */
    public void mirrorY() {
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width / 2; col++) {
                swap(row * width + col, row * width + (width - 1 - col));
            }
        }
    }

    public PixelMatrix<T> copy() {
        return new PixelMatrix<>(width, height, data.clone());
    }

    public boolean sameShape(PixelMatrix<?> other) {
        return width == other.width && height == other.height;
    }

    private void swap(int i, int j) {
        Object tmp = data[i];
        data[i] = data[j];
        data[j] = tmp;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PixelMatrix)) return false;
        PixelMatrix<?> other = (PixelMatrix<?>) obj;
        return sameShape(other) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("PixelMatrix (").append(height).append(" x ").append(width).append("):\n");
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                sb.append(data[row * width + col]).append(' ');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
