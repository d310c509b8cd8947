package com.snapimg.server.img;

/**
 * Result of a row minimum search: the winning column and its value.
 */
public final class RowMinimum<T> {
    public final int column;
    public final T value;

    public RowMinimum(int column, T value) {
        this.column = column;
        this.value = value;
    }

    @Override
    public String toString() {
        return "RowMinimum(" + column + ", " + value + ")";
    }
}
