package com.snapimg.server.img;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PixelMatrixTest {

    private static PixelMatrix<Integer> grid3x2() {
        // 1 2 3
        // 4 5 6
        return PixelMatrix.fromList(3, 2, List.of(1, 2, 3, 4, 5, 6));
    }

    @Test
    void testFromListRejectsWrongLength() {
        assertThrows(ShapeMismatchException.class, () -> PixelMatrix.fromList(2, 2, List.of(1, 2, 3)));
    }

    @Test
    void testCheckedAccessOutOfRange() {
        PixelMatrix<Integer> m = grid3x2();
        assertEquals(Optional.of(6), m.get(1, 2));
        assertTrue(m.get(2, 0).isEmpty());
        assertTrue(m.get(0, 3).isEmpty());
        assertTrue(m.get(-1, 0).isEmpty());

        assertFalse(m.set(5, 5, 99));
        assertTrue(m.set(0, 0, 42));
        assertEquals(42, m.at(0, 0));
    }

    @Test
    void testFillAndBorder() {
        PixelMatrix<Integer> m = PixelMatrix.filled(4, 3, 0);
        m.fillBorder(7);
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 4; col++) {
                boolean border = row == 0 || row == 2 || col == 0 || col == 3;
                assertEquals(border ? 7 : 0, m.at(row, col), "cell " + row + "," + col);
            }
        }
        m.fill(3);
        assertEquals(Optional.of(3), m.min());
        assertEquals(Optional.of(3), m.max());
    }

    @Test
    void testFillBorderOnEmptyMatrixIsNoOp() {
        PixelMatrix<Integer> m = PixelMatrix.filled(0, 4, 0);
        m.fillBorder(1);
        assertEquals(0, m.size());
    }

    @Test
    void testMinMax() {
        PixelMatrix<Integer> m = grid3x2();
        assertEquals(Optional.of(1), m.min());
        assertEquals(Optional.of(6), m.max());
        assertTrue(PixelMatrix.filled(0, 0, 0).min().isEmpty());
    }

    @Test
    void testMinInRowRangeLeftmostTie() {
        PixelMatrix<Long> m = PixelMatrix.fromList(3, 3, List.of(
                5L, 2L, 2L,
                1L, 1L, 1L,
                9L, 3L, 3L));

        RowMinimum<Long> top = m.minInRowRange(0, 0, 3).orElseThrow();
        assertEquals(1, top.column);
        assertEquals(2L, top.value);

        assertEquals(0, m.minInRow(1).orElseThrow().column);
        assertEquals(1, m.minInRowRange(2, 1, 3).orElseThrow().column);
    }

    @Test
    void testMinInRowRangeInvalidRange() {
        PixelMatrix<Integer> m = grid3x2();
        assertTrue(m.minInRowRange(0, 2, 2).isEmpty());
        assertTrue(m.minInRowRange(0, 0, 4).isEmpty());
        assertTrue(m.minInRowRange(2, 0, 1).isEmpty());
    }

    @Test
    void testTrimWidthKeepsRowMajorLayout() {
        PixelMatrix<Integer> m = grid3x2();
        m.trimWidth(2);
        assertEquals(2, m.getWidth());
        assertEquals(2, m.getHeight());
        assertEquals(PixelMatrix.fromList(2, 2, List.of(1, 2, 4, 5)), m);

        assertThrows(IllegalArgumentException.class, () -> m.trimWidth(3));
    }

    @Test
    void testTrimHeight() {
        PixelMatrix<Integer> m = grid3x2();
        m.trimHeight(1);
        assertEquals(PixelMatrix.fromList(3, 1, List.of(1, 2, 3)), m);
    }

    @Test
    void testTranspose() {
        PixelMatrix<Integer> m = grid3x2();
        m.transpose();
        assertEquals(2, m.getWidth());
        assertEquals(3, m.getHeight());
        assertEquals(PixelMatrix.fromList(2, 3, List.of(1, 4, 2, 5, 3, 6)), m);
    }

    @Test
    void testMirrors() {
        PixelMatrix<Integer> x = grid3x2();
        x.mirrorX();
        assertEquals(PixelMatrix.fromList(3, 2, List.of(4, 5, 6, 1, 2, 3)), x);

        PixelMatrix<Integer> y = grid3x2();
        y.mirrorY();
        assertEquals(PixelMatrix.fromList(3, 2, List.of(3, 2, 1, 6, 5, 4)), y);
    }

    @Test
    void testCopyIsIndependent() {
        PixelMatrix<Integer> m = grid3x2();
        PixelMatrix<Integer> c = m.copy();
        c.put(0, 0, 100);
        assertEquals(1, m.at(0, 0));
    }
}
