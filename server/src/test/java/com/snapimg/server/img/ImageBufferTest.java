package com.snapimg.server.img;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ImageBufferTest {

    /**
     * A width x height image whose pixel at (row, col) is (row, col, row * width + col).
     */
    static ImageBuffer gradient(int width, int height) {
        ImageBuffer image = ImageBuffer.blank(width, height, 255);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                image.setPixel(row, col, new PixelRGB(row, col, row * width + col));
            }
        }
        return image;
    }

    static void assertSameImage(ImageBuffer expected, ImageBuffer actual) {
        assertEquals(expected.getWidth(), actual.getWidth(), "width");
        assertEquals(expected.getHeight(), actual.getHeight(), "height");
        for (Channel c : Channel.values()) {
            assertEquals(expected.channelCopy(c), actual.channelCopy(c), "channel " + c);
        }
    }

    @Test
    public void testMismatchedChannelsRejected() {
        PixelMatrix<Integer> a = PixelMatrix.filled(2, 2, 0);
        PixelMatrix<Integer> b = PixelMatrix.filled(2, 3, 0);
        assertThrows(ShapeMismatchException.class, () -> new ImageBuffer(a, a.copy(), b, 255));
        assertThrows(ShapeMismatchException.class, () -> new ImageBuffer(a, null, a.copy(), 255));
    }

    @Test
    public void testReplaceChannelsIsAllOrNothing() {
        ImageBuffer image = gradient(3, 2);
        ImageBuffer before = image.copy();
        assertThrows(ShapeMismatchException.class, () -> image.replaceChannels(
                PixelMatrix.filled(2, 3, 0), PixelMatrix.filled(2, 3, 0), PixelMatrix.filled(3, 2, 0)));
        assertSameImage(before, image);
    }

    @Test
    public void testGetSetPixel() {
        ImageBuffer image = ImageBuffer.blank(2, 2, 255);
        assertTrue(image.setPixel(1, 0, new PixelRGB(10, 20, 30)));
        assertEquals(new PixelRGB(10, 20, 30), image.getPixel(1, 0).orElseThrow());
        assertFalse(image.setPixel(2, 0, new PixelRGB(1, 1, 1)));
        assertTrue(image.getPixel(0, 2).isEmpty());
        assertThrows(IllegalStateException.class, () -> image.pixelAt(0, 2));
    }

    @Test
    public void testRotateLeft() {
        // 3 wide, 2 tall; rotating left puts the last column on top
        ImageBuffer image = gradient(3, 2);
        image.rotateLeft();
        assertEquals(2, image.getWidth());
        assertEquals(3, image.getHeight());
        assertEquals(new PixelRGB(0, 2, 2), image.pixelAt(0, 0));
        assertEquals(new PixelRGB(1, 2, 5), image.pixelAt(0, 1));
        assertEquals(new PixelRGB(0, 0, 0), image.pixelAt(2, 0));
    }

    @Test
    public void testRotateRight() {
        ImageBuffer image = gradient(3, 2);
        image.rotateRight();
        assertEquals(2, image.getWidth());
        assertEquals(3, image.getHeight());
        assertEquals(new PixelRGB(1, 0, 3), image.pixelAt(0, 0));
        assertEquals(new PixelRGB(0, 0, 0), image.pixelAt(0, 1));
        assertEquals(new PixelRGB(0, 2, 2), image.pixelAt(2, 1));
    }

    @Test
    public void testRotateRoundTrip() {
        int[][] sizes = { { 4, 3 }, { 1, 5 }, { 0, 3 }, { 3, 0 }, { 0, 0 } };
        for (int[] size : sizes) {
            ImageBuffer image = gradient(size[0], size[1]);
            ImageBuffer original = image.copy();
            image.rotateLeft();
            assertEquals(size[1], image.getWidth());
            assertEquals(size[0], image.getHeight());
            image.rotateRight();
            assertSameImage(original, image);
        }
    }

    @Test
    public void testMirrorAndFlip() {
        ImageBuffer image = gradient(3, 2);
        image.mirrorY();
        assertEquals(new PixelRGB(0, 2, 2), image.pixelAt(0, 0));

        ImageBuffer flipped = gradient(3, 2);
        flipped.rotate180();
        assertEquals(new PixelRGB(1, 2, 5), flipped.pixelAt(0, 0));
        assertEquals(new PixelRGB(0, 0, 0), flipped.pixelAt(1, 2));

        ImageBuffer mx = gradient(3, 2);
        mx.mirrorX();
        assertEquals(new PixelRGB(1, 0, 3), mx.pixelAt(0, 0));
    }

    @Test
    public void testTranspose() {
        ImageBuffer image = gradient(3, 2);
        image.transpose();
        assertEquals(2, image.getWidth());
        assertEquals(3, image.getHeight());
        assertEquals(new PixelRGB(1, 2, 5), image.pixelAt(2, 1));
    }

    @Test
    public void testShiftAndTrim() {
        ImageBuffer image = gradient(4, 1);
        image.shiftRowLeft(0, 1);
        image.trimWidth(3);
        assertEquals(3, image.getWidth());
        assertEquals(0, image.pixelAt(0, 0).g);
        assertEquals(2, image.pixelAt(0, 1).g);
        assertEquals(3, image.pixelAt(0, 2).g);
        assertThrows(IllegalStateException.class, () -> image.shiftRowLeft(0, 3));
    }

    @Test
    public void testFill() {
        ImageBuffer image = ImageBuffer.blank(2, 3, 255);
        image.fill(new PixelRGB(1, 2, 3));
        assertEquals(PixelMatrix.fromList(2, 3, List.of(2, 2, 2, 2, 2, 2)), image.channelCopy(Channel.GREEN));
    }
}
