package com.snapimg.server.service;

import com.snapimg.server.img.ImageBuffer;
import com.snapimg.server.img.ImageException;
import com.snapimg.server.img.MissingCropMethodException;
import com.snapimg.server.img.PixelRGB;
import com.snapimg.server.img.io.ImageCodec;
import com.snapimg.server.img.io.ImageInfo;
import com.snapimg.server.img.io.PpmCodec;
import com.snapimg.server.img.io.PpmFormat;
import com.snapimg.server.util.SnapConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class ImageProcessingServiceTest {

    private static ImageBuffer image(int width, int height) {
        ImageBuffer image = ImageBuffer.blank(width, height, 255);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                image.setPixel(row, col, new PixelRGB((row * 37) % 256, (col * 53) % 256, (row + col) % 256));
            }
        }
        return image;
    }

    @Test
    public void testDefaultConstructorUsesClasspathConfig() {
        ImageProcessingService service = new ImageProcessingService();
        assertEquals("nearest", service.getConfig().defaultScaleMethod);
        assertEquals(4096, service.getConfig().maxPixels);
    }

    @Test
    public void testNullConfigFallsBackToDefaults() {
        ImageProcessingService service = new ImageProcessingService(null);
        assertEquals("bilinear", service.getConfig().defaultScaleMethod);
    }

    @Test
    public void testDecodeEnforcesPixelLimit() throws IOException {
        ImageProcessingService service = new ImageProcessingService();
        byte[] big = PpmCodec.encode(image(100, 50));
        assertThrows(ImageException.class, () -> service.decode(big));

        byte[] small = PpmCodec.encode(image(10, 10));
        assertEquals(100, service.decode(small).getPixelCount());

        assertThrows(ImageException.class, () -> service.decode(new byte[0]));
    }

    @Test
    public void testNonPpmInputGetsConfiguredFlavour() throws IOException {
        ImageProcessingService service = new ImageProcessingService();
        byte[] png = ImageCodec.encode(image(4, 4), "png");

        byte[] out = service.process(ImageOperation.ROTATE_LEFT, png, null, "ppm");
        assertEquals("P3", new String(out, 0, 2, StandardCharsets.US_ASCII));
        assertEquals(PpmFormat.P3, service.decode(png).getFormat());
    }

    @Test
    public void testProcessSeamCarveToPng() throws IOException {
        ImageProcessingService service = new ImageProcessingService(SnapConfig.defaults());
        byte[] in = PpmCodec.encode(image(12, 9));

        byte[] out = service.process(ImageOperation.SEAM_CARVE, in, OperationRequest.ofSize(8, 6), "png");

        ImageBuffer result = ImageCodec.decodeAny(out);
        assertEquals(8, result.getWidth());
        assertEquals(6, result.getHeight());
    }

    @Test
    public void testResizeUsesConfiguredScaleMethod() {
        ImageProcessingService service = new ImageProcessingService();
        ImageBuffer image = ImageBuffer.blank(2, 1, 255);
        image.setPixel(0, 1, new PixelRGB(100, 100, 100));

        service.apply(ImageOperation.RESIZE, image, OperationRequest.ofSize(4, 1));

        // nearest from the test configuration, so no interpolated 50
        assertEquals(0, image.pixelAt(0, 1).r);
        assertEquals(100, image.pixelAt(0, 2).r);
    }

    @Test
    public void testResizeShrinkNeedsCropMethod() {
        ImageProcessingService service = new ImageProcessingService(SnapConfig.defaults());
        ImageBuffer image = image(6, 6);
        assertThrows(MissingCropMethodException.class,
                () -> service.apply(ImageOperation.RESIZE, image, OperationRequest.ofSize(4, 6)));

        OperationRequest req = OperationRequest.ofSize(4, 3);
        req.cropX = "left-right";
        req.cropY = "bottom";
        service.apply(ImageOperation.RESIZE, image, req);
        assertEquals(4, image.getWidth());
        assertEquals(3, image.getHeight());
    }

    @Test
    public void testCropDefaultsToConfiguredMethod() {
        ImageProcessingService service = new ImageProcessingService();
        ImageBuffer image = image(5, 2);
        PixelRGB second = image.pixelAt(0, 1);

        service.apply(ImageOperation.CROP, image, OperationRequest.ofSize(2, 2));

        // left-right trims one column on the left, two on the right
        assertEquals(second, image.pixelAt(0, 0));
    }

    @Test
    public void testSizeParametersValidated() {
        ImageProcessingService service = new ImageProcessingService(SnapConfig.defaults());
        ImageBuffer image = image(4, 4);
        assertThrows(IllegalArgumentException.class,
                () -> service.apply(ImageOperation.SCALE, image, new OperationRequest()));
        assertThrows(IllegalArgumentException.class,
                () -> service.apply(ImageOperation.SEAM_CARVE, image, OperationRequest.ofSize(0, 2)));
        assertThrows(IllegalArgumentException.class,
                () -> service.apply(ImageOperation.SEAM_CARVE, image, OperationRequest.ofSize(5, 2)));
        assertThrows(IllegalArgumentException.class,
                () -> service.apply(ImageOperation.SCALE_RGB, image, new OperationRequest()));
        assertThrows(IllegalArgumentException.class,
                () -> service.apply(ImageOperation.HUE_SHIFT, image, new OperationRequest()));
        assertEquals(4, image.getWidth());
    }

    @Test
    public void testColorAndOrientationOperations() {
        ImageProcessingService service = new ImageProcessingService(SnapConfig.defaults());
        ImageBuffer image = ImageBuffer.blank(3, 1, 255);
        image.setPixel(0, 0, new PixelRGB(200, 100, 50));

        OperationRequest tint = new OperationRequest();
        tint.r = 0.5;
        tint.g = 1.0;
        tint.b = 0.0;
        service.apply(ImageOperation.SCALE_RGB, image, tint);
        assertEquals(new PixelRGB(100, 100, 0), image.pixelAt(0, 0));

        service.apply(ImageOperation.ROTATE_RIGHT, image, null);
        assertEquals(1, image.getWidth());
        assertEquals(3, image.getHeight());

        service.apply(ImageOperation.TRANSPOSE, image, null);
        service.apply(ImageOperation.MIRROR_Y, image, null);
        assertEquals(new PixelRGB(100, 100, 0), image.pixelAt(0, 2));
    }

    @Test
    public void testInfo() {
        ImageProcessingService service = new ImageProcessingService(SnapConfig.defaults());
        ImageInfo info = service.info(image(7, 3));
        assertEquals(7, info.width);
        assertEquals(21, info.pixelCount);
    }

    @Test
    public void testOperationNames() {
        assertEquals(ImageOperation.SEAM_CARVE, ImageOperation.fromName("sc"));
        assertEquals(ImageOperation.HUE_SHIFT, ImageOperation.fromName("Hue-Shift"));
        assertEquals(ImageOperation.CONVERT, ImageOperation.fromName("save"));
        assertThrows(IllegalArgumentException.class, () -> ImageOperation.fromName("sharpen"));
    }

    @Test
    public void testHeaderOnlyUploadRejectedBeforeAllocation() {
        ImageProcessingService service = new ImageProcessingService(SnapConfig.defaults());
        byte[] body = "P6\n20000 20000\n255\n".getBytes(StandardCharsets.US_ASCII);

        ImageException e = assertThrows(ImageException.class, () -> service.decode(body));
        assertTrue(e.getMessage().contains("400000000"), e.getMessage());
    }

    @Test
    public void testImageIoUploadRejectedFromHeader() throws IOException {
        ImageProcessingService service = new ImageProcessingService();
        byte[] png = ImageCodec.encode(image(100, 50), "png");

        ImageException e = assertThrows(ImageException.class, () -> service.decode(png));
        assertTrue(e.getMessage().contains("limit is 4096"), e.getMessage());
    }

    @Test
    public void testOperationNamesIgnoreDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertEquals(ImageOperation.MIRROR_X, ImageOperation.fromName("MIRROR-X"));
            assertEquals(ImageOperation.INFO, ImageOperation.fromName("INFO"));
        } finally {
            Locale.setDefault(saved);
        }
    }
}
