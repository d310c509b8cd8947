package com.snapimg.server.img.io;

import com.snapimg.server.img.ImageBuffer;
import com.snapimg.server.img.ImageException;
import com.snapimg.server.img.ImageFormatException;
import com.snapimg.server.img.PixelRGB;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.Locale;

/**
 * Bridges {@link ImageBuffer} to the formats ImageIO knows (PNG, JPEG, GIF,
 * BMP, ...). Decoded images always get a max intensity of 255.
 */
public final class ImageCodec {

    private ImageCodec() {
    }

    /**
     * Decodes PPM natively and everything else through ImageIO.
     */
    public static ImageBuffer decodeAny(byte[] data) throws IOException {
        return decodeAny(data, 0);
    }

    /**
     * Like {@link #decodeAny(byte[])}, but rejects images with more than
     * {@code maxPixels} pixels before their pixel data is decoded. A limit of
     * 0 or less means no limit.
     *
     * @throws ImageException if the image is larger than the limit
     */
    public static ImageBuffer decodeAny(byte[] data, long maxPixels) throws IOException {
        if (PpmCodec.looksLikePpm(data)) {
            return PpmCodec.decode(data, maxPixels);
        }
        return decode(new ByteArrayInputStream(data), maxPixels);
    }

    public static ImageBuffer decode(InputStream in) throws IOException {
        return decode(in, 0);
    }

    /**
     * Reads the dimensions from the image header first and only decodes the
     * pixels when they are within {@code maxPixels}.
     */
    public static ImageBuffer decode(InputStream in, long maxPixels) throws IOException {
        try (ImageInputStream iis = ImageIO.createImageInputStream(in)) {
            if (iis == null) {
                throw new ImageFormatException("No ImageIO reader could decode the image data");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new ImageFormatException("No ImageIO reader could decode the image data");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                long pixels = (long) reader.getWidth(0) * reader.getHeight(0);
                if (maxPixels > 0 && pixels > maxPixels) {
                    throw new ImageException("Image has " + pixels + " pixels, limit is " + maxPixels);
                }
                BufferedImage bi = reader.read(0);
                if (bi == null) {
                    throw new ImageFormatException("No ImageIO reader could decode the image data");
                }
                return fromBufferedImage(bi);
            } finally {
                reader.dispose();
            }
        }
    }

    public static ImageBuffer fromBufferedImage(BufferedImage bi) {
        int width = bi.getWidth();
        int height = bi.getHeight();
        ImageBuffer image = ImageBuffer.blank(width, height, 255);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int clr = bi.getRGB(x, y);
                int red = (clr & 0x00ff0000) >> 16;
                int green = (clr & 0x0000ff00) >> 8;
                int blue = clr & 0x000000ff;
                image.setPixel(y, x, new PixelRGB(red, green, blue));
            }
        }
        return image;
    }

    /**
     * Samples are clamped to 0..255; images with another max intensity are
     * written as-is, not rescaled.
     */
    public static BufferedImage toBufferedImage(ImageBuffer image) {
        if (image.getWidth() == 0 || image.getHeight() == 0) {
            throw new ImageFormatException("Cannot encode an empty " + image.getWidth() + "x" + image.getHeight()
                    + " image through ImageIO");
        }
        BufferedImage bi = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                PixelRGB p = image.pixelAt(y, x);
                bi.setRGB(x, y, (clamp(p.r) << 16) | (clamp(p.g) << 8) | clamp(p.b));
            }
        }
        return bi;
    }

    public static void encode(ImageBuffer image, String formatName, OutputStream out) throws IOException {
        String format = formatName.toLowerCase(Locale.ROOT);
        if (!ImageIO.write(toBufferedImage(image), format, out)) {
            throw new ImageFormatException("No ImageIO writer for format '" + formatName + "'");
        }
    }

    /**
     * Encodes to the format named by a file extension; "ppm" and "pnm" are
     * written natively.
     */
    public static byte[] encode(ImageBuffer image, String extension) throws IOException {
        String ext = extension.toLowerCase(Locale.ROOT);
        if (ImageFiles.isPpmExtension(ext)) {
            return PpmCodec.encode(image);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        encode(image, ImageFiles.formatNameFor(ext), out);
        return out.toByteArray();
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(v, 255));
    }
}
