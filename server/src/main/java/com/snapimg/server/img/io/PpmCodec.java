package com.snapimg.server.img.io;

import com.snapimg.server.img.ImageBuffer;
import com.snapimg.server.img.ImageException;
import com.snapimg.server.img.ImageFormatException;
import com.snapimg.server.img.PixelMatrix;
import com.snapimg.server.img.PixelRGB;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader and writer for the PPM pixmap format.
 *
 * Layout: magic ("P3" or "P6"), width and height, max intensity, then the
 * samples row by row, three per pixel. P3 samples are whitespace separated
 * decimal integers, P6 samples are single raw bytes following exactly one
 * whitespace byte after the header. Lines starting with '#' in the header
 * are comments.
 */
public final class PpmCodec {

    private PpmCodec() {
    }

    public static boolean looksLikePpm(byte[] data) {
        return data != null && data.length >= 2 && data[0] == 'P' && (data[1] == '3' || data[1] == '6');
    }

    public static ImageBuffer decode(InputStream in) throws IOException {
        return decode(in.readAllBytes());
    }

    /**
     * @throws ImageFormatException if the header is malformed or the number of
     *                              samples is not exactly width * height * 3
     */
    public static ImageBuffer decode(byte[] data) {
        return decode(data, 0);
    }

    /**
     * Decodes, rejecting images with more than {@code maxPixels} pixels as
     * soon as the header has been read. A limit of 0 or less means no limit.
     *
     * @throws ImageException       if the header declares too many pixels
     * @throws ImageFormatException if the data is malformed
     */
    public static ImageBuffer decode(byte[] data, long maxPixels) {
        if (data == null || data.length < 2 || data[0] != 'P') {
            throw new ImageFormatException("Unsupported PPM format: missing magic number");
        }
        PpmFormat format;
        if (data[1] == '3') {
            format = PpmFormat.P3;
        } else if (data[1] == '6') {
            format = PpmFormat.P6;
        } else {
            throw new ImageFormatException("Unsupported PPM format: P" + (char) data[1]);
        }
        if (data.length < 3 || !Tokenizer.isWhitespace(data[2])) {
            throw new ImageFormatException("Expected whitespace after PPM magic number");
        }

        Tokenizer tokens = new Tokenizer(data, 2);
        int width = tokens.nextInt("width");
        int height = tokens.nextInt("height");
        int maxIntensity = tokens.nextInt("max intensity");
        long pixels = (long) width * height;
        if (maxPixels > 0 && pixels > maxPixels) {
            throw new ImageException("Image has " + pixels + " pixels, limit is " + maxPixels);
        }
        long expected = pixels * 3;
        if (expected > Integer.MAX_VALUE) {
            throw new ImageFormatException("Image too large: " + width + "x" + height);
        }

        List<Integer> red;
        List<Integer> green;
        List<Integer> blue;

        if (format == PpmFormat.P3) {
            // every sample takes at least two bytes, so the data bounds the pixel count
            int capacity = (int) Math.min(pixels, data.length / 6 + 1);
            red = new ArrayList<>(capacity);
            green = new ArrayList<>(capacity);
            blue = new ArrayList<>(capacity);

            int count = 0;
            int[] pixel = new int[3];
            String token;
            while ((token = tokens.next()) != null) {
                int value = parseInt(token, "pixel value");
                if (value > maxIntensity) {
                    throw new ImageFormatException("Pixel value " + value + " exceeds max intensity " + maxIntensity);
                }
                if (count >= expected) {
                    throw new ImageFormatException("Incorrect number of pixel values: more than " + expected);
                }
                pixel[count % 3] = value;
                count++;
                if (count % 3 == 0) {
                    red.add(pixel[0]);
                    green.add(pixel[1]);
                    blue.add(pixel[2]);
                }
            }
            if (count != expected) {
                throw new ImageFormatException(
                        "Incorrect number of pixel values: expected " + expected + ", got " + count);
            }
        } else {
            if (maxIntensity > 255) {
                throw new ImageFormatException("16-bit P6 data is not supported (max intensity " + maxIntensity + ")");
            }
            int start = tokens.rasterStart();
            long length = data.length - start;
            if (length != expected) {
                throw new ImageFormatException(
                        "Binary pixel data length mismatch: expected " + expected + " bytes, got " + length);
            }
            red = new ArrayList<>((int) pixels);
            green = new ArrayList<>((int) pixels);
            blue = new ArrayList<>((int) pixels);
            for (int i = start; i < data.length; i += 3) {
                red.add(sample(data[i], maxIntensity));
                green.add(sample(data[i + 1], maxIntensity));
                blue.add(sample(data[i + 2], maxIntensity));
            }
        }

        return new ImageBuffer(
                PixelMatrix.fromList(width, height, red),
                PixelMatrix.fromList(width, height, green),
                PixelMatrix.fromList(width, height, blue),
                maxIntensity,
                format);
    }

    /**
     * Encodes using the format the image was decoded from.
     */
    public static byte[] encode(ImageBuffer image) {
        return encode(image, image.getFormat());
    }

    public static byte[] encode(ImageBuffer image, PpmFormat format) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(image, format, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new IllegalStateException(e);
        }
        return out.toByteArray();
    }

    public static void write(ImageBuffer image, PpmFormat format, OutputStream out) throws IOException {
        switch (format) {
            case P3:
                writeAscii(image, out);
                break;
            case P6:
                writeBinary(image, out);
                break;
            default:
                throw new ImageFormatException("Unsupported PPM format " + format);
        }
    }

    private static void writeHeader(ImageBuffer image, String magic, OutputStream out) throws IOException {
        String header = magic + "\n" + image.getWidth() + " " + image.getHeight() + "\n" + image.getMaxIntensity()
                + "\n";
        out.write(header.getBytes(StandardCharsets.US_ASCII));
    }

    private static void writeAscii(ImageBuffer image, OutputStream out) throws IOException {
        writeHeader(image, "P3", out);
        StringBuilder line = new StringBuilder();
        for (int row = 0; row < image.getHeight(); row++) {
            line.setLength(0);
            for (int col = 0; col < image.getWidth(); col++) {
                PixelRGB p = image.pixelAt(row, col);
                line.append(p.r).append(' ').append(p.g).append(' ').append(p.b);
                if (col < image.getWidth() - 1) {
                    line.append(' ');
                }
            }
            line.append('\n');
            out.write(line.toString().getBytes(StandardCharsets.US_ASCII));
        }
    }

    private static void writeBinary(ImageBuffer image, OutputStream out) throws IOException {
        if (image.getMaxIntensity() > 255) {
            throw new ImageFormatException(
                    "Cannot write P6 with max intensity " + image.getMaxIntensity() + " (8-bit only)");
        }
        writeHeader(image, "P6", out);
        byte[] rowBytes = new byte[image.getWidth() * 3];
        for (int row = 0; row < image.getHeight(); row++) {
            for (int col = 0; col < image.getWidth(); col++) {
                PixelRGB p = image.pixelAt(row, col);
                rowBytes[col * 3] = (byte) p.r;
                rowBytes[col * 3 + 1] = (byte) p.g;
                rowBytes[col * 3 + 2] = (byte) p.b;
            }
            out.write(rowBytes);
        }
    }

    private static int sample(byte b, int maxIntensity) {
        int value = b & 0xff;
        if (value > maxIntensity) {
            throw new ImageFormatException("Pixel value " + value + " exceeds max intensity " + maxIntensity);
        }
        return value;
    }

    private static int parseInt(String token, String what) {
        try {
            int value = Integer.parseInt(token);
            if (value < 0) {
                throw new ImageFormatException("Negative " + what + ": " + token);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ImageFormatException("Invalid " + what + ": '" + token + "'", e);
        }
    }

    /**
     * Splits ASCII data into whitespace separated tokens, skipping '#'
     * comments up to the end of their line.
     */
    private static final class Tokenizer {
        private final byte[] data;
        private int pos;

        Tokenizer(byte[] data, int pos) {
            this.data = data;
            this.pos = pos;
        }

        String next() {
            skipWhitespaceAndComments();
            if (pos >= data.length) {
                return null;
            }
            int start = pos;
            while (pos < data.length && !isWhitespace(data[pos]) && data[pos] != '#') {
                pos++;
            }
            return new String(data, start, pos - start, StandardCharsets.US_ASCII);
        }

        int nextInt(String what) {
            String token = next();
            if (token == null) {
                throw new ImageFormatException("Missing " + what + " in PPM header");
            }
            return parseInt(token, what);
        }

        /**
         * Position of the first raw sample: one whitespace byte after the
         * last header token.
         */
        int rasterStart() {
            if (pos >= data.length) {
                return pos;
            }
            if (!isWhitespace(data[pos])) {
                throw new ImageFormatException("Expected whitespace after PPM header");
            }
            return pos + 1;
        }

        private void skipWhitespaceAndComments() {
            while (pos < data.length) {
                byte b = data[pos];
                if (b == '#') {
                    while (pos < data.length && data[pos] != '\n') {
                        pos++;
                    }
                } else if (isWhitespace(b)) {
                    pos++;
                } else {
                    return;
                }
            }
        }

        static boolean isWhitespace(byte b) {
            return b == ' ' || b == '\n' || b == '\r' || b == '\t' || b == 0x0b || b == '\f';
        }
    }
}
