package com.snapimg.server.img.io;

import com.snapimg.server.img.ImageBuffer;
import com.snapimg.server.img.ImageFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads and saves images by file path, picking the codec from the file
 * extension.
 */
public final class ImageFiles {

    private static final Logger logger = LoggerFactory.getLogger(ImageFiles.class);

    private ImageFiles() {
    }

    public static ImageBuffer load(Path path) throws IOException {
        String ext = extensionOf(path);
        try (InputStream in = Files.newInputStream(path)) {
            ImageBuffer image = isPpmExtension(ext) ? PpmCodec.decode(in) : ImageCodec.decode(in);
            logger.info("Loaded {} ({}x{})", path, image.getWidth(), image.getHeight());
            return image;
        }
    }

    /**
     * Writes the image, creating missing parent directories. PPM output keeps
     * the image's own P3/P6 flavour.
     */
    public static void save(ImageBuffer image, Path path) throws IOException {
        String ext = extensionOf(path);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            if (isPpmExtension(ext)) {
                PpmCodec.write(image, image.getFormat(), out);
            } else {
                ImageCodec.encode(image, formatNameFor(ext), out);
            }
        }
        logger.info("Saved {} ({}x{})", path, image.getWidth(), image.getHeight());
    }

    public static void convert(Path in, Path out) throws IOException {
        save(load(in), out);
    }

    public static boolean isPpmExtension(String ext) {
        return "ppm".equals(ext) || "pnm".equals(ext);
    }

    /**
     * Maps a file extension to an ImageIO format name.
     *
     * @throws ImageFormatException for a missing or unknown extension
     */
    public static String formatNameFor(String ext) {
        if (ext == null || ext.isEmpty()) {
            throw new ImageFormatException("Missing or invalid file extension");
        }
        switch (ext.toLowerCase(Locale.ROOT)) {
            case "png":
                return "png";
            case "jpg":
            case "jpeg":
                return "jpeg";
            case "gif":
                return "gif";
            case "bmp":
                return "bmp";
            case "wbmp":
                return "wbmp";
            case "tif":
            case "tiff":
                return "tiff";
            default:
                throw new ImageFormatException("Unknown or unsupported image file extension '" + ext + "'");
        }
    }

    public static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString() : "";
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            throw new ImageFormatException("Missing or invalid file extension: " + path);
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
