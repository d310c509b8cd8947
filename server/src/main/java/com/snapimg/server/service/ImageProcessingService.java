package com.snapimg.server.service;

import com.snapimg.server.img.ImageBuffer;
import com.snapimg.server.img.ImageException;
import com.snapimg.server.img.color.ColorOps;
import com.snapimg.server.img.geometry.CropMethod;
import com.snapimg.server.img.geometry.GeometricOps;
import com.snapimg.server.img.geometry.ScaleMethod;
import com.snapimg.server.img.io.ImageCodec;
import com.snapimg.server.img.io.ImageInfo;
import com.snapimg.server.img.io.PpmCodec;
import com.snapimg.server.img.io.PpmFormat;
import com.snapimg.server.img.seam.SeamCarver;
import com.snapimg.server.util.ConfigResolver;
import com.snapimg.server.util.SnapConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Runs image operations on decoded images. Each call works on its own
 * {@link ImageBuffer}, so concurrent requests never share pixel data.
 */
@Service
public class ImageProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(ImageProcessingService.class);

    private final SnapConfig config;

    public ImageProcessingService() {
        this(ConfigResolver.resolve());
    }

    public ImageProcessingService(SnapConfig config) {
        this.config = config != null ? config : SnapConfig.defaults();
    }

    @PostConstruct
    public void init() {
        logger.info("Image processing service ready: scale={}, crop={}, ppm={}, maxPixels={}",
                config.defaultScaleMethod, config.defaultCropMethod, config.defaultPpmFormat, config.maxPixels);
    }

    public SnapConfig getConfig() {
        return config;
    }

    /**
     * Decodes PPM or any ImageIO format. Images that did not come from a PPM
     * file get the configured PPM flavour for later PPM output.
     *
     * @throws ImageException if the data cannot be decoded or exceeds maxPixels
     */
    public ImageBuffer decode(byte[] data) throws IOException {
        if (data == null || data.length == 0) {
            throw new ImageException("Empty image data");
        }
        boolean ppm = PpmCodec.looksLikePpm(data);
        // the limit is enforced from the header, before any pixel storage is allocated
        ImageBuffer image = ImageCodec.decodeAny(data, config.maxPixels);
        if (!ppm) {
            image.setFormat(PpmFormat.fromName(config.defaultPpmFormat));
        }
        return image;
    }

    public byte[] encode(ImageBuffer image, String outputFormat) throws IOException {
        String format = outputFormat != null && !outputFormat.isEmpty() ? outputFormat : config.defaultOutputFormat;
        return ImageCodec.encode(image, format);
    }

    public ImageInfo info(ImageBuffer image) {
        return ImageInfo.of(image);
    }

    /**
     * Decodes, applies one operation and encodes the result.
     */
    public byte[] process(ImageOperation operation, byte[] data, OperationRequest request, String outputFormat)
            throws IOException {
        ImageBuffer image = decode(data);
        apply(operation, image, request);
        return encode(image, outputFormat);
    }

    /**
     * Applies one operation to the image in place.
     *
     * @throws IllegalArgumentException if a required parameter is missing or invalid
     */
    public ImageBuffer apply(ImageOperation operation, ImageBuffer image, OperationRequest request) {
        OperationRequest req = request != null ? request : new OperationRequest();
        int beforeWidth = image.getWidth();
        int beforeHeight = image.getHeight();
        long start = System.currentTimeMillis();

        switch (operation) {
            case INFO:
            case CONVERT:
                break;
            case RESIZE:
                requireSize(req);
                GeometricOps.resize(image, req.width, req.height, scaleMethod(req.method),
                        req.cropX != null ? CropMethod.fromName(req.cropX) : null,
                        req.cropY != null ? CropMethod.fromName(req.cropY) : null);
                break;
            case SCALE:
                requireSize(req);
                GeometricOps.scale(image, req.width, req.height, scaleMethod(req.method));
                break;
            case CROP:
                requireSize(req);
                CropMethod cropMethod = CropMethod.fromName(
                        req.method != null ? req.method : config.defaultCropMethod);
                GeometricOps.crop(image, req.width, req.height, cropMethod, req.centerX, req.centerY);
                break;
            case SEAM_CARVE:
                requireSize(req);
                SeamCarver.seamCarve(image, req.width, req.height);
                break;
            case SCALE_RGB:
                if (req.r == null || req.g == null || req.b == null) {
                    throw new IllegalArgumentException("scale-rgb needs r, g and b factors");
                }
                ColorOps.scaleRgb(image, req.r, req.g, req.b);
                break;
            case HUE_SHIFT:
                if (req.degrees == null) {
                    throw new IllegalArgumentException("hue-shift needs degrees");
                }
                ColorOps.hueShift(image, req.degrees);
                break;
            case ROTATE_LEFT:
                image.rotateLeft();
                break;
            case ROTATE_RIGHT:
                image.rotateRight();
                break;
            case FLIP:
                image.rotate180();
                break;
            case MIRROR_X:
                image.mirrorX();
                break;
            case MIRROR_Y:
                image.mirrorY();
                break;
            case TRANSPOSE:
                image.transpose();
                break;
            default:
                throw new IllegalArgumentException("Unsupported operation " + operation);
        }

        logger.info("{}: {}x{} -> {}x{} in {} ms", operation.commandName(), beforeWidth, beforeHeight,
                image.getWidth(), image.getHeight(), System.currentTimeMillis() - start);
        return image;
    }

    private ScaleMethod scaleMethod(String name) {
        return ScaleMethod.fromName(name != null ? name : config.defaultScaleMethod);
    }

    private static void requireSize(OperationRequest req) {
        if (req.width == null || req.height == null) {
            throw new IllegalArgumentException("width and height are required");
        }
        if (req.width <= 0 || req.height <= 0) {
            throw new IllegalArgumentException(
                    "Dimensions must be positive integers: " + req.width + "x" + req.height);
        }
    }
}
