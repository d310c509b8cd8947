package com.snapimg.server.controller;

import com.snapimg.server.img.ImageBuffer;
import com.snapimg.server.img.ImageException;
import com.snapimg.server.img.io.ImageInfo;
import com.snapimg.server.service.ImageOperation;
import com.snapimg.server.service.ImageProcessingService;
import com.snapimg.server.service.OperationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Locale;

@RestController
@RequestMapping("/images")
public class ImageController {

    private static final Logger logger = LoggerFactory.getLogger(ImageController.class);
    private final ImageProcessingService imageService;

    public ImageController(ImageProcessingService imageService) {
        this.imageService = imageService;
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    @PostMapping("/info")
    public ResponseEntity<?> info(@RequestBody byte[] body) {
        try {
            ImageBuffer image = imageService.decode(body);
            ImageInfo info = imageService.info(image);
            return ResponseEntity.ok(info);
        } catch (ImageException | IllegalArgumentException e) {
            logger.warn("Rejected info request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to read image", e);
            return ResponseEntity.status(500).body("Failed to read image: " + e.getMessage());
        }
    }

    /**
     * Applies {@code operation} to the image in the request body and returns
     * the encoded result. Parameters that the operation does not use are
     * ignored.
     */
    @PostMapping("/{operation}")
    public ResponseEntity<?> process(@PathVariable("operation") String operation,
            @RequestBody byte[] body,
            @RequestParam(value = "width", required = false) Integer width,
            @RequestParam(value = "height", required = false) Integer height,
            @RequestParam(value = "method", required = false) String method,
            @RequestParam(value = "cropX", required = false) String cropX,
            @RequestParam(value = "cropY", required = false) String cropY,
            @RequestParam(value = "centerX", required = false) Integer centerX,
            @RequestParam(value = "centerY", required = false) Integer centerY,
            @RequestParam(value = "r", required = false) Double r,
            @RequestParam(value = "g", required = false) Double g,
            @RequestParam(value = "b", required = false) Double b,
            @RequestParam(value = "degrees", required = false) Double degrees,
            @RequestParam(value = "format", required = false) String format) {

        OperationRequest request = new OperationRequest();
        request.width = width;
        request.height = height;
        request.method = method;
        request.cropX = cropX;
        request.cropY = cropY;
        request.centerX = centerX;
        request.centerY = centerY;
        request.r = r;
        request.g = g;
        request.b = b;
        request.degrees = degrees;

        try {
            ImageOperation op = ImageOperation.fromName(operation);
            if (op == ImageOperation.INFO) {
                return info(body);
            }
            logger.info("Received {} request ({} bytes).", op.commandName(), body != null ? body.length : 0);

            String outputFormat = format != null ? format : imageService.getConfig().defaultOutputFormat;
            byte[] result = imageService.process(op, body, request, outputFormat);
            return ResponseEntity.ok()
                    .contentType(mediaTypeFor(outputFormat))
                    .body(result);
        } catch (ImageException | IllegalArgumentException e) {
            logger.warn("Rejected {} request: {}", operation, e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to process {} request", operation, e);
            return ResponseEntity.status(500).body("Failed to process image: " + e.getMessage());
        }
    }

    static MediaType mediaTypeFor(String format) {
        switch (format.toLowerCase(Locale.ROOT)) {
            case "png":
                return MediaType.IMAGE_PNG;
            case "jpg":
            case "jpeg":
                return MediaType.IMAGE_JPEG;
            case "gif":
                return MediaType.IMAGE_GIF;
            case "bmp":
                return MediaType.parseMediaType("image/bmp");
            case "ppm":
            case "pnm":
                return MediaType.parseMediaType("image/x-portable-pixmap");
            default:
                return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
