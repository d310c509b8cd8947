package com.snapimg.server.tools;

import com.snapimg.server.img.ImageBuffer;
import com.snapimg.server.img.io.ImageFiles;
import com.snapimg.server.service.ImageOperation;
import com.snapimg.server.service.ImageProcessingService;
import com.snapimg.server.service.OperationRequest;
import com.snapimg.server.util.ConfigResolver;
import com.snapimg.server.util.SnapConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line front end for the image operations.
 * Usage: SnapCli [img] <command> <in> [<out> ...] [--option value ...]
 */
public class SnapCli {

    private static final Logger logger = LoggerFactory.getLogger(SnapCli.class);

    static final String USAGE = String.join("\n",
            "Usage: snap [img] <command> <args>",
            "  info <in>",
            "  resize <in> <out> <width> <height> <nearest|bilinear> [--crop-x M] [--crop-y M]",
            "  scale <in> <out> <width> <height> [--method nearest|bilinear]",
            "  crop <in> <out> <width> <height> [--method M] [--center-x N] [--center-y N]",
            "Relative <out> paths are resolved against outputDirectory from snap_config.json;",
            "scale and crop fall back to its defaultScaleMethod / defaultCropMethod.",
            "  seam-carve|sc <in> <out> <width> <height>",
            "  scale-rgb|tint <in> <out> <r> <g> <b>",
            "  hue-shift|hue <in> <out> <degrees>",
            "  rotate-left|rotate-right|flip|mirror-x|mirror-y|transpose <in> <out>",
            "  convert|save <in> <out>",
            "Crop methods: left, right, left-right, top, bottom, top-bottom,",
            "  left-top, left-bottom, right-top, right-bottom, rectangular");

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return the process exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--")) {
                if (i + 1 >= args.length) {
                    err.println("Missing value for option " + arg);
                    err.println(USAGE);
                    return 1;
                }
                options.put(arg.substring(2), args[++i]);
            } else {
                positional.add(arg);
            }
        }
        if (!positional.isEmpty() && "img".equals(positional.get(0))) {
            positional.remove(0);
        }
        if (positional.isEmpty()) {
            err.println(USAGE);
            return 1;
        }

        ImageOperation op;
        try {
            op = ImageOperation.fromName(positional.get(0));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 1;
        }
        List<String> params = positional.subList(1, positional.size());

        try {
            SnapConfig config = ConfigResolver.resolve();
            ImageProcessingService service = new ImageProcessingService(config);
            OperationRequest request = new OperationRequest();

            if (op == ImageOperation.INFO) {
                requireArgs(params, 1);
                ImageBuffer image = ImageFiles.load(Paths.get(params.get(0)));
                out.println(service.info(image));
                return 0;
            }

            switch (op) {
                case RESIZE:
                    requireArgs(params, 5);
                    readSize(params, request);
                    request.method = params.get(4);
                    request.cropX = options.get("crop-x");
                    request.cropY = options.get("crop-y");
                    break;
                case SCALE:
                    requireArgs(params, 4);
                    readSize(params, request);
                    request.method = options.get("method");
                    break;
                case CROP:
                    requireArgs(params, 4);
                    readSize(params, request);
                    request.method = options.get("method");
                    request.centerX = options.containsKey("center-x")
                            ? parseNonNegative(options.get("center-x"), "center-x") : null;
                    request.centerY = options.containsKey("center-y")
                            ? parseNonNegative(options.get("center-y"), "center-y") : null;
                    break;
                case SEAM_CARVE:
                    requireArgs(params, 4);
                    readSize(params, request);
                    break;
                case SCALE_RGB:
                    requireArgs(params, 5);
                    request.r = parseDouble(params.get(2), "r");
                    request.g = parseDouble(params.get(3), "g");
                    request.b = parseDouble(params.get(4), "b");
                    break;
                case HUE_SHIFT:
                    requireArgs(params, 3);
                    request.degrees = parseDouble(params.get(2), "degrees");
                    break;
                default:
                    requireArgs(params, 2);
                    break;
            }

            Path in = Paths.get(params.get(0));
            Path outPath = outputPath(config, params.get(1));
            if (op == ImageOperation.CONVERT) {
                ImageFiles.convert(in, outPath);
                return 0;
            }

            ImageBuffer image = ImageFiles.load(in);
            service.apply(op, image, request);
            ImageFiles.save(image, outPath);
            return 0;
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 1;
        } catch (Exception e) {
            logger.error("{} failed", op.commandName(), e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Relative output paths land in the configured output directory.
     */
    static Path outputPath(SnapConfig config, String name) {
        Path path = Paths.get(name);
        if (path.isAbsolute() || config.outputDirectory == null || config.outputDirectory.isEmpty()) {
            return path;
        }
        return Paths.get(config.outputDirectory).resolve(path);
    }

    private static void readSize(List<String> params, OperationRequest request) {
        request.width = parsePositive(params.get(2), "width");
        request.height = parsePositive(params.get(3), "height");
    }

    private static void requireArgs(List<String> params, int count) {
        if (params.size() < count) {
            throw new UsageException("Expected " + count + " arguments, got " + params.size());
        }
    }

    private static int parsePositive(String value, String name) {
        int v = parseNonNegative(value, name);
        if (v == 0) {
            throw new UsageException(name + " must be a positive integer, got '" + value + "'");
        }
        return v;
    }

    private static int parseNonNegative(String value, String name) {
        try {
            int v = Integer.parseInt(value);
            if (v < 0) {
                throw new UsageException(name + " must not be negative, got '" + value + "'");
            }
            return v;
        } catch (NumberFormatException e) {
            throw new UsageException(name + " must be an integer, got '" + value + "'");
        }
    }

    private static double parseDouble(String value, String name) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new UsageException(name + " must be a number, got '" + value + "'");
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
