package com.snapimg.server.util;

/**
 * Settings read from snap_config.json. Missing fields keep these defaults.
 */
public class SnapConfig {
    public String defaultScaleMethod = "bilinear";
    public String defaultCropMethod = "rectangular";
    public String defaultPpmFormat = "P6";
    public String defaultOutputFormat = "ppm";
    public long maxPixels = 16_777_216L;
    public String outputDirectory = ".";

    public SnapConfig() {
    }

    public static SnapConfig defaults() {
        return new SnapConfig();
    }

    public SnapConfig copy() {
        SnapConfig c = new SnapConfig();
        c.defaultScaleMethod = this.defaultScaleMethod;
        c.defaultCropMethod = this.defaultCropMethod;
        c.defaultPpmFormat = this.defaultPpmFormat;
        c.defaultOutputFormat = this.defaultOutputFormat;
        c.maxPixels = this.maxPixels;
        c.outputDirectory = this.outputDirectory;
        return c;
    }
}
