package com.snapimg.server.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;

public class ConfigResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigResolver.class);

    public static final String CONFIG_PROPERTY = "snap.config";
    public static final String CONFIG_RESOURCE = "/snap_config.json";

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Resolves the configuration: the file named by the snap.config system
     * property, then snap_config.json on the classpath, then the defaults.
     */
    public static SnapConfig resolve() {
        // 1. Check System Property
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            File file = new File(sysProp);
            if (file.isFile()) {
                try {
                    SnapConfig config = mapper.readValue(file, SnapConfig.class);
                    logger.info("Loaded configuration from {}", file.getAbsolutePath());
                    return config;
                } catch (Exception e) {
                    logger.warn("Failed to read configuration from {}: {}", sysProp, e.getMessage());
                }
            } else {
                logger.warn("Configuration file {} does not exist, ignoring", sysProp);
            }
        }

        // 2. Check classpath
        try (InputStream is = ConfigResolver.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                return mapper.readValue(is, SnapConfig.class);
            }
        } catch (Exception e) {
            logger.warn("Failed to read {} from classpath: {}", CONFIG_RESOURCE, e.getMessage());
        }

        // 3. Default
        logger.info("No configuration found, using defaults");
        return SnapConfig.defaults();
    }

    public static SnapConfig read(InputStream is) throws java.io.IOException {
        return mapper.readValue(is, SnapConfig.class);
    }
}
