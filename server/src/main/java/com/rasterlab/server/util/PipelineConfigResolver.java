package com.rasterlab.server.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class PipelineConfigResolver {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigResolver.class);

    public static final String CONFIG_PROPERTY = "raster.config";
    public static final String CONFIG_RESOURCE = "/pipeline_config.json";

    public static PipelineConfig resolve() {
        // 1. Explicit file
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            File file = new File(sysProp);
            try {
                PipelineConfig config = new ObjectMapper().readValue(file, PipelineConfig.class);
                logger.info("Loaded pipeline config from {}", file.getAbsolutePath());
                return fillMissing(config);
            } catch (IOException e) {
                logger.error("Failed to read pipeline config {}, using defaults", file.getAbsolutePath(), e);
                return PipelineConfig.defaults();
            }
        }

        // 2. Classpath
        try (InputStream is = PipelineConfigResolver.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                PipelineConfig config = load(is);
                logger.info("Loaded pipeline config from classpath {}", CONFIG_RESOURCE);
                return config;
            }
        } catch (IOException e) {
            logger.warn("Failed to read {} from classpath, using defaults: {}", CONFIG_RESOURCE, e.getMessage());
            return PipelineConfig.defaults();
        }

        // 3. Default
        logger.warn("No {} on classpath, using defaults", CONFIG_RESOURCE);
        return PipelineConfig.defaults();
    }

    public static PipelineConfig load(InputStream is) throws IOException {
        return fillMissing(new ObjectMapper().readValue(is, PipelineConfig.class));
    }

    // Sections set to null in the file fall back to defaults.
    private static PipelineConfig fillMissing(PipelineConfig config) {
        if (config.grayscale == null) {
            config.grayscale = new PipelineConfig.GrayscaleConfig();
        }
        if (config.edgeDetection == null) {
            config.edgeDetection = new PipelineConfig.EdgeConfig();
        }
        if (config.pascal == null) {
            config.pascal = new PipelineConfig.PascalConfig();
        }
        if (config.pascal.palettes == null || config.pascal.palettes.isEmpty()) {
            config.pascal.palettes = PipelineConfig.defaultPalettes();
        }
        return config;
    }
}
