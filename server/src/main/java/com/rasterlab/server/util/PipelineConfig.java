package com.rasterlab.server.util;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bound from pipeline_config.json. Missing sections keep the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfig {
    public GrayscaleConfig grayscale = new GrayscaleConfig();
    public EdgeConfig edgeDetection = new EdgeConfig();
    public PascalConfig pascal = new PascalConfig();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GrayscaleConfig {
        public double red = 0.21;
        public double green = 0.72;
        public double blue = 0.07;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EdgeConfig {
        public double defaultThreshold = 50.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PascalConfig {
        public int defaultModulus = 2;
        public int defaultSize = 64;
        public int maxSize = 1024;
        public String defaultPalette = "mono";
        // name -> list of [r, g, b]
        public Map<String, List<int[]>> palettes = defaultPalettes();
    }

    public static Map<String, List<int[]>> defaultPalettes() {
        Map<String, List<int[]>> palettes = new LinkedHashMap<>();
        palettes.put("mono", List.of(new int[] { 0, 0, 0 }, new int[] { 255, 255, 255 }));
        palettes.put("sierpinski", List.of(new int[] { 255, 255, 255 }, new int[] { 0, 0, 0 }));
        palettes.put("rgb", List.of(new int[] { 255, 0, 0 }, new int[] { 0, 255, 0 }, new int[] { 0, 0, 255 }));
        return palettes;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }
}
