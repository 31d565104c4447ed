package com.rasterlab.server.service;

import com.rasterlab.server.codec.PpmCodec;
import com.rasterlab.server.geometry.RasterGeometry;
import com.rasterlab.server.image.EdgeDetector;
import com.rasterlab.server.image.LuminanceConverter;
import com.rasterlab.server.image.PascalModuloGenerator;
import com.rasterlab.server.image.PixelPalette;
import com.rasterlab.server.image.Raster;
import com.rasterlab.server.util.PipelineConfig;
import com.rasterlab.server.util.PipelineConfigResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Text-in, text-out entry points over the raster pipeline. All raster arguments and results
 * are P3 pixel maps.
 */
@Service
public class RasterProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(RasterProcessingService.class);

    private PipelineConfig config;
    private EdgeDetector edgeDetector;
    private Map<String, PixelPalette> palettes = Collections.emptyMap();

    public RasterProcessingService() {
    }

    public RasterProcessingService(PipelineConfig config) {
        configure(config);
    }

    @PostConstruct
    public void init() {
        logger.info("Initializing Raster Processing Service...");
        configure(PipelineConfigResolver.resolve());
    }

    private void configure(PipelineConfig config) {
        this.config = config;
        PipelineConfig.GrayscaleConfig gs = config.grayscale;
        this.edgeDetector = new EdgeDetector(new LuminanceConverter(gs.red, gs.green, gs.blue));

        Map<String, PixelPalette> loaded = new LinkedHashMap<>();
        for (Map.Entry<String, List<int[]>> e : config.pascal.palettes.entrySet()) {
            loaded.put(e.getKey(), PixelPalette.fromRgb(e.getKey(), e.getValue()));
        }
        this.palettes = Collections.unmodifiableMap(loaded);

        if (!palettes.containsKey(config.pascal.defaultPalette)) {
            logger.warn("Default palette '{}' is not defined, available: {}", config.pascal.defaultPalette,
                    palettes.keySet());
        }
        logger.info("Pipeline configured: grayscale=({}, {}, {}), defaultThreshold={}, palettes={}",
                gs.red, gs.green, gs.blue, config.edgeDetection.defaultThreshold, palettes.keySet());
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public Map<String, PixelPalette> getPalettes() {
        return palettes;
    }

    /**
     * @param threshold null for the configured default
     */
    public String detectEdges(String ppm, Double threshold) {
        double t = threshold != null ? threshold : config.edgeDetection.defaultThreshold;
        Raster image = PpmCodec.decode(ppm);
        Raster edges = edgeDetector.detect(image, t);
        logger.debug("Edge detection {}x{} -> {}x{} at threshold {}", image.getHeight(), image.getWidth(),
                edges.getHeight(), edges.getWidth(), t);
        return PpmCodec.encode(edges);
    }

    public String rotate(String ppm, int degrees) {
        return PpmCodec.encode(RasterGeometry.rotate(PpmCodec.decode(ppm), degrees));
    }

    public String concatVertical(String top, String bottom) {
        return PpmCodec.encode(RasterGeometry.verticalConcat(PpmCodec.decode(top), PpmCodec.decode(bottom)));
    }

    public String concatHorizontal(String left, String right) {
        return PpmCodec.encode(RasterGeometry.horizontalConcat(PpmCodec.decode(left), PpmCodec.decode(right)));
    }

    /**
     * Null arguments take the configured defaults.
     */
    public String pascal(Integer modulus, Integer size, String paletteName) {
        return PpmCodec.encode(pascalRaster(modulus, size, paletteName));
    }

    public Raster pascalRaster(Integer modulus, Integer size, String paletteName) {
        PipelineConfig.PascalConfig pc = config.pascal;
        int m = modulus != null ? modulus : pc.defaultModulus;
        int s = size != null ? size : pc.defaultSize;
        if (s > pc.maxSize) {
            throw new IllegalArgumentException("Size " + s + " exceeds the maximum of " + pc.maxSize);
        }
        PixelPalette palette = palette(paletteName != null ? paletteName : pc.defaultPalette);

        logger.debug("Generating Pascal triangle: modulus={}, size={}, palette={}", m, s, palette.getName());
        return PascalModuloGenerator.generate(m, palette, s);
    }

    public PixelPalette palette(String name) {
        PixelPalette palette = palettes.get(name);
        if (palette == null) {
            throw new IllegalArgumentException("Unknown palette '" + name + "', available: " + palettes.keySet());
        }
        return palette;
    }
}
