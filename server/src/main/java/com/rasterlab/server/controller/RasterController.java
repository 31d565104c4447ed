package com.rasterlab.server.controller;

import com.rasterlab.server.service.RasterProcessingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
public class RasterController {

    private static final Logger logger = LoggerFactory.getLogger(RasterController.class);
    private final RasterProcessingService processingService;

    public RasterController(RasterProcessingService processingService) {
        this.processingService = processingService;
    }

    public static class ConcatRequest {
        public String first;
        public String second;
    }

    @PostMapping(value = "/edges", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> edges(@RequestBody String ppm,
            @RequestParam(value = "threshold", required = false) Double threshold) {
        logger.info("Received edge detection request, threshold={}", threshold);
        return ResponseEntity.ok(processingService.detectEdges(ppm, threshold));
    }

    @PostMapping(value = "/rotate", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> rotate(@RequestBody String ppm, @RequestParam("degrees") int degrees) {
        logger.info("Received rotate request, degrees={}", degrees);
        return ResponseEntity.ok(processingService.rotate(ppm, degrees));
    }

    @PostMapping(value = "/concat/vertical", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> concatVertical(@RequestBody ConcatRequest request) {
        if (request == null || request.first == null || request.second == null) {
            return ResponseEntity.badRequest().body("Both 'first' and 'second' images are required.");
        }
        return ResponseEntity.ok(processingService.concatVertical(request.first, request.second));
    }

    @PostMapping(value = "/concat/horizontal", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> concatHorizontal(@RequestBody ConcatRequest request) {
        if (request == null || request.first == null || request.second == null) {
            return ResponseEntity.badRequest().body("Both 'first' and 'second' images are required.");
        }
        return ResponseEntity.ok(processingService.concatHorizontal(request.first, request.second));
    }

    @GetMapping(value = "/pascal", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> pascal(@RequestParam(value = "modulus", required = false) Integer modulus,
            @RequestParam(value = "size", required = false) Integer size,
            @RequestParam(value = "palette", required = false) String palette) {
        logger.info("Received pascal request, modulus={}, size={}, palette={}", modulus, size, palette);
        return ResponseEntity.ok(processingService.pascal(modulus, size, palette));
    }

    // Covers PpmFormatException too.
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadInput(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().contentType(MediaType.TEXT_PLAIN).body(e.getMessage());
    }
}
