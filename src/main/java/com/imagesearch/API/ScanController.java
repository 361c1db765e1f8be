package com.imagesearch.API;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/scan")
@CrossOrigin(origins = "*")
public class ScanController {
    private final ScanService scanService;

    public ScanController(ScanService scanService) {
        this.scanService = scanService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> scan(@RequestBody ScanRequest request) {
        try {
            return ResponseEntity.ok(scanService.runScan(request));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (Exception e) {
            log.error("Scan failed", e);
            return ResponseEntity.internalServerError().body(error("Scan failed: " + e.getMessage()));
        }
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(value = "sourceImage", required = false) String sourceImage,
                             @RequestParam(value = "searchDirectory", required = false) String searchDirectory,
                             @RequestParam(value = "matchThreshold", required = false) Double matchThreshold,
                             @RequestParam(value = "ratioThreshold", required = false) Double ratioThreshold,
                             @RequestParam(value = "highlightRegion", required = false) Boolean highlightRegion) {
        return scanService.streamScan(new ScanRequest(sourceImage, searchDirectory, matchThreshold, ratioThreshold, highlightRegion));
    }

    @DeleteMapping("/{scanId}")
    public ResponseEntity<Void> cancel(@PathVariable String scanId) {
        return scanService.cancel(scanId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/{scanId}/progress")
    public ResponseEntity<?> progress(@PathVariable String scanId) {
        return scanService.progress(scanId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(error(e.getMessage()));
    }

    private static Map<String, String> error(String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return error;
    }
}
