package com.imagesearch.API;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters of one scan. Thresholds left null fall back to the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {
    private String sourceImage;
    private String searchDirectory;
    private Double matchThreshold;
    private Double ratioThreshold;
    private Boolean highlightRegion;
}
