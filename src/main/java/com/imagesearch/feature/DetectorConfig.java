package com.imagesearch.feature;

import lombok.Builder;
import lombok.Value;

/**
 * Fixed SIFT detector parameters. One configuration is used for the source and every candidate
 * of a scan.
 */
@Value
@Builder(toBuilder = true)
public class DetectorConfig {
    @Builder.Default
    DetectorType type = DetectorType.OPENCV;
    /** Keep only the best N features, 0 keeps all. */
    @Builder.Default
    int maxFeatures = 0;
    @Builder.Default
    int octaves = 4;
    @Builder.Default
    int octaveLayers = 3;
    @Builder.Default
    double contrastThreshold = 0.04;
    @Builder.Default
    double edgeThreshold = 10.0;
    @Builder.Default
    double sigma = 1.6;
    @Builder.Default
    boolean doubleImageSize = false;

    public static DetectorConfig defaults() {
        return DetectorConfig.builder().build();
    }

    public void validate() {
        if (type == null) throw new IllegalArgumentException("detector type is required");
        if (maxFeatures < 0) throw new IllegalArgumentException("maxFeatures must be >= 0");
        if (octaves < 1) throw new IllegalArgumentException("octaves must be >= 1");
        if (octaveLayers < 1) throw new IllegalArgumentException("octaveLayers must be >= 1");
        if (contrastThreshold <= 0) throw new IllegalArgumentException("contrastThreshold must be > 0");
        if (edgeThreshold <= 0) throw new IllegalArgumentException("edgeThreshold must be > 0");
        if (sigma <= 0) throw new IllegalArgumentException("sigma must be > 0");
    }

    /** Per-layer contrast cut used on DoG values in [0, 1]. */
    public double layerContrastThreshold() {
        return contrastThreshold / octaveLayers;
    }
}
