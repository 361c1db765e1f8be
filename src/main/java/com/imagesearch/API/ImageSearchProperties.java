package com.imagesearch.API;

import com.imagesearch.feature.DetectorConfig;
import com.imagesearch.feature.DetectorType;
import com.imagesearch.scan.ScanConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults bound from {@code imagesearch.*} in application.properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "imagesearch")
public class ImageSearchProperties {
    private Scan scan = new Scan();
    private Detector detector = new Detector();
    private Concurrency concurrency = new Concurrency();
    private Stream stream = new Stream();

    @Getter
    @Setter
    public static class Scan {
        private double ratioTestThreshold = 0.75;
        private double matchPercentageThreshold = ScanConfig.DEFAULT_MATCH_THRESHOLD;
        private boolean highlightRegion = false;
    }

    @Getter
    @Setter
    public static class Detector {
        private DetectorType type = DetectorType.OPENCV;
        private int maxFeatures = 0;
        private int octaves = 4;
        private int octaveLayers = 3;
        private double contrastThreshold = 0.04;
        private double edgeThreshold = 10.0;
        private double sigma = 1.6;
        private boolean doubleImageSize = false;
    }

    @Getter
    @Setter
    public static class Concurrency {
        private int scanThreads = 2;
    }

    @Getter
    @Setter
    public static class Stream {
        /** SSE timeout in milliseconds, 0 waits forever. */
        private long timeoutMs = 0;
    }

    public ScanConfig toScanConfig() {
        return ScanConfig.builder()
                .ratioTestThreshold(scan.getRatioTestThreshold())
                .matchPercentageThreshold(scan.getMatchPercentageThreshold())
                .highlightRegion(scan.isHighlightRegion())
                .detector(DetectorConfig.builder()
                        .type(detector.getType())
                        .maxFeatures(detector.getMaxFeatures())
                        .octaves(detector.getOctaves())
                        .octaveLayers(detector.getOctaveLayers())
                        .contrastThreshold(detector.getContrastThreshold())
                        .edgeThreshold(detector.getEdgeThreshold())
                        .sigma(detector.getSigma())
                        .doubleImageSize(detector.isDoubleImageSize())
                        .build())
                .build();
    }
}
