package com.imagesearch.scan;

import com.imagesearch.feature.DetectorConfig;
import com.imagesearch.matching.DescriptorMatcher;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable settings of one scan, fixed when the scan is prepared.
 */
@Value
@Builder(toBuilder = true)
public class ScanConfig {
    public static final double DEFAULT_MATCH_THRESHOLD = 10.0;

    /** Lowe ratio, (0, 1). */
    @Builder.Default
    double ratioTestThreshold = DescriptorMatcher.DEFAULT_RATIO;
    /** A candidate is reported when its percentage is strictly greater than this, [0, 100]. */
    @Builder.Default
    double matchPercentageThreshold = DEFAULT_MATCH_THRESHOLD;
    /** Attach the bounding box of matched candidate keypoints to each result. */
    @Builder.Default
    boolean highlightRegion = false;
    @Builder.Default
    DetectorConfig detector = DetectorConfig.defaults();

    public static ScanConfig defaults() {
        return ScanConfig.builder().build();
    }

    public void validate() {
        if (!(ratioTestThreshold > 0.0 && ratioTestThreshold < 1.0)) {
            throw new IllegalArgumentException("ratioTestThreshold must be in (0, 1), got " + ratioTestThreshold);
        }
        if (!(matchPercentageThreshold >= 0.0 && matchPercentageThreshold <= 100.0)) {
            throw new IllegalArgumentException("matchPercentageThreshold must be in [0, 100], got " + matchPercentageThreshold);
        }
        if (detector == null) {
            throw new IllegalArgumentException("detector configuration is required");
        }
        detector.validate();
    }
}
