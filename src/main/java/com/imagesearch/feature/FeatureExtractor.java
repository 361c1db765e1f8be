package com.imagesearch.feature;

import com.imagesearch.imageOperator.PixelGrid;

/**
 * Turns an image into keypoints and descriptors.
 * <p>
 * Implementations are stateless apart from their fixed detector configuration, so one instance
 * can extract the source and every candidate of a scan and keep the scores comparable. A
 * featureless image yields {@link FeatureSet#empty()}.
 */
public interface FeatureExtractor {
    FeatureSet extract(PixelGrid image);
}
