package com.imagesearch.feature;

import com.imagesearch.openpanoSIFT.OpenPanoSiftExtractor;

public final class FeatureExtractors {

    private FeatureExtractors() {
    }

    public static FeatureExtractor create(DetectorConfig config) {
        switch (config.getType()) {
            case OPENPANO:
                return new OpenPanoSiftExtractor(config);
            case OPENCV:
            default:
                return new OpenCvSiftExtractor(config);
        }
    }
}
