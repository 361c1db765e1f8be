package com.imagesearch.matching;

import com.imagesearch.feature.FeatureSet;
import com.imagesearch.feature.Keypoint;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Axis-aligned box around the candidate keypoints that matched the source.
 */
@Value
public class Region {
    int x;
    int y;
    int width;
    int height;

    public static Optional<Region> around(List<Correspondence> correspondences, FeatureSet candidate) {
        if (correspondences.isEmpty()) {
            return Optional.empty();
        }
        float minX = Float.MAX_VALUE, minY = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE, maxY = -Float.MAX_VALUE;
        for (Correspondence c : correspondences) {
            Keypoint kp = candidate.getKeypoints().get(c.getCandidateIndex());
            minX = Math.min(minX, kp.getX());
            minY = Math.min(minY, kp.getY());
            maxX = Math.max(maxX, kp.getX());
            maxY = Math.max(maxY, kp.getY());
        }
        int x0 = (int) Math.floor(minX);
        int y0 = (int) Math.floor(minY);
        return Optional.of(new Region(x0, y0,
                (int) Math.ceil(maxX) - x0 + 1,
                (int) Math.ceil(maxY) - y0 + 1));
    }
}
