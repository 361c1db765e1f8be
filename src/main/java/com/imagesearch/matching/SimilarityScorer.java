package com.imagesearch.matching;

import java.util.List;

/**
 * Share of the source keypoints that found a confident correspondence, in percent.
 * <p>
 * The denominator is the source keypoint count only, so {@code score(a, b)} and
 * {@code score(b, a)} generally differ. With at most one correspondence per source descriptor
 * the value stays within [0, 100]; no clamp is applied.
 */
public final class SimilarityScorer {

    private SimilarityScorer() {
    }

    public static double score(List<Correspondence> correspondences, int sourceKeypointCount) {
        return score(correspondences.size(), sourceKeypointCount);
    }

    public static double score(int correspondenceCount, int sourceKeypointCount) {
        if (sourceKeypointCount <= 0) {
            throw new DegenerateInputException("Source image has no keypoints, similarity is undefined");
        }
        return 100.0 * correspondenceCount / sourceKeypointCount;
    }
}
