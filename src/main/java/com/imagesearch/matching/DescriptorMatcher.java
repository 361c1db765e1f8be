package com.imagesearch.matching;

import com.imagesearch.feature.FeatureSet;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.DMatch;
import org.bytedeco.opencv.opencv_core.DMatchVector;
import org.bytedeco.opencv.opencv_core.DMatchVectorVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.BFMatcher;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_core.NORM_L2;

/**
 * Brute-force L2 matcher with Lowe's ratio test.
 * <p>
 * For every source descriptor the two nearest candidate descriptors are found; the nearest one
 * is kept only if {@code d1 < ratio * d2}. Each source descriptor yields at most one
 * correspondence, so the result never holds more entries than the source has descriptors.
 */
public class DescriptorMatcher {
    public static final double DEFAULT_RATIO = 0.75;

    private final double ratio;

    public DescriptorMatcher() {
        this(DEFAULT_RATIO);
    }

    public DescriptorMatcher(double ratio) {
        if (!(ratio > 0.0 && ratio < 1.0)) {
            throw new IllegalArgumentException("Ratio test threshold must be in (0, 1), got " + ratio);
        }
        this.ratio = ratio;
    }

    public double getRatio() {
        return ratio;
    }

    public List<Correspondence> match(FeatureSet source, FeatureSet candidate) {
        List<Correspondence> good = new ArrayList<>();
        // fewer than two neighbours: nothing can pass the ratio test
        if (source.isEmpty() || candidate.size() < 2) {
            return good;
        }
        if (source.getDimension() != candidate.getDimension()) {
            throw new IllegalArgumentException("Descriptor dimensions differ: "
                    + source.getDimension() + " vs " + candidate.getDimension());
        }

        Mat query = toDescriptorMat(source);
        Mat train = toDescriptorMat(candidate);
        BFMatcher matcher = new BFMatcher(NORM_L2, false);
        DMatchVectorVector knnMatches = new DMatchVectorVector();
        try {
            matcher.knnMatch(query, train, knnMatches, 2);
            for (long i = 0; i < knnMatches.size(); i++) {
                DMatchVector matches = knnMatches.get(i);
                if (matches.size() < 2) continue;
                DMatch m = matches.get(0);
                DMatch n = matches.get(1);
                if (m.distance() < ratio * n.distance()) {
                    good.add(new Correspondence(m.queryIdx(), m.trainIdx(), m.distance()));
                }
            }
        } finally {
            knnMatches.close();
            matcher.close();
            query.release();
            train.release();
        }
        return good;
    }

    /** One CV_32F row per descriptor, copied in bulk. */
    static Mat toDescriptorMat(FeatureSet features) {
        int rows = features.size();
        int cols = features.getDimension();
        float[] buf = new float[rows * cols];
        for (int i = 0; i < rows; i++) {
            System.arraycopy(features.descriptorRow(i), 0, buf, i * cols, cols);
        }
        Mat mat = new Mat(rows, cols, CV_32F);
        new FloatPointer(mat.data()).put(buf);
        return mat;
    }
}
