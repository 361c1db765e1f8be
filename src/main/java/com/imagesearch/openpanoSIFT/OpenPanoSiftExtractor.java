package com.imagesearch.openpanoSIFT;

import com.imagesearch.feature.DetectorConfig;
import com.imagesearch.feature.FeatureExtractor;
import com.imagesearch.feature.FeatureSet;
import com.imagesearch.feature.Keypoint;
import com.imagesearch.imageOperator.MatConverter;
import com.imagesearch.imageOperator.PixelGrid;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link FeatureExtractor} backed by the in-house Gaussian/DoG pyramid detector.
 */
@Slf4j
public class OpenPanoSiftExtractor implements FeatureExtractor {
    private final DetectorConfig config;

    public OpenPanoSiftExtractor(DetectorConfig config) {
        config.validate();
        this.config = config;
    }

    @Override
    public FeatureSet extract(PixelGrid image) {
        Mat fGray = MatConverter.toFloatGray(image);
        ScaleSpace ss = new ScaleSpace(config);
        SiftDetector detector = new SiftDetector(config, ss);

        List<MatVector> gaussianPyramid = ss.buildGaussianPyramid(fGray);
        List<MatVector> dogPyramid = ss.buildDoGPyramid(gaussianPyramid);
        List<SiftDetector.Candidate> candidates;
        try {
            candidates = detector.run(gaussianPyramid, dogPyramid);
        } finally {
            release(gaussianPyramid);
            release(dogPyramid);
            fGray.release();
        }

        if (candidates.isEmpty()) {
            return FeatureSet.empty();
        }
        if (config.getMaxFeatures() > 0 && candidates.size() > config.getMaxFeatures()) {
            candidates.sort(Comparator.comparingDouble((SiftDetector.Candidate c) -> c.response).reversed());
            candidates = new ArrayList<>(candidates.subList(0, config.getMaxFeatures()));
        }

        List<Keypoint> keypoints = new ArrayList<>(candidates.size());
        float[][] descriptors = new float[candidates.size()][];
        for (int i = 0; i < candidates.size(); i++) {
            SiftDetector.Candidate c = candidates.get(i);
            keypoints.add(new Keypoint(detector.imageX(c), detector.imageY(c), 2 * detector.imageScale(c),
                    c.angle, c.response, c.octave));
            descriptors[i] = c.descriptor;
        }
        log.trace("OpenPano SIFT found {} keypoints", keypoints.size());
        return new FeatureSet(keypoints, descriptors);
    }

    private static void release(List<MatVector> pyramid) {
        for (MatVector octave : pyramid) {
            for (long i = 0; i < octave.size(); i++) {
                octave.get(i).release();
            }
            octave.close();
        }
        pyramid.clear();
    }
}
