package com.imagesearch.feature;

import com.imagesearch.imageOperator.MatConverter;
import com.imagesearch.imageOperator.PixelGrid;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.KeyPoint;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.SIFT;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;

/**
 * SIFT keypoints and 128-float descriptors computed by OpenCV.
 */
@Slf4j
public class OpenCvSiftExtractor implements FeatureExtractor {
    private final DetectorConfig config;

    public OpenCvSiftExtractor(DetectorConfig config) {
        config.validate();
        this.config = config;
    }

    @Override
    public FeatureSet extract(PixelGrid image) {
        Mat gray = MatConverter.toGray(image);
        KeyPointVector keyPoints = new KeyPointVector();
        Mat descriptors = new Mat();
        // SIFT instances keep scratch buffers, so each call gets its own
        SIFT sift = SIFT.create(config.getMaxFeatures(), config.getOctaveLayers(),
                config.getContrastThreshold(), config.getEdgeThreshold(), config.getSigma(), false);
        try {
            sift.detectAndCompute(gray, new Mat(), keyPoints, descriptors);
            if (descriptors.empty() || keyPoints.size() == 0) {
                return FeatureSet.empty();
            }
            return toFeatureSet(keyPoints, descriptors);
        } finally {
            sift.close();
            gray.release();
            descriptors.release();
            keyPoints.close();
        }
    }

    private FeatureSet toFeatureSet(KeyPointVector keyPoints, Mat descriptors) {
        int rows = descriptors.rows();
        int cols = descriptors.cols();
        if (rows != keyPoints.size()) {
            throw new IllegalStateException("OpenCV returned " + keyPoints.size() + " keypoints and " + rows + " descriptors");
        }
        Mat floats = descriptors;
        if (descriptors.type() != CV_32F) {
            floats = new Mat();
            descriptors.convertTo(floats, CV_32F);
        }
        float[] buf = new float[rows * cols];
        new FloatPointer(floats.data()).get(buf);
        if (floats != descriptors) floats.release();

        List<Keypoint> kps = new ArrayList<>(rows);
        float[][] desc = new float[rows][cols];
        for (int i = 0; i < rows; i++) {
            KeyPoint kp = keyPoints.get(i);
            kps.add(new Keypoint(kp.pt().x(), kp.pt().y(), kp.size(), kp.angle(), kp.response(), kp.octave()));
            System.arraycopy(buf, i * cols, desc[i], 0, cols);
        }
        log.trace("Extracted {} SIFT features", rows);
        return new FeatureSet(kps, desc);
    }
}
