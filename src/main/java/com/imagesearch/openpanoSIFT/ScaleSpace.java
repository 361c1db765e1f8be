package com.imagesearch.openpanoSIFT;

import com.imagesearch.feature.DetectorConfig;
import org.bytedeco.opencv.opencv_core.*;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Gaussian and difference-of-Gaussian pyramids for one float gray image.
 */
public class ScaleSpace {
    // Octaves smaller than this cannot hold a keypoint away from the detector border
    static final int MIN_OCTAVE_SIZE = 2 * SiftDetector.BORDER + 3;
    // Lowe: the camera already blurred the image with sigma 0.5
    private static final double ASSUMED_BLUR = 0.5;

    private final DetectorConfig config;

    public ScaleSpace(DetectorConfig config) {
        this.config = config;
    }

    public List<MatVector> buildGaussianPyramid(Mat baseImage) {
        List<MatVector> pyramid = new ArrayList<>();
        Mat currentImg;
        double inputBlur = ASSUMED_BLUR;

        if (config.isDoubleImageSize()) {
            currentImg = new Mat();
            resize(baseImage, currentImg, new Size(), 2.0, 2.0, INTER_LINEAR);
            inputBlur *= 2;
        } else {
            currentImg = baseImage.clone();
        }

        double sigma0 = config.getSigma();
        double initialBlur = Math.sqrt(Math.max(sigma0 * sigma0 - inputBlur * inputBlur, 0.01));
        Mat blurredBase = new Mat();
        GaussianBlur(currentImg, blurredBase, new Size(0, 0), initialBlur, initialBlur, BORDER_DEFAULT);
        currentImg.release();
        currentImg = blurredBase;

        int scales = config.getOctaveLayers();
        double k = Math.pow(2, 1.0 / scales);
        double[] sigmas = new double[scales + 3];

        sigmas[0] = sigma0;
        for (int i = 1; i < sigmas.length; i++) {
            double prevSigma = Math.pow(k, i - 1) * sigma0;
            double totalSigma = Math.pow(k, i) * sigma0;
            sigmas[i] = Math.sqrt(totalSigma * totalSigma - prevSigma * prevSigma);
        }

        for (int o = 0; o < config.getOctaves(); o++) {
            if (Math.min(currentImg.rows(), currentImg.cols()) < MIN_OCTAVE_SIZE) {
                currentImg.release();
                break;
            }
            MatVector octave = new MatVector(sigmas.length);
            octave.put(0, currentImg);

            for (int i = 1; i < sigmas.length; i++) {
                Mat prev = octave.get(i - 1);
                Mat next = new Mat();
                GaussianBlur(prev, next, new Size(0, 0), sigmas[i], sigmas[i], BORDER_DEFAULT);
                octave.put(i, next);
            }
            pyramid.add(octave);

            if (o < config.getOctaves() - 1) {
                // the layer with twice the base sigma seeds the next octave
                Mat baseNext = octave.get(scales);
                Mat downsampled = new Mat();
                resize(baseNext, downsampled, new Size(baseNext.cols() / 2, baseNext.rows() / 2), 0, 0, INTER_NEAREST);
                currentImg = downsampled;
            }
        }
        return pyramid;
    }

    public List<MatVector> buildDoGPyramid(List<MatVector> gPyramid) {
        List<MatVector> dogPyramid = new ArrayList<>();
        for (MatVector octave : gPyramid) {
            long size = octave.size();
            MatVector dogOctave = new MatVector(size - 1);
            for (long i = 0; i < size - 1; i++) {
                Mat diff = new Mat();
                subtract(octave.get(i + 1), octave.get(i), diff);
                dogOctave.put(i, diff);
            }
            dogPyramid.add(dogOctave);
        }
        return dogPyramid;
    }

    /** Scale factor from octave {@code o} coordinates back to input image pixels. */
    public double octaveToImage(int o) {
        double f = Math.pow(2.0, o);
        return config.isDoubleImageSize() ? f / 2.0 : f;
    }
}
