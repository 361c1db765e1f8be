package com.imagesearch.openpanoSIFT;

import com.imagesearch.feature.DetectorConfig;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.*;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Scale-space extrema detection, sub-pixel refinement, orientation and 128-bin descriptor, run
 * over pyramids built by {@link ScaleSpace}.
 */
public class SiftDetector {
    static final int BORDER = 5;
    static final int DESCRIPTOR_HIST_WIDTH = 4; // 4x4 grid
    static final int DESCRIPTOR_HIST_BINS = 8;  // 8 orientations
    static final int DESCRIPTOR_SIZE = DESCRIPTOR_HIST_WIDTH * DESCRIPTOR_HIST_WIDTH * DESCRIPTOR_HIST_BINS;
    private static final int ORIENTATION_BINS = 36;
    private static final double ORIENTATION_SIGMA_FACTOR = 1.5;
    private static final float DESCRIPTOR_CLAMP = 0.2f;

    private final DetectorConfig config;
    private final ScaleSpace scaleSpace;

    /** Keypoint under construction, in octave coordinates. */
    static class Candidate {
        int octave;
        int layer;
        float octaveX, octaveY;  // refined position inside the octave
        float octaveScale;       // sigma inside the octave
        float response;
        float angle;             // degrees
        final float[] descriptor = new float[DESCRIPTOR_SIZE];
    }

    public SiftDetector(DetectorConfig config, ScaleSpace scaleSpace) {
        this.config = config;
        this.scaleSpace = scaleSpace;
    }

    public List<Candidate> run(List<MatVector> gaussianPyramid, List<MatVector> dogPyramid) {
        List<Candidate> keypoints = new ArrayList<>();
        double threshold = config.layerContrastThreshold();

        for (int o = 0; o < dogPyramid.size(); o++) {
            MatVector dogOctave = dogPyramid.get(o);
            MatVector gaussOctave = gaussianPyramid.get(o);
            long numLayers = dogOctave.size();

            for (int s = 1; s < numLayers - 1; s++) {
                FloatIndexer idxBelow = dogOctave.get(s - 1).createIndexer();
                FloatIndexer idxCurr = dogOctave.get(s).createIndexer();
                FloatIndexer idxAbove = dogOctave.get(s + 1).createIndexer();
                Mat gauss = gaussOctave.get(s);
                FloatIndexer idxGauss = gauss.createIndexer();

                int rows = (int) idxCurr.size(0);
                int cols = (int) idxCurr.size(1);
                try {
                    for (int y = BORDER; y < rows - BORDER; y++) {
                        for (int x = BORDER; x < cols - BORDER; x++) {
                            float val = idxCurr.get(y, x);
                            if (Math.abs(val) < threshold) continue;
                            if (!isExtremum(val, x, y, idxBelow, idxCurr, idxAbove)) continue;

                            Candidate kp = interpolate(x, y, o, s, idxBelow, idxCurr, idxAbove);
                            if (kp == null) continue;
                            assignOrientation(kp, idxGauss, rows, cols);
                            computeDescriptor(kp, idxGauss, rows, cols);
                            keypoints.add(kp);
                        }
                    }
                } finally {
                    idxBelow.release();
                    idxCurr.release();
                    idxAbove.release();
                    idxGauss.release();
                }
            }
        }
        return keypoints;
    }

    /** Strict maximum or minimum over the 26 neighbours in scale space. */
    private boolean isExtremum(float val, int x, int y, FloatIndexer below, FloatIndexer curr, FloatIndexer above) {
        boolean isMax = val > 0;
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                float b = below.get(y + dy, x + dx);
                float a = above.get(y + dy, x + dx);
                if (isMax) {
                    if (val <= b || val <= a) return false;
                    if ((dx != 0 || dy != 0) && val <= curr.get(y + dy, x + dx)) return false;
                } else {
                    if (val >= b || val >= a) return false;
                    if ((dx != 0 || dy != 0) && val >= curr.get(y + dy, x + dx)) return false;
                }
            }
        }
        return true;
    }

    private Candidate interpolate(int c, int r, int octave, int layer, FloatIndexer below, FloatIndexer curr, FloatIndexer above) {
        float dx = (curr.get(r, c + 1) - curr.get(r, c - 1)) * 0.5f;
        float dy = (curr.get(r + 1, c) - curr.get(r - 1, c)) * 0.5f;
        float ds = (above.get(r, c) - below.get(r, c)) * 0.5f;

        float v2 = 2.0f * curr.get(r, c);
        float dxx = curr.get(r, c + 1) + curr.get(r, c - 1) - v2;
        float dyy = curr.get(r + 1, c) + curr.get(r - 1, c) - v2;
        float dss = above.get(r, c) + below.get(r, c) - v2;
        float dxy = (curr.get(r + 1, c + 1) - curr.get(r + 1, c - 1) - curr.get(r - 1, c + 1) + curr.get(r - 1, c - 1)) * 0.25f;
        float dxs = (above.get(r, c + 1) - above.get(r, c - 1) - below.get(r, c + 1) + below.get(r, c - 1)) * 0.25f;
        float dys = (above.get(r + 1, c) - above.get(r - 1, c) - below.get(r + 1, c) + below.get(r - 1, c)) * 0.25f;

        // Solve H * offset = -D
        Mat H = new Mat(3, 3, CV_32F);
        Mat D = new Mat(3, 1, CV_32F);
        Mat X = new Mat();
        FloatIndexer hIdx = H.createIndexer();
        FloatIndexer dIdx = D.createIndexer();
        try {
            hIdx.put(0, 0, dxx); hIdx.put(0, 1, dxy); hIdx.put(0, 2, dxs);
            hIdx.put(1, 0, dxy); hIdx.put(1, 1, dyy); hIdx.put(1, 2, dys);
            hIdx.put(2, 0, dxs); hIdx.put(2, 1, dys); hIdx.put(2, 2, dss);
            dIdx.put(0, 0, -dx); dIdx.put(1, 0, -dy); dIdx.put(2, 0, -ds);

            if (!solve(H, D, X, DECOMP_LU)) return null;

            FloatIndexer xIdx = X.createIndexer();
            float ox = xIdx.get(0, 0);
            float oy = xIdx.get(1, 0);
            float os = xIdx.get(2, 0);
            xIdx.release();

            if (Math.abs(ox) > 0.5 || Math.abs(oy) > 0.5 || Math.abs(os) > 0.5) return null;

            // Reject edges: principal curvature ratio from the 2x2 spatial Hessian
            float tr = dxx + dyy;
            float det = dxx * dyy - dxy * dxy;
            if (det <= 0) return null;
            float edgeThresh = (float) config.getEdgeThreshold();
            if ((tr * tr) / det >= ((edgeThresh + 1) * (edgeThresh + 1) / edgeThresh)) return null;

            Candidate kp = new Candidate();
            kp.octave = octave;
            kp.layer = layer;
            kp.octaveX = c + ox;
            kp.octaveY = r + oy;
            kp.octaveScale = (float) (config.getSigma() * Math.pow(2.0, (layer + os) / config.getOctaveLayers()));
            kp.response = Math.abs(curr.get(r, c) + 0.5f * (dx * ox + dy * oy + ds * os));
            return kp;
        } finally {
            hIdx.release();
            dIdx.release();
            H.release();
            D.release();
            X.release();
        }
    }

    private void assignOrientation(Candidate kp, FloatIndexer idx, int rows, int cols) {
        float scl = kp.octaveScale;
        int r = Math.round(kp.octaveY);
        int c = Math.round(kp.octaveX);
        double weightSigma = ORIENTATION_SIGMA_FACTOR * scl;
        int radius = (int) Math.round(3 * weightSigma);

        float[] hist = new float[ORIENTATION_BINS];

        for (int i = -radius; i <= radius; i++) {
            for (int j = -radius; j <= radius; j++) {
                int y = r + i;
                int x = c + j;
                if (y <= 0 || y >= rows - 1 || x <= 0 || x >= cols - 1) continue;

                float dx = idx.get(y, x + 1) - idx.get(y, x - 1);
                float dy = idx.get(y + 1, x) - idx.get(y - 1, x);
                float mag = (float) Math.sqrt(dx * dx + dy * dy);
                float angle = (float) Math.toDegrees(Math.atan2(dy, dx));
                if (angle < 0) angle += 360;

                float weight = (float) Math.exp(-(i * i + j * j) / (2 * weightSigma * weightSigma));
                int bin = (int) (angle / (360f / ORIENTATION_BINS));
                if (bin >= ORIENTATION_BINS) bin = 0;

                hist[bin] += mag * weight;
            }
        }

        float maxVal = 0;
        int maxBin = 0;
        for (int k = 0; k < ORIENTATION_BINS; k++) {
            if (hist[k] > maxVal) {
                maxVal = hist[k];
                maxBin = k;
            }
        }
        // bin centre
        kp.angle = (maxBin + 0.5f) * (360f / ORIENTATION_BINS);
    }

    private void computeDescriptor(Candidate kp, FloatIndexer idx, int rows, int cols) {
        float scale = kp.octaveScale;
        float angleRad = (float) Math.toRadians(kp.angle);
        float cos_t = (float) Math.cos(angleRad);
        float sin_t = (float) Math.sin(angleRad);

        float hist_width = DESCRIPTOR_HIST_WIDTH;
        float bins = DESCRIPTOR_HIST_BINS;

        int radius = (int) ((hist_width + 1) * Math.sqrt(2) * (scale * DESCRIPTOR_HIST_WIDTH + 0.5) / 2.0);
        if (radius < 1) radius = 1;

        int r_kp = Math.round(kp.octaveY);
        int c_kp = Math.round(kp.octaveX);

        for (int i = -radius; i <= radius; i++) {
            for (int j = -radius; j <= radius; j++) {
                // rotate (i, j) into the keypoint frame
                float j_rot = j * cos_t + i * sin_t;
                float i_rot = -j * sin_t + i * cos_t;

                float r_bin = i_rot / scale + hist_width / 2f - 0.5f;
                float c_bin = j_rot / scale + hist_width / 2f - 0.5f;

                if (r_bin > -1 && r_bin < hist_width && c_bin > -1 && c_bin < hist_width) {
                    int y = r_kp + i;
                    int x = c_kp + j;
                    if (y <= 0 || y >= rows - 1 || x <= 0 || x >= cols - 1) continue;

                    float dx = idx.get(y, x + 1) - idx.get(y, x - 1);
                    float dy = idx.get(y + 1, x) - idx.get(y - 1, x);
                    float mod = (float) Math.sqrt(dx * dx + dy * dy);
                    float ori = (float) Math.atan2(dy, dx);

                    float ori_rot = ori - angleRad;
                    while (ori_rot < 0) ori_rot += 2 * Math.PI;
                    while (ori_rot >= 2 * Math.PI) ori_rot -= 2 * Math.PI;

                    float o_bin = (float) (ori_rot * bins / (2 * Math.PI));
                    float rc = i_rot / scale;
                    float cc = j_rot / scale;
                    float weight = (float) Math.exp(-(rc * rc + cc * cc) / (0.5 * hist_width * hist_width));

                    distributeToHistogram(kp.descriptor, r_bin, c_bin, o_bin, mod * weight);
                }
            }
        }

        normalizeAndClamp(kp.descriptor);
    }

    /** Trilinear interpolation into the 4x4x8 histogram. */
    private void distributeToHistogram(float[] desc, float r, float c, float o, float mag) {
        int r0 = (int) Math.floor(r);
        int c0 = (int) Math.floor(c);
        int o0 = (int) Math.floor(o);

        float dr = r - r0;
        float dc = c - c0;
        float do_ = o - o0;

        for (int ir = 0; ir <= 1; ir++) {
            int r_idx = r0 + ir;
            if (r_idx < 0 || r_idx >= DESCRIPTOR_HIST_WIDTH) continue;
            for (int ic = 0; ic <= 1; ic++) {
                int c_idx = c0 + ic;
                if (c_idx < 0 || c_idx >= DESCRIPTOR_HIST_WIDTH) continue;
                for (int io = 0; io <= 1; io++) {
                    int o_idx = (o0 + io) % DESCRIPTOR_HIST_BINS;
                    float val = mag * (ir == 0 ? 1 - dr : dr)
                            * (ic == 0 ? 1 - dc : dc)
                            * (io == 0 ? 1 - do_ : do_);
                    desc[(r_idx * DESCRIPTOR_HIST_WIDTH + c_idx) * DESCRIPTOR_HIST_BINS + o_idx] += val;
                }
            }
        }
    }

    static void normalizeAndClamp(float[] vec) {
        if (!normalize(vec)) return;
        for (int i = 0; i < vec.length; i++) {
            if (vec[i] > DESCRIPTOR_CLAMP) vec[i] = DESCRIPTOR_CLAMP;
        }
        normalize(vec);
    }

    private static boolean normalize(float[] vec) {
        float sum = 0;
        for (float v : vec) sum += v * v;
        sum = (float) Math.sqrt(sum);
        if (sum == 0) return false;
        for (int i = 0; i < vec.length; i++) vec[i] /= sum;
        return true;
    }

    /** Image-space x of a candidate. */
    float imageX(Candidate kp) {
        return (float) (kp.octaveX * scaleSpace.octaveToImage(kp.octave));
    }

    float imageY(Candidate kp) {
        return (float) (kp.octaveY * scaleSpace.octaveToImage(kp.octave));
    }

    float imageScale(Candidate kp) {
        return (float) (kp.octaveScale * scaleSpace.octaveToImage(kp.octave));
    }
}
