package com.imagesearch.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Bridges {@link PixelGrid} and OpenCV matrices.
 */
public final class MatConverter {

    private MatConverter() {
    }

    public static Mat toMat(PixelGrid grid) {
        Mat mat = new Mat(grid.getHeight(), grid.getWidth(), CV_8UC(grid.getChannels()));
        mat.data().put(grid.copySamples());
        return mat;
    }

    public static PixelGrid fromMat(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Empty matrix");
        }
        if (mat.depth() != CV_8U) {
            throw new IllegalArgumentException("Only 8-bit matrices are supported, got depth " + mat.depth());
        }
        Mat source = mat.isContinuous() ? mat : mat.clone();
        byte[] buf = new byte[(int) (source.total() * source.channels())];
        source.data().get(buf);
        if (source != mat) source.release();
        return new PixelGrid(mat.cols(), mat.rows(), mat.channels(), buf);
    }

    /** 8-bit single channel copy of the grid, whatever its channel count. */
    public static Mat toGray(PixelGrid grid) {
        Mat src = toMat(grid);
        if (grid.getChannels() == 1) {
            return src;
        }
        Mat gray = new Mat();
        cvtColor(src, gray, grid.getChannels() == 4 ? COLOR_BGRA2GRAY : COLOR_BGR2GRAY);
        src.release();
        return gray;
    }

    /** Gray image scaled to [0, 1] as {@code CV_32F}. */
    public static Mat toFloatGray(PixelGrid grid) {
        Mat gray = toGray(grid);
        Mat fGray = new Mat();
        gray.convertTo(fGray, CV_32F, 1.0 / 255.0, 0.0);
        gray.release();
        return fGray;
    }
}
