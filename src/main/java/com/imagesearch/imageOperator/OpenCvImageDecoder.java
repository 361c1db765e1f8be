package com.imagesearch.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_imgcodecs.*;

/**
 * Reads PNG and JPEG files (and whatever else imgcodecs understands) as 3-channel BGR grids.
 */
public class OpenCvImageDecoder implements ImageDecoder {

    @Override
    public PixelGrid decode(Path path) throws DecodeException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new DecodeException(path, "not a readable file");
        }
        Mat raw = imread(path.toAbsolutePath().toString(), IMREAD_COLOR);
        try {
            if (raw == null || raw.empty()) {
                throw new DecodeException(path, "unsupported or corrupt image data");
            }
            return MatConverter.fromMat(raw);
        } finally {
            if (raw != null) raw.release();
        }
    }
}
