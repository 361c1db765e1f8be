package com.imagesearch.imageOperator;

import lombok.Getter;

import java.util.Arrays;

/**
 * Decoded image as an immutable grid of unsigned 8-bit samples.
 * <p>
 * Samples are stored row-major with interleaved channels in BGR(A) order, the same layout
 * OpenCV uses for {@code CV_8UC1}, {@code CV_8UC3} and {@code CV_8UC4} matrices.
 */
@Getter
public final class PixelGrid {
    private final int width;
    private final int height;
    private final int channels;
    @Getter(lombok.AccessLevel.NONE)
    private final byte[] samples;

    public PixelGrid(int width, int height, int channels, byte[] samples) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Empty image: " + width + "x" + height);
        }
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        if (samples == null || samples.length != width * height * channels) {
            throw new IllegalArgumentException("Sample buffer does not match " + width + "x" + height + "x" + channels);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.samples = samples.clone();
    }

    public byte[] copySamples() {
        return samples.clone();
    }

    /** Unsigned sample value at (x, y) in channel {@code c}. */
    public int sample(int x, int y, int c) {
        return samples[(y * width + x) * channels + c] & 0xFF;
    }

    public boolean sameContent(PixelGrid other) {
        return other != null
                && width == other.width
                && height == other.height
                && channels == other.channels
                && Arrays.equals(samples, other.samples);
    }
}
