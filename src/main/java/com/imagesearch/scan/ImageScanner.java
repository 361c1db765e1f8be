package com.imagesearch.scan;

import com.imagesearch.feature.DetectorConfig;
import com.imagesearch.feature.FeatureExtractor;
import com.imagesearch.feature.FeatureExtractors;
import com.imagesearch.imageOperator.ImageDecoder;
import com.imagesearch.imageOperator.ImageDirectory;
import com.imagesearch.imageOperator.OpenCvImageDecoder;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

/**
 * Entry point of the matching pipeline. Holds the collaborators shared by all scans and hands
 * out one {@link ScanTask} per invocation; the task owns its progress and cancellation state.
 */
public class ImageScanner {
    private final ImageDecoder decoder;
    private final Function<DetectorConfig, FeatureExtractor> extractorFactory;
    private final Function<Path, List<Path>> candidateLister;

    public ImageScanner() {
        this(new OpenCvImageDecoder(), FeatureExtractors::create, ImageDirectory::listImages);
    }

    public ImageScanner(ImageDecoder decoder, Function<DetectorConfig, FeatureExtractor> extractorFactory) {
        this(decoder, extractorFactory, ImageDirectory::listImages);
    }

    public ImageScanner(ImageDecoder decoder,
                        Function<DetectorConfig, FeatureExtractor> extractorFactory,
                        Function<Path, List<Path>> candidateLister) {
        this.decoder = decoder;
        this.extractorFactory = extractorFactory;
        this.candidateLister = candidateLister;
    }

    /**
     * @throws IllegalArgumentException if {@code config} is out of range
     */
    public ScanTask prepare(Path sourceImage, Path searchDirectory, ScanConfig config) {
        config.validate();
        return new ScanTask(sourceImage, searchDirectory, config, decoder, extractorFactory, candidateLister);
    }

    /** Prepares and runs a scan on the calling thread. */
    public ScanSummary scan(Path sourceImage, Path searchDirectory, ScanConfig config, ScanListener listener) {
        return prepare(sourceImage, searchDirectory, config).run(listener);
    }
}
