package com.imagesearch.scan;

import com.imagesearch.feature.DetectorConfig;
import com.imagesearch.feature.FeatureExtractor;
import com.imagesearch.feature.FeatureSet;
import com.imagesearch.imageOperator.DecodeException;
import com.imagesearch.imageOperator.ImageDecoder;
import com.imagesearch.matching.Correspondence;
import com.imagesearch.matching.DescriptorMatcher;
import com.imagesearch.matching.Region;
import com.imagesearch.matching.SimilarityScorer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * One scan of a search directory against a source image.
 * <p>
 * {@link #run} walks the candidates one at a time on the calling thread. {@link #cancel} and
 * {@link #getProgress} may be called from any thread; cancellation is checked before every
 * candidate and before a match is emitted.
 */
@Slf4j
public class ScanTask {
    @Getter
    private final String id = UUID.randomUUID().toString();
    @Getter
    private final Path sourceImage;
    @Getter
    private final Path searchDirectory;
    @Getter
    private final ScanConfig config;

    private final ImageDecoder decoder;
    private final Function<DetectorConfig, FeatureExtractor> extractorFactory;
    private final Function<Path, List<Path>> candidateLister;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean canceled = new AtomicBoolean();
    private volatile ScanProgress progress;
    private volatile boolean finished;

    ScanTask(Path sourceImage, Path searchDirectory, ScanConfig config, ImageDecoder decoder,
             Function<DetectorConfig, FeatureExtractor> extractorFactory,
             Function<Path, List<Path>> candidateLister) {
        this.sourceImage = sourceImage;
        this.searchDirectory = searchDirectory;
        this.config = config;
        this.decoder = decoder;
        this.extractorFactory = extractorFactory;
        this.candidateLister = candidateLister;
    }

    /** Requests cooperative cancellation; a no-op once the scan has finished. */
    public void cancel() {
        if (finished) return;
        if (canceled.compareAndSet(false, true)) {
            log.info("Scan {} cancellation requested", id);
        }
    }

    public boolean isCanceled() {
        return canceled.get();
    }

    public Optional<ScanProgress> getProgress() {
        return Optional.ofNullable(progress);
    }

    public ScanSummary run(ScanListener listener) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Scan " + id + " has already been run");
        }
        try {
            return scan(listener);
        } finally {
            finished = true;
        }
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Names the input that keeps this scan from starting, if any. Such a scan runs as a no-op
     * and emits no events.
     */
    public Optional<String> missingInput() {
        if (sourceImage == null || !Files.isRegularFile(sourceImage)) {
            return Optional.of("source image not set");
        }
        if (searchDirectory == null || !Files.isDirectory(searchDirectory)) {
            return Optional.of("search directory not set");
        }
        return Optional.empty();
    }

    private ScanSummary scan(ScanListener listener) {
        Optional<String> missing = missingInput();
        if (missing.isPresent()) {
            log.info("Scan {} not started: {} (source {}, directory {})", id, missing.get(), sourceImage, searchDirectory);
            return ScanSummary.notStarted(missing.get());
        }

        List<Path> candidates = candidateLister.apply(searchDirectory);
        int total = candidates.size();
        if (total == 0) {
            log.info("Scan {}: no images in {}", id, searchDirectory);
            ScanSummary summary = ScanSummary.builder().status(ScanStatus.COMPLETED).build();
            listener.onCompleted(summary);
            return summary;
        }

        log.info("Scan {}: {} against {} candidates in {}", id, sourceImage.getFileName(), total, searchDirectory);
        FeatureExtractor extractor = extractorFactory.apply(config.getDetector());

        FeatureSet sourceFeatures;
        try {
            sourceFeatures = extractor.extract(decoder.decode(sourceImage));
        } catch (DecodeException e) {
            return reject(listener, total, "source image cannot be decoded: " + e.getMessage());
        } catch (RuntimeException e) {
            return reject(listener, total, "source feature extraction failed: " + e.getMessage());
        }
        if (sourceFeatures.isEmpty()) {
            return reject(listener, total, "source image has no keypoints, no similarity can be computed");
        }
        log.debug("Scan {}: source has {} keypoints", id, sourceFeatures.size());

        DescriptorMatcher matcher = new DescriptorMatcher(config.getRatioTestThreshold());
        int analyzed = 0;
        int skipped = 0;
        int matches = 0;
        double lastPercentage = 0.0;

        for (int i = 0; i < total; i++) {
            if (canceled.get()) {
                return finishCanceled(listener, total, i, analyzed, skipped, matches);
            }
            Path candidate = candidates.get(i);
            String name = candidate.getFileName().toString();

            FeatureSet candidateFeatures = extractCandidate(extractor, candidate);
            if (candidateFeatures == null) {
                skipped++;
                publish(listener, new ScanProgress(name, i + 1, total, lastPercentage, true));
                continue;
            }

            List<Correspondence> correspondences = matcher.match(sourceFeatures, candidateFeatures);
            double percentage = SimilarityScorer.score(correspondences, sourceFeatures.size());
            lastPercentage = percentage;
            analyzed++;
            log.debug("Scan {}: {} -> {} correspondences, {}%", id, name, correspondences.size(),
                    String.format("%.2f", percentage));
            publish(listener, new ScanProgress(name, i + 1, total, percentage, false));

            if (percentage > config.getMatchPercentageThreshold() && !canceled.get()) {
                Region region = config.isHighlightRegion()
                        ? Region.around(correspondences, candidateFeatures).orElse(null)
                        : null;
                matches++;
                listener.onMatch(new MatchResult(candidate, percentage, region));
            }
        }

        ScanSummary summary = ScanSummary.builder()
                .status(ScanStatus.COMPLETED)
                .total(total)
                .processed(total)
                .analyzed(analyzed)
                .skipped(skipped)
                .matches(matches)
                .build();
        log.info("Scan {} completed: {} analyzed, {} skipped, {} matches", id, analyzed, skipped, matches);
        listener.onCompleted(summary);
        return summary;
    }

    /** Features of one candidate, or null when it has to be skipped. */
    private FeatureSet extractCandidate(FeatureExtractor extractor, Path candidate) {
        FeatureSet features;
        try {
            features = extractor.extract(decoder.decode(candidate));
        } catch (DecodeException e) {
            log.warn("Skipping {}: {}", candidate.getFileName(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.warn("Skipping {}: feature extraction failed", candidate.getFileName(), e);
            return null;
        }
        if (features.isEmpty()) {
            log.debug("Skipping {}: no keypoints", candidate.getFileName());
            return null;
        }
        return features;
    }

    private void publish(ScanListener listener, ScanProgress next) {
        progress = next;
        listener.onProgress(next);
    }

    private ScanSummary reject(ScanListener listener, int total, String reason) {
        log.warn("Scan {} rejected: {}", id, reason);
        ScanSummary summary = ScanSummary.builder()
                .status(ScanStatus.REJECTED)
                .total(total)
                .reason(reason)
                .build();
        listener.onRejected(summary);
        return summary;
    }

    private ScanSummary finishCanceled(ScanListener listener, int total, int processed,
                                       int analyzed, int skipped, int matches) {
        ScanSummary summary = ScanSummary.builder()
                .status(ScanStatus.CANCELED)
                .total(total)
                .processed(processed)
                .analyzed(analyzed)
                .skipped(skipped)
                .matches(matches)
                .build();
        log.info("Scan {} canceled after {}/{} candidates", id, processed, total);
        listener.onCanceled(summary);
        return summary;
    }
}
