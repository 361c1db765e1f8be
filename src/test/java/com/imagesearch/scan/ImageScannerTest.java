package com.imagesearch.scan;

import com.imagesearch.feature.FeatureExtractor;
import com.imagesearch.feature.FeatureFixtures;
import com.imagesearch.feature.FeatureSet;
import com.imagesearch.imageOperator.DecodeException;
import com.imagesearch.imageOperator.ImageDecoder;
import com.imagesearch.imageOperator.PixelGrid;
import com.imagesearch.matching.Region;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Orchestration tests. Image files hold a short text label; the decoder turns the label into a
 * one-row grid and the extractor looks the label up in {@link #features}.
 */
class ImageScannerTest {

    @TempDir
    Path root;

    private Path sourceDir;
    private Path candidates;
    private final Map<String, FeatureSet> features = new HashMap<>();
    private final AtomicInteger extractions = new AtomicInteger();
    private ImageScanner scanner;

    private final ImageDecoder decoder = path -> {
        try {
            byte[] bytes = Files.readAllBytes(path);
            if (new String(bytes, StandardCharsets.UTF_8).startsWith("corrupt")) {
                throw new DecodeException(path, "bad header");
            }
            return new PixelGrid(bytes.length, 1, 1, bytes);
        } catch (IOException e) {
            throw new DecodeException(path, e.getMessage());
        }
    };

    private final FeatureExtractor extractor = image -> {
        extractions.incrementAndGet();
        String label = new String(image.copySamples(), StandardCharsets.UTF_8);
        return features.getOrDefault(label, FeatureSet.empty());
    };

    @BeforeEach
    void setUp() throws IOException {
        sourceDir = Files.createDirectory(root.resolve("source"));
        candidates = Files.createDirectory(root.resolve("candidates"));
        scanner = new ImageScanner(decoder, config -> extractor);
        features.put("A", FeatureFixtures.source(10));
    }

    private Path image(Path dir, String name, String label) throws IOException {
        return Files.writeString(dir.resolve(name), label);
    }

    @Test
    void copyMatchesUnrelatedDoesNotAndCorruptIsSkipped() throws IOException {
        Path source = image(sourceDir, "A.png", "A");
        features.put("A_copy", FeatureFixtures.source(10));
        features.put("unrelated", FeatureFixtures.candidate(0));
        image(candidates, "A_copy.png", "A_copy");
        image(candidates, "corrupt.png", "corrupt");
        image(candidates, "unrelated.png", "unrelated");
        RecordingListener listener = new RecordingListener();

        ScanSummary summary = scanner.scan(source, candidates, ScanConfig.defaults(), listener);

        assertEquals(ScanStatus.COMPLETED, summary.getStatus());
        assertEquals(3, listener.progress.size());
        ScanProgress last = listener.progress.get(2);
        assertEquals(3, last.getIndex());
        assertEquals(3, last.getTotal());
        assertTrue(listener.progress.get(1).isSkipped());
        assertEquals("corrupt.png", listener.progress.get(1).getCurrentName());
        assertEquals(100.0, listener.progress.get(1).getLastPercentage());
        assertEquals(0.0, last.getLastPercentage());

        assertEquals(1, listener.matches.size());
        assertEquals("A_copy.png", listener.matches.get(0).getCandidate().getFileName().toString());
        assertEquals(100.0, listener.matches.get(0).getPercentage());
        assertTrue(listener.matches.get(0).getRegion().isEmpty());

        assertEquals(List.of("completed"), listener.terminal);
        assertEquals(2, summary.getAnalyzed());
        assertEquals(1, summary.getSkipped());
        assertEquals(1, summary.getMatches());
    }

    @Test
    void emptyDirectoryCompletesImmediately() throws IOException {
        Path source = image(sourceDir, "A.png", "A");
        image(candidates, "readme.txt", "A");
        RecordingListener listener = new RecordingListener();

        ScanSummary summary = scanner.scan(source, candidates, ScanConfig.defaults(), listener);

        assertEquals(ScanStatus.COMPLETED, summary.getStatus());
        assertTrue(listener.progress.isEmpty());
        assertTrue(listener.matches.isEmpty());
        assertEquals(List.of("completed"), listener.terminal);
        assertEquals(0, extractions.get());
    }

    @Test
    void cancellationAfterFirstCandidateStopsTheScan() throws IOException {
        Path source = image(sourceDir, "A.png", "A");
        for (int i = 1; i <= 5; i++) {
            features.put("c" + i, FeatureFixtures.source(10));
            image(candidates, "c" + i + ".png", "c" + i);
        }
        ScanTask task = scanner.prepare(source, candidates, ScanConfig.defaults());
        AtomicReference<ScanTask> ref = new AtomicReference<>(task);
        RecordingListener listener = new RecordingListener() {
            @Override
            public void onProgress(ScanProgress progress) {
                super.onProgress(progress);
                ref.get().cancel();
            }
        };

        ScanSummary summary = task.run(listener);

        assertEquals(ScanStatus.CANCELED, summary.getStatus());
        assertEquals(1, listener.progress.size());
        assertTrue(listener.matches.size() <= 1);
        assertEquals(List.of("canceled"), listener.terminal);
        assertEquals(1, summary.getProcessed());
        // source plus the first candidate
        assertEquals(2, extractions.get());
    }

    @Test
    void scoreEqualToThresholdIsNotAMatch() throws IOException {
        Path source = image(sourceDir, "A.png", "A");
        features.put("one", FeatureFixtures.candidate(1));
        features.put("two", FeatureFixtures.candidate(2));
        image(candidates, "one.png", "one");
        image(candidates, "two.png", "two");

        RecordingListener atTen = new RecordingListener();
        scanner.scan(source, candidates, ScanConfig.defaults(), atTen);
        RecordingListener justBelow = new RecordingListener();
        scanner.scan(source, candidates, ScanConfig.builder().matchPercentageThreshold(9.999).build(), justBelow);

        assertEquals(10.0, atTen.progress.get(0).getLastPercentage());
        assertEquals(List.of("two.png"), atTen.matchNames());
        assertEquals(List.of("one.png", "two.png"), justBelow.matchNames());
    }

    @Test
    void missingInputsAreANoOp() throws IOException {
        Path source = image(sourceDir, "A.png", "A");
        ScanListener listener = mock(ScanListener.class);

        assertEquals(ScanStatus.NOT_STARTED, scanner.scan(null, candidates, ScanConfig.defaults(), listener).getStatus());
        assertEquals(ScanStatus.NOT_STARTED, scanner.scan(source, null, ScanConfig.defaults(), listener).getStatus());
        assertEquals(ScanStatus.NOT_STARTED, scanner.scan(source, root.resolve("nowhere"), ScanConfig.defaults(), listener).getStatus());
        assertEquals(ScanStatus.NOT_STARTED, scanner.scan(sourceDir.resolve("missing.png"), candidates, ScanConfig.defaults(), listener).getStatus());

        verifyNoInteractions(listener);
        assertEquals(0, extractions.get());
    }

    @Test
    void sourceWithoutKeypointsIsRejectedUpFront() throws IOException {
        Path source = image(sourceDir, "flat.png", "flat");
        image(candidates, "A.png", "A");
        RecordingListener listener = new RecordingListener();

        ScanSummary summary = scanner.scan(source, candidates, ScanConfig.defaults(), listener);

        assertEquals(ScanStatus.REJECTED, summary.getStatus());
        assertNotNull(summary.getReason());
        assertEquals(List.of("rejected"), listener.terminal);
        assertTrue(listener.progress.isEmpty());
        assertEquals(1, extractions.get());
    }

    @Test
    void undecodableSourceIsRejected() throws IOException {
        Path source = image(sourceDir, "A.png", "corrupt");
        image(candidates, "A.png", "A");
        RecordingListener listener = new RecordingListener();

        ScanSummary summary = scanner.scan(source, candidates, ScanConfig.defaults(), listener);

        assertEquals(ScanStatus.REJECTED, summary.getStatus());
        assertEquals(List.of("rejected"), listener.terminal);
    }

    @Test
    void failingExtractionOnSourceRejectsTheScan() throws IOException {
        Path source = image(sourceDir, "A.png", "boom");
        image(candidates, "A.png", "A");
        FeatureExtractor exploding = image -> {
            throw new IllegalStateException("native failure");
        };
        RecordingListener listener = new RecordingListener();

        ScanSummary summary = new ImageScanner(decoder, config -> exploding)
                .scan(source, candidates, ScanConfig.defaults(), listener);

        assertEquals(ScanStatus.REJECTED, summary.getStatus());
        assertTrue(summary.getReason().contains("native failure"));
        assertEquals(List.of("rejected"), listener.terminal);
        assertTrue(listener.progress.isEmpty());
        assertTrue(listener.matches.isEmpty());
    }

    @Test
    void candidateWithoutFeaturesIsSkipped() throws IOException {
        Path source = image(sourceDir, "A.png", "A");
        image(candidates, "blank.png", "blank");
        RecordingListener listener = new RecordingListener();

        ScanSummary summary = scanner.scan(source, candidates, ScanConfig.defaults(), listener);

        assertEquals(1, summary.getSkipped());
        assertEquals(0, summary.getAnalyzed());
        assertTrue(listener.progress.get(0).isSkipped());
    }

    @Test
    void failingExtractionOnlySkipsThatCandidate() throws IOException {
        Path source = image(sourceDir, "A.png", "A");
        image(candidates, "a_boom.png", "boom");
        image(candidates, "b_copy.png", "A");
        FeatureExtractor exploding = image -> {
            if (new String(image.copySamples(), StandardCharsets.UTF_8).equals("boom")) {
                throw new IllegalStateException("native failure");
            }
            return extractor.extract(image);
        };
        RecordingListener listener = new RecordingListener();

        ScanSummary summary = new ImageScanner(decoder, config -> exploding)
                .scan(source, candidates, ScanConfig.defaults(), listener);

        assertEquals(ScanStatus.COMPLETED, summary.getStatus());
        assertEquals(List.of("b_copy.png"), listener.matchNames());
    }

    @Test
    void highlightRegionWrapsMatchedCandidateKeypoints() throws IOException {
        Path source = image(sourceDir, "A.png", "A");
        features.put("three", FeatureFixtures.candidate(3));
        image(candidates, "three.png", "three");
        RecordingListener listener = new RecordingListener();

        scanner.scan(source, candidates, ScanConfig.builder().highlightRegion(true).build(), listener);

        // fixture keypoints sit at (10i, 5i) for i = 0..2
        assertEquals(new Region(0, 0, 21, 11), listener.matches.get(0).getRegion().orElseThrow());
    }

    @Test
    void repeatedScansGiveIdenticalScores() throws IOException {
        Path source = image(sourceDir, "A.png", "A");
        features.put("part", FeatureFixtures.candidate(4));
        image(candidates, "part.png", "part");

        RecordingListener first = new RecordingListener();
        RecordingListener second = new RecordingListener();
        scanner.scan(source, candidates, ScanConfig.defaults(), first);
        scanner.scan(source, candidates, ScanConfig.defaults(), second);

        assertEquals(40.0, first.progress.get(0).getLastPercentage());
        assertEquals(first.progress, second.progress);
    }

    @Test
    void taskRunsOnceAndKeepsLastProgress() throws IOException {
        Path source = image(sourceDir, "A.png", "A");
        image(candidates, "A.png", "A");
        ScanTask task = scanner.prepare(source, candidates, ScanConfig.defaults());

        assertTrue(task.getProgress().isEmpty());
        task.run(new RecordingListener());

        assertTrue(task.isFinished());
        assertEquals(1, task.getProgress().orElseThrow().getIndex());
        assertThrows(IllegalStateException.class, () -> task.run(new RecordingListener()));
    }

    @Test
    void invalidConfigurationIsRefused() {
        ScanConfig badRatio = ScanConfig.builder().ratioTestThreshold(1.5).build();

        assertThrows(IllegalArgumentException.class, () -> scanner.prepare(sourceDir, candidates, badRatio));
    }

    static class RecordingListener implements ScanListener {
        final List<ScanProgress> progress = new ArrayList<>();
        final List<MatchResult> matches = new ArrayList<>();
        final List<String> terminal = new ArrayList<>();

        @Override
        public void onProgress(ScanProgress p) {
            progress.add(p);
        }

        @Override
        public void onMatch(MatchResult result) {
            matches.add(result);
        }

        @Override
        public void onCompleted(ScanSummary summary) {
            terminal.add("completed");
        }

        @Override
        public void onCanceled(ScanSummary summary) {
            terminal.add("canceled");
        }

        @Override
        public void onRejected(ScanSummary summary) {
            terminal.add("rejected");
        }

        List<String> matchNames() {
            List<String> names = new ArrayList<>();
            for (MatchResult m : matches) names.add(m.getCandidate().getFileName().toString());
            return names;
        }
    }
}
