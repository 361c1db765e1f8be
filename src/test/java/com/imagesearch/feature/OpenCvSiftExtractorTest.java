package com.imagesearch.feature;

import com.imagesearch.TestImages;
import com.imagesearch.imageOperator.PixelGrid;
import com.imagesearch.matching.DescriptorMatcher;
import com.imagesearch.matching.SimilarityScorer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OpenCvSiftExtractorTest {

    private final FeatureExtractor extractor = new OpenCvSiftExtractor(DetectorConfig.defaults());

    @Test
    void texturedImageYieldsPairedKeypointsAndDescriptors() {
        FeatureSet features = extractor.extract(TestImages.toGrid(TestImages.shapes(1, 320, 240)));

        assertFalse(features.isEmpty());
        assertEquals(features.getKeypoints().size(), features.size());
        assertEquals(128, features.getDimension());
        for (Keypoint kp : features.getKeypoints()) {
            assertTrue(kp.getX() >= 0 && kp.getX() < 320);
            assertTrue(kp.getY() >= 0 && kp.getY() < 240);
        }
    }

    @Test
    void featurelessImageYieldsEmptySet() {
        assertTrue(extractor.extract(TestImages.toGrid(TestImages.blank(200, 150))).isEmpty());
    }

    @Test
    void grayscaleInputIsAccepted() {
        PixelGrid color = TestImages.toGrid(TestImages.shapes(3, 200, 200));
        byte[] gray = new byte[200 * 200];
        for (int y = 0; y < 200; y++) {
            for (int x = 0; x < 200; x++) {
                gray[y * 200 + x] = (byte) color.sample(x, y, 1);
            }
        }

        FeatureSet features = extractor.extract(new PixelGrid(200, 200, 1, gray));

        assertFalse(features.isEmpty());
    }

    @Test
    void extractionIsDeterministicAndSelfMatchIsNearComplete() {
        PixelGrid image = TestImages.toGrid(TestImages.shapes(11, 320, 240));

        FeatureSet first = extractor.extract(image);
        FeatureSet second = extractor.extract(image);
        DescriptorMatcher matcher = new DescriptorMatcher();
        double score = SimilarityScorer.score(matcher.match(first, second), first.size());

        assertEquals(first.size(), second.size());
        assertEquals(score, SimilarityScorer.score(matcher.match(first, second), first.size()));
        assertTrue(score >= 90.0, "self match scored " + score);
    }

    @Test
    void maxFeaturesCapsTheKeypointCount() {
        FeatureExtractor capped = new OpenCvSiftExtractor(DetectorConfig.builder().maxFeatures(20).build());

        FeatureSet features = capped.extract(TestImages.toGrid(TestImages.shapes(5, 320, 240)));

        assertTrue(features.size() <= 25, "got " + features.size());
    }

    @Test
    void detectorParametersReachOpenCv() {
        PixelGrid image = TestImages.toGrid(TestImages.shapes(5, 320, 240));
        FeatureExtractor strict = new OpenCvSiftExtractor(DetectorConfig.builder()
                .contrastThreshold(0.2)
                .edgeThreshold(5.0)
                .build());

        int loose = extractor.extract(image).size();
        int tight = strict.extract(image).size();

        assertTrue(tight < loose, "strict " + tight + " vs default " + loose);
    }
}
