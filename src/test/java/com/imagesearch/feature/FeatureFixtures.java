package com.imagesearch.feature;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-built feature sets with predictable ratio-test outcomes.
 * <p>
 * Source descriptors are unit vectors e0..e(n-1). A candidate built by {@link #candidate} holds
 * e0..e(k-1) plus two zero vectors: e0..e(k-1) then match exactly, while every other source
 * descriptor sits at distance 1 from both zero vectors and fails the ratio test.
 */
public final class FeatureFixtures {
    public static final int DIM = 16;

    private FeatureFixtures() {
    }

    public static float[] unit(int i) {
        float[] v = new float[DIM];
        v[i] = 1f;
        return v;
    }

    public static FeatureSet source(int n) {
        List<float[]> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) rows.add(unit(i));
        return of(rows);
    }

    public static FeatureSet candidate(int matching) {
        List<float[]> rows = new ArrayList<>();
        for (int i = 0; i < matching; i++) rows.add(unit(i));
        rows.add(new float[DIM]);
        rows.add(new float[DIM]);
        return of(rows);
    }

    public static FeatureSet of(List<float[]> descriptors) {
        List<Keypoint> kps = new ArrayList<>();
        for (int i = 0; i < descriptors.size(); i++) {
            kps.add(new Keypoint(10f * i, 5f * i, 2f, 0f, 1f, 0));
        }
        return new FeatureSet(kps, descriptors.toArray(new float[0][]));
    }
}
