package com.imagesearch.feature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keypoints of one image and their descriptors. {@code getKeypoints().get(i)} is described by
 * {@code getDescriptor(i)}.
 */
public final class FeatureSet {
    private static final FeatureSet EMPTY = new FeatureSet(List.of(), new float[0][]);

    private final List<Keypoint> keypoints;
    private final float[][] descriptors;
    private final int dimension;

    public FeatureSet(List<Keypoint> keypoints, float[][] descriptors) {
        if (keypoints == null || descriptors == null) {
            throw new IllegalArgumentException("keypoints and descriptors are required");
        }
        if (keypoints.size() != descriptors.length) {
            throw new IllegalArgumentException("Got " + keypoints.size() + " keypoints but "
                    + descriptors.length + " descriptors");
        }
        int dim = descriptors.length == 0 ? 0 : descriptors[0].length;
        float[][] copy = new float[descriptors.length][];
        for (int i = 0; i < descriptors.length; i++) {
            if (descriptors[i] == null || descriptors[i].length != dim) {
                throw new IllegalArgumentException("Descriptor " + i + " does not have dimension " + dim);
            }
            copy[i] = descriptors[i].clone();
        }
        this.keypoints = Collections.unmodifiableList(new ArrayList<>(keypoints));
        this.descriptors = copy;
        this.dimension = dim;
    }

    public static FeatureSet empty() {
        return EMPTY;
    }

    public List<Keypoint> getKeypoints() {
        return keypoints;
    }

    public int size() {
        return keypoints.size();
    }

    public boolean isEmpty() {
        return keypoints.isEmpty();
    }

    public int getDimension() {
        return dimension;
    }

    /**
     * Descriptor row without copying, for matchers that run in a tight loop. Callers must not
     * write to the returned array.
     */
    public float[] descriptorRow(int index) {
        return descriptors[index];
    }

    public float[] getDescriptor(int index) {
        return descriptors[index].clone();
    }
}
