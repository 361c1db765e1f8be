package com.imagesearch.feature;

public enum DetectorType {
    /** OpenCV's SIFT implementation. */
    OPENCV,
    /** The in-house scale-space detector in {@code com.imagesearch.openpanoSIFT}. */
    OPENPANO
}
