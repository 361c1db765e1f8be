package com.imagesearch.scan;

public enum ScanStatus {
    /** Source image or search directory missing, nothing was emitted. */
    NOT_STARTED,
    /** The source image could not be used (unreadable or without keypoints). */
    REJECTED,
    COMPLETED,
    CANCELED
}
