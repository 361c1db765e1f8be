package com.imagesearch.matching;

/**
 * The inputs admit no meaningful similarity score, e.g. a source image without keypoints.
 */
public class DegenerateInputException extends RuntimeException {
    public DegenerateInputException(String message) {
        super(message);
    }
}
