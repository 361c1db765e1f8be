package com.imagesearch.scan;

import lombok.Value;

/**
 * Snapshot published after each candidate.
 */
@Value
public class ScanProgress {
    String currentName;
    /** 1-based index of the candidate just handled. */
    int index;
    int total;
    /** Percentage of the last candidate that could be scored; carried over for skipped ones. */
    double lastPercentage;
    /** The candidate could not be decoded or had no features. */
    boolean skipped;
}
