package com.imagesearch.scan;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScanSummary {
    ScanStatus status;
    int total;
    /** Candidates visited, skipped ones included. */
    int processed;
    int analyzed;
    int skipped;
    int matches;
    String reason;

    static ScanSummary notStarted(String reason) {
        return ScanSummary.builder().status(ScanStatus.NOT_STARTED).reason(reason).build();
    }
}
