package com.imagesearch.API;

import com.imagesearch.scan.ScanStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ScanReport {
    String scanId;
    ScanStatus status;
    int total;
    int analyzed;
    int skipped;
    List<MatchView> matches;
    String message;
}
