package com.imagesearch.API;

import com.imagesearch.matching.Region;
import com.imagesearch.scan.MatchResult;
import lombok.Value;

@Value
public class MatchView {
    String path;
    String fileName;
    double percentage;
    Region region;

    public static MatchView of(MatchResult result) {
        return new MatchView(result.getCandidate().toString(),
                result.getCandidate().getFileName().toString(),
                result.getPercentage(),
                result.getRegion().orElse(null));
    }
}
