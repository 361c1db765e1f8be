package com.imagesearch.scan;

import com.imagesearch.matching.Region;
import lombok.Value;

import java.nio.file.Path;
import java.util.Optional;

@Value
public class MatchResult {
    Path candidate;
    double percentage;
    Region region;

    public Optional<Region> getRegion() {
        return Optional.ofNullable(region);
    }
}
