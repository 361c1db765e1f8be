package com.imagesearch;

import com.imagesearch.scan.ImageScanner;
import com.imagesearch.scan.MatchResult;
import com.imagesearch.scan.ScanConfig;
import com.imagesearch.scan.ScanListener;
import com.imagesearch.scan.ScanProgress;
import com.imagesearch.scan.ScanSummary;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line scan: {@code ScanMain <sourceImage> <searchDirectory> [matchThreshold]}.
 */
@Slf4j
public class ScanMain {

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: ScanMain <sourceImage> <searchDirectory> [matchThreshold]");
            return;
        }
        Path source = Paths.get(args[0]);
        Path directory = Paths.get(args[1]);
        ScanConfig.ScanConfigBuilder config = ScanConfig.builder();
        if (args.length > 2) {
            config.matchPercentageThreshold(Double.parseDouble(args[2]));
        }

        ScanSummary summary = new ImageScanner().scan(source, directory, config.build(), new ScanListener() {
            @Override
            public void onProgress(ScanProgress progress) {
                log.info("[{}/{}] {} {}", progress.getIndex(), progress.getTotal(), progress.getCurrentName(),
                        progress.isSkipped() ? "skipped" : String.format("%.2f%%", progress.getLastPercentage()));
            }

            @Override
            public void onMatch(MatchResult result) {
                System.out.printf("MATCH %6.2f%%  %s%n", result.getPercentage(), result.getCandidate());
            }

            @Override
            public void onRejected(ScanSummary rejected) {
                System.err.println("Scan rejected: " + rejected.getReason());
            }
        });
        log.info("Scan finished with status {}: {} analyzed, {} skipped, {} matches",
                summary.getStatus(), summary.getAnalyzed(), summary.getSkipped(), summary.getMatches());
    }
}
