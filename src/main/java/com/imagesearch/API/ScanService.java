package com.imagesearch.API;

import com.imagesearch.scan.CollectingScanListener;
import com.imagesearch.scan.ImageScanner;
import com.imagesearch.scan.MatchResult;
import com.imagesearch.scan.ScanConfig;
import com.imagesearch.scan.ScanListener;
import com.imagesearch.scan.ScanProgress;
import com.imagesearch.scan.ScanStatus;
import com.imagesearch.scan.ScanSummary;
import com.imagesearch.scan.ScanTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ScanService {
    private final ImageScanner scanner;
    private final ImageSearchProperties properties;
    private final ExecutorService scanExecutor;
    private final Map<String, ScanTask> activeScans = new ConcurrentHashMap<>();

    public ScanService(ImageScanner scanner, ImageSearchProperties properties,
                       @Qualifier("scanExecutor") ExecutorService scanExecutor) {
        this.scanner = scanner;
        this.properties = properties;
        this.scanExecutor = scanExecutor;
    }

    /**
     * Runs a scan on the calling thread and returns every match it found.
     */
    public ScanReport runScan(ScanRequest request) {
        ScanTask task = prepare(request);
        activeScans.put(task.getId(), task);
        try {
            CollectingScanListener collector = new CollectingScanListener();
            ScanSummary summary = task.run(collector);
            return ScanReport.builder()
                    .scanId(task.getId())
                    .status(summary.getStatus())
                    .total(summary.getTotal())
                    .analyzed(summary.getAnalyzed())
                    .skipped(summary.getSkipped())
                    .matches(collector.getMatches().stream().map(MatchView::of).collect(Collectors.toList()))
                    .message(messageFor(summary))
                    .build();
        } finally {
            activeScans.remove(task.getId());
        }
    }

    /**
     * Starts a scan in the background and streams its events as server-sent events.
     * A client that goes away cancels the scan.
     */
    public SseEmitter streamScan(ScanRequest request) {
        ScanTask task = prepare(request);
        long timeout = properties.getStream().getTimeoutMs();
        SseEmitter emitter = timeout > 0 ? new SseEmitter(timeout) : new SseEmitter(0L);
        emitter.onCompletion(task::cancel);
        emitter.onTimeout(task::cancel);
        emitter.onError(e -> task.cancel());

        register(task);
        try {
            scanExecutor.submit(() -> runStreamed(task, emitter));
        } catch (RejectedExecutionException e) {
            activeScans.remove(task.getId());
            throw new IllegalStateException("Scan executor is shut down", e);
        }
        return emitter;
    }

    public boolean cancel(String scanId) {
        ScanTask task = activeScans.get(scanId);
        if (task == null) return false;
        task.cancel();
        return true;
    }

    public Optional<ScanProgress> progress(String scanId) {
        ScanTask task = activeScans.get(scanId);
        return task == null ? Optional.empty() : task.getProgress();
    }

    void register(ScanTask task) {
        activeScans.put(task.getId(), task);
    }

    boolean isActive(String scanId) {
        return activeScans.containsKey(scanId);
    }

    ScanConfig toConfig(ScanRequest request) {
        ScanConfig defaults = properties.toScanConfig();
        ScanConfig.ScanConfigBuilder builder = defaults.toBuilder();
        if (request.getMatchThreshold() != null) builder.matchPercentageThreshold(request.getMatchThreshold());
        if (request.getRatioThreshold() != null) builder.ratioTestThreshold(request.getRatioThreshold());
        if (request.getHighlightRegion() != null) builder.highlightRegion(request.getHighlightRegion());
        return builder.build();
    }

    private ScanTask prepare(ScanRequest request) {
        return scanner.prepare(toPath(request.getSourceImage()), toPath(request.getSearchDirectory()), toConfig(request));
    }

    void runStreamed(ScanTask task, SseEmitter emitter) {
        SseScanListener listener = new SseScanListener(task, emitter);
        try {
            // a scan that cannot start only reports not-started
            if (task.missingInput().isEmpty()) {
                listener.send("started", Map.of("scanId", task.getId()));
            }
            ScanSummary summary = task.run(listener);
            if (summary.getStatus() == ScanStatus.NOT_STARTED) {
                listener.send("not-started", summary);
            }
            emitter.complete();
        } catch (RuntimeException e) {
            log.error("Streamed scan {} failed", task.getId(), e);
            emitter.completeWithError(e);
        } finally {
            activeScans.remove(task.getId());
        }
    }

    private static Path toPath(String value) {
        if (value == null || value.isBlank()) return null;
        return Paths.get(value.trim());
    }

    private static String messageFor(ScanSummary summary) {
        switch (summary.getStatus()) {
            case NOT_STARTED:
                return "Scan not started: " + summary.getReason();
            case REJECTED:
                return "Scan rejected: " + summary.getReason();
            case CANCELED:
                return "Scan canceled after " + summary.getProcessed() + "/" + summary.getTotal() + " images";
            default:
                return "Analyzed " + summary.getAnalyzed() + " of " + summary.getTotal() + " images, "
                        + summary.getMatches() + " matches";
        }
    }

    /**
     * Forwards scan events to an SSE client; a failed send means the client left.
     */
    static class SseScanListener implements ScanListener {
        private final ScanTask task;
        private final SseEmitter emitter;

        SseScanListener(ScanTask task, SseEmitter emitter) {
            this.task = task;
            this.emitter = emitter;
        }

        void send(String name, Object data) {
            try {
                emitter.send(SseEmitter.event().name(name).data(data));
            } catch (IOException | IllegalStateException e) {
                log.debug("Client of scan {} disconnected: {}", task.getId(), e.getMessage());
                task.cancel();
            }
        }

        @Override
        public void onProgress(ScanProgress progress) {
            send("progress", progress);
        }

        @Override
        public void onMatch(MatchResult result) {
            send("match", MatchView.of(result));
        }

        @Override
        public void onCompleted(ScanSummary summary) {
            send("completed", summary);
        }

        @Override
        public void onCanceled(ScanSummary summary) {
            send("canceled", summary);
        }

        @Override
        public void onRejected(ScanSummary summary) {
            send("rejected", summary);
        }
    }
}
