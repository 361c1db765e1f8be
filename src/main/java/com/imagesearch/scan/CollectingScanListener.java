package com.imagesearch.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps the matches of a scan and optionally forwards every event.
 */
public class CollectingScanListener implements ScanListener {
    private final List<MatchResult> matches = Collections.synchronizedList(new ArrayList<>());
    private final ScanListener delegate;

    public CollectingScanListener() {
        this(new ScanListener() {
        });
    }

    public CollectingScanListener(ScanListener delegate) {
        this.delegate = delegate;
    }

    @Override
    public void onProgress(ScanProgress progress) {
        delegate.onProgress(progress);
    }

    @Override
    public void onMatch(MatchResult result) {
        matches.add(result);
        delegate.onMatch(result);
    }

    @Override
    public void onCompleted(ScanSummary summary) {
        delegate.onCompleted(summary);
    }

    @Override
    public void onCanceled(ScanSummary summary) {
        delegate.onCanceled(summary);
    }

    @Override
    public void onRejected(ScanSummary summary) {
        delegate.onRejected(summary);
    }

    public List<MatchResult> getMatches() {
        synchronized (matches) {
            return List.copyOf(matches);
        }
    }
}
