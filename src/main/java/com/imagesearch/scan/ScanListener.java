package com.imagesearch.scan;

/**
 * Receives the events of one scan, on the thread running it.
 * <p>
 * Exactly one of {@link #onCompleted}, {@link #onCanceled} or {@link #onRejected} ends a scan
 * that started. A scan that did not start because its inputs are missing emits nothing.
 */
public interface ScanListener {

    default void onProgress(ScanProgress progress) {
    }

    default void onMatch(MatchResult result) {
    }

    default void onCompleted(ScanSummary summary) {
    }

    default void onCanceled(ScanSummary summary) {
    }

    default void onRejected(ScanSummary summary) {
    }
}
