package com.labelops.daemon;

import com.labelops.core.pipeline.BatchResult;

import java.nio.file.Path;

/**
 * Callbacks from {@link DaemonWatcher}. Invoked on the scanner thread for detection and on the
 * worker thread for everything else.
 */
public interface WatcherListener {
    WatcherListener NONE = new WatcherListener() {
    };

    default void onDetected(String clientId, Path file) {
    }

    default void onProcessingStarted(String clientId, Path file) {
    }

    default void onArchived(String clientId, Path file, Path archived, BatchResult result) {
    }

    default void onQuarantined(String clientId, Path file, Path quarantined, Exception cause) {
    }

    default void onStateChanged(String clientId, WatchState state) {
    }
}
