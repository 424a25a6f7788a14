package com.labelops.daemon;

/**
 * Per-client watcher state. {@link #QUARANTINED} lasts until the client's next file is detected.
 */
public enum WatchState {
    IDLE,
    DETECTED,
    PROCESSING,
    QUARANTINED
}
