package com.labelops.core.pipeline;

import java.util.Locale;

/**
 * Where a batch's text came from, as recorded in its manifest.
 */
public enum BatchSource {
    TELEGRAM,
    WATCH,
    GUI,
    CLI;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
