package com.labelops.config;

/**
 * Per-client working folders and the directory names used when a client does not override them.
 */
public enum FolderKind {
    IN_TXT("in_txt", "IN_TXT"),
    READY_XLSX("ready_xlsx", "READY_XLSX"),
    ARCHIVE("archive", "ARCHIVE"),
    TRACKING_OUT("tracking_out", "TRACKING_OUT"),
    FAILURES("failures", "FAILURES");

    private final String key;
    private final String defaultDirectoryName;

    FolderKind(String key, String defaultDirectoryName) {
        this.key = key;
        this.defaultDirectoryName = defaultDirectoryName;
    }

    public String key() {
        return key;
    }

    public String defaultDirectoryName() {
        return defaultDirectoryName;
    }
}
