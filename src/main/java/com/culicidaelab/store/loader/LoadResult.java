package com.culicidaelab.store.loader;

/**
 * Result of a seed data loading operation
 */
public class LoadResult {
    private final boolean success;
    private final long recordsLoaded;
    private final long durationMs;
    private final String message;

    public LoadResult(boolean success, long recordsLoaded, long durationMs, String message) {
        this.success = success;
        this.recordsLoaded = recordsLoaded;
        this.durationMs = durationMs;
        this.message = message;
    }

    public boolean isSuccess() { return success; }
    public long getRecordsLoaded() { return recordsLoaded; }
    public long getDurationMs() { return durationMs; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return String.format("LoadResult{success=%s, records=%d, duration=%dms, message='%s'}",
                           success, recordsLoaded, durationMs, message);
    }
}
