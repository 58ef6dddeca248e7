package io.gamevault.state.engine;

/**
 * Per-call write options. Skipping enforcement is an explicit, audited argument of the write
 * itself and never ambient connection state.
 */
public record WriteOptions(String bypassReason) {
    public static final WriteOptions GUARDED = new WriteOptions(null);

    public static WriteOptions bypass(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A bypass must state its reason");
        }
        return new WriteOptions(reason.trim());
    }

    public boolean bypass() {
        return bypassReason != null;
    }
}
