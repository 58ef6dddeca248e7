package io.gamevault.state.engine;

/**
 * A resolver chunk failed and was rolled back. Chunks committed before it stay resolved and
 * logged.
 */
public final class ResolutionFailureException extends GameStateException {
    private final String runId;
    private final int failedChunk;
    private final int pairsResolvedBefore;
    private final int logEntriesBefore;

    public ResolutionFailureException(String runId, int failedChunk, int pairsResolvedBefore, int logEntriesBefore,
                                      Throwable cause) {
        super("Resolution run " + runId + " failed in chunk " + failedChunk
                + " after " + pairsResolvedBefore + " resolved pair(s): " + cause.getMessage(), cause);
        this.runId = runId;
        this.failedChunk = failedChunk;
        this.pairsResolvedBefore = pairsResolvedBefore;
        this.logEntriesBefore = logEntriesBefore;
    }

    @Override
    public String kind() {
        return "ResolutionFailure";
    }

    public String runId() {
        return runId;
    }

    public int failedChunk() {
        return failedChunk;
    }

    public int pairsResolvedBefore() {
        return pairsResolvedBefore;
    }

    public int logEntriesBefore() {
        return logEntriesBefore;
    }
}
