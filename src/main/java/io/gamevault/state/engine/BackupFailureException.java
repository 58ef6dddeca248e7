package io.gamevault.state.engine;

/**
 * No confirmed snapshot is available. The resolver refuses to run until one is.
 */
public final class BackupFailureException extends GameStateException {
    public BackupFailureException(String message) {
        super(message);
    }

    public BackupFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "BackupFailure";
    }
}
