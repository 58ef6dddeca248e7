package io.gamevault.state.engine;

/**
 * Root of the engine's domain errors. {@link #kind()} is the stable name surfaced to callers and
 * operators.
 */
public abstract class GameStateException extends RuntimeException {
    protected GameStateException(String message) {
        super(message);
    }

    protected GameStateException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String kind();
}
