package io.gamevault.state.engine;

public final class RollbackFailureException extends GameStateException {
    public RollbackFailureException(String message) {
        super(message);
    }

    public RollbackFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "RollbackFailure";
    }
}
