package io.gamevault.state.model;

/**
 * The (user, game) pair that exclusivity is enforced on.
 */
public record GameKeyRef(long userId, long gameKey) implements Comparable<GameKeyRef> {
    public GameKeyRef {
        if (userId <= 0L) {
            throw new IllegalArgumentException("userId must be positive: " + userId);
        }
        if (gameKey <= 0L) {
            throw new IllegalArgumentException("gameKey must be positive: " + gameKey);
        }
    }

    @Override
    public int compareTo(GameKeyRef other) {
        int byUser = Long.compare(userId, other.userId);
        return byUser != 0 ? byUser : Long.compare(gameKey, other.gameKey);
    }

    @Override
    public String toString() {
        return "user=" + userId + ",game=" + gameKey;
    }
}
