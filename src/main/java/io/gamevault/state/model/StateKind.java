package io.gamevault.state.model;

/**
 * The three tracking sets, declared in ascending priority. A record of a higher kind always
 * wins over a record of a lower kind for the same user and game.
 */
public enum StateKind {
    WISHLIST("Wishlist", "user_wishlist"),
    COLLECTION("Collection", "user_collection"),
    PROGRESS("Progress", "game_progress");

    private final String label;
    private final String table;

    StateKind(String label, String table) {
        this.label = label;
        this.table = table;
    }

    public String label() {
        return label;
    }

    public String table() {
        return table;
    }

    public int priority() {
        return ordinal();
    }

    public boolean outranks(StateKind other) {
        return other == null || priority() > other.priority();
    }

    /**
     * Pairwise label with the lower kind first, for example {@code Wishlist-Progress}.
     */
    public static String pairLabel(StateKind a, StateKind b) {
        StateKind low = a.priority() <= b.priority() ? a : b;
        StateKind high = low == a ? b : a;
        return low.label + "-" + high.label;
    }

    public static StateKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("State kind must not be blank");
        }
        String value = raw.trim();
        for (StateKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value) || kind.label.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        if ("started".equalsIgnoreCase(value) || "completed".equalsIgnoreCase(value)) {
            return PROGRESS;
        }
        throw new IllegalArgumentException("Unknown state kind: " + raw);
    }

    public static StateKind fromLabelOrNull(String raw) {
        return raw == null || raw.isBlank() ? null : fromString(raw);
    }
}
