package warden.core.model.abuse;

/**
 * Per-identifier abuse monitor state.
 *
 * <p>Transitions: {@code CLEAN -> WATCHING} on the first violation,
 * {@code WATCHING -> FLAGGED} when a pattern matches, {@code FLAGGED -> BLOCKED}
 * when a HIGH severity alert blocks the identifier, and {@code BLOCKED -> CLEAN}
 * when the block expires or is lifted.
 */
public enum MonitorState {
    CLEAN,
    WATCHING,
    FLAGGED,
    BLOCKED
}
