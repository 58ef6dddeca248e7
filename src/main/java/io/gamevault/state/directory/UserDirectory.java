package io.gamevault.state.directory;

import java.util.Optional;

/**
 * Read-only mapping from an external authentication identity to the internal user key.
 */
public interface UserDirectory {
    Optional<Long> resolveUserId(String authIdentity);
}
