package cadence.error;

import javax.annotation.Nonnull;

/**
 * Thrown when a command reaches a player that was already stopped.
 */
public class PlayerClosedException extends IllegalStateException {
    public PlayerClosedException(@Nonnull String tenantId) {
        super("Player for tenant " + tenantId + " is closed");
    }
}
