package cadence.send;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * Reports who is currently in a voice channel. Implemented by the platform binding.
 */
public interface PresenceQuery {
    /**
     * Returns how many members are connected to a voice channel, including the bot itself.
     *
     * @param tenantId  Tenant that owns the channel.
     * @param channelId Voice channel to inspect.
     *
     * @return The member count.
     */
    @Nonnegative
    @CheckReturnValue
    int occupancy(@Nonnull String tenantId, @Nonnull String channelId);
}
