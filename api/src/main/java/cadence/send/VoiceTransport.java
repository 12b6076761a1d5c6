package cadence.send;

import cadence.error.VoiceConnectException;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;

/**
 * Opens voice sessions. Implemented by the platform binding.
 */
public interface VoiceTransport {
    /**
     * Joins the given voice channel of a tenant.
     *
     * <br>If the tenant already has a session open, implementations should move it to the
     * new channel or close it; the player never keeps two sessions open for one tenant.
     *
     * @param tenantId  Tenant that owns the channel.
     * @param channelId Voice channel to join.
     *
     * @return An open session.
     *
     * @throws VoiceConnectException If the channel can't be joined.
     */
    @Nonnull
    @CheckReturnValue
    VoiceSession open(@Nonnull String tenantId, @Nonnull String channelId);
}
