package cadence.send;

import cadence.error.TransportException;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;

/**
 * Live connection to one voice channel, into which encoded frames are written in order.
 * The format of the frames depends on the transport. Currently only opus audio is supported.
 */
public interface VoiceSession extends AutoCloseable {
    /**
     * Tenant this session belongs to.
     *
     * @return The tenant id.
     */
    @Nonnull
    @CheckReturnValue
    String tenantId();
    
    /**
     * Voice channel this session is connected to.
     *
     * @return The channel id.
     */
    @Nonnull
    @CheckReturnValue
    String channelId();
    
    /**
     * Writes one frame. Called once per frame interval by the streamer, never concurrently.
     *
     * <br>This method must not block for longer than a frame interval.
     *
     * @param frame Encoded frame. Must not be modified.
     *
     * @throws TransportException If the frame can't be sent.
     */
    void sendFrame(@Nonnull byte[] frame);
    
    /**
     * Leaves the voice channel. Called exactly once by the owning player.
     */
    @Override
    void close();
}
