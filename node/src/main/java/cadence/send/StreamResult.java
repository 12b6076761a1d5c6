package cadence.send;

/**
 * How a stream ended, when it didn't fail.
 */
public enum StreamResult {
    /** Every frame was written. */
    FINISHED,
    /** The token was cancelled before the last frame. */
    CANCELLED
}
