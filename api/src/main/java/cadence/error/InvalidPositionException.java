package cadence.error;

/**
 * Thrown when removing a queue position that doesn't exist. The queue is left untouched.
 */
public class InvalidPositionException extends IllegalArgumentException {
    private final int position;
    private final int size;
    
    public InvalidPositionException(int position, int size) {
        super("Invalid position " + position + ", queue has " + size + " pending songs");
        this.position = position;
        this.size = size;
    }
    
    public int position() {
        return position;
    }
    
    public int size() {
        return size;
    }
}
