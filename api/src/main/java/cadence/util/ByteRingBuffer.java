package cadence.util;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Fixed size circular buffer of bytes. When full, storing a value overwrites the oldest one.
 * Not thread safe.
 */
public class ByteRingBuffer implements Iterable<Byte> {
    private final byte[] array;
    private int next;
    private int size;
    
    public ByteRingBuffer(int capacity) {
        if(capacity < 1) {
            throw new IllegalArgumentException("Capacity < 1");
        }
        this.array = new byte[capacity];
    }
    
    /**
     * Stores a value, dropping the oldest one if the buffer is full.
     *
     * @param value Value to store.
     */
    public void put(byte value) {
        array[next] = value;
        next = (next + 1) % array.length;
        if(size < array.length) {
            size++;
        }
    }
    
    public void clear() {
        next = 0;
        size = 0;
    }
    
    /**
     * Returns the sum of the stored values.
     *
     * @return The sum of all values in this buffer.
     */
    public int sum() {
        var sum = 0;
        for(var i = 0; i < size; i++) {
            sum += array[index(i)];
        }
        return sum;
    }
    
    public int size() {
        return size;
    }
    
    public int capacity() {
        return array.length;
    }
    
    /**
     * Returns the newest value.
     *
     * @return The last stored value.
     *
     * @throws NoSuchElementException If the buffer is empty.
     */
    public byte getLast() {
        if(size == 0) {
            throw new NoSuchElementException();
        }
        return array[index(size - 1)];
    }
    
    //0 is the oldest stored value
    private int index(int n) {
        var start = next - size;
        if(start < 0) start += array.length;
        return (start + n) % array.length;
    }
    
    /**
     * Iterates from the oldest to the newest value.
     */
    @Nonnull
    @Override
    public Iterator<Byte> iterator() {
        return new Iterator<>() {
            private int i;
            
            @Override
            public boolean hasNext() {
                return i < size;
            }
            
            @Override
            public Byte next() {
                if(!hasNext()) {
                    throw new NoSuchElementException();
                }
                return array[index(i++)];
            }
        };
    }
}
