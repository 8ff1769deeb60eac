package prodcons;

public interface BoundedBuffer<V> {
    /**
     * puts an element to back of buffer or blocks caller while buffer is full.
     */
    void put(V v) throws InterruptedException;

    /**
     * takes an element from the head of buffer or blocks caller while buffer is empty.
     * Throws {@link BufferDrainedException} once nothing will ever be put again and the buffer is empty.
     */
    V take() throws InterruptedException;

    int capacity();

    /**
     * number of elements currently stored.
     */
    int size();
}
