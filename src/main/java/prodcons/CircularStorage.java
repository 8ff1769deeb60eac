package prodcons;

import net.jcip.annotations.NotThreadSafe;

import java.util.Objects;

/**
 * Fixed-capacity ring of slots with explicit occupancy counter.
 * Has no concurrency control of its own: the owner must hold its lock around every call.
 * Full and empty are told apart by {@code occupied}, not by comparing head with tail.
 */
@NotThreadSafe
public final class CircularStorage<V> {
    private final V[] slots;
    //next read position
    private int head;
    //next write position
    private int tail;
    private int occupied;

    public CircularStorage(int capacity) {
        if (capacity <= 0) {
            throw new InvalidConfigurationException("capacity must be > 0, was " + capacity);
        }
        slots = (V[]) new Object[capacity];
    }

    /**
     * INVARIANT: storage must be not full
     */
    public void insert(V v) {
        Objects.requireNonNull(v, "item");
        if (occupied == slots.length) {
            throw new IllegalStateException("insert into full storage, capacity " + slots.length);
        }
        slots[tail++] = v;
        if (tail == slots.length) {
            tail = 0;
        }
        occupied++;
    }

    /**
     * INVARIANT: storage must be not empty
     */
    public V remove() {
        if (occupied == 0) {
            throw new IllegalStateException("remove from empty storage");
        }
        final V v = slots[head];
        //drop the reference so a consumed item is not kept alive by the ring
        slots[head++] = null;
        if (head == slots.length) {
            head = 0;
        }
        occupied--;
        return v;
    }

    public int capacity() {
        return slots.length;
    }

    public int occupied() {
        return occupied;
    }

    public boolean isEmpty() {
        return occupied == 0;
    }

    public boolean isFull() {
        return occupied == slots.length;
    }

    int head() {
        return head;
    }

    int tail() {
        return tail;
    }
}
