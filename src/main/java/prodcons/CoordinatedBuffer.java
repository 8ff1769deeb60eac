package prodcons;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded buffer shared by a fixed number of producers and consumers that terminates cleanly.
 * <p>
 * Unlike a buffer built on condition queues, blocking happens on two counting semaphores
 * (free slots and available items) outside the lock, and the lock is only held for the mutation itself.
 * Ordering for both sides is: wait for the resource, lock, mutate, unlock, signal the other side.
 * <p>
 * Shutdown: every producer calls {@link #producerFinished()} exactly once. The last one posts one extra
 * item signal per consumer. A consumer that wakes, finds no producers left and an empty buffer, re-posts the
 * signal it consumed before leaving, so the wake-up travels on to every other waiter regardless of how many
 * consumers there are.
 */
@ThreadSafe
public final class CoordinatedBuffer<V> implements BoundedBuffer<V> {
    private static final Logger log = LoggerFactory.getLogger(CoordinatedBuffer.class);

    private final ReentrantLock lock = new ReentrantLock();
    @GuardedBy("lock")
    private final CircularStorage<V> storage;
    @GuardedBy("lock")
    private final ShutdownCoordinator shutdown;
    @GuardedBy("lock")
    private int highWaterMark;

    //permits are advisory: they may lag the guarded state between release and acquire, but every mutation
    //is re-validated under the lock
    private final Semaphore spacePermits;
    private final Semaphore itemPermits;

    public CoordinatedBuffer(int capacity, int producers, int consumers) {
        this.storage = new CircularStorage<>(capacity);
        this.shutdown = new ShutdownCoordinator(producers, consumers);
        this.spacePermits = new Semaphore(capacity);
        this.itemPermits = new Semaphore(0);
    }

    public CoordinatedBuffer(PipelineConfig config) {
        this(config.capacity(), config.producers(), config.consumers());
    }

    @Override
    public void put(V v) throws InterruptedException {
        Objects.requireNonNull(v, "item");
        //we must not hold the lock while waiting for space, otherwise no consumer could ever free a slot
        spacePermits.acquire();
        final int occupied;
        lock.lock();
        try {
            if (shutdown.isProductionFinished()) {
                //nothing changed, hand the slot back before failing
                spacePermits.release();
                throw new IllegalStateException("put rejected: all producers have already announced completion");
            }
            storage.insert(v);
            occupied = storage.occupied();
            if (occupied > highWaterMark) {
                highWaterMark = occupied;
            }
        } finally {
            lock.unlock();
        }
        itemPermits.release();
        if (log.isDebugEnabled()) {
            log.debug("{} put {}, occupancy {}/{}", Thread.currentThread().getName(), v, occupied, storage.capacity());
        }
    }

    @Override
    public V take() throws InterruptedException {
        return takeOrDrained().orElseThrow(
                () -> new BufferDrainedException("all producers have finished and the buffer is drained"));
    }

    /**
     * Blocks until an item or the shutdown signal arrives.
     *
     * @return the item at the head, or empty if nothing will ever be put again
     */
    public Optional<V> takeOrDrained() throws InterruptedException {
        awaitItemSignal();
        return removeOrPropagateShutdown();
    }

    /**
     * Consumes one item signal, blocking while there is none. The signal may come from a put or from shutdown.
     */
    void awaitItemSignal() throws InterruptedException {
        itemPermits.acquire();
    }

    /**
     * Second half of a take, to be called right after {@link #awaitItemSignal()}.
     * Re-checks the termination condition under the lock and either removes the head item or,
     * if the signal was a shutdown wake-up, re-posts it for the next waiter and returns empty.
     */
    Optional<V> removeOrPropagateShutdown() {
        V v = null;
        int occupied = 0;
        lock.lock();
        try {
            if (!shutdown.shouldExit(storage.occupied())) {
                if (storage.isEmpty()) {
                    //a signal without an item is only legal after the last producer finished
                    throw new IllegalStateException("item signal consumed with empty buffer while "
                            + shutdown.activeProducers() + " producer(s) still active");
                }
                v = storage.remove();
                occupied = storage.occupied();
            }
        } finally {
            lock.unlock();
        }
        if (v == null) {
            //pass the wake-up on: the next blocked consumer must also reach this check
            itemPermits.release();
            log.debug("{} woke on shutdown signal with empty buffer", Thread.currentThread().getName());
            return Optional.empty();
        }
        spacePermits.release();
        if (log.isDebugEnabled()) {
            log.debug("{} took {}, occupancy {}/{}", Thread.currentThread().getName(), v, occupied, storage.capacity());
        }
        return Optional.of(v);
    }

    /**
     * Announces that the calling producer will put nothing more. Must be called exactly once per producer.
     */
    public void producerFinished() {
        final int wakeUps;
        final int remaining;
        lock.lock();
        try {
            wakeUps = shutdown.producerCompleted();
            remaining = shutdown.activeProducers();
        } finally {
            lock.unlock();
        }
        log.info("{} announced completion, active producers: {}", Thread.currentThread().getName(), remaining);
        if (wakeUps > 0) {
            //rounded up on purpose: extra wake-ups are re-posted by whoever consumes them, missing ones deadlock
            log.info("Last producer finished, posting {} wake-up(s) for consumers", wakeUps);
            itemPermits.release(wakeUps);
        }
    }

    @Override
    public int capacity() {
        return storage.capacity();
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return storage.occupied();
        } finally {
            lock.unlock();
        }
    }

    /**
     * largest occupancy ever observed after a put.
     */
    public int highWaterMark() {
        lock.lock();
        try {
            return highWaterMark;
        } finally {
            lock.unlock();
        }
    }

    public int activeProducers() {
        lock.lock();
        try {
            return shutdown.activeProducers();
        } finally {
            lock.unlock();
        }
    }

    public boolean isProductionFinished() {
        lock.lock();
        try {
            return shutdown.isProductionFinished();
        } finally {
            lock.unlock();
        }
    }

    public int availableSpacePermits() {
        return spacePermits.availablePermits();
    }

    public int availableItemPermits() {
        return itemPermits.availablePermits();
    }

    //the lock is private and no callback runs under it, so no caller can hold it on entry
    boolean isLockHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
