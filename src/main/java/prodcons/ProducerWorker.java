package prodcons;

import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.IntFunction;

/**
 * Puts a fixed number of generated items into the buffer, then announces completion exactly once.
 * <p>
 * Completion is announced even if the worker is interrupted or the generator fails: a producer that never
 * announced would keep every consumer blocked forever. The failure still propagates to the caller.
 */
@ThreadSafe
public final class ProducerWorker<V> implements Callable<ProducerReport<V>> {
    private static final Logger log = LoggerFactory.getLogger(ProducerWorker.class);

    public enum State {
        PRODUCING,
        ANNOUNCING_COMPLETION,
        DONE
    }

    private final int id;
    private final int itemCount;
    private final IntFunction<? extends V> generator;
    private final CoordinatedBuffer<V> buffer;
    private final boolean recordItems;
    private volatile State state = State.PRODUCING;

    /**
     * @param generator maps the 0-based sequence number of an item to the item itself
     */
    public ProducerWorker(int id, int itemCount, IntFunction<? extends V> generator, CoordinatedBuffer<V> buffer) {
        this(id, itemCount, generator, buffer, false);
    }

    /**
     * @param recordItems keep every item that was successfully put and return them in the report
     */
    public ProducerWorker(int id, int itemCount, IntFunction<? extends V> generator, CoordinatedBuffer<V> buffer,
                          boolean recordItems) {
        if (itemCount < 0) {
            throw new InvalidConfigurationException("item count must be >= 0, was " + itemCount);
        }
        this.id = id;
        this.itemCount = itemCount;
        this.generator = Objects.requireNonNull(generator, "generator");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.recordItems = recordItems;
    }

    @Override
    public ProducerReport<V> call() throws InterruptedException {
        log.info("Producer {} starting, {} item(s) to produce", id, itemCount);
        final List<V> recorded = recordItems ? new ArrayList<>(itemCount) : null;
        int produced = 0;
        try {
            for (int i = 0; i < itemCount; i++) {
                final V item = generator.apply(i);
                buffer.put(item);
                produced++;
                //only items the buffer accepted count
                if (recorded != null) {
                    recorded.add(item);
                }
            }
        } catch (InterruptedException e) {
            log.warn("Producer {} interrupted after {} of {} item(s)", id, produced, itemCount);
            throw e;
        } finally {
            state = State.ANNOUNCING_COMPLETION;
            buffer.producerFinished();
            state = State.DONE;
        }
        log.info("Producer {} done, produced {} item(s)", id, produced);
        if (recorded != null) {
            return new ProducerReport<>(id, recorded);
        }
        return new ProducerReport<>(id, produced);
    }

    public int id() {
        return id;
    }

    public State state() {
        return state;
    }
}
