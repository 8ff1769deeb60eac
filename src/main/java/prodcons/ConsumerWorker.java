package prodcons;

import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * Drains the buffer into a sink until it is told nothing will ever arrive again.
 * <p>
 * Each wake-up is checked under the buffer lock before anything is removed, so a shutdown signal is never
 * mistaken for an item. The sink is called outside the lock, from this worker's thread only.
 */
@ThreadSafe
public final class ConsumerWorker<V> implements Callable<ConsumerReport> {
    private static final Logger log = LoggerFactory.getLogger(ConsumerWorker.class);

    public enum State {
        WAITING_FOR_ITEM,
        CHECKING_TERMINATION,
        CONSUMING,
        EXITING
    }

    private final int id;
    private final Consumer<? super V> sink;
    private final CoordinatedBuffer<V> buffer;
    private volatile State state = State.WAITING_FOR_ITEM;

    public ConsumerWorker(int id, Consumer<? super V> sink, CoordinatedBuffer<V> buffer) {
        this.id = id;
        this.sink = Objects.requireNonNull(sink, "sink");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    @Override
    public ConsumerReport call() throws InterruptedException {
        log.info("Consumer {} starting", id);
        int consumed = 0;
        try {
            while (true) {
                state = State.WAITING_FOR_ITEM;
                buffer.awaitItemSignal();
                state = State.CHECKING_TERMINATION;
                final Optional<V> item = buffer.removeOrPropagateShutdown();
                if (item.isEmpty()) {
                    state = State.EXITING;
                    break;
                }
                state = State.CONSUMING;
                sink.accept(item.get());
                consumed++;
            }
        } catch (InterruptedException e) {
            log.warn("Consumer {} interrupted after {} item(s)", id, consumed);
            throw e;
        }
        log.info("Consumer {} exiting, consumed {} item(s)", id, consumed);
        return new ConsumerReport(id, consumed);
    }

    public int id() {
        return id;
    }

    public State state() {
        return state;
    }
}
