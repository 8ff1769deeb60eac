package prodcons;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Spawns and joins the producers and consumers of one {@link CoordinatedBuffer}.
 * <p>
 * Every worker blocks for most of its life, so each one gets its own thread from a cached pool:
 * on a fixed pool smaller than the worker count, blocked producers could occupy every thread while the
 * consumers that would unblock them sit in the queue forever.
 * <p>
 * Exactly {@link PipelineConfig#producers()} producers and {@link PipelineConfig#consumers()} consumers must be
 * spawned before the run can terminate; spawning more is rejected.
 * <p>
 * Once every configured consumer has aborted nothing can drain the buffer any more, so the producers are
 * cancelled and their joins fail instead of blocking forever.
 */
@ThreadSafe
public final class ProducerConsumerPipeline<V> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProducerConsumerPipeline.class);
    private static final AtomicInteger PIPELINE_IDS = new AtomicInteger(1);

    private final PipelineConfig config;
    private final CoordinatedBuffer<V> buffer;
    private final ExecutorService executor;
    private final boolean recordProducedItems;
    @GuardedBy("this")
    private int spawnedProducers;
    @GuardedBy("this")
    private int spawnedConsumers;
    @GuardedBy("this")
    private int abortedConsumers;
    @GuardedBy("this")
    private final List<Future<?>> producerFutures = new ArrayList<>();

    public ProducerConsumerPipeline(PipelineConfig config) {
        this(config, false);
    }

    /**
     * @param recordProducedItems every producer report carries the items it put, see {@link ProducerReport#items()}
     */
    public ProducerConsumerPipeline(PipelineConfig config, boolean recordProducedItems) {
        this.config = Objects.requireNonNull(config, "config");
        this.recordProducedItems = recordProducedItems;
        this.buffer = new CoordinatedBuffer<>(config);
        this.executor = Executors.newCachedThreadPool(new WorkerThreadFactory(PIPELINE_IDS.getAndIncrement()));
        log.info("Pipeline created: {}", config);
    }

    /**
     * Spawns a producer that puts the configured number of items.
     */
    public WorkerHandle<ProducerReport<V>, ProducerWorker.State> spawnProducer(IntFunction<? extends V> generator) {
        return spawnProducer(config.itemsPerProducer(), generator);
    }

    public synchronized WorkerHandle<ProducerReport<V>, ProducerWorker.State> spawnProducer(int itemCount, IntFunction<? extends V> generator) {
        if (spawnedProducers == config.producers()) {
            throw new IllegalStateException("all " + config.producers() + " configured producers already spawned");
        }
        final int id = ++spawnedProducers;
        final ProducerWorker<V> worker = new ProducerWorker<>(id, itemCount, generator, buffer, recordProducedItems);
        final WorkerHandle<ProducerReport<V>, ProducerWorker.State> handle =
                submit("producer-" + id, worker, worker::state, null);
        producerFutures.add(handle.future());
        if (abortedConsumers == config.consumers()) {
            handle.future().cancel(true);
        }
        return handle;
    }

    public synchronized WorkerHandle<ConsumerReport, ConsumerWorker.State> spawnConsumer(Consumer<? super V> sink) {
        if (spawnedConsumers == config.consumers()) {
            throw new IllegalStateException("all " + config.consumers() + " configured consumers already spawned");
        }
        final int id = ++spawnedConsumers;
        final ConsumerWorker<V> worker = new ConsumerWorker<>(id, sink, buffer);
        return submit("consumer-" + id, worker, worker::state, this::consumerAborted);
    }

    /**
     * Blocks until the worker reaches its terminal state.
     *
     * @return the worker's report
     * @throws WorkerFailedException if the worker aborted or was cancelled
     */
    public <R> R join(WorkerHandle<R, ?> handle) throws InterruptedException {
        Objects.requireNonNull(handle, "handle");
        try {
            return handle.future().get();
        } catch (ExecutionException e) {
            throw new WorkerFailedException(handle.name() + " aborted", e.getCause());
        } catch (CancellationException e) {
            throw new WorkerFailedException(handle.name() + " cancelled, no consumer left to drain the buffer", e);
        }
    }

    /**
     * Spawns every configured worker, waits for all producers and then all consumers.
     * All workers are joined even if some fail. A consumer failure is thrown in preference to a producer
     * failure, since it is the cause when producers get cancelled; the other failures are suppressed.
     *
     * @param generators gives the item generator of the producer with the given 1-based id
     * @param sinks      gives the sink of the consumer with the given 1-based id
     */
    public PipelineResult<V> run(IntFunction<? extends IntFunction<? extends V>> generators,
                              IntFunction<? extends Consumer<? super V>> sinks) throws InterruptedException {
        Objects.requireNonNull(generators, "generators");
        Objects.requireNonNull(sinks, "sinks");
        final List<WorkerHandle<ConsumerReport, ConsumerWorker.State>> consumerHandles = new ArrayList<>();
        for (int i = 1; i <= config.consumers(); i++) {
            consumerHandles.add(spawnConsumer(sinks.apply(i)));
        }
        final List<WorkerHandle<ProducerReport<V>, ProducerWorker.State>> producerHandles = new ArrayList<>();
        for (int i = 1; i <= config.producers(); i++) {
            producerHandles.add(spawnProducer(generators.apply(i)));
        }

        RuntimeException producerFailure = null;
        final List<ProducerReport<V>> producerReports = new ArrayList<>();
        for (WorkerHandle<ProducerReport<V>, ProducerWorker.State> handle : producerHandles) {
            try {
                producerReports.add(join(handle));
            } catch (WorkerFailedException e) {
                producerFailure = combine(producerFailure, e);
            }
        }
        log.info("All {} producer(s) joined", producerHandles.size());
        RuntimeException consumerFailure = null;
        final List<ConsumerReport> consumerReports = new ArrayList<>();
        for (WorkerHandle<ConsumerReport, ConsumerWorker.State> handle : consumerHandles) {
            try {
                consumerReports.add(join(handle));
            } catch (WorkerFailedException e) {
                consumerFailure = combine(consumerFailure, e);
            }
        }
        log.info("All {} consumer(s) joined", consumerHandles.size());
        if (consumerFailure != null || producerFailure != null) {
            throw consumerFailure != null ? combine(consumerFailure, producerFailure) : producerFailure;
        }
        final PipelineResult<V> result = new PipelineResult<>(producerReports, consumerReports, buffer.highWaterMark());
        log.info("Pipeline finished: {}", result);
        return result;
    }

    public CoordinatedBuffer<V> buffer() {
        return buffer;
    }

    public PipelineConfig config() {
        return config;
    }

    /**
     * Releases the worker threads. Workers still blocked at this point are interrupted.
     */
    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker threads did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @param onAbort run when the worker fails with anything but an interruption, may be null
     */
    private <R, S extends Enum<S>> WorkerHandle<R, S> submit(String name, Callable<R> worker, Supplier<S> state,
                                                             Runnable onAbort) {
        final Callable<R> named = () -> {
            //name the pooled thread after the worker so buffer log lines identify it
            final Thread current = Thread.currentThread();
            final String previous = current.getName();
            current.setName(name);
            try {
                return worker.call();
            } catch (InterruptedException e) {
                //the worker already logged its interruption
                throw e;
            } catch (Exception | Error e) {
                log.error("{} aborted", name, e);
                if (onAbort != null) {
                    onAbort.run();
                }
                throw e;
            } finally {
                current.setName(previous);
            }
        };
        return new WorkerHandle<>(name, executor.submit(named), state);
    }

    private void consumerAborted() {
        final List<Future<?>> toCancel;
        synchronized (this) {
            abortedConsumers++;
            if (abortedConsumers < config.consumers()) {
                return;
            }
            toCancel = new ArrayList<>(producerFutures);
        }
        log.error("All {} consumer(s) aborted, cancelling {} producer(s)", config.consumers(), toCancel.size());
        for (Future<?> future : toCancel) {
            future.cancel(true);
        }
    }

    private static RuntimeException combine(RuntimeException primary, RuntimeException next) {
        if (primary == null) {
            return next;
        }
        if (next == null) {
            return primary;
        }
        primary.addSuppressed(next);
        return primary;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final int pipelineId;
        private final AtomicInteger threadIds = new AtomicInteger(1);

        WorkerThreadFactory(int pipelineId) {
            this.pipelineId = pipelineId;
        }

        @Override
        public Thread newThread(Runnable r) {
            return new Thread(r, "pipeline-" + pipelineId + "-worker-" + threadIds.getAndIncrement());
        }
    }
}
