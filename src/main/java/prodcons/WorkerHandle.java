package prodcons;

import net.jcip.annotations.ThreadSafe;

import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Reference to a spawned worker. Pass it to {@link ProducerConsumerPipeline#join(WorkerHandle)} to wait for it.
 */
@ThreadSafe
public final class WorkerHandle<R, S extends Enum<S>> {
    private final String name;
    private final Future<R> future;
    private final Supplier<S> state;

    WorkerHandle(String name, Future<R> future, Supplier<S> state) {
        this.name = name;
        this.future = future;
        this.state = state;
    }

    public String name() {
        return name;
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * current state-machine state of the worker, e.g. {@link ProducerWorker.State#DONE}.
     */
    public S state() {
        return state.get();
    }

    Future<R> future() {
        return future;
    }

    @Override
    public String toString() {
        return "WorkerHandle{" + name + ", state=" + state() + '}';
    }
}
