package prodcons;

import net.jcip.annotations.NotThreadSafe;

/**
 * Termination bookkeeping shared by producers and consumers of one {@link CoordinatedBuffer}.
 * <p>
 * Counts producers that have not yet announced completion. Reaching zero is one-way and means
 * nothing will ever be put again. Every call must be made under the owning buffer's lock.
 */
@NotThreadSafe
final class ShutdownCoordinator {
    private final int consumers;
    private int activeProducers;

    ShutdownCoordinator(int producers, int consumers) {
        if (producers <= 0) {
            throw new InvalidConfigurationException("producer count must be > 0, was " + producers);
        }
        if (consumers <= 0) {
            throw new InvalidConfigurationException("consumer count must be > 0, was " + consumers);
        }
        this.activeProducers = producers;
        this.consumers = consumers;
    }

    /**
     * Records one producer's completion.
     *
     * @return how many wake-ups the caller must post: one per consumer when this was the last producer, else 0
     */
    int producerCompleted() {
        if (activeProducers == 0) {
            throw new IllegalStateException("completion announced after all producers had already finished");
        }
        activeProducers--;
        return activeProducers == 0 ? consumers : 0;
    }

    boolean isProductionFinished() {
        return activeProducers == 0;
    }

    /**
     * true when a consumer woken with the given occupancy must leave instead of taking an item.
     */
    boolean shouldExit(int occupied) {
        return activeProducers == 0 && occupied == 0;
    }

    int activeProducers() {
        return activeProducers;
    }
}
