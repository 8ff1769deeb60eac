package prodcons;

import net.jcip.annotations.Immutable;

import java.util.Collections;
import java.util.List;

/**
 * Reports of every worker of one completed run plus the buffer's occupancy high-water mark.
 */
@Immutable
public final class PipelineResult<V> {
    private final List<ProducerReport<V>> producers;
    private final List<ConsumerReport> consumers;
    private final int highWaterMark;

    public PipelineResult(List<ProducerReport<V>> producers, List<ConsumerReport> consumers, int highWaterMark) {
        this.producers = Collections.unmodifiableList(producers);
        this.consumers = Collections.unmodifiableList(consumers);
        this.highWaterMark = highWaterMark;
    }

    public List<ProducerReport<V>> producers() {
        return producers;
    }

    public List<ConsumerReport> consumers() {
        return consumers;
    }

    public int highWaterMark() {
        return highWaterMark;
    }

    public long totalProduced() {
        long total = 0;
        for (ProducerReport<V> report : producers) {
            total += report.itemsProduced();
        }
        return total;
    }

    public long totalConsumed() {
        long total = 0;
        for (ConsumerReport report : consumers) {
            total += report.itemsConsumed();
        }
        return total;
    }

    /**
     * true when every produced item was consumed exactly once.
     */
    public boolean isConserved() {
        return totalProduced() == totalConsumed();
    }

    @Override
    public String toString() {
        return "PipelineResult{produced=" + totalProduced() + ", consumed=" + totalConsumed()
                + ", highWaterMark=" + highWaterMark + '}';
    }
}
