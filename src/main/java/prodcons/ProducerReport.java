package prodcons;

import net.jcip.annotations.Immutable;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one producer. The items themselves are only kept when the producer was asked to record them.
 */
@Immutable
public final class ProducerReport<V> {
    private final int id;
    private final int itemsProduced;
    private final List<V> items;

    public ProducerReport(int id, int itemsProduced) {
        this.id = id;
        this.itemsProduced = itemsProduced;
        this.items = null;
    }

    /**
     * @param items every item that was put, in put order
     */
    public ProducerReport(int id, List<V> items) {
        this.id = id;
        this.itemsProduced = items.size();
        this.items = Collections.unmodifiableList(items);
    }

    public int id() {
        return id;
    }

    public int itemsProduced() {
        return itemsProduced;
    }

    public boolean hasRecordedItems() {
        return items != null;
    }

    /**
     * @throws IllegalStateException if the producer did not record its items
     */
    public List<V> items() {
        if (items == null) {
            throw new IllegalStateException("producer " + id + " did not record its items");
        }
        return items;
    }

    @Override
    public String toString() {
        return "ProducerReport{id=" + id + ", itemsProduced=" + itemsProduced + '}';
    }
}
