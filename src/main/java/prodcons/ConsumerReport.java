package prodcons;

import net.jcip.annotations.Immutable;

@Immutable
public final class ConsumerReport {
    private final int id;
    private final int itemsConsumed;

    public ConsumerReport(int id, int itemsConsumed) {
        this.id = id;
        this.itemsConsumed = itemsConsumed;
    }

    public int id() {
        return id;
    }

    public int itemsConsumed() {
        return itemsConsumed;
    }

    @Override
    public String toString() {
        return "ConsumerReport{id=" + id + ", itemsConsumed=" + itemsConsumed + '}';
    }
}
