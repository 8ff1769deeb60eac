package prodcons;

import net.jcip.annotations.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Sales processed by one manager (consumer): count, total, overall average and per-batch averages.
 * <p>
 * Sales are grouped in batches of {@code batchSize} in arrival order; the trailing batch may be partial.
 * Written by the manager's thread only. Read it after that manager has been joined.
 */
@NotThreadSafe
public final class SalesLedger implements Consumer<Double> {
    private static final Logger log = LoggerFactory.getLogger(SalesLedger.class);

    private final int managerId;
    private final int batchSize;
    private final List<Double> completedBatchAverages = new ArrayList<>();
    private long count;
    private long totalCents;
    private int batchCount;
    private long batchCents;

    public SalesLedger(int managerId, int batchSize) {
        if (batchSize <= 0) {
            throw new InvalidConfigurationException("batch size must be > 0, was " + batchSize);
        }
        this.managerId = managerId;
        this.batchSize = batchSize;
    }

    @Override
    public void accept(Double sale) {
        final long cents = SaleGenerator.toCents(sale);
        count++;
        totalCents += cents;
        batchCount++;
        batchCents += cents;
        if (batchCount == batchSize) {
            final double average = batchCents / 100.0 / batchCount;
            completedBatchAverages.add(average);
            log.info("Manager {} closed batch #{} of {} sale(s), average {}",
                    managerId, completedBatchAverages.size(), batchCount, String.format("%.2f", average));
            batchCount = 0;
            batchCents = 0;
        }
    }

    public int managerId() {
        return managerId;
    }

    public long count() {
        return count;
    }

    public long totalCents() {
        return totalCents;
    }

    public double total() {
        return totalCents / 100.0;
    }

    /**
     * @return average sale, 0 if nothing was processed
     */
    public double average() {
        return count == 0 ? 0.0 : totalCents / 100.0 / count;
    }

    /**
     * averages of all full batches followed by the average of the trailing partial batch, if any.
     */
    public List<Double> batchAverages() {
        final List<Double> averages = new ArrayList<>(completedBatchAverages);
        if (batchCount > 0) {
            averages.add(batchCents / 100.0 / batchCount);
        }
        return Collections.unmodifiableList(averages);
    }
}
