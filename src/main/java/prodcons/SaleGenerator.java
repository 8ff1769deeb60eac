package prodcons;

import net.jcip.annotations.NotThreadSafe;

import java.util.Random;
import java.util.function.IntFunction;

/**
 * Generates the sale amounts rung up by one cash register: 1.00 to 1000.99 in whole cents.
 * Seeded, so the same register produces the same sales on every run.
 * Used by a single producer thread; the running total is read after that producer has been joined.
 * It counts every generated sale, including one whose put was interrupted.
 */
@NotThreadSafe
public final class SaleGenerator implements IntFunction<Double> {
    static final int CENT_RANGE = 100_000;
    static final int MIN_CENTS = 100;

    private final Random random;
    private long totalCents;
    private int generated;

    public SaleGenerator(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public Double apply(int sequence) {
        final int cents = random.nextInt(CENT_RANGE) + MIN_CENTS;
        totalCents += cents;
        generated++;
        return cents / 100.0;
    }

    /**
     * Whole cents of a sale amount produced by {@link #apply}.
     */
    static long toCents(double sale) {
        return Math.round(sale * 100);
    }

    public long totalCents() {
        return totalCents;
    }

    public int generated() {
        return generated;
    }
}
