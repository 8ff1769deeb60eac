package prodcons;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SaleGeneratorTest {

    @Test
    public void testSameSeedRingsUpSameSales() {
        final var a = new SaleGenerator(7);
        final var b = new SaleGenerator(7);
        for (int i = 0; i < 100; i++) {
            assertThat(a.apply(i)).isEqualTo(b.apply(i));
        }
        assertThat(a.totalCents()).isEqualTo(b.totalCents());
    }

    @Test
    public void testAmountsAreWholeCentsWithinRange() {
        final var generator = new SaleGenerator(1);
        long cents = 0;
        for (int i = 0; i < 10_000; i++) {
            final double sale = generator.apply(i);
            assertThat(sale).isBetween(1.00, 1000.99);
            final long saleCents = Math.round(sale * 100);
            assertThat(saleCents / 100.0).isEqualTo(sale);
            cents += saleCents;
        }
        assertThat(generator.generated()).isEqualTo(10_000);
        assertThat(generator.totalCents()).isEqualTo(cents);
    }
}
