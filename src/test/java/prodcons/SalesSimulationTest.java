package prodcons;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SalesSimulationTest {

    @Test
    @Timeout(30)
    public void testManagersProcessExactlyWhatRegistersRangUp() throws InterruptedException {
        final var config = PipelineConfig.builder().capacity(5).producers(6).itemsPerProducer(40).consumers(2).build();
        final var simulation = new SalesSimulation(config, 42L);

        final PipelineResult<Double> result = simulation.run();

        assertThat(result.isConserved()).isTrue();
        assertThat(result.totalConsumed()).isEqualTo(240);
        assertThat(simulation.isBalanced()).isTrue();
        long processed = 0;
        for (SalesLedger manager : simulation.managers()) {
            processed += manager.count();
        }
        assertThat(processed).isEqualTo(240);
    }

    @Test
    @Timeout(30)
    public void testSalesGeneratedButNeverPutDoNotUnbalance() throws InterruptedException {
        final var config = PipelineConfig.builder().capacity(3).producers(2).itemsPerProducer(10).consumers(2).build();
        final var simulation = new SalesSimulation(config, 7L);
        simulation.run();

        //a register that rang up a sale and was stopped before handing it over
        final SaleGenerator register = simulation.registers().get(0);
        register.apply(10);
        assertThat(register.generated()).isEqualTo(11);

        assertThat(simulation.isBalanced()).isTrue();
    }

    @Test
    public void testUnprocessedPutSaleUnbalances() {
        final var ledger = new SalesLedger(1, 5);
        ledger.accept(12.50);
        final var result = new PipelineResult<Double>(
                List.of(new ProducerReport<>(1, List.of(12.50, 3.25))),
                List.of(new ConsumerReport(1, 1)),
                2);

        assertThat(SalesSimulation.isBalanced(result, List.of(ledger))).isFalse();
        ledger.accept(3.25);
        assertThat(SalesSimulation.isBalanced(result, List.of(ledger))).isTrue();
    }

    @Test
    public void testBalanceNeedsACompletedRun() {
        final var config = PipelineConfig.builder().capacity(1).producers(1).itemsPerProducer(1).consumers(1).build();
        assertThatThrownBy(new SalesSimulation(config, 1L)::isBalanced).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testClasspathDefaultsAndOverrides() {
        final var overrides = new Properties();
        overrides.setProperty(PipelineConfig.CONSUMERS_KEY, "4");
        overrides.setProperty("unrelated.key", "ignored");

        final Properties properties = SalesSimulation.loadProperties(overrides);
        final var config = PipelineConfig.fromProperties(properties);

        assertThat(config.capacity()).isEqualTo(5);
        assertThat(config.producers()).isEqualTo(6);
        assertThat(config.consumers()).isEqualTo(4);
        assertThat(properties.getProperty("unrelated.key")).isNull();
        assertThat(SalesSimulation.seed(properties)).isEqualTo(42L);
    }

    @Test
    public void testSeedMustBeNumeric() {
        final var properties = new Properties();
        assertThat(SalesSimulation.seed(properties)).isEqualTo(SalesSimulation.DEFAULT_SEED);
        properties.setProperty(SalesSimulation.SEED_KEY, "x");
        assertThatThrownBy(() -> SalesSimulation.seed(properties)).isInstanceOf(InvalidConfigurationException.class);
    }
}
