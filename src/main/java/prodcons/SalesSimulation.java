package prodcons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Point-of-sale run: cash registers (producers) ring up sales, managers (consumers) process them.
 * <p>
 * Configuration comes from {@code simulation.properties} on the classpath; a system property with the same
 * key wins, e.g. {@code -Dconsumers.count=4}. Exits with status 1 if any sale was lost or duplicated.
 */
public final class SalesSimulation {
    private static final Logger log = LoggerFactory.getLogger(SalesSimulation.class);

    static final String CONFIG_RESOURCE = "/simulation.properties";
    static final String SEED_KEY = "simulation.seed";
    static final long DEFAULT_SEED = 42L;
    private static final List<String> KEYS = Arrays.asList(
            PipelineConfig.CAPACITY_KEY,
            PipelineConfig.PRODUCERS_KEY,
            PipelineConfig.ITEMS_PER_PRODUCER_KEY,
            PipelineConfig.CONSUMERS_KEY,
            SEED_KEY);

    private final PipelineConfig config;
    private final List<SaleGenerator> registers;
    private final List<SalesLedger> managers;
    private volatile PipelineResult<Double> lastResult;

    public SalesSimulation(PipelineConfig config, long seed) {
        this.config = config;
        final List<SaleGenerator> registers = new ArrayList<>(config.producers());
        for (int i = 0; i < config.producers(); i++) {
            registers.add(new SaleGenerator(seed + i));
        }
        final List<SalesLedger> managers = new ArrayList<>(config.consumers());
        for (int i = 0; i < config.consumers(); i++) {
            //a manager reports averages per buffer-full of sales
            managers.add(new SalesLedger(i + 1, config.capacity()));
        }
        this.registers = Collections.unmodifiableList(registers);
        this.managers = Collections.unmodifiableList(managers);
    }

    public static void main(String[] args) throws InterruptedException {
        final Properties properties = loadProperties(System.getProperties());
        final SalesSimulation simulation = new SalesSimulation(
                PipelineConfig.fromProperties(properties), seed(properties));
        simulation.run();
        if (!simulation.isBalanced()) {
            log.error("Sales were lost or duplicated");
            System.exit(1);
        }
    }

    public PipelineResult<Double> run() throws InterruptedException {
        log.info("Starting sales simulation: {} register(s), {} manager(s), buffer of {}",
                config.producers(), config.consumers(), config.capacity());
        final PipelineResult<Double> result;
        //registers record what they put, the balance is checked against that
        try (ProducerConsumerPipeline<Double> pipeline = new ProducerConsumerPipeline<>(config, true)) {
            result = pipeline.run(id -> registers.get(id - 1), id -> managers.get(id - 1));
        }
        lastResult = result;
        for (int i = 0; i < registers.size(); i++) {
            final SaleGenerator register = registers.get(i);
            log.info("Register {} rang up {} sale(s), total {}",
                    i + 1, register.generated(), formatCents(register.totalCents()));
        }
        for (SalesLedger manager : managers) {
            log.info("Manager {} processed {} sale(s), total {}, average {}",
                    manager.managerId(), manager.count(), formatCents(manager.totalCents()),
                    String.format("%.2f", manager.average()));
        }
        log.info("Simulation finished: {} sale(s) produced, {} processed, buffer peaked at {}/{}",
                result.totalProduced(), result.totalConsumed(), result.highWaterMark(), config.capacity());
        return result;
    }

    /**
     * true when managers processed exactly the sales the registers put into the buffer, by count and by amount.
     *
     * @throws IllegalStateException if no run has completed
     */
    public boolean isBalanced() {
        final PipelineResult<Double> result = lastResult;
        if (result == null) {
            throw new IllegalStateException("no completed run to balance");
        }
        return isBalanced(result, managers);
    }

    /**
     * Sales a register generated but never managed to put are not counted.
     */
    static boolean isBalanced(PipelineResult<Double> result, List<SalesLedger> managers) {
        long producedCount = 0;
        long producedCents = 0;
        for (ProducerReport<Double> report : result.producers()) {
            producedCount += report.itemsProduced();
            for (Double sale : report.items()) {
                producedCents += SaleGenerator.toCents(sale);
            }
        }
        long processedCount = 0;
        long processedCents = 0;
        for (SalesLedger manager : managers) {
            processedCount += manager.count();
            processedCents += manager.totalCents();
        }
        return producedCount == processedCount && producedCents == processedCents;
    }

    public List<SaleGenerator> registers() {
        return registers;
    }

    public List<SalesLedger> managers() {
        return managers;
    }

    static Properties loadProperties(Properties overrides) {
        final Properties properties = new Properties();
        try (InputStream in = SalesSimulation.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath, using defaults", CONFIG_RESOURCE);
            } else {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + CONFIG_RESOURCE, e);
        }
        for (String key : KEYS) {
            final String value = overrides.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return properties;
    }

    static long seed(Properties properties) {
        final String raw = properties.getProperty(SEED_KEY);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_SEED;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("'" + SEED_KEY + "' must be a long, was '" + raw + "'", e);
        }
    }

    private static String formatCents(long cents) {
        return String.format("%d.%02d", cents / 100, cents % 100);
    }
}
