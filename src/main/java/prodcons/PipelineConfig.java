package prodcons;

import net.jcip.annotations.Immutable;

import java.util.Properties;

/**
 * Startup parameters of a {@link ProducerConsumerPipeline}. Fixed for the whole run.
 */
@Immutable
public final class PipelineConfig {
    public static final String CAPACITY_KEY = "buffer.capacity";
    public static final String PRODUCERS_KEY = "producers.count";
    public static final String ITEMS_PER_PRODUCER_KEY = "producers.items";
    public static final String CONSUMERS_KEY = "consumers.count";

    private final int capacity;
    private final int producers;
    private final int itemsPerProducer;
    private final int consumers;

    private PipelineConfig(Builder builder) {
        if (builder.capacity <= 0) {
            throw new InvalidConfigurationException("buffer capacity must be > 0, was " + builder.capacity);
        }
        if (builder.producers <= 0) {
            throw new InvalidConfigurationException("producer count must be > 0, was " + builder.producers);
        }
        if (builder.itemsPerProducer < 0) {
            throw new InvalidConfigurationException("items per producer must be >= 0, was " + builder.itemsPerProducer);
        }
        if (builder.consumers <= 0) {
            throw new InvalidConfigurationException("consumer count must be > 0, was " + builder.consumers);
        }
        this.capacity = builder.capacity;
        this.producers = builder.producers;
        this.itemsPerProducer = builder.itemsPerProducer;
        this.consumers = builder.consumers;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the four keys from {@code properties}; missing keys keep the builder defaults.
     */
    public static PipelineConfig fromProperties(Properties properties) {
        return builder()
                .capacity(intProperty(properties, CAPACITY_KEY, Builder.DEFAULT_CAPACITY))
                .producers(intProperty(properties, PRODUCERS_KEY, Builder.DEFAULT_PRODUCERS))
                .itemsPerProducer(intProperty(properties, ITEMS_PER_PRODUCER_KEY, Builder.DEFAULT_ITEMS_PER_PRODUCER))
                .consumers(intProperty(properties, CONSUMERS_KEY, Builder.DEFAULT_CONSUMERS))
                .build();
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        final String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("'" + key + "' must be an integer, was '" + raw + "'", e);
        }
    }

    public int capacity() {
        return capacity;
    }

    public int producers() {
        return producers;
    }

    public int itemsPerProducer() {
        return itemsPerProducer;
    }

    public int consumers() {
        return consumers;
    }

    public long totalItems() {
        return (long) producers * itemsPerProducer;
    }

    @Override
    public String toString() {
        return "PipelineConfig{capacity=" + capacity + ", producers=" + producers
                + ", itemsPerProducer=" + itemsPerProducer + ", consumers=" + consumers + '}';
    }

    public static final class Builder {
        static final int DEFAULT_CAPACITY = 5;
        static final int DEFAULT_PRODUCERS = 6;
        static final int DEFAULT_ITEMS_PER_PRODUCER = 8;
        static final int DEFAULT_CONSUMERS = 2;

        private int capacity = DEFAULT_CAPACITY;
        private int producers = DEFAULT_PRODUCERS;
        private int itemsPerProducer = DEFAULT_ITEMS_PER_PRODUCER;
        private int consumers = DEFAULT_CONSUMERS;

        private Builder() {
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder producers(int producers) {
            this.producers = producers;
            return this;
        }

        public Builder itemsPerProducer(int itemsPerProducer) {
            this.itemsPerProducer = itemsPerProducer;
            return this;
        }

        public Builder consumers(int consumers) {
            this.consumers = consumers;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
