package prodcons;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineConfigTest {

    @Test
    public void testDefaults() {
        final var config = PipelineConfig.builder().build();
        assertThat(config.capacity()).isEqualTo(5);
        assertThat(config.producers()).isEqualTo(6);
        assertThat(config.itemsPerProducer()).isEqualTo(8);
        assertThat(config.consumers()).isEqualTo(2);
        assertThat(config.totalItems()).isEqualTo(48);
    }

    @Test
    public void testRejectsOutOfRangeValues() {
        assertThatThrownBy(() -> PipelineConfig.builder().capacity(0).build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("capacity");
        assertThatThrownBy(() -> PipelineConfig.builder().producers(0).build())
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> PipelineConfig.builder().itemsPerProducer(-1).build())
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> PipelineConfig.builder().consumers(-2).build())
                .isInstanceOf(InvalidConfigurationException.class)
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testZeroItemsPerProducerIsAllowed() {
        assertThat(PipelineConfig.builder().itemsPerProducer(0).build().totalItems()).isZero();
    }

    @Test
    public void testFromPropertiesKeepsDefaultsForMissingKeys() {
        final var properties = new Properties();
        properties.setProperty(PipelineConfig.CAPACITY_KEY, " 12 ");
        properties.setProperty(PipelineConfig.CONSUMERS_KEY, "3");
        final var config = PipelineConfig.fromProperties(properties);
        assertThat(config.capacity()).isEqualTo(12);
        assertThat(config.consumers()).isEqualTo(3);
        assertThat(config.producers()).isEqualTo(6);
        assertThat(config.itemsPerProducer()).isEqualTo(8);
    }

    @Test
    public void testFromPropertiesRejectsGarbage() {
        final var properties = new Properties();
        properties.setProperty(PipelineConfig.PRODUCERS_KEY, "many");
        assertThatThrownBy(() -> PipelineConfig.fromProperties(properties))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining(PipelineConfig.PRODUCERS_KEY)
                .hasCauseInstanceOf(NumberFormatException.class);
    }
}
