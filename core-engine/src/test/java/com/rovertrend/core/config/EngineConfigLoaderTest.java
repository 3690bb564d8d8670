package com.rovertrend.core.config;

import com.rovertrend.core.model.AggregationMethod;
import com.rovertrend.core.model.DriftMethod;
import com.rovertrend.core.model.ForecastMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfigLoader}.
 */
class EngineConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getAnalysis().isEnableArima()).isFalse();
        assertThat(config.getAnalysis().isEnableNonLinear()).isTrue();
        assertThat(config.getAnalysis().getMaxPolynomialDegree()).isEqualTo(2);
        assertThat(config.getAnalysis().getTimeoutMillis()).isEqualTo(5000L);
        assertThat(config.getDrift().getMethod()).isEqualTo(DriftMethod.PAGE_HINKLEY);
        assertThat(config.getDrift().getSensitivity()).isEqualTo(0.7);
        assertThat(config.getDrift().getWindowSize()).isEqualTo(30);
        assertThat(config.getDrift().isAutoReset()).isFalse();
        assertThat(config.getPrediction().getHorizon()).isEqualTo(5);
        assertThat(config.getPrediction().getMethod()).isEqualTo(ForecastMethod.EXPONENTIAL_SMOOTHING);
        assertThat(config.getPrediction().getAggregationMethod()).isEqualTo(AggregationMethod.EQUAL_WEIGHTED);
        assertThat(config.getPrediction().isIncludePredictionIntervals()).isTrue();
    }

    @Test
    @DisplayName("Should load the bundled defaults")
    void shouldLoadBundledDefaults() {
        EngineConfig config = EngineConfigLoader.fromClasspath(EngineConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getDrift().getMethod()).isEqualTo(DriftMethod.CUSUM);
        assertThat(config.getPrediction().getMethod()).isEqualTo(ForecastMethod.ENSEMBLE);
        assertThat(config.getAnalysis().getChangePointWindow()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should report every invalid setting at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("invalid-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Engine configuration validation failed")
                .hasMessageContaining("sensitivity")
                .hasMessageContaining("windowSize")
                .hasMessageContaining("horizon");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when config file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> EngineConfigLoader.fromFile("/no/such/trend-engine.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should fall back to default sections when set to null")
    void shouldDefaultMissingSections() {
        EngineConfig config = new EngineConfig();
        config.setDrift(null);
        config.setPrediction(null);

        assertThat(config.getDrift().getMethod()).isEqualTo(DriftMethod.CUSUM);
        assertThat(config.getPrediction().getHorizon()).isEqualTo(10);
        config.validate();
    }

    @Test
    @DisplayName("Should expose only static loaders")
    void shouldNotBeInstantiable() throws Exception {
        Constructor<EngineConfigLoader> constructor = EngineConfigLoader.class.getDeclaredConstructor();

        assertThat(Modifier.isPrivate(constructor.getModifiers())).isTrue();
        assertThat(EngineConfigLoader.class.getConstructors()).isEmpty();
    }
}
