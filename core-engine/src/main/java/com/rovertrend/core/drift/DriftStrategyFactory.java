package com.rovertrend.core.drift;

import com.rovertrend.core.config.DriftDetectorConfig;

import java.util.Objects;

/**
 * Creates the {@link DriftMethodStrategy} for a detector configuration.
 *
 * <p>
 * This is the single point of extension when adding a drift method:
 * register it here and in {@link DriftMethodState}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftStrategyFactory {

    private DriftStrategyFactory() {
        // utility class, not instantiable
    }

    /**
     * @param config validated detector configuration
     * @return a strategy for {@code config.getMethod()}
     * @throws NullPointerException if {@code config} or its method is {@code null}
     */
    public static DriftMethodStrategy create(DriftDetectorConfig config) {
        Objects.requireNonNull(config, "Drift detector config must not be null");
        Objects.requireNonNull(config.getMethod(), "Drift method must not be null");

        double sensitivity = config.getSensitivity();
        return switch (config.getMethod()) {
            case ADWIN -> new AdwinStrategy(sensitivity, config.getWindowSize());
            case PAGE_HINKLEY -> new PageHinkleyStrategy(sensitivity);
            case DDM -> new DdmStrategy(sensitivity);
            case EDDM -> new EddmStrategy(sensitivity);
            case CUSUM -> new CusumStrategy(sensitivity);
            case EWMA -> new EwmaStrategy(sensitivity);
        };
    }
}
