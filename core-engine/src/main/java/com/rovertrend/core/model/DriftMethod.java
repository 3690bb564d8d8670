package com.rovertrend.core.model;

import java.util.Locale;

/**
 * Streaming drift-detection algorithms.
 *
 * @since 1.0.0
 */
public enum DriftMethod {
    ADWIN,
    PAGE_HINKLEY,
    DDM,
    EDDM,
    CUSUM,
    EWMA;

    /**
     * Lenient lookup accepting any case and {@code -} in place of {@code _}
     * (e.g. {@code "page-hinkley"}).
     *
     * @param value method name
     * @return the matching method
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DriftMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Drift method must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (DriftMethod method : values()) {
            if (method.name().equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown drift method: '" + value
                + "'. Supported: adwin, page_hinkley, ddm, eddm, cusum, ewma");
    }
}
