package com.rovertrend.core.model;

/**
 * What shifted at a {@link ChangePoint}.
 *
 * @since 1.0.0
 */
public enum ChangeType {
    MEAN,
    VARIANCE,
    TREND
}
