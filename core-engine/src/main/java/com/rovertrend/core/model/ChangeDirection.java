package com.rovertrend.core.model;

/**
 * @since 1.0.0
 */
public enum ChangeDirection {
    INCREASE,
    DECREASE
}
