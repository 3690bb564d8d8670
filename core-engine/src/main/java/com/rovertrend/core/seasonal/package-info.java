/**
 * Seasonal period detection and additive decomposition.
 *
 * @since 1.0.0
 */
package com.rovertrend.core.seasonal;
