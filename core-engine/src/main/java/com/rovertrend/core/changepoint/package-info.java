/**
 * Structural break detection over finite series.
 *
 * @since 1.0.0
 */
package com.rovertrend.core.changepoint;
