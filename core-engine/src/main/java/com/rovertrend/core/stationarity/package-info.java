/**
 * Unit-root testing.
 *
 * @since 1.0.0
 */
package com.rovertrend.core.stationarity;
