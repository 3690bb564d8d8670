/**
 * YAML configuration for the analysis engine.
 *
 * <p>
 * {@link com.rovertrend.core.config.EngineConfigLoader} binds
 * {@code trend-engine.yml} onto {@link com.rovertrend.core.config.EngineConfig}
 * and validates it before returning.
 * </p>
 *
 * @since 1.0.0
 */
package com.rovertrend.core.config;
