/**
 * Immutable data model shared by every analysis component.
 *
 * <p>
 * Inputs are {@link com.rovertrend.core.model.TelemetryStream} instances
 * supplied by the ingestion layer. Outputs are composite analyses, drift
 * results and forecasts consumed by the dashboard.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.rovertrend.core.model.AdvancedTrendAnalysis} - batch analysis result</li>
 * <li>{@link com.rovertrend.core.model.DriftResult} - per-sample drift snapshot</li>
 * <li>{@link com.rovertrend.core.model.PredictionResult} - multi-step forecast</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.rovertrend.core.model;
