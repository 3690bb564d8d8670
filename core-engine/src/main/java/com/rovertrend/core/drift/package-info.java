/**
 * Streaming concept-drift detection.
 *
 * <p>
 * A {@link com.rovertrend.core.drift.DriftDetector} owns the state of one
 * stream and delegates the test to a stateless
 * {@link com.rovertrend.core.drift.DriftMethodStrategy}. Six methods are
 * available: ADWIN, Page-Hinkley, DDM, EDDM, CUSUM and EWMA.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.rovertrend.core.drift.DriftDetector} - per-stream detector
 * and state machine</li>
 * <li>{@link com.rovertrend.core.drift.DriftMonitorRegistry} - detectors by
 * stream id</li>
 * <li>{@link com.rovertrend.core.drift.DriftStrategyFactory} - method
 * dispatch</li>
 * <li>{@link com.rovertrend.core.drift.DriftStateCodec} - JSON snapshots</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.rovertrend.core.drift;
