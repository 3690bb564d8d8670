package com.rovertrend.core.drift;

import com.rovertrend.core.config.DriftDetectorConfig;
import com.rovertrend.core.model.DriftResult;
import com.rovertrend.core.model.DriftStatistics;
import com.rovertrend.core.model.DriftStatus;
import com.rovertrend.core.model.DriftTestStatistics;
import com.rovertrend.core.util.RunningStatistics;
import com.rovertrend.core.util.SeriesMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Incremental concept-drift detector for one telemetry stream.
 *
 * <h3>State machine</h3>
 * <p>
 * {@code STABLE → WARNING → DRIFT}. With {@code autoReset} enabled the
 * detector returns to {@code STABLE} immediately after reporting a drift: the
 * method state restarts and a new reference baseline is built (ADWIN keeps
 * the post-change part of its window as the new baseline). Without it, the
 * detector stays in {@code DRIFT} until {@link #reset()} is called.
 * </p>
 *
 * <h3>Baseline</h3>
 * <p>
 * Methods working on standardized values first collect {@code windowSize}
 * samples as the reference baseline and return {@code STABLE} results with a
 * zero statistic meanwhile.
 * </p>
 *
 * <h3>Ignored samples</h3>
 * <p>
 * Non-finite values and samples not strictly after the previous timestamp are
 * ignored: they are not counted and the previous result is returned.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * Calls on one instance are serialized by an internal lock. Distinct
 * instances share nothing and can run in parallel.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DriftDetector.class);

    public static final String DEFAULT_STREAM_ID = "default";

    private final String streamId;
    private final DriftDetectorConfig config;
    private final DriftMethodStrategy strategy;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<DriftEventListener> listeners = new CopyOnWriteArrayList<>();

    private DriftDetectorState state;
    private DriftResult latestResult;

    public DriftDetector(DriftDetectorConfig config) {
        this(DEFAULT_STREAM_ID, config);
    }

    /**
     * @param streamId stream the detector monitors
     * @param config   detector configuration, copied and validated here
     * @throws NullPointerException  if an argument is {@code null}
     * @throws IllegalStateException if the configuration is invalid
     */
    public DriftDetector(String streamId, DriftDetectorConfig config) {
        this.streamId = Objects.requireNonNull(streamId, "Stream id must not be null");
        Objects.requireNonNull(config, "Drift detector config must not be null");
        config.validate();
        this.config = config.copy();
        this.strategy = DriftStrategyFactory.create(this.config);
        this.state = DriftDetectorState.initial(strategy);
        LOG.info("Drift detector started for stream '{}': {}", streamId, this.config);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Feed one sample.
     *
     * @param value     sample value
     * @param timestamp sample instant; must not be {@code null}
     * @return the detector's verdict after this sample
     */
    public DriftResult processDataPoint(double value, Instant timestamp) {
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        lock.lock();
        try {
            Instant last = state.getLastTimestamp();
            if (!Double.isFinite(value) || (last != null && !timestamp.isAfter(last))) {
                LOG.trace("Stream '{}': ignoring sample value={} at {} (last {})", streamId, value, timestamp, last);
                if (latestResult == null) {
                    latestResult = idleResult(state, last != null ? last : timestamp);
                }
                return latestResult;
            }

            DriftDetectorState previous = state;
            Transition transition = advance(previous, value, timestamp);
            state = transition.next;
            latestResult = transition.result;

            if (previous.getWarningsIssued() != state.getWarningsIssued()) {
                fire(DriftEventType.WARNING, transition, timestamp);
            }
            if (previous.getDriftsDetected() != state.getDriftsDetected()) {
                LOG.info("Drift detected on stream '{}' at {} ({}, statistic={})", streamId, timestamp,
                        config.getMethod(), transition.result.getStatistics().getTestStatistic());
                fire(DriftEventType.DRIFT_DETECTED, transition, timestamp);
            }
            return latestResult;
        } finally {
            lock.unlock();
        }
    }

    public DriftStatistics getDriftStatistics() {
        lock.lock();
        try {
            return state.statistics();
        } finally {
            lock.unlock();
        }
    }

    public DriftStatus getStatus() {
        lock.lock();
        try {
            return state.getStatus();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the result of the last processed sample, empty before the first
     */
    public Optional<DriftResult> getLatestResult() {
        lock.lock();
        try {
            return Optional.ofNullable(latestResult);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the current state, suitable for {@link DriftStateCodec#toJson}
     */
    public DriftDetectorState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resume from a snapshot.
     *
     * @throws IllegalArgumentException if the snapshot belongs to another method
     */
    public void restore(DriftDetectorState snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        if (snapshot.getMethod() != config.getMethod()) {
            throw new IllegalArgumentException("Snapshot for " + snapshot.getMethod()
                    + " cannot be restored into a " + config.getMethod() + " detector");
        }
        lock.lock();
        try {
            state = snapshot;
            latestResult = null;
            LOG.info("Stream '{}': restored drift state after {} samples", streamId, snapshot.getSamplesProcessed());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discard the baseline and test state. Counters are kept.
     */
    public void reset() {
        lock.lock();
        try {
            state = new DriftDetectorState(state.getMethod(), DriftStatus.STABLE, RunningStatistics.empty(),
                    new double[0], strategy.initialState(), state.getSamplesProcessed(),
                    state.getDriftsDetected(), state.getWarningsIssued(), state.getLastTimestamp(),
                    state.getLastDriftTimestamp(), 0);
            LOG.debug("Stream '{}': drift detector reset", streamId);
        } finally {
            lock.unlock();
        }
    }

    public void addListener(DriftEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener must not be null"));
    }

    public void removeListener(DriftEventListener listener) {
        listeners.remove(listener);
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * @return a copy of the configuration
     */
    public DriftDetectorConfig getConfig() {
        return config.copy();
    }

    // ---------------------------------------------------------------
    // Transition
    // ---------------------------------------------------------------

    private static final class Transition {
        private final DriftDetectorState next;
        private final DriftResult result;
        private final double shift;

        private Transition(DriftDetectorState next, DriftResult result, double shift) {
            this.next = next;
            this.result = result;
            this.shift = shift;
        }
    }

    private Transition advance(DriftDetectorState s, double value, Instant timestamp) {
        int windowSize = config.getWindowSize();
        long samples = s.getSamplesProcessed() + 1;
        double[] recent = appendBounded(s.getRecent(), value, windowSize);
        RunningStatistics reference = s.getReference();
        boolean baselineComplete = reference.getCount() >= windowSize;

        if (!baselineComplete) {
            reference = reference.add(value);
        }
        if (strategy.requiresBaseline() && !baselineComplete) {
            DriftDetectorState next = new DriftDetectorState(s.getMethod(), DriftStatus.STABLE, reference, recent,
                    s.getMethodState(), samples, s.getDriftsDetected(), s.getWarningsIssued(), timestamp,
                    s.getLastDriftTimestamp(), 0);
            return new Transition(next, result(next.getStatus(), 0.0, reference, recent, timestamp,
                    s.getLastDriftTimestamp(), new DriftTestStatistics(0.0, strategy.threshold(), null)), 0.0);
        }

        double refStd = Math.max(reference.getStd(), 1e-9 * Math.max(1.0, Math.abs(reference.getMean())));
        double z = reference.getCount() > 0 ? (value - reference.getMean()) / refStd : 0.0;
        DriftStep step = strategy.step(s.getMethodState(), value, z);

        DriftStatus status = switch (step.getSignal()) {
            case DRIFT -> DriftStatus.DRIFT;
            case WARNING -> DriftStatus.WARNING;
            case NONE -> DriftStatus.STABLE;
        };
        long drifts = s.getDriftsDetected();
        long warnings = s.getWarningsIssued();
        Instant driftTimestamp = s.getLastDriftTimestamp();
        if (status == DriftStatus.DRIFT && s.getStatus() != DriftStatus.DRIFT) {
            drifts++;
            driftTimestamp = timestamp;
        }
        if (status == DriftStatus.WARNING && s.getStatus() == DriftStatus.STABLE) {
            warnings++;
        }
        int excursion = status == DriftStatus.STABLE ? 0 : Math.min(s.getExcursion() + 1, windowSize);
        double shift = excursionShift(recent, excursion, reference);

        DriftResult result = result(status, step.getConfidence(), reference, recent, timestamp, driftTimestamp,
                new DriftTestStatistics(step.getStatistic(), step.getThreshold(), step.getPValue()));

        DriftDetectorState next;
        if (status == DriftStatus.DRIFT && config.isAutoReset()) {
            double[] retained = strategy.retainedValues(step.getState());
            RunningStatistics newReference = retained != null
                    ? RunningStatistics.of(retained)
                    : RunningStatistics.empty();
            double[] newRecent = retained != null ? lastValues(retained, windowSize) : new double[0];
            next = new DriftDetectorState(s.getMethod(), DriftStatus.STABLE, newReference, newRecent,
                    strategy.afterDrift(step.getState()), samples, drifts, warnings, timestamp, driftTimestamp, 0);
            LOG.debug("Stream '{}': auto reset after drift", streamId);
        } else {
            next = new DriftDetectorState(s.getMethod(), status, reference, recent, step.getState(), samples,
                    drifts, warnings, timestamp, driftTimestamp, excursion);
        }
        return new Transition(next, result, shift);
    }

    private DriftResult result(DriftStatus status, double confidence, RunningStatistics reference, double[] recent,
            Instant timestamp, Instant driftTimestamp, DriftTestStatistics statistics) {
        return DriftResult.builder()
                .method(config.getMethod())
                .status(status)
                .detected(status == DriftStatus.DRIFT)
                .warning(status == DriftStatus.WARNING)
                .confidence(confidence)
                .timestamp(timestamp)
                .driftTimestamp(driftTimestamp)
                .currentMean(SeriesMath.mean(recent))
                .currentVariance(SeriesMath.variance(recent))
                .referenceMean(reference.getMean())
                .referenceVariance(reference.getVariance())
                .statistics(statistics)
                .build();
    }

    private DriftResult idleResult(DriftDetectorState s, Instant timestamp) {
        return result(s.getStatus(), 0.0, s.getReference(), s.getRecent(), timestamp, s.getLastDriftTimestamp(),
                new DriftTestStatistics(0.0, strategy.threshold(), null));
    }

    private void fire(DriftEventType type, Transition transition, Instant timestamp) {
        if (listeners.isEmpty()) {
            return;
        }
        DriftEvent event = new DriftEvent(streamId, type, timestamp, DriftSeverity.fromShift(transition.shift),
                transition.result);
        for (DriftEventListener listener : listeners) {
            try {
                listener.onDriftEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Stream '{}': drift listener failed on {}: {}", streamId, type, e.getMessage(), e);
            }
        }
    }

    /**
     * Standardized shift of the excursion's mean from the reference mean.
     */
    private static double excursionShift(double[] recent, int excursion, RunningStatistics reference) {
        if (recent.length == 0) {
            return 0.0;
        }
        int count = Math.max(1, Math.min(excursion, recent.length));
        double mean = SeriesMath.mean(recent, recent.length - count, recent.length);
        double refStd = reference.getStd();
        if (refStd > 0) {
            return (mean - reference.getMean()) / refStd;
        }
        return mean == reference.getMean() ? 0.0 : Double.POSITIVE_INFINITY;
    }

    private static double[] appendBounded(double[] values, double value, int max) {
        int keep = Math.min(values.length, max - 1);
        double[] next = new double[keep + 1];
        System.arraycopy(values, values.length - keep, next, 0, keep);
        next[keep] = value;
        return next;
    }

    private static double[] lastValues(double[] values, int max) {
        int keep = Math.min(values.length, max);
        double[] out = new double[keep];
        System.arraycopy(values, values.length - keep, out, 0, keep);
        return out;
    }
}
