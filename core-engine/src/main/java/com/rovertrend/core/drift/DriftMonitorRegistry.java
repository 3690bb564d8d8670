package com.rovertrend.core.drift;

import com.rovertrend.core.config.DriftDetectorConfig;
import com.rovertrend.core.model.DriftResult;
import com.rovertrend.core.model.DriftStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Drift detectors keyed by stream id.
 *
 * <p>
 * A detector lives from {@link #start} to {@link #stop}. Registry-level
 * listeners are attached to every detector started afterwards. Each detector
 * serializes its own samples, so different streams can be fed from different
 * threads.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftMonitorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DriftMonitorRegistry.class);

    private final ConcurrentMap<String, DriftDetector> detectors = new ConcurrentHashMap<>();
    private final List<DriftEventListener> listeners = new CopyOnWriteArrayList<>();
    private final DriftDetectorConfig defaultConfig;

    public DriftMonitorRegistry() {
        this(new DriftDetectorConfig());
    }

    /**
     * @param defaultConfig configuration used by {@link #start(String)}
     * @throws IllegalStateException if the configuration is invalid
     */
    public DriftMonitorRegistry(DriftDetectorConfig defaultConfig) {
        Objects.requireNonNull(defaultConfig, "Default drift config must not be null");
        defaultConfig.validate();
        this.defaultConfig = defaultConfig.copy();
    }

    /**
     * Start monitoring with the default configuration.
     */
    public DriftDetector start(String streamId) {
        return start(streamId, defaultConfig);
    }

    /**
     * Start monitoring a stream. If it is already monitored, the existing
     * detector is returned unchanged.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public DriftDetector start(String streamId, DriftDetectorConfig config) {
        Objects.requireNonNull(streamId, "Stream id must not be null");
        Objects.requireNonNull(config, "Drift config must not be null");
        return detectors.computeIfAbsent(streamId, id -> {
            DriftDetector detector = new DriftDetector(id, config);
            listeners.forEach(detector::addListener);
            return detector;
        });
    }

    /**
     * Feed one sample to the stream's detector.
     *
     * @throws IllegalStateException if the stream is not monitored
     */
    public DriftResult process(String streamId, double value, Instant timestamp) {
        return require(streamId).processDataPoint(value, timestamp);
    }

    /**
     * Stop monitoring and discard the detector.
     *
     * @return {@code true} if the stream was monitored
     */
    public boolean stop(String streamId) {
        DriftDetector removed = detectors.remove(streamId);
        if (removed != null) {
            LOG.info("Drift monitoring stopped for stream '{}' after {} samples", streamId,
                    removed.getDriftStatistics().getSamplesProcessed());
        }
        return removed != null;
    }

    public boolean isMonitoring(String streamId) {
        return detectors.containsKey(streamId);
    }

    public Set<String> monitoredStreams() {
        return Set.copyOf(detectors.keySet());
    }

    public Optional<DriftDetector> detector(String streamId) {
        return Optional.ofNullable(detectors.get(streamId));
    }

    public Optional<DriftResult> latestResult(String streamId) {
        DriftDetector detector = detectors.get(streamId);
        return detector != null ? detector.getLatestResult() : Optional.empty();
    }

    public Optional<DriftStatistics> statistics(String streamId) {
        return detector(streamId).map(DriftDetector::getDriftStatistics);
    }

    /**
     * @throws IllegalStateException if the stream is not monitored
     */
    public void reset(String streamId) {
        require(streamId).reset();
    }

    /**
     * @return the JSON snapshot of the stream's detector state
     * @throws IllegalStateException if the stream is not monitored
     */
    public String snapshot(String streamId) {
        return DriftStateCodec.toJson(require(streamId).getState());
    }

    /**
     * Start (or reuse) the stream's detector and resume it from a snapshot.
     *
     * @throws IllegalArgumentException if the snapshot is invalid or belongs to
     *                                  another method
     */
    public DriftDetector restore(String streamId, DriftDetectorConfig config, String snapshotJson) {
        DriftDetectorState snapshot = DriftStateCodec.fromJson(snapshotJson);
        DriftDetector detector = start(streamId, config);
        detector.restore(snapshot);
        return detector;
    }

    /**
     * Attach a listener to every detector, current and future.
     */
    public void addListener(DriftEventListener listener) {
        Objects.requireNonNull(listener, "Listener must not be null");
        listeners.add(listener);
        detectors.values().forEach(d -> d.addListener(listener));
    }

    private DriftDetector require(String streamId) {
        Objects.requireNonNull(streamId, "Stream id must not be null");
        DriftDetector detector = detectors.get(streamId);
        if (detector == null) {
            throw new IllegalStateException("No drift monitor for stream '" + streamId + "'");
        }
        return detector;
    }
}
