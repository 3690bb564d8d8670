package com.rovertrend.core.drift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rovertrend.core.model.DriftMethod;
import com.rovertrend.core.model.DriftStatistics;
import com.rovertrend.core.model.DriftStatus;
import com.rovertrend.core.util.RunningStatistics;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of everything a {@link DriftDetector} knows about its
 * stream.
 *
 * <h3>Contents</h3>
 * <ul>
 * <li>reference baseline statistics, frozen once {@code windowSize} samples
 * have been seen</li>
 * <li>the last {@code windowSize} raw values, which give the current mean
 * and variance</li>
 * <li>the method's own test state</li>
 * <li>counters and the last sample and drift instants</li>
 * <li>the length of the current warning or drift excursion</li>
 * </ul>
 *
 * <p>
 * A new instance replaces the old one on every processed sample. Instances
 * serialize to JSON through {@link DriftStateCodec}, which allows monitoring
 * to resume after a restart.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DriftDetectorState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DriftMethod method;
    private final DriftStatus status;
    private final RunningStatistics reference;
    private final double[] recent;
    private final DriftMethodState methodState;
    private final long samplesProcessed;
    private final long driftsDetected;
    private final long warningsIssued;
    private final Instant lastTimestamp;
    private final Instant lastDriftTimestamp;
    private final int excursion;

    @JsonCreator
    public DriftDetectorState(@JsonProperty("method") DriftMethod method,
            @JsonProperty("status") DriftStatus status,
            @JsonProperty("reference") RunningStatistics reference,
            @JsonProperty("recent") double[] recent,
            @JsonProperty("methodState") DriftMethodState methodState,
            @JsonProperty("samplesProcessed") long samplesProcessed,
            @JsonProperty("driftsDetected") long driftsDetected,
            @JsonProperty("warningsIssued") long warningsIssued,
            @JsonProperty("lastTimestamp") Instant lastTimestamp,
            @JsonProperty("lastDriftTimestamp") Instant lastDriftTimestamp,
            @JsonProperty("excursion") int excursion) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.reference = reference != null ? reference : RunningStatistics.empty();
        this.recent = recent != null ? recent.clone() : new double[0];
        this.methodState = Objects.requireNonNull(methodState, "methodState must not be null");
        this.samplesProcessed = samplesProcessed;
        this.driftsDetected = driftsDetected;
        this.warningsIssued = warningsIssued;
        this.lastTimestamp = lastTimestamp;
        this.lastDriftTimestamp = lastDriftTimestamp;
        this.excursion = excursion;
    }

    /**
     * @return the state of a detector that has seen no samples
     */
    static DriftDetectorState initial(DriftMethodStrategy strategy) {
        return new DriftDetectorState(strategy.method(), DriftStatus.STABLE, RunningStatistics.empty(),
                new double[0], strategy.initialState(), 0, 0, 0, null, null, 0);
    }

    public DriftMethod getMethod() {
        return method;
    }

    public DriftStatus getStatus() {
        return status;
    }

    public RunningStatistics getReference() {
        return reference;
    }

    public double[] getRecent() {
        return recent.clone();
    }

    public DriftMethodState getMethodState() {
        return methodState;
    }

    public long getSamplesProcessed() {
        return samplesProcessed;
    }

    public long getDriftsDetected() {
        return driftsDetected;
    }

    public long getWarningsIssued() {
        return warningsIssued;
    }

    public Instant getLastTimestamp() {
        return lastTimestamp;
    }

    public Instant getLastDriftTimestamp() {
        return lastDriftTimestamp;
    }

    /**
     * @return consecutive samples, up to the current one, that were not
     *         {@code STABLE}; {@code 0} while stable
     */
    public int getExcursion() {
        return excursion;
    }

    DriftStatistics statistics() {
        return new DriftStatistics(samplesProcessed, driftsDetected, warningsIssued);
    }

    @Override
    public String toString() {
        return "DriftDetectorState{" +
                "method=" + method +
                ", status=" + status +
                ", samplesProcessed=" + samplesProcessed +
                ", driftsDetected=" + driftsDetected +
                ", warningsIssued=" + warningsIssued +
                ", lastTimestamp=" + lastTimestamp +
                '}';
    }
}
