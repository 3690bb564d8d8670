package com.rovertrend.core.drift;

import com.rovertrend.core.model.DriftResult;

import java.time.Instant;
import java.util.Objects;

/**
 * Notification of a warning or drift transition on one stream.
 *
 * @since 1.0.0
 */
public final class DriftEvent {

    private final String streamId;
    private final DriftEventType type;
    private final Instant timestamp;
    private final DriftSeverity severity;
    private final DriftResult result;

    public DriftEvent(String streamId, DriftEventType type, Instant timestamp, DriftSeverity severity,
            DriftResult result) {
        this.streamId = Objects.requireNonNull(streamId, "streamId must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    public String getStreamId() {
        return streamId;
    }

    public DriftEventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public DriftSeverity getSeverity() {
        return severity;
    }

    public DriftResult getResult() {
        return result;
    }

    @Override
    public String toString() {
        return "DriftEvent{" +
                "streamId='" + streamId + '\'' +
                ", type=" + type +
                ", timestamp=" + timestamp +
                ", severity=" + severity +
                '}';
    }
}
