package com.rovertrend.core.drift;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;

/**
 * Immutable per-method test state, replaced wholesale on every step.
 *
 * <p>
 * Serialized with a {@code "method"} discriminator so that a detector state
 * snapshot can be restored without knowing its method in advance.
 * </p>
 *
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "method")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AdwinStrategy.State.class, name = "ADWIN"),
        @JsonSubTypes.Type(value = PageHinkleyStrategy.State.class, name = "PAGE_HINKLEY"),
        @JsonSubTypes.Type(value = DdmStrategy.State.class, name = "DDM"),
        @JsonSubTypes.Type(value = EddmStrategy.State.class, name = "EDDM"),
        @JsonSubTypes.Type(value = CusumStrategy.State.class, name = "CUSUM"),
        @JsonSubTypes.Type(value = EwmaStrategy.State.class, name = "EWMA")
})
public interface DriftMethodState extends Serializable {
}
