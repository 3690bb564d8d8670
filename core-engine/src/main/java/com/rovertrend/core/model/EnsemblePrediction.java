package com.rovertrend.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A forecast combined from several member forecasters.
 *
 * <p>
 * Member weights sum to {@code 1}. Each member keeps its own forecast, weight
 * and backtest performance so the dashboard can show the breakdown.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsemblePrediction extends PredictionResult {

    private static final long serialVersionUID = 1L;

    private final List<ModelContribution> models;
    private final AggregationMethod aggregationMethod;

    /**
     * @param combined          the aggregated forecast
     * @param models            members, in the order they were combined
     * @param aggregationMethod how the members were weighted
     */
    public EnsemblePrediction(PredictionResult combined, List<ModelContribution> models,
            AggregationMethod aggregationMethod) {
        super(combined);
        Objects.requireNonNull(models, "models must not be null");
        this.models = Collections.unmodifiableList(new ArrayList<>(models));
        this.aggregationMethod = Objects.requireNonNull(aggregationMethod,
                "aggregationMethod must not be null");
    }

    public List<ModelContribution> getModels() {
        return models;
    }

    public AggregationMethod getAggregationMethod() {
        return aggregationMethod;
    }

    /** @return sum of member weights, {@code 1} up to rounding */
    public double totalWeight() {
        double total = 0;
        for (ModelContribution model : models) {
            total += model.getWeight();
        }
        return total;
    }
}
