package com.rovertrend.core.prediction;

import com.rovertrend.core.model.ForecastMethod;
import com.rovertrend.core.model.PredictionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent forecasts per stream and a running score per forecasting method.
 *
 * <p>
 * Each stream keeps its last {@value #MAX_HISTORY} results, oldest dropped
 * first. When actual values arrive, every kept forecast of the stream is
 * scored against them and the score of the method that produced it becomes
 * {@code max(0, 1 - MAPE/100)} over the overlapping prefix. Methods never
 * scored report {@value #DEFAULT_PERFORMANCE}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. Each stream's history is guarded by its own lock.
 * </p>
 *
 * @since 1.0.0
 */
public class PredictionHistory {

    private static final Logger LOG = LoggerFactory.getLogger(PredictionHistory.class);

    /** Forecasts kept per stream. */
    public static final int MAX_HISTORY = 100;

    /** Score of a method that has not been evaluated yet. */
    public static final double DEFAULT_PERFORMANCE = 0.5;

    private final Map<String, Deque<PredictionResult>> history = new ConcurrentHashMap<>();
    private final Map<ForecastMethod, Double> performance = new ConcurrentHashMap<>();

    /**
     * Keep a forecast made for a stream, evicting the oldest beyond
     * {@value #MAX_HISTORY}.
     */
    public void record(String streamId, PredictionResult result) {
        Objects.requireNonNull(streamId, "Stream id must not be null");
        Objects.requireNonNull(result, "Prediction result must not be null");
        Deque<PredictionResult> results = history.computeIfAbsent(streamId, id -> new ArrayDeque<>());
        synchronized (results) {
            results.addLast(result);
            if (results.size() > MAX_HISTORY) {
                results.pollFirst();
            }
        }
    }

    /** @return the kept forecasts of a stream, oldest first */
    public List<PredictionResult> getHistory(String streamId) {
        Deque<PredictionResult> results = history.get(streamId);
        if (results == null) {
            return Collections.emptyList();
        }
        synchronized (results) {
            return Collections.unmodifiableList(new ArrayList<>(results));
        }
    }

    /**
     * Score every kept forecast of a stream against values observed after it.
     *
     * @param streamId stream whose forecasts are scored
     * @param actual   observed values, aligned with the first forecast step
     * @return number of forecasts scored; 0 if the stream has no history
     */
    public int updateModelPerformance(String streamId, double[] actual) {
        Objects.requireNonNull(streamId, "Stream id must not be null");
        Objects.requireNonNull(actual, "Actual values must not be null");
        List<PredictionResult> results = getHistory(streamId);
        int scored = 0;
        for (PredictionResult result : results) {
            int overlap = Math.min(actual.length, result.getHorizon());
            if (overlap == 0) {
                continue;
            }
            double mape = ForecastMetrics.mape(Arrays.copyOf(actual, overlap),
                    Arrays.copyOf(result.getPredictions(), overlap));
            if (Double.isNaN(mape)) {
                LOG.debug("Stream '{}': no non-zero actuals to score {} against", streamId, result.getMethod());
                continue;
            }
            double score = Math.max(0.0, 1.0 - mape / 100.0);
            performance.put(result.getMethod(), score);
            scored++;
            LOG.debug("Stream '{}': {} scored {} (MAPE {}%)", streamId, result.getMethod(), score, mape);
        }
        return scored;
    }

    /** @return the current score of every forecasting method */
    public Map<ForecastMethod, Double> getModelPerformance() {
        Map<ForecastMethod, Double> snapshot = new EnumMap<>(ForecastMethod.class);
        for (ForecastMethod method : ForecastMethod.values()) {
            snapshot.put(method, performance.getOrDefault(method, DEFAULT_PERFORMANCE));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    /** Forget every kept forecast. Method scores are retained. */
    public void clear() {
        history.clear();
        LOG.debug("Prediction history cleared");
    }
}
