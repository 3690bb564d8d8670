package com.rovertrend.core.analysis;

import com.rovertrend.core.model.AdvancedTrendAnalysis;
import com.rovertrend.core.model.ChangePoint;
import com.rovertrend.core.model.TrendModel;

/**
 * Callbacks fired by {@link AdvancedTrendAnalyzer} while a stream is analyzed.
 *
 * <p>
 * Every method has an empty default so listeners override only what they
 * need. Callbacks run on the analyzing thread; an exception thrown by a
 * listener is logged and does not affect the analysis.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnalysisListener {

    default void onAnalysisStarted(String streamId, int dataPoints) {
    }

    /**
     * @param streamId analyzed stream
     * @param model    the trend model selected as best
     */
    default void onModelFitted(String streamId, TrendModel model) {
    }

    default void onChangePointDetected(String streamId, ChangePoint changePoint) {
    }

    default void onAnalysisCompleted(AdvancedTrendAnalysis analysis) {
    }

    /**
     * Called when the analysis is abandoned, for example on timeout.
     *
     * @param streamId analyzed stream
     * @param cause    the exception about to be rethrown to the caller
     */
    default void onAnalysisFailed(String streamId, RuntimeException cause) {
    }
}
