package com.rovertrend.core.prediction;

import com.rovertrend.core.model.ArimaModel;
import com.rovertrend.core.util.AnalysisDeadline;

import java.util.Objects;

/**
 * What an earlier analysis already learned about the series being forecast.
 *
 * @since 1.0.0
 */
public final class ForecastContext {

    private static final ForecastContext EMPTY = new ForecastContext(null, 0, AnalysisDeadline.none());

    private final ArimaModel arima;
    private final int seasonalPeriod;
    private final AnalysisDeadline deadline;

    /**
     * @param arima          ARIMA model fitted to the full series, or {@code null}
     * @param seasonalPeriod detected season length, {@code 0} if none
     * @param deadline       budget for the forecast
     */
    public ForecastContext(ArimaModel arima, int seasonalPeriod, AnalysisDeadline deadline) {
        this.arima = arima;
        this.seasonalPeriod = Math.max(0, seasonalPeriod);
        this.deadline = Objects.requireNonNull(deadline, "Deadline must not be null");
    }

    public static ForecastContext empty() {
        return EMPTY;
    }

    public ArimaModel getArima() {
        return arima;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public AnalysisDeadline getDeadline() {
        return deadline;
    }
}
