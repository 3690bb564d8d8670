package com.rovertrend.core.prediction;

import com.rovertrend.core.model.ArimaModel;
import com.rovertrend.core.model.ArimaOrder;
import com.rovertrend.core.model.ForecastMethod;
import com.rovertrend.core.stationarity.StationarityTester;
import com.rovertrend.core.trend.ArimaForecast;
import com.rovertrend.core.trend.TrendModelFitter;
import com.rovertrend.core.util.AnalysisDeadline;

import java.util.Objects;
import java.util.Optional;

/**
 * ARIMA forecasts.
 *
 * <p>
 * When built with a model already fitted to the full series, that model is
 * reused for the full series and its order is refitted on backtest
 * prefixes. Otherwise the order is searched on every call.
 * </p>
 *
 * @since 1.0.0
 */
public class ArimaForecaster implements Forecaster {

    private final TrendModelFitter fitter;
    private final StationarityTester stationarityTester;
    private final ArimaModel fitted;
    private final int fittedLength;
    private final AnalysisDeadline deadline;

    /**
     * @param fitter       fitter used for order search and refits
     * @param tester       stationarity test used by the order search
     * @param fitted       model fitted to a series of {@code fittedLength}
     *                     samples, or {@code null}
     * @param fittedLength length of the series {@code fitted} belongs to
     * @param deadline     checked during order search
     */
    public ArimaForecaster(TrendModelFitter fitter, StationarityTester tester, ArimaModel fitted, int fittedLength,
            AnalysisDeadline deadline) {
        this.fitter = Objects.requireNonNull(fitter, "Trend fitter must not be null");
        this.stationarityTester = Objects.requireNonNull(tester, "Stationarity tester must not be null");
        this.fitted = fitted;
        this.fittedLength = fittedLength;
        this.deadline = Objects.requireNonNull(deadline, "Deadline must not be null");
    }

    @Override
    public ForecastMethod method() {
        return ForecastMethod.ARIMA;
    }

    @Override
    public Optional<Forecast> forecast(double[] series, int horizon) {
        Optional<ArimaModel> model = modelFor(series);
        if (model.isEmpty()) {
            return Optional.empty();
        }
        ArimaForecast forecast = fitter.forecastArima(model.get(), series, horizon);
        return Optional.of(new Forecast(forecast.getMean(), forecast.getStandardErrors(),
                model.get().getSigma2()));
    }

    private Optional<ArimaModel> modelFor(double[] series) {
        if (fitted != null) {
            if (series.length == fittedLength) {
                return Optional.of(fitted);
            }
            ArimaOrder order = fitted.getOrder();
            return fitter.fitArimaOrder(series, order);
        }
        return fitter.fitArima(series, stationarityTester.test(series), deadline);
    }
}
