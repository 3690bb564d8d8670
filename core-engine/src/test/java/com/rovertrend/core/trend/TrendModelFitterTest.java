package com.rovertrend.core.trend;

import com.rovertrend.core.model.ArimaModel;
import com.rovertrend.core.model.ArimaOrder;
import com.rovertrend.core.model.TrendModel;
import com.rovertrend.core.model.TrendType;
import com.rovertrend.core.stationarity.StationarityTester;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TrendModelFitter}.
 */
class TrendModelFitterTest {

    private final TrendModelFitter fitter = new TrendModelFitter();
    private final StationarityTester tester = new StationarityTester();

    @Test
    @DisplayName("Should fit a perfect line through 1..10")
    void shouldFitPerfectLine() {
        double[] series = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };

        TrendModel linear = fitter.fitLinear(series);

        assertThat(linear.getType()).isEqualTo(TrendType.LINEAR);
        assertThat(linear.getCoefficients()[0]).isCloseTo(1.0, within(1e-9));
        assertThat(linear.getCoefficients()[1]).isCloseTo(1.0, within(1e-9));
        assertThat(linear.getR2()).isGreaterThanOrEqualTo(0.999);
        assertThat(linear.getRmse()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("Should prefer the linear model for a noiseless line")
    void shouldSelectLinearForLine() {
        double[] series = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };
        List<TrendModel> candidates = new ArrayList<>();
        candidates.add(fitter.fitLinear(series));
        fitter.fitNonLinear(series).ifPresent(candidates::add);

        assertThat(fitter.selectBest(candidates).getType()).isEqualTo(TrendType.LINEAR);
    }

    @Test
    @DisplayName("Should keep residual plus detrended equal to the original for every model")
    void shouldPreserveResidualIdentity() {
        double[] series = noisyQuadratic(new Random(5), 40);
        List<TrendModel> models = new ArrayList<>();
        models.add(fitter.fitLinear(series));
        fitter.fitNonLinear(series).ifPresent(models::add);
        fitter.fitPolynomial(series, 3).ifPresent(models::add);

        for (TrendModel model : models) {
            for (int i = 0; i < series.length; i++) {
                assertThat(model.getResiduals()[i]).isEqualTo(series[i] - model.getDetrended()[i]);
            }
        }
    }

    @Test
    @DisplayName("Should choose a polynomial for a noisy quadratic")
    void shouldFitQuadratic() {
        double[] series = noisyQuadratic(new Random(42), 50);

        Optional<TrendModel> nonLinear = fitter.fitNonLinear(series);
        TrendModel linear = fitter.fitLinear(series);

        assertThat(nonLinear).isPresent();
        assertThat(nonLinear.get().getType()).isEqualTo(TrendType.POLYNOMIAL);
        assertThat(nonLinear.get().getR2()).isGreaterThan(linear.getR2());
        assertThat(fitter.selectBest(List.of(linear, nonLinear.get())).getType())
                .isEqualTo(TrendType.POLYNOMIAL);
    }

    @Test
    @DisplayName("Should recover the coefficients of a quadratic polynomial")
    void shouldRecoverPolynomialCoefficients() {
        double[] series = new double[30];
        for (int i = 0; i < series.length; i++) {
            series[i] = 2.0 - 0.3 * i + 0.05 * i * i;
        }

        TrendModel quadratic = fitter.fitPolynomial(series, 2).orElseThrow();

        assertThat(quadratic.getCoefficients()).hasSize(3);
        assertThat(quadratic.getCoefficients()[0]).isCloseTo(2.0, within(1e-6));
        assertThat(quadratic.getCoefficients()[1]).isCloseTo(-0.3, within(1e-6));
        assertThat(quadratic.getCoefficients()[2]).isCloseTo(0.05, within(1e-6));
    }

    @Test
    @DisplayName("Should identify exponential growth")
    void shouldFitExponential() {
        double[] series = new double[40];
        for (int i = 0; i < series.length; i++) {
            series[i] = 3.0 * Math.exp(0.1 * i);
        }

        TrendModel model = fitter.fitNonLinear(series).orElseThrow();

        assertThat(model.getType()).isEqualTo(TrendType.EXPONENTIAL);
        assertThat(model.getCoefficients()[0]).isCloseTo(3.0, within(1e-6));
        assertThat(model.getCoefficients()[1]).isCloseTo(0.1, within(1e-9));
    }

    @Test
    @DisplayName("Should NOT fit non-linear forms to fewer than four points")
    void shouldSkipNonLinearForShortSeries() {
        assertThat(fitter.fitNonLinear(new double[] { 1, 4, 9 })).isEmpty();
    }

    @Test
    @DisplayName("Should handle empty and single-sample series in the linear fit")
    void shouldFitDegenerateLines() {
        assertThat(fitter.fitLinear(new double[0]).getCoefficients()).containsExactly(0.0, 0.0);
        assertThat(fitter.fitLinear(new double[] { 7.5 }).getCoefficients()).containsExactly(7.5, 0.0);
    }

    @Test
    @DisplayName("Should throw when selecting from no candidates")
    void shouldRejectEmptySelection() {
        assertThatThrownBy(() -> fitter.selectBest(Collections.emptyList()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fit an undifferenced ARIMA model to a stationary AR(1) process")
    void shouldFitStationaryArima() {
        Random random = new Random(17);
        double[] series = new double[300];
        for (int t = 1; t < series.length; t++) {
            series[t] = 0.7 * series[t - 1] + random.nextGaussian();
        }

        ArimaModel model = fitter.fitArima(series, tester.test(series)).orElseThrow();

        assertThat(model.getOrder().getD()).isZero();
        assertThat(model.getOrder().getP() + model.getOrder().getQ()).isPositive();
        assertThat(model.getSigma2()).isBetween(0.7, 1.4);
        assertThat(model.getTrendModel().getType()).isEqualTo(TrendType.ARIMA);
    }

    @Test
    @DisplayName("Should difference a trending random walk before fitting")
    void shouldDifferenceRandomWalk() {
        Random random = new Random(23);
        double[] series = new double[200];
        for (int t = 1; t < series.length; t++) {
            series[t] = series[t - 1] + 1.0 + random.nextGaussian();
        }

        ArimaModel model = fitter.fitArima(series, tester.test(series)).orElseThrow();

        assertThat(model.getOrder().getD()).isPositive();
    }

    @Test
    @DisplayName("Should extrapolate a random walk with drift linearly")
    void shouldForecastRandomWalkWithDrift() {
        Random random = new Random(29);
        double[] series = new double[100];
        for (int t = 1; t < series.length; t++) {
            series[t] = series[t - 1] + 0.5 + 0.2 * random.nextGaussian();
        }
        ArimaModel model = fitter.fitArimaOrder(series, new ArimaOrder(0, 1, 0)).orElseThrow();

        ArimaForecast forecast = fitter.forecastArima(model, series, 5);

        double last = series[series.length - 1];
        for (int h = 0; h < 5; h++) {
            assertThat(forecast.getMean()[h]).isCloseTo(last + (h + 1) * model.getConstant(), within(1e-9));
            assertThat(forecast.getStandardErrors()[h])
                    .isCloseTo(Math.sqrt(model.getSigma2() * (h + 1)), within(1e-9));
        }
        assertThat(model.getConstant()).isCloseTo(0.5, within(0.1));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double[] noisyQuadratic(Random random, int n) {
        double[] series = new double[n];
        for (int i = 0; i < n; i++) {
            series[i] = 2.0 + 0.5 * i * i + 0.5 * random.nextGaussian();
        }
        return series;
    }
}
