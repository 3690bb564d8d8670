package com.rovertrend.core.trend;

import com.rovertrend.core.model.ArimaModel;
import com.rovertrend.core.model.ArimaOrder;
import com.rovertrend.core.model.TrendModel;
import com.rovertrend.core.model.TrendType;
import com.rovertrend.core.util.SeriesMath;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed-order ARIMA estimation and forecasting.
 *
 * <p>
 * Parameters are estimated with the Hannan-Rissanen two-stage regression: a
 * long autoregression supplies innovation estimates, then the differenced
 * series is regressed on its own lags and the lagged innovations. Residuals
 * are then recomputed recursively (conditional sum of squares) from the
 * final coefficients.
 * </p>
 *
 * <p>
 * The AR and MA coefficients of an accepted candidate each have absolute
 * sum below 1, a sufficient condition for stationarity and invertibility.
 * </p>
 */
final class ArimaEstimator {

    /** Residual degrees of freedom required beyond the parameter count. */
    private static final int MIN_DOF = 3;

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private static final double MIN_MSE = 1e-300;

    private ArimaEstimator() {
    }

    /**
     * Fit {@code order} to {@code series}.
     *
     * @param series       level series
     * @param order        model order
     * @param commonStart  first differenced index included in the likelihood,
     *                     shared by every candidate of a grid so their
     *                     information criteria are comparable
     * @return the model, or empty when the series is too short, the regression
     *         is singular or the estimate is unstable
     */
    static Optional<ArimaModel> fit(double[] series, ArimaOrder order, int commonStart) {
        int p = order.getP();
        int q = order.getQ();
        int d = order.getD();
        double[] w = SeriesMath.difference(series, d);
        int n = w.length;
        int start = Math.max(commonStart, p);
        int k = p + q + 1;
        if (n - start < k + MIN_DOF) {
            return Optional.empty();
        }

        double constant;
        double[] phi = new double[p];
        double[] theta = new double[q];
        try {
            if (p == 0 && q == 0) {
                constant = SeriesMath.mean(w);
            } else if (q == 0) {
                double[] beta = regress(w, p, null, 0, p);
                constant = beta[0];
                System.arraycopy(beta, 1, phi, 0, p);
            } else {
                int m = longArOrder(n, p, q);
                if (n - m < m + 1 + MIN_DOF) {
                    return Optional.empty();
                }
                double[] longAr = regress(w, m, null, 0, m);
                double[] innovations = new double[n];
                for (int t = m; t < n; t++) {
                    double pred = longAr[0];
                    for (int i = 1; i <= m; i++) {
                        pred += longAr[i] * w[t - i];
                    }
                    innovations[t] = w[t] - pred;
                }
                int first = Math.max(p, m + q);
                if (n - first < k + MIN_DOF) {
                    return Optional.empty();
                }
                double[] beta = regress(w, p, innovations, q, first);
                constant = beta[0];
                System.arraycopy(beta, 1, phi, 0, p);
                System.arraycopy(beta, 1 + p, theta, 0, q);
            }
        } catch (MathIllegalArgumentException e) {
            return Optional.empty();
        }

        if (absSum(phi) >= 1.0 || absSum(theta) >= 1.0) {
            return Optional.empty();
        }

        double[] residuals = cssResiduals(w, constant, phi, theta);
        if (!SeriesMath.allFinite(residuals) || !Double.isFinite(constant)) {
            return Optional.empty();
        }

        int nEff = n - start;
        double sse = SeriesMath.sumOfSquares(residuals, start);
        double sigma2 = nEff > k ? sse / (nEff - k) : sse / nEff;
        double logLik = -0.5 * nEff * (Math.log(2 * Math.PI) + Math.log(Math.max(sse / nEff, MIN_MSE)) + 1);
        double aic = -2 * logLik + 2 * k;
        double bic = -2 * logLik + k * Math.log(nEff);

        double[] fitted = new double[series.length];
        for (int t = 0; t < series.length; t++) {
            fitted[t] = t < d ? series[t] : series[t] - residuals[t - d];
        }
        double[] coefficients = new double[k];
        coefficients[0] = constant;
        System.arraycopy(phi, 0, coefficients, 1, p);
        System.arraycopy(theta, 0, coefficients, 1 + p, q);
        TrendModel trend = TrendModel.of(TrendType.ARIMA, coefficients, equation(order, constant, phi, theta),
                series, fitted);

        return Optional.of(ArimaModel.builder()
                .order(order)
                .constant(constant)
                .arCoefficients(phi)
                .maCoefficients(theta)
                .sigma2(sigma2)
                .logLikelihood(logLik)
                .aic(aic)
                .bic(bic)
                .residuals(residuals)
                .trendModel(trend)
                .build());
    }

    /**
     * Forecast {@code horizon} steps past the end of {@code series}, which
     * must be the series the model was fitted to.
     *
     * @throws IllegalArgumentException if the residuals do not line up with the series
     */
    static ArimaForecast forecast(ArimaModel model, double[] series, int horizon) {
        ArimaOrder order = model.getOrder();
        int d = order.getD();
        double[] phi = model.getArCoefficients();
        double[] theta = model.getMaCoefficients();
        double[] residuals = model.getResiduals();

        // stage[j] holds the j-times differenced series, extended with forecasts
        double[][] stage = new double[d + 1][];
        stage[0] = series;
        for (int j = 1; j <= d; j++) {
            stage[j] = SeriesMath.difference(stage[j - 1], 1);
        }
        double[] w = stage[d];
        if (residuals.length != w.length) {
            throw new IllegalArgumentException("Model residuals (" + residuals.length
                    + ") do not match differenced series (" + w.length + ")");
        }

        int n = w.length;
        double[] wExt = new double[n + horizon];
        System.arraycopy(w, 0, wExt, 0, n);
        for (int h = 0; h < horizon; h++) {
            int t = n + h;
            double pred = model.getConstant();
            for (int i = 1; i <= phi.length; i++) {
                int idx = t - i;
                if (idx >= 0) {
                    pred += phi[i - 1] * wExt[idx];
                }
            }
            for (int j = 1; j <= theta.length; j++) {
                int idx = t - j;
                if (idx >= 0 && idx < n) {
                    pred += theta[j - 1] * residuals[idx];
                }
            }
            wExt[t] = pred;
        }

        double[] forecast = new double[horizon];
        System.arraycopy(wExt, n, forecast, 0, horizon);
        for (int j = d - 1; j >= 0; j--) {
            double last = stage[j].length > 0 ? stage[j][stage[j].length - 1] : 0.0;
            for (int h = 0; h < horizon; h++) {
                last += forecast[h];
                forecast[h] = last;
            }
        }

        double[] psi = psiWeights(phi, theta, d, horizon);
        double[] se = new double[horizon];
        double cumulative = 0;
        for (int h = 0; h < horizon; h++) {
            cumulative += psi[h] * psi[h];
            se[h] = Math.sqrt(model.getSigma2() * cumulative);
        }
        return new ArimaForecast(forecast, se);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * OLS of {@code w[t]} on an intercept, {@code arLags} lags of {@code w}
     * and {@code maLags} lags of {@code innovations}, for {@code t >= first}.
     *
     * @return {@code [intercept, ar..., ma...]}
     */
    private static double[] regress(double[] w, int arLags, double[] innovations, int maLags, int first) {
        int rows = w.length - first;
        double[] y = new double[rows];
        double[][] x = new double[rows][arLags + maLags];
        for (int r = 0; r < rows; r++) {
            int t = first + r;
            y[r] = w[t];
            for (int i = 1; i <= arLags; i++) {
                x[r][i - 1] = w[t - i];
            }
            for (int j = 1; j <= maLags; j++) {
                x[r][arLags + j - 1] = innovations[t - j];
            }
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
        ols.newSampleData(y, x);
        return ols.estimateRegressionParameters();
    }

    private static int longArOrder(int n, int p, int q) {
        int preferred = Math.min((int) Math.round(2 * Math.log(n)), n / 4);
        return Math.max(Math.max(p, q) + 1, preferred);
    }

    static double[] cssResiduals(double[] w, double constant, double[] phi, double[] theta) {
        int n = w.length;
        int p = phi.length;
        double[] e = new double[n];
        for (int t = p; t < n; t++) {
            double pred = constant;
            for (int i = 1; i <= p; i++) {
                pred += phi[i - 1] * w[t - i];
            }
            for (int j = 1; j <= theta.length && t - j >= 0; j++) {
                pred += theta[j - 1] * e[t - j];
            }
            e[t] = w[t] - pred;
        }
        return e;
    }

    /**
     * MA(infinity) weights of {@code phi(B)(1-B)^d y = theta(B) e}.
     */
    static double[] psiWeights(double[] phi, double[] theta, int d, int count) {
        // lag polynomial 1 - phi_1 B - ... multiplied by (1 - B)^d
        double[] ar = new double[phi.length + 1];
        ar[0] = 1.0;
        for (int i = 0; i < phi.length; i++) {
            ar[i + 1] = -phi[i];
        }
        for (int j = 0; j < d; j++) {
            double[] next = new double[ar.length + 1];
            for (int i = 0; i < ar.length; i++) {
                next[i] += ar[i];
                next[i + 1] -= ar[i];
            }
            ar = next;
        }

        double[] psi = new double[count];
        for (int j = 0; j < count; j++) {
            double value = j == 0 ? 1.0 : (j <= theta.length ? theta[j - 1] : 0.0);
            for (int i = 1; i < ar.length && i <= j; i++) {
                value -= ar[i] * psi[j - i];
            }
            psi[j] = value;
        }
        return psi;
    }

    private static double absSum(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += Math.abs(v);
        }
        return sum;
    }

    private static String equation(ArimaOrder order, double constant, double[] phi, double[] theta) {
        StringBuilder sb = new StringBuilder(order.toString()).append(": w = ")
                .append(String.format(Locale.ROOT, "%.4f", constant));
        for (int i = 0; i < phi.length; i++) {
            sb.append(String.format(Locale.ROOT, " %+.4f·w[t-%d]", phi[i], i + 1));
        }
        for (int j = 0; j < theta.length; j++) {
            sb.append(String.format(Locale.ROOT, " %+.4f·e[t-%d]", theta[j], j + 1));
        }
        return sb.toString();
    }
}
