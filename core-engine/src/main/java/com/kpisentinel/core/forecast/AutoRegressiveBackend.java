package com.kpisentinel.core.forecast;

import com.kpisentinel.core.model.ForecastMethod;
import com.kpisentinel.core.model.ForecastPoint;
import com.kpisentinel.core.model.ForecastResult;
import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.model.ModelParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Autoregressive model with a linear trend and a weekly seasonal lag.
 *
 * <h3>Fit</h3>
 * <ol>
 * <li>A constant plus linear trend is fitted by least squares and removed.</li>
 * <li>AR models on the detrended series are searched over non-seasonal orders
 * 0..{@value #MAX_AR_ORDER}, with and without the seasonal lag
 * {@value #SEASONAL_LAG}; the candidate with the lowest AIC wins.</li>
 * </ol>
 *
 * <h3>Forecast</h3>
 * <p>
 * Points start the day after the history ends and run through the last day of
 * the evaluation date's month. The band is symmetric, its half-width
 * {@code z * sqrt(var_h)} where {@code var_h} accumulates the squared
 * psi-weights of the chosen AR polynomial. The confidence level defaults to
 * 95%.
 * </p>
 *
 * @since 1.0.0
 */
public class AutoRegressiveBackend extends AbstractNumericBackend {

    private static final Logger LOG = LoggerFactory.getLogger(AutoRegressiveBackend.class);

    static final int MAX_AR_ORDER = 3;
    static final int SEASONAL_LAG = 7;
    static final int MIN_OBSERVATIONS = 3;

    private static final double MIN_VARIANCE = 1e-12;

    public AutoRegressiveBackend(ModelParameters params) {
        super(params);
    }

    @Override
    public ForecastResult forecast(MetricSeries history, LocalDate evaluationDate) {
        Objects.requireNonNull(evaluationDate, "Evaluation date must not be null");
        double[] y = requireComplete(history, MIN_OBSERVATIONS);
        int n = y.length;

        double[][] trendDesign = new double[n][];
        for (int i = 0; i < n; i++) {
            trendDesign[i] = new double[] { 1, i };
        }
        double[] trend = LeastSquares.fit(trendDesign, y, new double[2]);
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = y[i] - (trend[0] + trend[1] * i);
        }

        Candidate best = selectOrder(residuals);
        checkCancelled();

        LocalDate lastHistory = history.getDates().get(n - 1);
        LocalDate end = ForecastHorizon.lastDayOfMonth(evaluationDate);
        int horizon = (int) ChronoUnit.DAYS.between(lastHistory, end);
        if (horizon <= 0) {
            LOG.warn("Metric [{}]: history ends on {}, nothing to forecast through {}",
                    metric, lastHistory, end);
            return ForecastResult.of(ForecastMethod.AUTOREGRESSIVE, List.of());
        }

        double[] extended = Arrays.copyOf(residuals, n + horizon);
        for (int t = n; t < n + horizon; t++) {
            double value = 0;
            for (int j = 0; j < best.lags.length; j++) {
                value += best.coefficients[j] * extended[t - best.lags[j]];
            }
            extended[t] = value;
        }

        double[] psi = psiWeights(best, horizon);
        double z = NormalQuantile.forConfidenceLevel(confidenceLevel);
        List<ForecastPoint> points = new ArrayList<>(horizon);
        double cumulative = 0;
        for (int h = 1; h <= horizon; h++) {
            cumulative += psi[h - 1] * psi[h - 1];
            int t = n - 1 + h;
            double yhat = trend[0] + trend[1] * t + extended[t];
            double width = z * Math.sqrt(best.variance * cumulative);
            points.add(checkedPoint(new ForecastPoint(lastHistory.plusDays(h), yhat, yhat - width, yhat + width)));
        }

        LOG.debug("Metric [{}]: AR lags {} selected (aic={}), {} day(s) ahead",
                metric, Arrays.toString(best.lags), best.aic, horizon);
        return ForecastResult.of(ForecastMethod.AUTOREGRESSIVE, points);
    }

    @Override
    public ForecastMethod getMethod() {
        return ForecastMethod.AUTOREGRESSIVE;
    }

    // ---------------------------------------------------------------
    // Order search
    // ---------------------------------------------------------------

    private Candidate selectOrder(double[] residuals) {
        Candidate best = null;
        for (int p = 0; p <= MAX_AR_ORDER; p++) {
            for (boolean seasonal : new boolean[] { false, true }) {
                checkCancelled();
                int[] lags = lags(p, seasonal);
                Candidate candidate = fit(residuals, lags);
                if (candidate != null && (best == null || candidate.aic < best.aic)) {
                    best = candidate;
                }
            }
        }
        if (best == null) {
            throw new ForecastException("Metric '" + metric + "': no autoregressive candidate could be fitted");
        }
        return best;
    }

    private static int[] lags(int order, boolean seasonal) {
        int[] lags = new int[order + (seasonal ? 1 : 0)];
        for (int i = 0; i < order; i++) {
            lags[i] = i + 1;
        }
        if (seasonal) {
            lags[order] = SEASONAL_LAG;
        }
        return lags;
    }

    private static Candidate fit(double[] r, int[] lags) {
        int start = lags.length == 0 ? 0 : lags[lags.length - 1];
        int m = r.length - start;
        if (m <= lags.length + 2) {
            return null;
        }
        double[] coefficients = new double[lags.length];
        if (lags.length > 0) {
            double[][] x = new double[m][lags.length];
            double[] target = new double[m];
            for (int t = start; t < r.length; t++) {
                for (int j = 0; j < lags.length; j++) {
                    x[t - start][j] = r[t - lags[j]];
                }
                target[t - start] = r[t];
            }
            try {
                coefficients = LeastSquares.fit(x, target, new double[lags.length]);
            } catch (ForecastException e) {
                return null;
            }
        }
        double rss = 0;
        for (int t = start; t < r.length; t++) {
            double predicted = 0;
            for (int j = 0; j < lags.length; j++) {
                predicted += coefficients[j] * r[t - lags[j]];
            }
            rss += (r[t] - predicted) * (r[t] - predicted);
        }
        double variance = Math.max(rss / m, MIN_VARIANCE);
        double aic = m * Math.log(variance) + 2.0 * (lags.length + 1);
        return new Candidate(lags, coefficients, variance, aic);
    }

    private static double[] psiWeights(Candidate model, int horizon) {
        double[] psi = new double[horizon];
        psi[0] = 1;
        for (int j = 1; j < horizon; j++) {
            double value = 0;
            for (int k = 0; k < model.lags.length; k++) {
                if (model.lags[k] <= j) {
                    value += model.coefficients[k] * psi[j - model.lags[k]];
                }
            }
            psi[j] = value;
        }
        return psi;
    }

    private static final class Candidate {
        private final int[] lags;
        private final double[] coefficients;
        private final double variance;
        private final double aic;

        private Candidate(int[] lags, double[] coefficients, double variance, double aic) {
            this.lags = lags;
            this.coefficients = coefficients;
            this.variance = variance;
            this.aic = aic;
        }
    }
}
