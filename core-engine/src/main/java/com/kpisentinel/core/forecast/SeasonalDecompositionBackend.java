package com.kpisentinel.core.forecast;

import com.kpisentinel.core.model.ForecastMethod;
import com.kpisentinel.core.model.ForecastPoint;
import com.kpisentinel.core.model.ForecastResult;
import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.model.ModelParameters;
import com.kpisentinel.core.model.SeasonalityMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Trend plus weekly seasonality model.
 *
 * <h3>Model</h3>
 * <p>
 * The trend is piecewise linear with up to {@value #MAX_CHANGE_POINTS} change
 * points spread over the first 80% of the history. Slope changes are ridge
 * penalised with strength {@code 1 / changePointSensitivity}, so a higher
 * sensitivity lets the trend follow recent shifts more closely. A weekly
 * Fourier series of order {@value #FOURIER_ORDER} (period 7) models the day of
 * week effect.
 * </p>
 * <ul>
 * <li>additive: {@code y = trend + weekly}</li>
 * <li>multiplicative: {@code y = trend * (1 + weekly)}; the trend comes from
 * the joint fit, the weekly factor is then fitted on {@code y / trend - 1}</li>
 * </ul>
 *
 * <h3>Band</h3>
 * <p>
 * {@code ± z * σ * sqrt(1 + h / n)} where σ is the in-sample residual standard
 * deviation, {@code h} the number of days past the end of the history and
 * {@code z} the normal quantile for the configured confidence level.
 * </p>
 *
 * <p>
 * Points are produced for every day from the first history date through the
 * last day of the evaluation date's month.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalDecompositionBackend extends AbstractNumericBackend {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalDecompositionBackend.class);

    static final int WEEKLY_PERIOD = 7;
    static final int FOURIER_ORDER = 3;
    static final int MAX_CHANGE_POINTS = 25;
    static final double CHANGE_POINT_RANGE = 0.8;
    static final double SEASONALITY_PRIOR_SCALE = 10.0;
    static final int MIN_OBSERVATIONS = 2;

    private static final double EPSILON = 1e-9;

    private final SeasonalityMode mode;
    private final double changePointSensitivity;

    /**
     * @param params metric parameters; {@code confidenceInterval} is required
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public SeasonalDecompositionBackend(ModelParameters params) {
        super(requireConfidence(params));
        this.mode = params.seasonality();
        this.changePointSensitivity = params.getChangePointSensitivity();
        if (!(changePointSensitivity > 0)) {
            throw new IllegalArgumentException("changePointSensitivity must be > 0 for metric '"
                    + metric + "', got: " + changePointSensitivity);
        }
    }

    private static ModelParameters requireConfidence(ModelParameters params) {
        Objects.requireNonNull(params, "ModelParameters must not be null");
        if (params.getConfidenceInterval() == null) {
            throw new IllegalArgumentException("confidenceInterval is required for metric '"
                    + params.getKpi() + "'");
        }
        return params;
    }

    @Override
    public ForecastResult forecast(MetricSeries history, LocalDate evaluationDate) {
        Objects.requireNonNull(evaluationDate, "Evaluation date must not be null");
        double[] y = requireComplete(history, MIN_OBSERVATIONS);
        int n = y.length;
        LocalDate start = history.getDates().get(0);
        double span = n - 1;

        double scale = 0;
        for (double v : y) {
            scale = Math.max(scale, Math.abs(v));
        }
        if (scale == 0) {
            scale = 1;
        }

        double[] changePoints = changePoints(n, span);
        int trendColumns = 2 + changePoints.length;
        int columns = trendColumns + 2 * FOURIER_ORDER;

        double[][] x = new double[n][];
        double[] scaled = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = features(i / span, start.plusDays(i), changePoints, columns);
            scaled[i] = y[i] / scale;
        }
        double[] penalty = new double[columns];
        for (int c = 2; c < trendColumns; c++) {
            penalty[c] = 1.0 / changePointSensitivity;
        }
        for (int c = trendColumns; c < columns; c++) {
            penalty[c] = 1.0 / SEASONALITY_PRIOR_SCALE;
        }
        checkCancelled();
        double[] beta = LeastSquares.fit(x, scaled, penalty);

        double[] weekly = mode == SeasonalityMode.MULTIPLICATIVE
                ? fitWeeklyFactor(x, y, beta, trendColumns, scale)
                : Arrays.copyOfRange(beta, trendColumns, columns);

        double sumSquares = 0;
        for (int i = 0; i < n; i++) {
            double residual = y[i] - predict(x[i], beta, weekly, trendColumns, scale);
            sumSquares += residual * residual;
        }
        double sigma = Math.sqrt(sumSquares / n);
        double z = NormalQuantile.forConfidenceLevel(confidenceLevel);

        LocalDate end = ForecastHorizon.lastDayOfMonth(evaluationDate);
        LocalDate lastHistory = history.getDates().get(n - 1);
        if (end.isBefore(lastHistory)) {
            end = lastHistory;
        }
        int total = (int) ChronoUnit.DAYS.between(start, end) + 1;

        List<ForecastPoint> points = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            checkCancelled();
            LocalDate date = start.plusDays(i);
            double[] row = features(i / span, date, changePoints, columns);
            double yhat = predict(row, beta, weekly, trendColumns, scale);
            int ahead = Math.max(0, i - (n - 1));
            double width = z * sigma * Math.sqrt(1.0 + (double) ahead / n);
            points.add(checkedPoint(new ForecastPoint(date, yhat, yhat - width, yhat + width)));
        }

        LOG.debug("Metric [{}]: {} fit on {} day(s), {} change point(s), sigma={}",
                metric, mode, n, changePoints.length, sigma);
        return ForecastResult.of(ForecastMethod.SEASONAL_DECOMPOSITION, points);
    }

    @Override
    public ForecastMethod getMethod() {
        return ForecastMethod.SEASONAL_DECOMPOSITION;
    }

    // ---------------------------------------------------------------
    // Model internals
    // ---------------------------------------------------------------

    private static double[] changePoints(int n, double span) {
        int count = Math.max(0, Math.min(MAX_CHANGE_POINTS, (int) (CHANGE_POINT_RANGE * n) - 1));
        double[] points = new double[count];
        for (int j = 0; j < count; j++) {
            long index = Math.round((j + 1) * CHANGE_POINT_RANGE * (n - 1) / (count + 1));
            points[j] = index / span;
        }
        return points;
    }

    private static double[] features(double t, LocalDate date, double[] changePoints, int columns) {
        double[] row = new double[columns];
        row[0] = 1;
        row[1] = t;
        for (int j = 0; j < changePoints.length; j++) {
            row[2 + j] = Math.max(0, t - changePoints[j]);
        }
        fillWeekly(row, 2 + changePoints.length, date);
        return row;
    }

    private static void fillWeekly(double[] row, int offset, LocalDate date) {
        long day = date.toEpochDay();
        for (int k = 1; k <= FOURIER_ORDER; k++) {
            double angle = 2 * Math.PI * k * day / WEEKLY_PERIOD;
            row[offset + 2 * (k - 1)] = Math.sin(angle);
            row[offset + 2 * (k - 1) + 1] = Math.cos(angle);
        }
    }

    private static double trend(double[] row, double[] beta, int trendColumns) {
        double sum = 0;
        for (int c = 0; c < trendColumns; c++) {
            sum += row[c] * beta[c];
        }
        return sum;
    }

    private static double weeklyTerm(double[] row, double[] coefficients, int offset) {
        double sum = 0;
        for (int c = 0; c < 2 * FOURIER_ORDER; c++) {
            sum += row[offset + c] * coefficients[c];
        }
        return sum;
    }

    private double predict(double[] row, double[] beta, double[] weekly, int trendColumns, double scale) {
        double trend = trend(row, beta, trendColumns) * scale;
        double seasonal = weeklyTerm(row, weekly, trendColumns);
        return mode == SeasonalityMode.MULTIPLICATIVE
                ? trend * (1 + seasonal)
                : trend + seasonal * scale;
    }

    private double[] fitWeeklyFactor(double[][] x, double[] y, double[] beta, int trendColumns,
            double scale) {
        List<double[]> rows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        for (int i = 0; i < y.length; i++) {
            double trend = trend(x[i], beta, trendColumns) * scale;
            if (Math.abs(trend) > EPSILON) {
                rows.add(Arrays.copyOfRange(x[i], trendColumns, trendColumns + 2 * FOURIER_ORDER));
                targets.add(y[i] / trend - 1);
            }
        }
        if (rows.isEmpty()) {
            LOG.warn("Metric [{}]: trend is zero everywhere, weekly factor set to 0", metric);
            return new double[2 * FOURIER_ORDER];
        }
        double[] target = new double[targets.size()];
        for (int i = 0; i < target.length; i++) {
            target[i] = targets.get(i);
        }
        double[] penalty = new double[2 * FOURIER_ORDER];
        Arrays.fill(penalty, 1.0 / SEASONALITY_PRIOR_SCALE);
        return LeastSquares.fit(rows.toArray(new double[0][]), target, penalty);
    }
}
