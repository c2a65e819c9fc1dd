package com.kpisentinel.core.forecast;

import com.kpisentinel.core.model.ForecastMethod;
import com.kpisentinel.core.model.ModelParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory that creates {@link ForecastBackend} instances from
 * {@link ModelParameters}.
 *
 * <p>
 * This is the single point of extension when adding a forecasting method:
 * add the constant to {@link ForecastMethod} and map it here.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastBackendFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastBackendFactory.class);

    private ForecastBackendFactory() {
        // utility class
    }

    /**
     * Create a backend for the given metric parameters.
     *
     * @param params metric parameters; must not be {@code null}
     * @return backend implementing the configured method
     * @throws NullPointerException     if {@code params} or its method is
     *                                  {@code null}
     * @throws IllegalArgumentException if the method is unknown or a parameter
     *                                  is invalid
     */
    public static ForecastBackend create(ModelParameters params) {
        Objects.requireNonNull(params, "ModelParameters must not be null");
        Objects.requireNonNull(params.getMethod(), "Method must not be null for metric '" + params.getKpi() + "'");

        ForecastMethod method = ForecastMethod.fromConfig(params.getMethod());
        LOG.trace("Metric [{}]: using {} backend", params.getKpi(), method.getConfigName());
        return switch (method) {
            case SEASONAL_DECOMPOSITION -> new SeasonalDecompositionBackend(params);
            case AUTOREGRESSIVE -> new AutoRegressiveBackend(params);
            case CONSTRAINT -> new ConstraintBackend();
        };
    }
}
