package com.kpisentinel.core.table;

import com.kpisentinel.core.model.ForecastMethod;
import com.kpisentinel.core.model.ForecastPoint;
import com.kpisentinel.core.model.ForecastResult;
import com.kpisentinel.core.model.ForecastRow;
import com.kpisentinel.core.model.ValueType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ForecastTableAssembler}.
 */
class ForecastTableAssemblerTest {

    private static final LocalDate EVALUATION = LocalDate.of(2024, 4, 28);

    @Test
    @DisplayName("Should keep rows from the evaluation date, clamped and rounded per metric")
    void shouldAssembleRows() {
        ForecastResult orders = ForecastResult.of(ForecastMethod.SEASONAL_DECOMPOSITION, List.of(
                new ForecastPoint(EVALUATION.minusDays(1), 90, 80, 100),
                new ForecastPoint(EVALUATION, 10.6, 5, 15),
                new ForecastPoint(EVALUATION.plusDays(1), -3.2, -8, 2)));
        ForecastResult rate = ForecastResult.of(ForecastMethod.AUTOREGRESSIVE, List.of(
                new ForecastPoint(EVALUATION, 0.4567, 0.3, 0.6)));

        List<ForecastRow> rows = new ForecastTableAssembler(EVALUATION)
                .add("orders", ValueType.INTEGER, orders)
                .add("payment_outage", ValueType.INTEGER, ForecastResult.constraintSentinel())
                .add("conversion_rate", ValueType.DECIMAL, rate)
                .build();

        assertThat(rows).containsExactly(
                new ForecastRow(EVALUATION, "orders", 11.0),
                new ForecastRow(EVALUATION.plusDays(1), "orders", 0.0),
                new ForecastRow(EVALUATION, "conversion_rate", 0.4567));
    }
}
