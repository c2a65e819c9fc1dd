package com.kpisentinel.core.imputation;

import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.model.TimeSeriesFrame;
import com.kpisentinel.core.model.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Imputer}.
 */
class ImputerTest {

    private Imputer imputer;

    @BeforeEach
    void setUp() {
        imputer = new Imputer();
    }

    @Test
    @DisplayName("Should fill gaps with the trailing 7-day mean of observed values")
    void shouldFillGapsWithTrailingMean() {
        Map<String, Double[]> values = new LinkedHashMap<>();
        values.put("metric1", new Double[] { 1.0, 2.0, null, 4.0, 5.0, null, null, 8.0, 9.0, 10.0 });
        values.put("metric2", new Double[] { 11.0, 12.0, 13.0, null, 15.0, null, null, null, 19.0, 20.0 });
        TimeSeriesFrame frame = TimeSeriesFrame.ofValues(dates(10), values);

        TimeSeriesFrame filled = imputer.fillGaps(frame);

        // means are taken over observed values only, filled values do not feed later gaps
        assertThat(filled.column("metric1").orElseThrow().getValues())
                .containsExactly(1.0, 2.0, 2.0, 4.0, 5.0, 3.0, 3.0, 8.0, 9.0, 10.0);
        assertThat(filled.column("metric2").orElseThrow().getValues())
                .containsExactly(11.0, 12.0, 13.0, 12.0, 15.0, 13.0, 13.0, 13.0, 19.0, 20.0);
    }

    @Test
    @DisplayName("Should keep fractional fills for decimal metrics")
    void shouldNotRoundDecimalMetrics() {
        MetricSeries series = new MetricSeries("rate", ValueType.DECIMAL, dates(3),
                new Double[] { 0.5, 0.25, null });

        assertThat(imputer.fillGaps(series).getValues()).containsExactly(0.5, 0.25, 0.375);
    }

    @Test
    @DisplayName("Should fill with 0 when the window holds no observation")
    void shouldFillZeroWithoutObservations() {
        Double[] values = new Double[9];
        values[0] = 4.0;
        MetricSeries series = new MetricSeries("orders", ValueType.INTEGER, dates(9), values);

        Double[] filled = imputer.fillGaps(series).getValues();

        assertThat(filled[6]).isEqualTo(4.0);
        assertThat(filled[7]).isEqualTo(0.0);
        assertThat(filled[8]).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should leave an entirely missing column untouched")
    void shouldLeaveAllMissingColumn() {
        MetricSeries series = new MetricSeries("empty", ValueType.DECIMAL, dates(3), new Double[3]);

        assertThat(imputer.fillGaps(series).isEntirelyMissing()).isTrue();
    }

    @Test
    @DisplayName("Should remove values beyond three standard deviations")
    void shouldRemoveOutliers() {
        Double[] values = new Double[21];
        Arrays.fill(values, 10.0);
        values[20] = 1000.0;
        MetricSeries series = new MetricSeries("orders", ValueType.INTEGER, dates(21), values);

        Double[] cleaned = imputer.removeOutliers(series).getValues();

        assertThat(cleaned[20]).isNull();
        assertThat(Arrays.copyOf(cleaned, 20)).containsOnly(10.0);
    }

    @Test
    @DisplayName("Should keep every value of a short series")
    void shouldKeepShortSeries() {
        Double[] values = { 1.0, 2.0, 3.0, 4.0, 500.0 };
        MetricSeries series = new MetricSeries("orders", ValueType.INTEGER, dates(5), values);

        assertThat(imputer.removeOutliers(series).getValues()).containsExactly(values);
    }

    @Test
    @DisplayName("Outlier removal should be idempotent")
    void outlierRemovalShouldBeIdempotent() {
        List<Double> raw = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            raw.add(100.0 + (i % 5));
        }
        raw.set(10, 160.0);
        raw.set(30, 400.0);
        MetricSeries series = new MetricSeries("sessions", ValueType.INTEGER, dates(40),
                raw.toArray(new Double[0]));

        MetricSeries once = imputer.removeOutliers(series);
        MetricSeries twice = imputer.removeOutliers(once);

        assertThat(once.getValues()[30]).isNull();
        assertThat(once.getValues()[10]).isNull();
        assertThat(twice.getValues()).containsExactly(once.getValues());
    }

    private static List<LocalDate> dates(int n) {
        List<LocalDate> dates = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            dates.add(LocalDate.of(2022, 1, 1).plusDays(i));
        }
        return dates;
    }
}
