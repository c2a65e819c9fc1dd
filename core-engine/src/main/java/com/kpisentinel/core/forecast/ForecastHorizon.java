package com.kpisentinel.core.forecast;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Month-end arithmetic used to size forecasts.
 *
 * <p>
 * The last day of a month is found by jumping 31 days past its first day,
 * which always lands in the next month, and stepping back by that day's
 * day-of-month.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastHorizon {

    private ForecastHorizon() {
        // utility class
    }

    /**
     * @param date any day of the month
     * @return last day of the month containing {@code date}
     */
    public static LocalDate lastDayOfMonth(LocalDate date) {
        Objects.requireNonNull(date, "Date must not be null");
        LocalDate inNextMonth = date.withDayOfMonth(1).plusDays(31);
        return inNextMonth.minusDays(inNextMonth.getDayOfMonth());
    }

    /**
     * @param date evaluation date
     * @return number of days from {@code date} through month end, inclusive
     */
    public static int remainingDays(LocalDate date) {
        return (int) ChronoUnit.DAYS.between(date, lastDayOfMonth(date)) + 1;
    }
}
