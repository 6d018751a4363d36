package com.market.sensitivity.series;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable date-indexed series of nullable doubles.
 *
 * <p>Dates are strictly increasing. A {@code null} value marks a missing
 * observation; NaN and infinite inputs are stored as missing so that every
 * consumer only has to check for {@code null}.
 */
public final class TimeSeries {

    private final List<LocalDate> dates;
    private final List<Double> values;

    private TimeSeries(List<LocalDate> dates, List<Double> values) {
        this.dates = dates;
        this.values = values;
    }

    public static TimeSeries of(List<LocalDate> dates, List<Double> values) {
        Objects.requireNonNull(dates, "dates");
        Objects.requireNonNull(values, "values");
        if (dates.size() != values.size()) {
            throw new IllegalArgumentException(
                    "dates and values differ in length: " + dates.size() + " vs " + values.size());
        }

        List<LocalDate> dateCopy = new ArrayList<>(dates.size());
        List<Double> valueCopy = new ArrayList<>(values.size());
        LocalDate previous = null;
        for (int i = 0; i < dates.size(); i++) {
            LocalDate date = Objects.requireNonNull(dates.get(i), "date at index " + i);
            if (previous != null && !date.isAfter(previous)) {
                throw new IllegalArgumentException(
                        "dates must be strictly increasing: " + previous + " then " + date);
            }
            dateCopy.add(date);
            valueCopy.add(normalize(values.get(i)));
            previous = date;
        }
        return new TimeSeries(Collections.unmodifiableList(dateCopy), Collections.unmodifiableList(valueCopy));
    }

    /**
     * Series over the given dates with every value missing.
     */
    public static TimeSeries empty(List<LocalDate> dates) {
        return of(dates, new ArrayList<>(Collections.nCopies(dates.size(), (Double) null)));
    }

    /**
     * New series on this index with the given values.
     */
    public TimeSeries withValues(List<Double> newValues) {
        return of(dates, newValues);
    }

    public int size() {
        return dates.size();
    }

    public LocalDate dateAt(int index) {
        return dates.get(index);
    }

    public Double valueAt(int index) {
        return values.get(index);
    }

    public boolean isMissing(int index) {
        return values.get(index) == null;
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public List<Double> values() {
        return values;
    }

    public boolean hasSameIndex(TimeSeries other) {
        return dates.equals(other.dates);
    }

    public int presentCount() {
        int count = 0;
        for (Double v : values) {
            if (v != null) count++;
        }
        return count;
    }

    /**
     * Mean over present values, empty when every value is missing.
     */
    public OptionalDouble mean() {
        return values.stream()
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
    }

    /**
     * First present value, or {@code null} if none.
     */
    public Double firstPresent() {
        for (Double v : values) {
            if (v != null) return v;
        }
        return null;
    }

    private static Double normalize(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries other)) return false;
        return dates.equals(other.dates) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dates, values);
    }

    @Override
    public String toString() {
        return "TimeSeries[size=" + size() + ", present=" + presentCount() + "]";
    }
}
