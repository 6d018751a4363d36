package com.market.sensitivity.indicator;

import com.market.sensitivity.series.TestSeries;
import com.market.sensitivity.series.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("VolatilityAdjustedRatioEngine Tests")
class VolatilityAdjustedRatioEngineTest {

    private static final int SIZE = 60;

    @Test
    @DisplayName("Unit true range reduces to the plain performance ratio")
    void unitTrueRangeMatchesPlainRatio() {
        int window = 8;
        TimeSeries returns = TestSeries.wave(SIZE, 0.02, 0.4);
        // high - low = 1 and closes sit mid-range, so every true range is exactly 1
        TimeSeries high = TestSeries.constant(SIZE, 101.0);
        TimeSeries low = TestSeries.constant(SIZE, 100.0);
        TimeSeries close = TestSeries.constant(SIZE, 100.5);

        TimeSeries adjusted = VolatilityAdjustedRatioEngine.compute(returns, high, low, close, window);
        TimeSeries plain = PerformanceRatioEngine.compute(returns, window);

        assertThat(adjusted.size()).isEqualTo(SIZE);
        for (int i = 0; i < 2 * window - 1; i++) {
            assertThat(adjusted.isMissing(i)).isTrue();
        }
        for (int i = 2 * window - 1; i < SIZE; i++) {
            assertThat(adjusted.valueAt(i)).isEqualTo(plain.valueAt(i));
        }
    }

    @Test
    @DisplayName("Returns are divided by the average true range")
    void dividesByAverageTrueRange() {
        TimeSeries returns = TestSeries.of(0.02, -0.04);
        TimeSeries atr = TestSeries.of(2.0, 4.0);

        TimeSeries adjusted = VolatilityAdjustedRatioEngine.adjustedReturns(returns, atr);

        assertThat(adjusted.valueAt(0)).isCloseTo(0.01, within(1e-12));
        assertThat(adjusted.valueAt(1)).isCloseTo(-0.01, within(1e-12));
    }

    @Test
    @DisplayName("Zero or missing true range gives a missing adjusted return")
    void zeroRangeIsMissing() {
        TimeSeries returns = TestSeries.of(0.02, -0.04, 0.01);
        TimeSeries atr = TestSeries.of(0.0, null, 1.0);

        TimeSeries adjusted = VolatilityAdjustedRatioEngine.adjustedReturns(returns, atr);

        assertThat(adjusted.isMissing(0)).isTrue();
        assertThat(adjusted.isMissing(1)).isTrue();
        assertThat(adjusted.valueAt(2)).isEqualTo(0.01);
    }

    @Test
    @DisplayName("Flat bars blank the whole ratio rather than producing infinities")
    void flatBarsYieldMissing() {
        TimeSeries returns = TestSeries.wave(SIZE, 0.02, 0.4);
        TimeSeries flat = TestSeries.constant(SIZE, 100.0);

        TimeSeries adjusted = VolatilityAdjustedRatioEngine.compute(returns, flat, flat, flat, 5);

        assertThat(adjusted.presentCount()).isZero();
    }

    @Test
    @DisplayName("Returns and bars must share one index")
    void rejectsMisalignedReturns() {
        TimeSeries bars = TestSeries.constant(10, 100.0);

        assertThatThrownBy(() -> VolatilityAdjustedRatioEngine.compute(TestSeries.constant(9, 0.01),
                bars, bars, bars, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
