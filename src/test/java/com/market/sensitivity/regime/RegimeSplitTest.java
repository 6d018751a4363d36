package com.market.sensitivity.regime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RegimeSplit Tests")
class RegimeSplitTest {

    @Test
    @DisplayName("Observations are partitioned by the sign of the market return")
    void partitionsBySign() {
        List<Double> metric = Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0, 6.0);
        List<Double> market = Arrays.asList(0.01, -0.02, 0.0, null, 0.03, -0.04);

        RegimeSplit split = RegimeSplit.of(metric, market);

        assertThat(split.up().getRegime()).isEqualTo(MarketRegime.UP);
        assertThat(split.up().getMarketReturns()).containsExactly(0.01, 0.03);
        assertThat(split.up().getMetricValues()).containsExactly(1.0, 5.0);
        assertThat(split.down().getRegime()).isEqualTo(MarketRegime.DOWN);
        assertThat(split.down().getMarketReturns()).containsExactly(-0.02, -0.04);
        assertThat(split.down().getMetricValues()).containsExactly(2.0, 6.0);
    }

    @Test
    @DisplayName("Missing metric values stay paired with their market return")
    void keepsMissingMetric() {
        RegimeSplit split = RegimeSplit.of(Arrays.asList(null, 2.0), Arrays.asList(0.01, -0.01));

        assertThat(split.up().getMetricValues()).containsExactly((Double) null);
        assertThat(split.up().getMarketReturns()).containsExactly(0.01);
        assertThat(split.down().getMetricValues()).containsExactly(2.0);
    }

    @Test
    @DisplayName("Gate requires strictly more than window / 4 per regime")
    void gateIsStrict() {
        // window 8 -> threshold 2
        RegimeSplit twoEach = RegimeSplit.of(
                Arrays.asList(1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0),
                Arrays.asList(0.01, -0.01, 0.02, -0.02, 0.0, 0.0, 0.0, 0.0));
        RegimeSplit threeEach = RegimeSplit.of(
                Arrays.asList(1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0),
                Arrays.asList(0.01, -0.01, 0.02, -0.02, 0.03, -0.03, 0.0, 0.0));

        assertThat(twoEach.isValid(8)).isFalse();
        assertThat(threeEach.isValid(8)).isTrue();
    }

    @Test
    @DisplayName("Gate uses integer division of the window")
    void gateUsesIntegerDivision() {
        // window 11 -> threshold 2
        RegimeSplit split = RegimeSplit.of(
                Arrays.asList(1.0, 1.0, 1.0, 1.0, 1.0, 1.0),
                Arrays.asList(0.01, 0.02, 0.03, -0.01, -0.02, -0.03));

        assertThat(split.isValid(11)).isTrue();
        assertThat(split.isValid(12)).isFalse();
    }

    @Test
    @DisplayName("Mismatched window lengths are rejected")
    void rejectsMismatchedLengths() {
        assertThatThrownBy(() -> RegimeSplit.of(List.of(1.0), List.of(0.01, 0.02)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Flat and missing market returns belong to no regime")
    void classifiesFlatAsNone() {
        assertThat(MarketRegime.classify(0.0)).isEmpty();
        assertThat(MarketRegime.classify(null)).isEmpty();
        assertThat(MarketRegime.classify(1e-9)).contains(MarketRegime.UP);
        assertThat(MarketRegime.classify(-1e-9)).contains(MarketRegime.DOWN);
    }
}
