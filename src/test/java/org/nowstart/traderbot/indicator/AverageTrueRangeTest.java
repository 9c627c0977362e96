package org.nowstart.traderbot.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.nowstart.traderbot.support.TestBars;

class AverageTrueRangeTest {

    @Test
    void update_seedsWithMeanTrueRangeThenWilderSmooths() {
        AverageTrueRange atr = new AverageTrueRange(2);

        assertThat(atr.update(TestBars.ohlc(0, "9", "10", "8", "9"))).isNaN();
        assertThat(atr.update(TestBars.ohlc(1, "9", "11", "9", "10"))).isCloseTo(2.0, within(1e-12));
        assertThat(atr.update(TestBars.ohlc(2, "10", "14", "10", "13"))).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void update_usesPreviousCloseForGaps() {
        AverageTrueRange atr = new AverageTrueRange(1);

        atr.update(TestBars.ohlc(0, "10", "10", "10", "10"));
        double value = atr.update(TestBars.ohlc(1, "15", "16", "15", "16"));

        assertThat(value).isCloseTo(6.0, within(1e-12));
        assertThat(atr.key()).isEqualTo("atr_1");
    }
}
