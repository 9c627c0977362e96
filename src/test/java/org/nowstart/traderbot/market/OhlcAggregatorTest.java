package org.nowstart.traderbot.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Observation;
import org.nowstart.traderbot.data.exception.StaleObservationException;

class OhlcAggregatorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final OhlcAggregator aggregator = new OhlcAggregator("BTCUSDT", Duration.ofMinutes(1));

    @Test
    void ingest_buildsBarAndSealsOnLaterWindow() {
        assertThat(aggregator.ingest(observation("100", "1", 5))).isEmpty();
        assertThat(aggregator.ingest(observation("105", "2", 20))).isEmpty();
        assertThat(aggregator.ingest(observation("98", "1", 40))).isEmpty();
        assertThat(aggregator.ingest(observation("101", "0.5", 59))).isEmpty();

        Optional<Bar> sealed = aggregator.ingest(observation("102", "1", 61));

        assertThat(sealed).isPresent();
        Bar bar = sealed.get();
        assertThat(bar.openTime()).isEqualTo(T0);
        assertThat(bar.open()).isEqualByComparingTo("100");
        assertThat(bar.high()).isEqualByComparingTo("105");
        assertThat(bar.low()).isEqualByComparingTo("98");
        assertThat(bar.close()).isEqualByComparingTo("101");
        assertThat(bar.volume()).isEqualByComparingTo("4.5");
        assertThat(aggregator.currentBar().orElseThrow().openTime()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void ingest_alignsWindowsToEpoch() {
        aggregator.ingest(observation("100", "1", 125));

        assertThat(aggregator.currentBar().orElseThrow().openTime()).isEqualTo(T0.plusSeconds(120));
    }

    @Test
    void ingest_rejectsStaleObservationAndKeepsOpenBar() {
        aggregator.ingest(observation("100", "1", 65));
        Bar before = aggregator.currentBar().orElseThrow();

        assertThatThrownBy(() -> aggregator.ingest(observation("50", "3", 30)))
                .isInstanceOf(StaleObservationException.class)
                .extracting(exception -> ((StaleObservationException) exception).getOpenWindowStart())
                .isEqualTo(T0.plusSeconds(60));

        assertThat(aggregator.currentBar()).contains(before);
    }

    @Test
    void ingest_rejectsObservationInsideSealedWindow() {
        aggregator.ingest(observation("100", "1", 10));
        aggregator.sealIfElapsed(T0.plusSeconds(60));

        assertThatThrownBy(() -> aggregator.ingest(observation("101", "1", 50)))
                .isInstanceOf(StaleObservationException.class);
    }

    @Test
    void ingest_producesNoSyntheticBarsForGaps() {
        aggregator.ingest(observation("100", "1", 0));

        Optional<Bar> sealed = aggregator.ingest(observation("110", "1", 600));

        assertThat(sealed.orElseThrow().openTime()).isEqualTo(T0);
        assertThat(aggregator.currentBar().orElseThrow().openTime()).isEqualTo(T0.plusSeconds(600));
    }

    @Test
    void sealedBar_isNotMutatedBySubsequentIngestion() {
        aggregator.ingest(observation("100", "1", 0));
        Bar sealed = aggregator.ingest(observation("120", "1", 60)).orElseThrow();

        aggregator.ingest(observation("200", "5", 70));
        aggregator.ingest(observation("1", "5", 80));

        assertThat(sealed.high()).isEqualByComparingTo("100");
        assertThat(sealed.low()).isEqualByComparingTo("100");
        assertThat(sealed.volume()).isEqualByComparingTo("1");
    }

    @Test
    void sealIfElapsed_sealsOnlyOnceWindowHasPassed() {
        aggregator.ingest(observation("100", "1", 10));

        assertThat(aggregator.sealIfElapsed(T0.plusSeconds(59))).isEmpty();
        assertThat(aggregator.sealIfElapsed(T0.plusSeconds(60))).isPresent();
        assertThat(aggregator.sealIfElapsed(T0.plusSeconds(120))).isEmpty();
        assertThat(aggregator.currentBar()).isEmpty();
    }

    @Test
    void ingest_refusesOtherSymbol() {
        Observation other = new Observation("ETHUSDT", new BigDecimal("10"), BigDecimal.ONE, T0);

        assertThatThrownBy(() -> aggregator.ingest(other))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Observation observation(String price, String quantity, long secondsAfterT0) {
        return new Observation("BTCUSDT", new BigDecimal(price), new BigDecimal(quantity), T0.plusSeconds(secondsAfterT0));
    }
}
