package org.nowstart.traderbot.gateway;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.nowstart.traderbot.data.dto.Bar;

/**
 * Market data provided by an exchange integration. Implementations are contributed as Spring beans.
 */
public interface MarketDataSource {

    /**
     * Subscribes to live price observations. Delivery is at-least-once and happens on the source's own thread.
     */
    MarketDataSubscription subscribe(String symbol, MarketDataListener listener);

    /**
     * Historical bars with {@code start <= openTime < end}, ascending by open time.
     */
    List<Bar> fetchHistory(String symbol, Duration timeframe, Instant start, Instant end);
}
