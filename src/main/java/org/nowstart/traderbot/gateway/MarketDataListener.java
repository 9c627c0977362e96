package org.nowstart.traderbot.gateway;

import org.nowstart.traderbot.data.dto.Observation;

public interface MarketDataListener {

    void onObservation(Observation observation);

    default void onDisconnected(Throwable cause) {
    }

    default void onReconnected() {
    }
}
