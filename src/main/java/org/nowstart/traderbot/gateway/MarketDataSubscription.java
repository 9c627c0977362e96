package org.nowstart.traderbot.gateway;

public interface MarketDataSubscription extends AutoCloseable {

    @Override
    void close();
}
