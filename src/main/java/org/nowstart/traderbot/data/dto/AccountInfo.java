package org.nowstart.traderbot.data.dto;

import java.util.List;

public record AccountInfo(
        boolean canTrade,
        List<AssetBalance> balances
) {
}
