package org.nowstart.traderbot.data.type;

public enum OptionType {
    INTEGER,
    DECIMAL,
    BOOLEAN,
    STRING
}
