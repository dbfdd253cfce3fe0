package com.driftindexer.domain.event;

public enum MarketType {
    SPOT,
    PERP
}
