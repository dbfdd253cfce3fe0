package com.driftindexer.domain.event;

public enum OrderType {
    MARKET,
    LIMIT,
    TRIGGER_MARKET,
    TRIGGER_LIMIT,
    ORACLE
}
