package com.driftindexer.domain.event;

public enum OrderStatus {
    INIT,
    OPEN,
    FILLED,
    CANCELED
}
