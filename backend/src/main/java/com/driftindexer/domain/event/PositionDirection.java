package com.driftindexer.domain.event;

public enum PositionDirection {
    LONG,
    SHORT
}
