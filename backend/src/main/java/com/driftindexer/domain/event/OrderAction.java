package com.driftindexer.domain.event;

/** Borsh variant index = ordinal. */
public enum OrderAction {
    PLACE,
    CANCEL,
    FILL,
    TRIGGER,
    EXPIRE
}
