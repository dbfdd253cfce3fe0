package com.driftindexer.domain.event;

public enum OrderTriggerCondition {
    ABOVE,
    BELOW,
    TRIGGERED_ABOVE,
    TRIGGERED_BELOW
}
