package com.driftindexer.domain.event;

/**
 * Order lifecycle event: emitted when a user places an order. {@code user} is the base58 user account.
 */
public record OrderRecord(long ts, String user, Order order) implements DriftEvent {

    @Override
    public DriftEventKind kind() {
        return DriftEventKind.ORDER_RECORD;
    }
}
