package com.driftindexer.domain.event;

/**
 * Known Drift event kinds. {@code eventName} is the Anchor event name the discriminant is derived from;
 * {@code collection} is where indexed records of this kind are stored.
 */
public enum DriftEventKind {

    ORDER_ACTION_RECORD("OrderActionRecord", "order_action_records"),
    ORDER_RECORD("OrderRecord", "order_records");

    private final String eventName;
    private final String collection;

    DriftEventKind(String eventName, String collection) {
        this.eventName = eventName;
        this.collection = collection;
    }

    public String getEventName() {
        return eventName;
    }

    public String getCollection() {
        return collection;
    }
}
