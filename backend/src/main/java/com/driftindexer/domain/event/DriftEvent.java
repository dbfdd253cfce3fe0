package com.driftindexer.domain.event;

/**
 * An event emitted by the Drift program into transaction logs. Implementations are immutable records;
 * {@link #kind()} is the tag of the union.
 */
public interface DriftEvent {

    DriftEventKind kind();
}
