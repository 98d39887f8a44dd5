package com.cognisync.model;

/**
 * Lifecycle of a SyncEvent.
 *
 *   PENDING ──lease──► PROCESSING ──► COMPLETED
 *   RETRYING ─lease──┘      ├──────► RETRYING
 *                           └──────► DEAD_LETTER
 *
 * PROCESSING is only entered through a lease. COMPLETED and DEAD_LETTER are
 * terminal; a dead-lettered event only moves again through a manual replay.
 */
public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    RETRYING,
    COMPLETED,
    DEAD_LETTER
}
