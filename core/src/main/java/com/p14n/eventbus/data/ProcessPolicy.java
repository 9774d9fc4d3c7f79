package com.p14n.eventbus.data;

/**
 * Decides which queued messages a single {@code process()} call delivers.
 */
public enum ProcessPolicy {

    /**
     * Keep taking messages until the queue is empty. Messages posted by
     * callbacks while processing are delivered by the same call, after
     * everything queued before them.
     */
    DRAIN_UNTIL_EMPTY,

    /**
     * Deliver only the messages queued when the call started. Messages posted
     * while processing wait for the next call.
     */
    SNAPSHOT
}
