package com.enterprise.bulkload.load.domain;

/**
 * Lifecycle of one run: IDLE, PRE_HOOK, RUNNING, POST_HOOK, DONE.
 */
public enum RunPhase {
    IDLE,
    PRE_HOOK,
    RUNNING,
    POST_HOOK,
    DONE
}
