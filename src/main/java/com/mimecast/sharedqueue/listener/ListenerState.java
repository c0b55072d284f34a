package com.mimecast.sharedqueue.listener;

/**
 * Poll loop states.
 */
public enum ListenerState {
    IDLE,
    POLLING,
    DISPATCHING,
    WAITING,
    STOPPED
}
