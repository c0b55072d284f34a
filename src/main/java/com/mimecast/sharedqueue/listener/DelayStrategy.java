package com.mimecast.sharedqueue.listener;

import java.time.Duration;

/**
 * Computes the wait between two polls.
 */
public interface DelayStrategy {

    /**
     * Get the next wait interval.
     *
     * @param hadMessages Whether the last poll returned any message.
     * @return Wait interval, always within the strategy's bounds.
     */
    Duration next(boolean hadMessages);
}
