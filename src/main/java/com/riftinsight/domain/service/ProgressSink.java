package com.riftinsight.domain.service;

import com.riftinsight.domain.exception.ClientDisconnectedException;
import com.riftinsight.domain.model.ProgressEvent;

/**
 * Destination of one analysis stream's events.
 */
public interface ProgressSink {

    /**
     * Write and flush one event.
     *
     * @throws ClientDisconnectedException when the client is gone
     */
    void send(ProgressEvent event);
}
