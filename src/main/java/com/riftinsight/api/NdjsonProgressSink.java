package com.riftinsight.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riftinsight.domain.exception.ClientDisconnectedException;
import com.riftinsight.domain.model.ProgressEvent;
import com.riftinsight.domain.service.ProgressSink;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes each event as one JSON line and flushes it straight away.
 */
class NdjsonProgressSink implements ProgressSink {

    private static final byte NEWLINE = '\n';

    private final OutputStream out;
    private final ObjectMapper objectMapper;

    NdjsonProgressSink(OutputStream out, ObjectMapper objectMapper) {
        this.out = out;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(ProgressEvent event) {
        try {
            out.write(objectMapper.writeValueAsBytes(event));
            out.write(NEWLINE);
            out.flush();
        } catch (IOException e) {
            throw new ClientDisconnectedException("Failed to write " + event.getType() + " event", e);
        }
    }
}
