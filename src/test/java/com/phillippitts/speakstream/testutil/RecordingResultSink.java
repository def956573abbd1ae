package com.phillippitts.speakstream.testutil;

import com.phillippitts.speakstream.exception.ConnectionException;
import com.phillippitts.speakstream.server.session.ResultSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects result messages in memory; can be switched to fail like a dropped connection.
 */
public class RecordingResultSink implements ResultSink {

    private final List<String> messages = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void sendText(String payload) {
        if (failing) {
            throw new ConnectionException("peer gone");
        }
        messages.add(payload);
    }

    @Override
    public boolean isOpen() {
        return !failing;
    }

    public void failSends() {
        this.failing = true;
    }

    public List<String> messages() {
        return messages;
    }
}
