package org.yafcp.processing;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Captures records from the loggers it is attached to, for assertions on log output.
 */
class RecordingHandler extends Handler {

    private final List<LogRecord> records = new ArrayList<>();
    private final List<Logger> attachedTo = new ArrayList<>();

    static RecordingHandler attach(Class<?>... sources) {
        RecordingHandler handler = new RecordingHandler();
        handler.setLevel(Level.ALL);
        for (Class<?> source : sources) {
            Logger logger = Logger.getLogger(source.getName());
            logger.addHandler(handler);
            handler.attachedTo.add(logger);
        }
        return handler;
    }

    void detach() {
        for (Logger logger : attachedTo) logger.removeHandler(this);
        attachedTo.clear();
    }

    @Override
    public synchronized void publish(LogRecord record) {
        records.add(record);
    }

    synchronized List<String> messages() {
        return records.stream().map(LogRecord::getMessage).collect(Collectors.toList());
    }

    synchronized List<String> messagesAt(Level level) {
        return records.stream().filter(r -> r.getLevel().equals(level))
                .map(LogRecord::getMessage).collect(Collectors.toList());
    }

    List<String> messagesContaining(String fragment) {
        return messages().stream().filter(m -> m.contains(fragment)).collect(Collectors.toList());
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }
}
