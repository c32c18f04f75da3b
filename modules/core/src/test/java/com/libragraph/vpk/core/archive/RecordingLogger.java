package com.libragraph.vpk.core.archive;

import org.jboss.logging.Logger;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Logger that keeps every formatted message in memory.
 */
class RecordingLogger extends Logger {

    record Entry(Level level, String message, Throwable thrown) {
    }

    private final List<Entry> entries = Collections.synchronizedList(new ArrayList<>());

    RecordingLogger() {
        super("recording");
    }

    List<Entry> entries() {
        return List.copyOf(entries);
    }

    List<String> messages(Level level) {
        return entries().stream()
                .filter(e -> e.level() == level)
                .map(Entry::message)
                .collect(Collectors.toList());
    }

    @Override
    public boolean isEnabled(Level level) {
        return true;
    }

    @Override
    protected void doLog(Level level, String loggerClassName, Object message, Object[] parameters, Throwable thrown) {
        String text = parameters == null || parameters.length == 0
                ? String.valueOf(message)
                : MessageFormat.format(String.valueOf(message), parameters);
        entries.add(new Entry(level, text, thrown));
    }

    @Override
    protected void doLogf(Level level, String loggerClassName, String format, Object[] parameters, Throwable thrown) {
        String text = parameters == null ? format : String.format(format, parameters);
        entries.add(new Entry(level, text, thrown));
    }
}
