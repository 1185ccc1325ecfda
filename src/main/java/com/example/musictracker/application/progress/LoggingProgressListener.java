package com.example.musictracker.application.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs progress at most once per time interval or event count, whichever triggers first.
 */
public class LoggingProgressListener<E extends ProgressEvent> implements ProgressListener<E> {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    private final String operation;
    private final int logIntervalSec;
    private final int logIntervalEvents;

    private long lastLogTimeMs;
    private int eventsSinceLastLog;

    public LoggingProgressListener(String operation, int logIntervalSec, int logIntervalEvents) {
        this.operation = operation;
        this.logIntervalSec = logIntervalSec > 0 ? logIntervalSec : 30;
        this.logIntervalEvents = logIntervalEvents > 0 ? logIntervalEvents : 100;
        this.lastLogTimeMs = System.currentTimeMillis();
    }

    @Override
    public void onProgress(E event) {
        eventsSinceLastLog++;
        if (!shouldLog()) {
            return;
        }
        log.info("TRACKER_PROGRESS op={} {} elapsed={}", operation, event.describe(), formatElapsed(event.getElapsedMs()));
    }

    private boolean shouldLog() {
        long now = System.currentTimeMillis();
        boolean timeTriggered = (now - lastLogTimeMs) >= logIntervalSec * 1000L;
        boolean eventTriggered = eventsSinceLastLog >= logIntervalEvents;
        if (timeTriggered || eventTriggered) {
            lastLogTimeMs = now;
            eventsSinceLastLog = 0;
            return true;
        }
        return false;
    }

    public static String formatElapsed(long elapsedMs) {
        if (elapsedMs < 1000) {
            return elapsedMs + "ms";
        }
        long seconds = elapsedMs / 1000;
        long minutes = seconds / 60;
        long remainSeconds = seconds % 60;
        if (minutes <= 0) {
            return seconds + "s";
        }
        long hours = minutes / 60;
        long remainMinutes = minutes % 60;
        if (hours <= 0) {
            return minutes + "m" + remainSeconds + "s";
        }
        return hours + "h" + remainMinutes + "m" + remainSeconds + "s";
    }
}
