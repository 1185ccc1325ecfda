package com.example.musictracker.application.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProgressNotifier {

    private static final Logger log = LoggerFactory.getLogger(ProgressNotifier.class);

    private ProgressNotifier() {
    }

    /**
     * Delivers the event; listener failures are logged and otherwise ignored.
     */
    public static <E extends ProgressEvent> void notifySafely(ProgressListener<E> listener, E event) {
        if (listener == null) {
            return;
        }
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            log.debug("Progress listener failed, event={}", event.describe(), e);
        }
    }
}
