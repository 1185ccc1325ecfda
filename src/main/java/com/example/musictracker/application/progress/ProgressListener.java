package com.example.musictracker.application.progress;

/**
 * Receives cumulative progress after each unit of work. Implementations must not rely on being called
 * at any particular rate and cannot influence the operation.
 */
@FunctionalInterface
public interface ProgressListener<E extends ProgressEvent> {

    void onProgress(E event);

    static <E extends ProgressEvent> ProgressListener<E> noop() {
        return event -> {
        };
    }

    default ProgressListener<E> andThen(ProgressListener<? super E> next) {
        return event -> {
            onProgress(event);
            next.onProgress(event);
        };
    }
}
