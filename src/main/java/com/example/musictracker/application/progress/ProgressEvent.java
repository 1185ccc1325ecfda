package com.example.musictracker.application.progress;

public interface ProgressEvent {

    long getElapsedMs();

    /**
     * Cumulative counters as {@code key=value} pairs for log lines.
     */
    String describe();
}
