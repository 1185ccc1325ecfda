package com.example.musictracker.domain.enumtype;

public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    PARTIAL_SUCCESS,
    CANCELED,
    FAILED;

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }
}
