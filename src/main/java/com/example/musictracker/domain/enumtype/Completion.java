package com.example.musictracker.domain.enumtype;

public enum Completion {
    FINISHED,
    ABORTED
}
