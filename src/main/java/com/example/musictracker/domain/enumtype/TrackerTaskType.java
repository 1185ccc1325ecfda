package com.example.musictracker.domain.enumtype;

public enum TrackerTaskType {
    SCAN,
    IMPORT,
    SCAN_AND_IMPORT,
    UNTRACK,
    PURGE_ORPHANED,
    PURGE_UNTRACKED,
    FIND_UNTRACKED_FILES
}
