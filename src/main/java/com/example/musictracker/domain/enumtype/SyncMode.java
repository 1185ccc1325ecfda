package com.example.musictracker.domain.enumtype;

/**
 * Decides whether a file below a pending directory is (re-)imported.
 */
public enum SyncMode {

    /**
     * Import only files that have no media source yet.
     */
    ONCE,

    /**
     * Re-import changed files unless the track carries unsynchronized local edits.
     */
    MODIFIED,

    /**
     * Re-import changed files and overwrite local edits.
     */
    MODIFIED_RESYNC,

    /**
     * Re-import every file.
     */
    ALWAYS
}
