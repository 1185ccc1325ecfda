package com.example.musictracker.domain.model;

import com.example.musictracker.domain.enumtype.Completion;

public final class PurgeOutcome {

    private final String root;
    private final Completion completion;
    private final int purgedCount;
    private final int purgedTracks;
    private final int purgedDirectories;

    public PurgeOutcome(String root, Completion completion, int purgedCount, int purgedTracks, int purgedDirectories) {
        this.root = root;
        this.completion = completion;
        this.purgedCount = purgedCount;
        this.purgedTracks = purgedTracks;
        this.purgedDirectories = purgedDirectories;
    }

    public String getRoot() {
        return root;
    }

    public Completion getCompletion() {
        return completion;
    }

    /**
     * Deleted media sources.
     */
    public int getPurgedCount() {
        return purgedCount;
    }

    public int getPurgedTracks() {
        return purgedTracks;
    }

    public int getPurgedDirectories() {
        return purgedDirectories;
    }

    @Override
    public String toString() {
        return "PurgeOutcome{root='" + root + "', completion=" + completion + ", sources=" + purgedCount + ", tracks=" + purgedTracks
                + ", directories=" + purgedDirectories + '}';
    }
}
