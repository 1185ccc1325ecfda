package com.example.musictracker.domain.model;

public final class RelocateOutcome {

    private final String oldPrefix;
    private final String newPrefix;
    private final int relocatedSources;
    private final int relocatedDirectories;

    public RelocateOutcome(String oldPrefix, String newPrefix, int relocatedSources, int relocatedDirectories) {
        this.oldPrefix = oldPrefix;
        this.newPrefix = newPrefix;
        this.relocatedSources = relocatedSources;
        this.relocatedDirectories = relocatedDirectories;
    }

    public String getOldPrefix() {
        return oldPrefix;
    }

    public String getNewPrefix() {
        return newPrefix;
    }

    public int getRelocatedSources() {
        return relocatedSources;
    }

    public int getRelocatedDirectories() {
        return relocatedDirectories;
    }

    public int getRelocatedCount() {
        return relocatedSources + relocatedDirectories;
    }

    @Override
    public String toString() {
        return "RelocateOutcome{'" + oldPrefix + "' -> '" + newPrefix + "', sources=" + relocatedSources
                + ", directories=" + relocatedDirectories + '}';
    }
}
