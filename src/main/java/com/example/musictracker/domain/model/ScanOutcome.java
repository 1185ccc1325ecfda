package com.example.musictracker.domain.model;

import com.example.musictracker.domain.enumtype.Completion;

public final class ScanOutcome {

    private final String root;
    private final Completion completion;
    private final DirectoriesStatus directories;
    private final int skippedDirectories;

    public ScanOutcome(String root, Completion completion, DirectoriesStatus directories, int skippedDirectories) {
        this.root = root;
        this.completion = completion;
        this.directories = directories;
        this.skippedDirectories = skippedDirectories;
    }

    public String getRoot() {
        return root;
    }

    public Completion getCompletion() {
        return completion;
    }

    public DirectoriesStatus getDirectories() {
        return directories;
    }

    /**
     * Directories below the root that could not be listed in this pass.
     */
    public int getSkippedDirectories() {
        return skippedDirectories;
    }

    @Override
    public String toString() {
        return "ScanOutcome{root='" + root + "', completion=" + completion + ", " + directories
                + ", skipped=" + skippedDirectories + '}';
    }
}
