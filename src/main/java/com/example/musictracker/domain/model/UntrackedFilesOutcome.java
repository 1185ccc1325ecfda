package com.example.musictracker.domain.model;

import com.example.musictracker.domain.enumtype.Completion;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class UntrackedFilesOutcome {

    private final String root;
    private final Completion completion;
    private final List<String> contentPaths;
    private final int skippedDirectories;

    public UntrackedFilesOutcome(String root, Completion completion, List<String> contentPaths, int skippedDirectories) {
        this.root = root;
        this.completion = completion;
        this.contentPaths = Collections.unmodifiableList(new ArrayList<>(contentPaths));
        this.skippedDirectories = skippedDirectories;
    }

    public String getRoot() {
        return root;
    }

    public Completion getCompletion() {
        return completion;
    }

    /**
     * Audio files without a media source, in traversal order.
     */
    public List<String> getContentPaths() {
        return contentPaths;
    }

    public int getSkippedDirectories() {
        return skippedDirectories;
    }

    @Override
    public String toString() {
        return "root='" + root + "' completion=" + completion + " untrackedFiles=" + contentPaths.size()
                + " skippedDirectories=" + skippedDirectories;
    }
}
