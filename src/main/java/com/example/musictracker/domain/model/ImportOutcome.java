package com.example.musictracker.domain.model;

import com.example.musictracker.domain.enumtype.Completion;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ImportOutcome {

    private final String root;
    private final Completion completion;
    private final TracksSummary tracks;
    private final ImportDirectoriesSummary directories;
    private final List<ImportedSourceIssues> issues;

    public ImportOutcome(String root,
                         Completion completion,
                         TracksSummary tracks,
                         ImportDirectoriesSummary directories,
                         List<ImportedSourceIssues> issues) {
        this.root = root;
        this.completion = completion;
        this.tracks = tracks;
        this.directories = directories;
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public String getRoot() {
        return root;
    }

    public Completion getCompletion() {
        return completion;
    }

    public TracksSummary getTracks() {
        return tracks;
    }

    public ImportDirectoriesSummary getDirectories() {
        return directories;
    }

    public List<ImportedSourceIssues> getIssues() {
        return issues;
    }

    @Override
    public String toString() {
        return "ImportOutcome{root='" + root + "', completion=" + completion + ", tracks[" + tracks
                + "], directories[" + directories + "], issues=" + issues.size() + '}';
    }
}
