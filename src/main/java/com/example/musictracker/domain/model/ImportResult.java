package com.example.musictracker.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of importing one file: either an imported track with content properties or a failure,
 * both possibly carrying diagnostic issues.
 */
public final class ImportResult {

    private final Track track;
    private final MediaSource source;
    private final List<String> issues;

    private ImportResult(Track track, MediaSource source, List<String> issues) {
        this.track = track;
        this.source = source;
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public static ImportResult imported(Track track, MediaSource source, List<String> issues) {
        if (track == null || source == null) {
            throw new IllegalArgumentException("Imported result requires track and source");
        }
        return new ImportResult(track, source, issues == null ? Collections.<String>emptyList() : issues);
    }

    public static ImportResult failed(List<String> issues) {
        return new ImportResult(null, null, issues == null ? Collections.<String>emptyList() : issues);
    }

    public boolean isImported() {
        return track != null;
    }

    public Track getTrack() {
        return track;
    }

    public MediaSource getSource() {
        return source;
    }

    public List<String> getIssues() {
        return issues;
    }
}
