package com.example.musictracker.domain.model;

public final class RelinkOutcome {

    private final String oldContentPath;
    private final String newContentPath;
    private final String trackUid;
    private final long revision;

    public RelinkOutcome(String oldContentPath, String newContentPath, String trackUid, long revision) {
        this.oldContentPath = oldContentPath;
        this.newContentPath = newContentPath;
        this.trackUid = trackUid;
        this.revision = revision;
    }

    public String getOldContentPath() {
        return oldContentPath;
    }

    public String getNewContentPath() {
        return newContentPath;
    }

    public String getTrackUid() {
        return trackUid;
    }

    public long getRevision() {
        return revision;
    }

    @Override
    public String toString() {
        return "old='" + oldContentPath + "' new='" + newContentPath + "' track=" + trackUid + " revision=" + revision;
    }
}
