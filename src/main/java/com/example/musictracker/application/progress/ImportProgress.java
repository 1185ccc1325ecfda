package com.example.musictracker.application.progress;

public final class ImportProgress implements ProgressEvent {

    private final long elapsedMs;
    private final int filesFinished;
    private final int created;
    private final int updated;
    private final int unchanged;
    private final int failed;
    private final int directoriesConfirmed;
    private final int directoriesSkipped;
    private final String lastPath;

    public ImportProgress(long elapsedMs, int filesFinished, int created, int updated, int unchanged, int failed,
                          int directoriesConfirmed, int directoriesSkipped, String lastPath) {
        this.elapsedMs = elapsedMs;
        this.filesFinished = filesFinished;
        this.created = created;
        this.updated = updated;
        this.unchanged = unchanged;
        this.failed = failed;
        this.directoriesConfirmed = directoriesConfirmed;
        this.directoriesSkipped = directoriesSkipped;
        this.lastPath = lastPath;
    }

    @Override
    public long getElapsedMs() {
        return elapsedMs;
    }

    public int getFilesFinished() {
        return filesFinished;
    }

    public int getCreated() {
        return created;
    }

    public int getUpdated() {
        return updated;
    }

    public int getUnchanged() {
        return unchanged;
    }

    public int getFailed() {
        return failed;
    }

    public int getDirectoriesConfirmed() {
        return directoriesConfirmed;
    }

    public int getDirectoriesSkipped() {
        return directoriesSkipped;
    }

    public String getLastPath() {
        return lastPath;
    }

    @Override
    public String describe() {
        return "files=" + filesFinished + " created=" + created + " updated=" + updated + " unchanged=" + unchanged
                + " failed=" + failed + " dirsConfirmed=" + directoriesConfirmed + " dirsSkipped=" + directoriesSkipped
                + " last=" + lastPath;
    }
}
