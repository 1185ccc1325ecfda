package com.example.musictracker.application.progress;

public final class ScanProgress implements ProgressEvent {

    private final long elapsedMs;
    private final int directoriesFinished;
    private final int directoriesSkipped;
    private final int entriesFinished;
    private final String lastDirectory;

    public ScanProgress(long elapsedMs, int directoriesFinished, int directoriesSkipped, int entriesFinished,
                        String lastDirectory) {
        this.elapsedMs = elapsedMs;
        this.directoriesFinished = directoriesFinished;
        this.directoriesSkipped = directoriesSkipped;
        this.entriesFinished = entriesFinished;
        this.lastDirectory = lastDirectory;
    }

    @Override
    public long getElapsedMs() {
        return elapsedMs;
    }

    public int getDirectoriesFinished() {
        return directoriesFinished;
    }

    public int getDirectoriesSkipped() {
        return directoriesSkipped;
    }

    public int getEntriesFinished() {
        return entriesFinished;
    }

    public String getLastDirectory() {
        return lastDirectory;
    }

    @Override
    public String describe() {
        return "dirs=" + directoriesFinished + " dirSkipped=" + directoriesSkipped + " entries=" + entriesFinished
                + " lastDir=" + lastDirectory;
    }
}
