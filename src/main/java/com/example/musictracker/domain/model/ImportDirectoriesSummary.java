package com.example.musictracker.domain.model;

public final class ImportDirectoriesSummary {

    private final int confirmed;
    private final int skipped;
    private final int untracked;
    private final int sourcesUntracked;

    public ImportDirectoriesSummary(int confirmed, int skipped, int untracked, int sourcesUntracked) {
        this.confirmed = confirmed;
        this.skipped = skipped;
        this.untracked = untracked;
        this.sourcesUntracked = sourcesUntracked;
    }

    public int getConfirmed() {
        return confirmed;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getUntracked() {
        return untracked;
    }

    /**
     * Sources whose file was missing from the listing of a re-imported directory.
     */
    public int getSourcesUntracked() {
        return sourcesUntracked;
    }

    @Override
    public String toString() {
        return "confirmed=" + confirmed + " skipped=" + skipped + " untracked=" + untracked
                + " sourcesUntracked=" + sourcesUntracked;
    }
}
