package com.example.musictracker.domain.model;

public final class UntrackOutcome {

    private final String root;
    private final int untrackedCount;

    public UntrackOutcome(String root, int untrackedCount) {
        this.root = root;
        this.untrackedCount = untrackedCount;
    }

    public String getRoot() {
        return root;
    }

    public int getUntrackedCount() {
        return untrackedCount;
    }

    @Override
    public String toString() {
        return "UntrackOutcome{root='" + root + "', untracked=" + untrackedCount + '}';
    }
}
