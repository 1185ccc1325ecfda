package com.example.musictracker.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Content paths of imported files, bucketed by what happened to their tracks.
 */
public final class TracksSummary {

    private final List<String> created;
    private final List<String> updated;
    private final List<String> unchanged;
    private final List<String> skipped;
    private final List<String> failed;
    private final List<String> notImported;
    private final List<String> notCreated;
    private final List<String> notUpdated;

    private TracksSummary(Builder builder) {
        this.created = freeze(builder.created);
        this.updated = freeze(builder.updated);
        this.unchanged = freeze(builder.unchanged);
        this.skipped = freeze(builder.skipped);
        this.failed = freeze(builder.failed);
        this.notImported = freeze(builder.notImported);
        this.notCreated = freeze(builder.notCreated);
        this.notUpdated = freeze(builder.notUpdated);
    }

    private static List<String> freeze(List<String> paths) {
        return Collections.unmodifiableList(new ArrayList<>(paths));
    }

    public List<String> getCreated() {
        return created;
    }

    public List<String> getUpdated() {
        return updated;
    }

    public List<String> getUnchanged() {
        return unchanged;
    }

    public List<String> getSkipped() {
        return skipped;
    }

    public List<String> getFailed() {
        return failed;
    }

    public List<String> getNotImported() {
        return notImported;
    }

    public List<String> getNotCreated() {
        return notCreated;
    }

    public List<String> getNotUpdated() {
        return notUpdated;
    }

    public int getTotal() {
        return created.size() + updated.size() + unchanged.size() + skipped.size() + failed.size()
                + notImported.size() + notCreated.size() + notUpdated.size();
    }

    @Override
    public String toString() {
        return "created=" + created.size() + " updated=" + updated.size() + " unchanged=" + unchanged.size()
                + " skipped=" + skipped.size() + " failed=" + failed.size() + " notImported=" + notImported.size()
                + " notCreated=" + notCreated.size() + " notUpdated=" + notUpdated.size();
    }

    public static class Builder {

        private final List<String> created = new ArrayList<>();
        private final List<String> updated = new ArrayList<>();
        private final List<String> unchanged = new ArrayList<>();
        private final List<String> skipped = new ArrayList<>();
        private final List<String> failed = new ArrayList<>();
        private final List<String> notImported = new ArrayList<>();
        private final List<String> notCreated = new ArrayList<>();
        private final List<String> notUpdated = new ArrayList<>();

        public Builder created(String path) {
            created.add(path);
            return this;
        }

        public Builder updated(String path) {
            updated.add(path);
            return this;
        }

        public Builder unchanged(String path) {
            unchanged.add(path);
            return this;
        }

        public Builder skipped(String path) {
            skipped.add(path);
            return this;
        }

        public Builder failed(String path) {
            failed.add(path);
            return this;
        }

        public Builder notImported(String path) {
            notImported.add(path);
            return this;
        }

        public Builder notCreated(String path) {
            notCreated.add(path);
            return this;
        }

        public Builder notUpdated(String path) {
            notUpdated.add(path);
            return this;
        }

        public Builder addAll(TracksSummary other) {
            created.addAll(other.created);
            updated.addAll(other.updated);
            unchanged.addAll(other.unchanged);
            skipped.addAll(other.skipped);
            failed.addAll(other.failed);
            notImported.addAll(other.notImported);
            notCreated.addAll(other.notCreated);
            notUpdated.addAll(other.notUpdated);
            return this;
        }

        public int failedCount() {
            return failed.size();
        }

        public int unchangedCount() {
            return unchanged.size();
        }

        public TracksSummary build() {
            return new TracksSummary(this);
        }
    }
}
