package com.example.musictracker.domain.model;

import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import java.util.EnumMap;
import java.util.Map;

/**
 * Directory counts per tracking status, either aggregated from the store or collected during a scan.
 */
public final class DirectoriesStatus {

    private final int current;
    private final int outdated;
    private final int added;
    private final int modified;
    private final int orphaned;

    public DirectoriesStatus(int current, int outdated, int added, int modified, int orphaned) {
        this.current = current;
        this.outdated = outdated;
        this.added = added;
        this.modified = modified;
        this.orphaned = orphaned;
    }

    public static DirectoriesStatus empty() {
        return new DirectoriesStatus(0, 0, 0, 0, 0);
    }

    public static DirectoriesStatus of(Map<DirTrackingStatus, Integer> counts) {
        Map<DirTrackingStatus, Integer> safe = new EnumMap<>(DirTrackingStatus.class);
        for (DirTrackingStatus status : DirTrackingStatus.values()) {
            Integer count = counts == null ? null : counts.get(status);
            safe.put(status, count == null ? 0 : count);
        }
        return new DirectoriesStatus(
                safe.get(DirTrackingStatus.CURRENT),
                safe.get(DirTrackingStatus.OUTDATED),
                safe.get(DirTrackingStatus.ADDED),
                safe.get(DirTrackingStatus.MODIFIED),
                safe.get(DirTrackingStatus.ORPHANED));
    }

    public int getCurrent() {
        return current;
    }

    public int getOutdated() {
        return outdated;
    }

    public int getAdded() {
        return added;
    }

    public int getModified() {
        return modified;
    }

    public int getOrphaned() {
        return orphaned;
    }

    public int count(DirTrackingStatus status) {
        switch (status) {
            case CURRENT:
                return current;
            case OUTDATED:
                return outdated;
            case ADDED:
                return added;
            case MODIFIED:
                return modified;
            case ORPHANED:
            default:
                return orphaned;
        }
    }

    public int getTotal() {
        return current + outdated + added + modified + orphaned;
    }

    public int getPending() {
        return added + modified;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DirectoriesStatus)) {
            return false;
        }
        DirectoriesStatus that = (DirectoriesStatus) o;
        return current == that.current && outdated == that.outdated && added == that.added
                && modified == that.modified && orphaned == that.orphaned;
    }

    @Override
    public int hashCode() {
        int result = current;
        result = 31 * result + outdated;
        result = 31 * result + added;
        result = 31 * result + modified;
        result = 31 * result + orphaned;
        return result;
    }

    @Override
    public String toString() {
        return "current=" + current + " outdated=" + outdated + " added=" + added
                + " modified=" + modified + " orphaned=" + orphaned;
    }
}
