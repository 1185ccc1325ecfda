package com.example.musictracker.domain.enumtype;

import java.util.Arrays;

/**
 * Change-detection state of a tracked directory.
 *
 * <p>The numeric codes are persisted and must never be reassigned.
 */
public enum DirTrackingStatus {

    CURRENT(0),
    OUTDATED(1),
    ADDED(2),
    MODIFIED(3),
    ORPHANED(4);

    private final int code;

    DirTrackingStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Outdated, added or modified: the catalog may not reflect the directory.
     */
    public boolean isStale() {
        return this == OUTDATED || this == ADDED || this == MODIFIED;
    }

    /**
     * Added or modified: the directory waits for an import pass.
     */
    public boolean isPending() {
        return this == ADDED || this == MODIFIED;
    }

    public static DirTrackingStatus fromCode(int code) {
        return Arrays.stream(values())
                .filter(item -> item.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown directory tracking status code: " + code));
    }

    /**
     * Classifies a directory from its previously stored record and the digest observed now.
     *
     * <p>A missing observation means the directory no longer exists. Pending states survive an unchanged
     * digest so that import work queued by an earlier scan is not lost, and an outdated directory with an
     * unchanged digest is queued again because its last import left work behind.
     *
     * @param priorDigest    stored digest, {@code null} if the directory was never tracked
     * @param priorStatus    stored status, {@code null} if the directory was never tracked
     * @param observedDigest digest computed in this pass, {@code null} if the directory is gone
     */
    public static DirTrackingStatus classify(byte[] priorDigest, DirTrackingStatus priorStatus, byte[] observedDigest) {
        boolean tracked = priorStatus != null;
        if (observedDigest == null) {
            if (!tracked) {
                throw new IllegalArgumentException("Neither a tracked record nor an observed digest");
            }
            return ORPHANED;
        }
        if (!tracked) {
            return ADDED;
        }
        if (!Arrays.equals(priorDigest, observedDigest)) {
            return priorStatus == ORPHANED ? ADDED : MODIFIED;
        }
        switch (priorStatus) {
            case ADDED:
            case MODIFIED:
                return priorStatus;
            case OUTDATED:
                return MODIFIED;
            case CURRENT:
            case ORPHANED:
            default:
                return CURRENT;
        }
    }
}
