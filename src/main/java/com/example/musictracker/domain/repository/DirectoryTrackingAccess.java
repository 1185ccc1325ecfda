package com.example.musictracker.domain.repository;

import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.model.DirectoriesStatus;
import com.example.musictracker.domain.model.TrackedDirectory;
import java.util.List;
import java.util.Optional;

/**
 * Tracking records of directories, unique per collection and directory path.
 */
public interface DirectoryTrackingAccess {

    Optional<TrackedDirectory> findDirectory(long collectionId, String path);

    void insertDirectory(long collectionId, TrackedDirectory directory);

    /**
     * Replaces digest and status of an existing record.
     */
    int updateDirectory(long collectionId, TrackedDirectory directory);

    int updateDirectoryStatus(long collectionId, String path, DirTrackingStatus status);

    List<TrackedDirectory> findDirectoriesByPrefix(long collectionId, String pathPrefix);

    /**
     * Pending directories below the prefix, least recently updated first.
     */
    List<TrackedDirectory> findPendingDirectories(long collectionId, String pathPrefix, int offset, int limit);

    /**
     * Marks the directory current if its stored digest still equals the given digest.
     *
     * @return {@code false} if the digest changed in the meantime or the record is gone
     */
    boolean confirmDirectory(long collectionId, String path, byte[] digest);

    /**
     * @param status only delete records with this status, or any status if {@code null}
     */
    int deleteDirectories(long collectionId, String pathPrefix, DirTrackingStatus status);

    DirectoriesStatus aggregateStatus(long collectionId, String pathPrefix);

    int relocateDirectories(long collectionId, String oldPrefix, String newPrefix);
}
