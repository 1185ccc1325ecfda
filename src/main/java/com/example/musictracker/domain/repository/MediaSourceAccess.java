package com.example.musictracker.domain.repository;

import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.model.MediaSource;
import java.util.List;
import java.util.Optional;

public interface MediaSourceAccess {

    Optional<MediaSource> findSourceByPath(long collectionId, String contentPath);

    List<MediaSource> findSourcesByPrefix(long collectionId, String pathPrefix);

    void insertSource(MediaSource source);

    int updateSource(MediaSource source);

    /**
     * Sources below the prefix whose parent directory has no tracking record.
     */
    List<Long> findUntrackedSourceIds(long collectionId, String pathPrefix);

    /**
     * Sources below the prefix whose parent directory record has the given status.
     */
    List<Long> findSourceIdsByDirectoryStatus(long collectionId, String pathPrefix, DirTrackingStatus status);

    /**
     * Re-links the sources stored directly in a directory with its current listing: sources whose file is
     * listed are tracked, all others become untracked and thereby purgeable.
     *
     * @return number of sources that became untracked
     */
    int relinkDirectorySources(long collectionId, String directoryPath, List<String> presentPaths);

    int deleteSources(List<Long> sourceIds);

    int relocateSources(long collectionId, String oldPrefix, String newPrefix);
}
