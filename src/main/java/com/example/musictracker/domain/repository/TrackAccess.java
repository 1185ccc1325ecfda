package com.example.musictracker.domain.repository;

import com.example.musictracker.domain.model.Track;
import java.util.List;
import java.util.Optional;

public interface TrackAccess {

    Optional<Track> findTrackByUid(String uid);

    Optional<Track> findTrackByMediaSourceId(long mediaSourceId);

    void insertTrack(Track track);

    /**
     * Writes the track if the stored revision still equals {@code expectedRevision}.
     *
     * @return {@code false} on a revision conflict
     */
    boolean updateTrack(Track track, long expectedRevision);

    int deleteTracksByMediaSourceIds(List<Long> mediaSourceIds);
}
