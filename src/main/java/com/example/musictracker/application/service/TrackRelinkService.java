package com.example.musictracker.application.service;

import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.common.util.ContentPaths;
import com.example.musictracker.domain.model.MediaSource;
import com.example.musictracker.domain.model.RelinkOutcome;
import com.example.musictracker.domain.model.Track;
import com.example.musictracker.domain.repository.CollectionWriteLease;
import com.example.musictracker.domain.repository.MediaTrackerRepository;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Reattaches a track to the file it was moved to.
 *
 * <p>After a move the old track still points to the vanished path, while the file at its new path has been
 * imported as a second track. Relinking deletes the replacement track and its source, moves the old source to
 * the new path and copies the replacement's metadata onto the old track, which keeps its uid and creation time.
 */
@Service
public class TrackRelinkService {

    private static final Logger log = LoggerFactory.getLogger(TrackRelinkService.class);

    private final MediaTrackerRepository repository;
    private final MediaCollectionService mediaCollectionService;

    public TrackRelinkService(MediaTrackerRepository repository, MediaCollectionService mediaCollectionService) {
        this.repository = repository;
        this.mediaCollectionService = mediaCollectionService;
    }

    public RelinkOutcome relinkMovedTrack(String collectionUid, String oldContentPath, String newContentPath) {
        long collectionId = mediaCollectionService.getCollection(collectionUid).getId();
        String from = ContentPaths.normalizeFile(oldContentPath);
        String to = ContentPaths.normalizeFile(newContentPath);
        if (from.equals(to)) {
            throw new BusinessException("400", "Old and new path are identical: '" + from + "'");
        }
        try (CollectionWriteLease ignored = repository.acquireWriteLease(collectionId)) {
            MediaSource oldSource = requireSource(collectionId, from);
            MediaSource newSource = requireSource(collectionId, to);
            Track oldTrack = requireTrack(oldSource);
            Track replacement = requireTrack(newSource);

            Track relinked;
            try {
                relinked = repository.inTransaction(() -> relink(oldSource, oldTrack, newSource, replacement));
            } catch (DataAccessException e) {
                throw new BusinessException("STORAGE_ERROR", "Failed to relink '" + from + "' to '" + to + "': "
                        + e.getMessage(), null, e);
            }
            RelinkOutcome outcome = new RelinkOutcome(from, to, relinked.getUid(), relinked.getRevision());
            log.info("RELINK_DONE collectionId={} {} replacedTrack={}", collectionId, outcome, replacement.getUid());
            return outcome;
        }
    }

    private Track relink(MediaSource oldSource, Track oldTrack, MediaSource newSource, Track replacement) {
        List<Long> replacedSourceIds = Collections.singletonList(newSource.getId());
        repository.deleteTracksByMediaSourceIds(replacedSourceIds);
        repository.deleteSources(replacedSourceIds);

        // The replacement was in sync with its file if no local edits happened since its import
        boolean replacementSynchronized = newSource.getSynchronizedRevision() != null
                && newSource.getSynchronizedRevision() == replacement.getRevision();

        Track track = replacement.copy();
        track.setId(oldTrack.getId());
        track.setUid(oldTrack.getUid());
        track.setMediaSourceId(oldSource.getId());
        track.setCreatedAt(oldTrack.getCreatedAt());
        track.setUpdatedAt(LocalDateTime.now());
        track.setRevision(oldTrack.getRevision() + 1);
        if (!repository.updateTrack(track, oldTrack.getRevision())) {
            throw new BusinessException("409", "Track " + oldTrack.getUid() + " was modified concurrently");
        }

        newSource.setId(oldSource.getId());
        newSource.setCollectedAt(oldSource.getCollectedAt());
        newSource.setTracked(Boolean.TRUE);
        newSource.setSynchronizedRevision(
                replacementSynchronized ? track.getRevision() : oldSource.getSynchronizedRevision());
        repository.updateSource(newSource);
        return track;
    }

    private MediaSource requireSource(long collectionId, String contentPath) {
        return repository.findSourceByPath(collectionId, contentPath)
                .orElseThrow(() -> new BusinessException("404", "Media source not found: " + contentPath));
    }

    private Track requireTrack(MediaSource source) {
        return repository.findTrackByMediaSourceId(source.getId())
                .orElseThrow(() -> new BusinessException("404", "No track imported from " + source.getContentPath()));
    }
}
