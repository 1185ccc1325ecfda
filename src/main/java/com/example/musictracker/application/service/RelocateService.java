package com.example.musictracker.application.service;

import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.common.util.ContentPaths;
import com.example.musictracker.domain.model.MediaSource;
import com.example.musictracker.domain.model.RelocateOutcome;
import com.example.musictracker.domain.model.TrackedDirectory;
import com.example.musictracker.domain.repository.CollectionWriteLease;
import com.example.musictracker.domain.repository.MediaTrackerRepository;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Moves media sources and tracking records from one path prefix to another, leaving digests, track uids and
 * revisions untouched.
 */
@Service
public class RelocateService {

    private static final Logger log = LoggerFactory.getLogger(RelocateService.class);

    private final MediaTrackerRepository repository;
    private final MediaCollectionService mediaCollectionService;

    public RelocateService(MediaTrackerRepository repository, MediaCollectionService mediaCollectionService) {
        this.repository = repository;
        this.mediaCollectionService = mediaCollectionService;
    }

    public RelocateOutcome relocate(String collectionUid, String oldPrefix, String newPrefix) {
        long collectionId = mediaCollectionService.getCollection(collectionUid).getId();
        return relocate(collectionId, oldPrefix, newPrefix);
    }

    public RelocateOutcome relocate(long collectionId, String oldPrefix, String newPrefix) {
        String from = ContentPaths.normalizeDirectory(oldPrefix);
        String to = ContentPaths.normalizeDirectory(newPrefix);
        if (from.equals(to)) {
            throw new BusinessException("400", "Old and new prefix are identical: '" + from + "'");
        }
        try (CollectionWriteLease ignored = repository.acquireWriteLease(collectionId)) {
            List<MediaSource> sources = repository.findSourcesByPrefix(collectionId, from);
            List<TrackedDirectory> directories = repository.findDirectoriesByPrefix(collectionId, from);
            rejectCollisions(
                    sources.stream().map(MediaSource::getContentPath).collect(Collectors.toSet()),
                    repository.findSourcesByPrefix(collectionId, to).stream()
                            .map(MediaSource::getContentPath).collect(Collectors.toSet()),
                    from, to);
            rejectCollisions(
                    directories.stream().map(TrackedDirectory::getPath).collect(Collectors.toSet()),
                    repository.findDirectoriesByPrefix(collectionId, to).stream()
                            .map(TrackedDirectory::getPath).collect(Collectors.toSet()),
                    from, to);

            int[] relocated;
            try {
                relocated = repository.inTransaction(() -> new int[] {
                        repository.relocateSources(collectionId, from, to),
                        repository.relocateDirectories(collectionId, from, to)});
            } catch (DataAccessException e) {
                throw new BusinessException("STORAGE_ERROR", "Failed to relocate '" + from + "' to '" + to + "': "
                        + e.getMessage(), null, e);
            }
            RelocateOutcome outcome = new RelocateOutcome(from, to, relocated[0], relocated[1]);
            log.info("RELOCATE_DONE collectionId={} {}", collectionId, outcome);
            return outcome;
        }
    }

    /**
     * Rejects the move if a rewritten path would land on a row that is not itself being moved.
     */
    private void rejectCollisions(Set<String> moving, Set<String> existingBelowTarget, String from, String to) {
        Set<String> stationary = new HashSet<>(existingBelowTarget);
        stationary.removeAll(moving);
        for (String path : moving) {
            String rewritten = ContentPaths.replacePrefix(path, from, to);
            if (stationary.contains(rewritten)) {
                throw new BusinessException("400", "Relocating '" + from + "' to '" + to + "' collides with existing path '"
                        + rewritten + "'", "Purge or relocate the existing entries first");
            }
        }
    }
}
