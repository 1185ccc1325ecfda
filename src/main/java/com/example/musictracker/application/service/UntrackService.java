package com.example.musictracker.application.service;

import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.model.UntrackOutcome;
import com.example.musictracker.domain.repository.CollectionWriteLease;
import com.example.musictracker.domain.repository.MediaTrackerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Forgets the tracking records below a root. Media sources and tracks are left in place.
 */
@Service
public class UntrackService {

    private static final Logger log = LoggerFactory.getLogger(UntrackService.class);

    private final MediaTrackerRepository repository;

    public UntrackService(MediaTrackerRepository repository) {
        this.repository = repository;
    }

    /**
     * @param statusFilter only untrack directories with this status, or all of them if {@code null}
     */
    public UntrackOutcome untrack(TrackerContext context, DirTrackingStatus statusFilter) {
        long collectionId = context.getCollectionId();
        String root = context.getRootPath();
        int untracked;
        try (CollectionWriteLease ignored = repository.acquireWriteLease(collectionId)) {
            untracked = repository.inTransaction(() -> repository.deleteDirectories(collectionId, root, statusFilter));
        } catch (DataAccessException e) {
            throw new BusinessException("STORAGE_ERROR", "Failed to untrack directories: " + e.getMessage(), null, e);
        }
        log.info("UNTRACK_DONE collectionId={} root='{}' status={} untracked={}", collectionId, root, statusFilter, untracked);
        return new UntrackOutcome(root, untracked);
    }
}
