package com.example.musictracker.application.service;

import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.domain.enumtype.Completion;
import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.model.PurgeOutcome;
import com.example.musictracker.domain.repository.CollectionWriteLease;
import com.example.musictracker.domain.repository.MediaTrackerRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Deletes media sources, together with their tracks, that are no longer backed by a live tracking record.
 */
@Service
public class PurgeService {

    private static final Logger log = LoggerFactory.getLogger(PurgeService.class);

    private static final int PURGE_BATCH_SIZE = 200;

    private final MediaTrackerRepository repository;

    public PurgeService(MediaTrackerRepository repository) {
        this.repository = repository;
    }

    /**
     * Purges the sources of orphaned directories below the root, then the orphaned tracking records themselves.
     * Records are only dropped after all of their sources are gone, so an aborted purge can be resumed.
     */
    public PurgeOutcome purgeOrphaned(TrackerContext context, BooleanSupplier cancelSignal) {
        long collectionId = context.getCollectionId();
        String root = context.getRootPath();
        try (CollectionWriteLease ignored = repository.acquireWriteLease(collectionId)) {
            List<Long> sourceIds = load(() -> repository.findSourceIdsByDirectoryStatus(
                    collectionId, root, DirTrackingStatus.ORPHANED));
            PurgeCounts counts = deleteInBatches(sourceIds, cancelSignal);
            int directories = 0;
            if (!counts.aborted) {
                directories = write(() -> repository.deleteDirectories(collectionId, root, DirTrackingStatus.ORPHANED));
            }
            PurgeOutcome outcome = counts.toOutcome(root, directories);
            log.info("PURGE_ORPHANED_DONE collectionId={} candidates={} {}", collectionId, sourceIds.size(), outcome);
            return outcome;
        }
    }

    /**
     * Purges sources below the root whose directory has no tracking record.
     */
    public PurgeOutcome purgeUntracked(TrackerContext context, BooleanSupplier cancelSignal) {
        long collectionId = context.getCollectionId();
        String root = context.getRootPath();
        try (CollectionWriteLease ignored = repository.acquireWriteLease(collectionId)) {
            List<Long> sourceIds = load(() -> repository.findUntrackedSourceIds(collectionId, root));
            PurgeOutcome outcome = deleteInBatches(sourceIds, cancelSignal).toOutcome(root, 0);
            log.info("PURGE_UNTRACKED_DONE collectionId={} candidates={} {}", collectionId, sourceIds.size(), outcome);
            return outcome;
        }
    }

    private PurgeCounts deleteInBatches(List<Long> sourceIds, BooleanSupplier cancelSignal) {
        PurgeCounts counts = new PurgeCounts();
        for (int from = 0; from < sourceIds.size(); from += PURGE_BATCH_SIZE) {
            if (cancelSignal != null && cancelSignal.getAsBoolean()) {
                counts.aborted = true;
                break;
            }
            List<Long> chunk = new ArrayList<>(
                    sourceIds.subList(from, Math.min(sourceIds.size(), from + PURGE_BATCH_SIZE)));
            int[] deleted = write(() -> new int[] {
                    repository.deleteTracksByMediaSourceIds(chunk),
                    repository.deleteSources(chunk)});
            counts.tracks += deleted[0];
            counts.sources += deleted[1];
        }
        return counts;
    }

    private <T> T load(Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new BusinessException("STORAGE_ERROR", "Failed to load purge candidates: " + e.getMessage(), null, e);
        }
    }

    private <T> T write(Supplier<T> work) {
        try {
            return repository.inTransaction(work);
        } catch (DataAccessException e) {
            throw new BusinessException("STORAGE_ERROR", "Failed to purge catalog rows: " + e.getMessage(), null, e);
        }
    }

    private static class PurgeCounts {

        private int sources;
        private int tracks;
        private boolean aborted;

        private PurgeOutcome toOutcome(String root, int directories) {
            return new PurgeOutcome(root, aborted ? Completion.ABORTED : Completion.FINISHED, sources, tracks, directories);
        }
    }
}
