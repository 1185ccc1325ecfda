package com.example.musictracker.application.service;

import com.example.musictracker.application.progress.ProgressListener;
import com.example.musictracker.application.progress.ProgressNotifier;
import com.example.musictracker.application.progress.ScanProgress;
import com.example.musictracker.common.config.AppTrackerProperties;
import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.common.util.ContentPaths;
import com.example.musictracker.domain.enumtype.Completion;
import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.model.DirectoriesStatus;
import com.example.musictracker.domain.model.DirectoryEntry;
import com.example.musictracker.domain.model.ScanOutcome;
import com.example.musictracker.domain.model.TrackedDirectory;
import com.example.musictracker.domain.repository.CollectionWriteLease;
import com.example.musictracker.domain.repository.MediaTrackerRepository;
import com.example.musictracker.infrastructure.fs.DirectoryDigestCalculator;
import com.example.musictracker.infrastructure.fs.DirectoryLister;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Walks the directory tree below a root, compares each directory's digest with its tracking record and
 * marks tracked directories that disappeared as orphaned.
 */
@Service
public class DirectoryScanService {

    private static final Logger log = LoggerFactory.getLogger(DirectoryScanService.class);

    private static final int ORPHAN_BATCH_SIZE = 500;

    private final MediaTrackerRepository repository;
    private final DirectoryLister directoryLister;
    private final DirectoryDigestCalculator digestCalculator;
    private final AppTrackerProperties appTrackerProperties;

    public DirectoryScanService(MediaTrackerRepository repository,
                                DirectoryLister directoryLister,
                                DirectoryDigestCalculator digestCalculator,
                                AppTrackerProperties appTrackerProperties) {
        this.repository = repository;
        this.directoryLister = directoryLister;
        this.digestCalculator = digestCalculator;
        this.appTrackerProperties = appTrackerProperties;
    }

    /**
     * @param maxDepth levels below the root to descend into, unlimited if {@code null}
     */
    public ScanOutcome scan(TrackerContext context,
                            Integer maxDepth,
                            ProgressListener<ScanProgress> progressListener,
                            BooleanSupplier cancelSignal) {
        if (maxDepth != null && maxDepth < 0) {
            throw new BusinessException("400", "maxDepth must not be negative");
        }
        String root = context.getRootPath();
        Path rootDirectory = context.getResolver().toFilePath(root);
        if (!Files.isDirectory(rootDirectory)) {
            throw new BusinessException("IO_ERROR", "Root directory is not accessible: " + rootDirectory,
                    "Check that the collection root is mounted and readable");
        }
        try (CollectionWriteLease ignored = repository.acquireWriteLease(context.getCollectionId())) {
            return doScan(context, maxDepth, progressListener, cancelSignal);
        }
    }

    private ScanOutcome doScan(TrackerContext context,
                               Integer maxDepth,
                               ProgressListener<ScanProgress> progressListener,
                               BooleanSupplier cancelSignal) {
        long collectionId = context.getCollectionId();
        String root = context.getRootPath();
        long startedAt = System.currentTimeMillis();
        int batchSize = Math.max(1, appTrackerProperties.getScanBatchSize());
        log.info("SCAN_START collectionId={} root='{}' maxDepth={} batchSize={}", collectionId, root, maxDepth, batchSize);

        Map<DirTrackingStatus, Integer> counts = new EnumMap<>(DirTrackingStatus.class);
        Set<String> visited = new HashSet<>();
        List<String> unreadable = new ArrayList<>();
        List<TrackedDirectory> batch = new ArrayList<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root);
        int finished = 0;
        int entries = 0;
        boolean aborted = false;

        while (!queue.isEmpty()) {
            if (isCanceled(cancelSignal)) {
                aborted = true;
                break;
            }
            String directoryPath = queue.poll();
            visited.add(directoryPath);
            List<DirectoryEntry> listing;
            try {
                listing = directoryLister.list(context.getResolver().toFilePath(directoryPath));
            } catch (IOException e) {
                if (directoryPath.equals(root)) {
                    throw new BusinessException("IO_ERROR", "Failed to list root directory '" + root + "': "
                            + e.getMessage(), null, e);
                }
                log.warn("SCAN_DIRECTORY_SKIPPED collectionId={} path='{}' reason={}", collectionId, directoryPath,
                        e.getMessage());
                unreadable.add(directoryPath);
                continue;
            }
            batch.add(new TrackedDirectory(directoryPath, digestCalculator.digest(listing), null));
            entries += listing.size();
            if (maxDepth == null || ContentPaths.depthBelow(root, directoryPath) < maxDepth) {
                for (DirectoryEntry entry : listing) {
                    if (entry.isDirectory()) {
                        queue.add(ContentPaths.childDirectory(directoryPath, entry.getName()));
                    }
                }
            }
            if (batch.size() >= batchSize) {
                commitObservations(collectionId, batch, counts);
            }
            finished++;
            ProgressNotifier.notifySafely(progressListener, new ScanProgress(
                    System.currentTimeMillis() - startedAt, finished, unreadable.size(), entries, directoryPath));
        }
        commitObservations(collectionId, batch, counts);

        Completion completion = aborted ? Completion.ABORTED : Completion.FINISHED;
        if (!aborted) {
            int orphaned = markOrphaned(collectionId, root, maxDepth, visited, unreadable);
            counts.merge(DirTrackingStatus.ORPHANED, orphaned, Integer::sum);
        }
        ScanOutcome outcome = new ScanOutcome(root, completion, DirectoriesStatus.of(counts), unreadable.size());
        log.info("SCAN_DONE collectionId={} root='{}' completion={} {} skipped={} elapsedMs={}",
                collectionId, root, completion, outcome.getDirectories(), unreadable.size(),
                System.currentTimeMillis() - startedAt);
        return outcome;
    }

    /**
     * Classifies and writes the observed directories in one transaction, then clears the batch.
     */
    private void commitObservations(long collectionId,
                                    List<TrackedDirectory> batch,
                                    Map<DirTrackingStatus, Integer> counts) {
        if (batch.isEmpty()) {
            return;
        }
        Map<DirTrackingStatus, Integer> batchCounts;
        try {
            batchCounts = repository.inTransaction(() -> {
                Map<DirTrackingStatus, Integer> committed = new EnumMap<>(DirTrackingStatus.class);
                for (TrackedDirectory observed : batch) {
                    committed.merge(writeObservation(collectionId, observed), 1, Integer::sum);
                }
                return committed;
            });
        } catch (DataAccessException e) {
            throw new BusinessException("STORAGE_ERROR", "Failed to store scanned directories: " + e.getMessage(),
                    null, e);
        }
        batchCounts.forEach((status, count) -> counts.merge(status, count, Integer::sum));
        batch.clear();
    }

    private DirTrackingStatus writeObservation(long collectionId, TrackedDirectory observed) {
        Optional<TrackedDirectory> prior = repository.findDirectory(collectionId, observed.getPath());
        DirTrackingStatus status = DirTrackingStatus.classify(
                prior.map(TrackedDirectory::getDigest).orElse(null),
                prior.map(TrackedDirectory::getStatus).orElse(null),
                observed.getDigest());
        TrackedDirectory record = new TrackedDirectory(observed.getPath(), observed.getDigest(), status);
        if (!prior.isPresent()) {
            repository.insertDirectory(collectionId, record);
        } else if (prior.get().getStatus() != status || !Arrays.equals(prior.get().getDigest(), observed.getDigest())) {
            repository.updateDirectory(collectionId, record);
        }
        return status;
    }

    /**
     * Marks tracked directories within the scanned depth that were not seen in this pass.
     *
     * @return number of directories now orphaned
     */
    private int markOrphaned(long collectionId,
                             String root,
                             Integer maxDepth,
                             Set<String> visited,
                             List<String> unreadable) {
        List<TrackedDirectory> missing = new ArrayList<>();
        for (TrackedDirectory tracked : repository.findDirectoriesByPrefix(collectionId, root)) {
            String path = tracked.getPath();
            if (visited.contains(path) || isBelowAny(path, unreadable)) {
                continue;
            }
            if (maxDepth != null && ContentPaths.depthBelow(root, path) > maxDepth) {
                continue;
            }
            missing.add(tracked);
        }
        for (int from = 0; from < missing.size(); from += ORPHAN_BATCH_SIZE) {
            List<TrackedDirectory> chunk = missing.subList(from, Math.min(missing.size(), from + ORPHAN_BATCH_SIZE));
            try {
                repository.inTransaction(() -> {
                    for (TrackedDirectory tracked : chunk) {
                        if (tracked.getStatus() != DirTrackingStatus.ORPHANED) {
                            repository.updateDirectoryStatus(collectionId, tracked.getPath(), DirTrackingStatus.ORPHANED);
                        }
                    }
                    return chunk.size();
                });
            } catch (DataAccessException e) {
                throw new BusinessException("STORAGE_ERROR", "Failed to mark orphaned directories: " + e.getMessage(),
                        null, e);
            }
        }
        if (!missing.isEmpty()) {
            log.info("SCAN_ORPHANED collectionId={} root='{}' count={}", collectionId, root, missing.size());
        }
        return missing.size();
    }

    private boolean isBelowAny(String path, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private boolean isCanceled(BooleanSupplier cancelSignal) {
        return cancelSignal != null && cancelSignal.getAsBoolean();
    }
}
