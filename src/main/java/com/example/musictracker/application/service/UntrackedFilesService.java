package com.example.musictracker.application.service;

import com.example.musictracker.application.progress.ProgressListener;
import com.example.musictracker.application.progress.ProgressNotifier;
import com.example.musictracker.application.progress.ScanProgress;
import com.example.musictracker.common.config.AppTrackerProperties;
import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.common.util.ContentPaths;
import com.example.musictracker.domain.enumtype.Completion;
import com.example.musictracker.domain.model.DirectoryEntry;
import com.example.musictracker.domain.model.UntrackedFilesOutcome;
import com.example.musictracker.domain.repository.MediaTrackerRepository;
import com.example.musictracker.infrastructure.fs.DirectoryLister;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Lists audio files below a root that have not been imported yet. Read-only, so it runs without the write
 * lease and next to other operations on the same collection.
 */
@Service
public class UntrackedFilesService {

    private static final Logger log = LoggerFactory.getLogger(UntrackedFilesService.class);

    private final MediaTrackerRepository repository;
    private final DirectoryLister directoryLister;
    private final AppTrackerProperties appTrackerProperties;

    public UntrackedFilesService(MediaTrackerRepository repository,
                                 DirectoryLister directoryLister,
                                 AppTrackerProperties appTrackerProperties) {
        this.repository = repository;
        this.directoryLister = directoryLister;
        this.appTrackerProperties = appTrackerProperties;
    }

    /**
     * @param maxDepth levels below the root to descend into, unlimited if {@code null}
     */
    public UntrackedFilesOutcome findUntrackedFiles(TrackerContext context,
                                                    Integer maxDepth,
                                                    ProgressListener<ScanProgress> progressListener,
                                                    BooleanSupplier cancelSignal) {
        if (maxDepth != null && maxDepth < 0) {
            throw new BusinessException("400", "maxDepth must not be negative");
        }
        long collectionId = context.getCollectionId();
        String root = context.getRootPath();
        Path rootDirectory = context.getResolver().toFilePath(root);
        if (!Files.isDirectory(rootDirectory)) {
            throw new BusinessException("IO_ERROR", "Root directory is not accessible: " + rootDirectory,
                    "Check that the collection root is mounted and readable");
        }
        Set<String> audioExtensions = appTrackerProperties.normalizedAudioExtensions();
        long startedAt = System.currentTimeMillis();
        log.info("FIND_UNTRACKED_START collectionId={} root='{}' maxDepth={}", collectionId, root, maxDepth);

        List<String> untracked = new ArrayList<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root);
        int finished = 0;
        int skipped = 0;
        int entries = 0;
        boolean aborted = false;
        while (!queue.isEmpty()) {
            if (cancelSignal != null && cancelSignal.getAsBoolean()) {
                aborted = true;
                break;
            }
            String directoryPath = queue.poll();
            List<DirectoryEntry> listing;
            try {
                listing = directoryLister.list(context.getResolver().toFilePath(directoryPath));
            } catch (IOException e) {
                if (directoryPath.equals(root)) {
                    throw new BusinessException("IO_ERROR", "Failed to list root directory '" + root + "': "
                            + e.getMessage(), null, e);
                }
                log.warn("FIND_UNTRACKED_DIRECTORY_SKIPPED collectionId={} path='{}' reason={}", collectionId,
                        directoryPath, e.getMessage());
                skipped++;
                continue;
            }
            boolean descend = maxDepth == null || ContentPaths.depthBelow(root, directoryPath) < maxDepth;
            for (DirectoryEntry entry : listing) {
                if (entry.isDirectory()) {
                    if (descend) {
                        queue.add(ContentPaths.childDirectory(directoryPath, entry.getName()));
                    }
                    continue;
                }
                if (!audioExtensions.contains(ContentPaths.extension(entry.getName()))) {
                    continue;
                }
                String contentPath = ContentPaths.childFile(directoryPath, entry.getName());
                if (!hasSource(collectionId, contentPath)) {
                    untracked.add(contentPath);
                }
            }
            entries += listing.size();
            finished++;
            ProgressNotifier.notifySafely(progressListener, new ScanProgress(
                    System.currentTimeMillis() - startedAt, finished, skipped, entries, directoryPath));
        }

        UntrackedFilesOutcome outcome = new UntrackedFilesOutcome(
                root, aborted ? Completion.ABORTED : Completion.FINISHED, untracked, skipped);
        log.info("FIND_UNTRACKED_DONE collectionId={} {} elapsedMs={}", collectionId, outcome,
                System.currentTimeMillis() - startedAt);
        return outcome;
    }

    private boolean hasSource(long collectionId, String contentPath) {
        try {
            return repository.findSourceByPath(collectionId, contentPath).isPresent();
        } catch (DataAccessException e) {
            throw new BusinessException("STORAGE_ERROR", "Failed to look up media source '" + contentPath + "': "
                    + e.getMessage(), null, e);
        }
    }
}
