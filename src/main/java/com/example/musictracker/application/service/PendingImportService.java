package com.example.musictracker.application.service;

import com.example.musictracker.application.progress.ImportProgress;
import com.example.musictracker.application.progress.ProgressListener;
import com.example.musictracker.application.progress.ProgressNotifier;
import com.example.musictracker.common.config.AppTrackerProperties;
import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.common.util.ContentPaths;
import com.example.musictracker.common.util.HashUtil;
import com.example.musictracker.domain.enumtype.Completion;
import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.enumtype.ReplaceMode;
import com.example.musictracker.domain.enumtype.SyncMode;
import com.example.musictracker.domain.model.DirectoryEntry;
import com.example.musictracker.domain.model.ImportDirectoriesSummary;
import com.example.musictracker.domain.model.ImportOutcome;
import com.example.musictracker.domain.model.ImportResult;
import com.example.musictracker.domain.model.ImportTrackConfig;
import com.example.musictracker.domain.model.ImportedSourceIssues;
import com.example.musictracker.domain.model.MediaFile;
import com.example.musictracker.domain.model.MediaSource;
import com.example.musictracker.domain.model.Track;
import com.example.musictracker.domain.model.TrackedDirectory;
import com.example.musictracker.domain.model.TracksSummary;
import com.example.musictracker.domain.repository.CollectionWriteLease;
import com.example.musictracker.domain.repository.MediaTrackerRepository;
import com.example.musictracker.infrastructure.fs.DirectoryLister;
import com.example.musictracker.infrastructure.importer.TrackImporter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Imports the files of pending directories and confirms each directory once all of its files went through.
 */
@Service
public class PendingImportService {

    private static final Logger log = LoggerFactory.getLogger(PendingImportService.class);

    private static final Map<String, String> CONTENT_TYPES = new HashMap<>();

    static {
        CONTENT_TYPES.put("mp3", "audio/mpeg");
        CONTENT_TYPES.put("flac", "audio/flac");
        CONTENT_TYPES.put("m4a", "audio/mp4");
        CONTENT_TYPES.put("aac", "audio/aac");
        CONTENT_TYPES.put("ogg", "audio/ogg");
        CONTENT_TYPES.put("wav", "audio/wav");
    }

    private enum DirectoryResult {
        CONFIRMED,
        PENDING,
        OUTDATED,
        UNTRACKED,
        ABORTED
    }

    private enum Applied {
        CREATED,
        UPDATED,
        CONFLICT
    }

    private final MediaTrackerRepository repository;
    private final DirectoryLister directoryLister;
    private final TrackImporter trackImporter;
    private final TrackValidator trackValidator;
    private final AppTrackerProperties appTrackerProperties;

    public PendingImportService(MediaTrackerRepository repository,
                                DirectoryLister directoryLister,
                                TrackImporter trackImporter,
                                TrackValidator trackValidator,
                                AppTrackerProperties appTrackerProperties) {
        this.repository = repository;
        this.directoryLister = directoryLister;
        this.trackImporter = trackImporter;
        this.trackValidator = trackValidator;
        this.appTrackerProperties = appTrackerProperties;
    }

    public ImportOutcome importPending(TrackerContext context,
                                       SyncMode syncMode,
                                       ReplaceMode replaceMode,
                                       ImportTrackConfig config,
                                       ProgressListener<ImportProgress> progressListener,
                                       BooleanSupplier cancelSignal) {
        ImportRun run = new ImportRun(
                context,
                syncMode == null ? appTrackerProperties.getDefaultSyncMode() : syncMode,
                replaceMode == null ? ReplaceMode.UPDATE_OR_CREATE : replaceMode,
                config == null ? ImportTrackConfig.defaults() : config,
                progressListener,
                cancelSignal);
        if (run.audioExtensions.isEmpty()) {
            throw new BusinessException("400", "app.tracker.audio-extensions is empty");
        }
        try (CollectionWriteLease ignored = repository.acquireWriteLease(context.getCollectionId())) {
            return doImport(run);
        }
    }

    private ImportOutcome doImport(ImportRun run) {
        long collectionId = run.context.getCollectionId();
        String root = run.context.getRootPath();
        int pageSize = Math.max(1, appTrackerProperties.getPendingPageSize());
        log.info("IMPORT_START collectionId={} root='{}' syncMode={} replaceMode={} batchSize={}",
                collectionId, root, run.syncMode, run.replaceMode, run.batchSize);

        boolean aborted = false;
        pages:
        while (true) {
            if (run.isCanceled()) {
                aborted = true;
                break;
            }
            List<TrackedDirectory> page;
            try {
                page = repository.findPendingDirectories(collectionId, root, run.pendingOffset, pageSize);
            } catch (DataAccessException e) {
                throw new BusinessException("STORAGE_ERROR", "Failed to load pending directories: " + e.getMessage(),
                        null, e);
            }
            if (page.isEmpty()) {
                break;
            }
            for (TrackedDirectory directory : page) {
                if (run.isCanceled()) {
                    aborted = true;
                    break pages;
                }
                DirectoryResult result = importDirectory(run, directory);
                if (result == DirectoryResult.ABORTED) {
                    aborted = true;
                    break pages;
                }
            }
        }

        Completion completion = aborted ? Completion.ABORTED : Completion.FINISHED;
        List<ImportedSourceIssues> issues = new ArrayList<>();
        run.issues.forEach((path, messages) -> issues.add(new ImportedSourceIssues(path, messages)));
        ImportOutcome outcome = new ImportOutcome(
                root,
                completion,
                run.tracks.build(),
                new ImportDirectoriesSummary(run.confirmed, run.skippedDirectories, run.untracked, run.sourcesUntracked),
                issues);
        if (aborted) {
            log.info("IMPORT_CANCELED collectionId={} root='{}' files={}", collectionId, root, run.filesFinished);
        }
        log.info("IMPORT_DONE collectionId={} root='{}' completion={} tracks[{}] directories[{}] elapsedMs={}",
                collectionId, root, completion, outcome.getTracks(), outcome.getDirectories(), run.elapsedMs());
        return outcome;
    }

    private DirectoryResult importDirectory(ImportRun run, TrackedDirectory directory) {
        long collectionId = run.context.getCollectionId();
        String directoryPath = directory.getPath();
        Path location = run.context.getResolver().toFilePath(directoryPath);
        if (Files.notExists(location)) {
            int removed = untrackVanished(collectionId, directoryPath);
            run.untracked += removed;
            log.info("IMPORT_DIRECTORY_UNTRACKED collectionId={} path='{}' records={}", collectionId, directoryPath, removed);
            return DirectoryResult.UNTRACKED;
        }
        List<DirectoryEntry> listing;
        try {
            listing = directoryLister.list(location);
        } catch (IOException e) {
            log.warn("IMPORT_DIRECTORY_SKIPPED collectionId={} path='{}' reason={}", collectionId, directoryPath,
                    e.getMessage());
            run.keepPending();
            return DirectoryResult.PENDING;
        }

        DirectoryBatch batch = new DirectoryBatch();
        List<String> presentPaths = new ArrayList<>();
        for (DirectoryEntry entry : listing) {
            if (entry.isDirectory()) {
                continue;
            }
            presentPaths.add(ContentPaths.childFile(directoryPath, entry.getName()));
        }
        for (DirectoryEntry entry : listing) {
            if (entry.isDirectory()) {
                continue;
            }
            if (run.isCanceled()) {
                flush(run, batch);
                return DirectoryResult.ABORTED;
            }
            String contentPath = ContentPaths.childFile(directoryPath, entry.getName());
            processFile(run, batch, contentPath, entry);
            if (batch.plans.size() >= run.batchSize) {
                flush(run, batch);
            }
            run.filesFinished++;
            run.lastPath = contentPath;
            run.notifyProgress();
        }
        flush(run, batch);

        int missing;
        try {
            missing = repository.inTransaction(
                    () -> repository.relinkDirectorySources(collectionId, directoryPath, presentPaths));
        } catch (DataAccessException e) {
            log.warn("IMPORT_RELINK_FAILED collectionId={} path='{}' reason={}", collectionId, directoryPath,
                    e.getMessage());
            run.keepPending();
            return DirectoryResult.PENDING;
        }
        if (missing > 0) {
            run.sourcesUntracked += missing;
            log.info("IMPORT_SOURCES_UNTRACKED collectionId={} path='{}' sources={}", collectionId, directoryPath,
                    missing);
        }

        if (batch.failed > 0) {
            markOutdated(collectionId, directoryPath);
            run.skippedDirectories++;
            log.warn("IMPORT_DIRECTORY_OUTDATED collectionId={} path='{}' failedFiles={}", collectionId, directoryPath,
                    batch.failed);
            return DirectoryResult.OUTDATED;
        }
        boolean confirmed;
        try {
            confirmed = repository.inTransaction(
                    () -> repository.confirmDirectory(collectionId, directoryPath, directory.getDigest()));
        } catch (DataAccessException e) {
            log.warn("IMPORT_CONFIRM_FAILED collectionId={} path='{}' reason={}", collectionId, directoryPath,
                    e.getMessage());
            run.keepPending();
            return DirectoryResult.PENDING;
        }
        if (!confirmed) {
            log.info("IMPORT_CONFIRM_REJECTED collectionId={} path='{}' reason=digest changed since scan",
                    collectionId, directoryPath);
            run.keepPending();
            return DirectoryResult.PENDING;
        }
        run.confirmed++;
        run.notifyProgress();
        return DirectoryResult.CONFIRMED;
    }

    private void processFile(ImportRun run, DirectoryBatch batch, String contentPath, DirectoryEntry entry) {
        long collectionId = run.context.getCollectionId();
        String extension = ContentPaths.extension(entry.getName());
        if (!run.audioExtensions.contains(extension)) {
            run.tracks.skipped(contentPath);
            return;
        }
        Optional<MediaSource> existingSource = repository.findSourceByPath(collectionId, contentPath);
        if (run.syncMode == SyncMode.ONCE && existingSource.isPresent()) {
            run.tracks.unchanged(contentPath);
            return;
        }
        Path filePath = run.context.getResolver().toFilePath(contentPath);
        byte[] digest;
        try {
            digest = HashUtil.digestFile(filePath);
        } catch (IOException e) {
            log.warn("IMPORT_FILE_UNREADABLE path='{}' reason={}", contentPath, e.getMessage());
            run.addIssues(contentPath, Collections.singletonList("Unreadable file: " + e.getMessage()));
            run.tracks.failed(contentPath);
            batch.failed++;
            return;
        }
        Track existingTrack = existingSource
                .flatMap(source -> repository.findTrackByMediaSourceId(source.getId()))
                .orElse(null);
        if (existingSource.isPresent() && !shouldReimport(run.syncMode, existingSource.get(), existingTrack, digest)) {
            if (run.syncMode == SyncMode.MODIFIED
                    && !Arrays.equals(existingSource.get().getContentDigest(), digest)) {
                run.tracks.notImported(contentPath);
            } else {
                run.tracks.unchanged(contentPath);
            }
            return;
        }

        MediaFile mediaFile = new MediaFile(contentPath, filePath, contentTypeOf(extension), entry.getSize(),
                entry.getLastModifiedMillis(), digest);
        ImportResult result;
        try {
            result = trackImporter.importTrack(mediaFile, existingTrack == null ? null : existingTrack.copy(), run.config);
        } catch (RuntimeException e) {
            log.warn("IMPORT_FILE_FAILED path='{}' reason={}", contentPath, e.getMessage());
            result = ImportResult.failed(Collections.singletonList(e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
        List<String> messages = new ArrayList<>(result.getIssues());
        if (!result.isImported()) {
            run.addIssues(contentPath, messages);
            run.tracks.failed(contentPath);
            batch.failed++;
            return;
        }
        List<String> violations = trackValidator.validate(result.getTrack(), result.getSource());
        messages.addAll(violations);
        run.addIssues(contentPath, messages);
        if (existingTrack == null) {
            if (run.replaceMode == ReplaceMode.UPDATE_ONLY || !violations.isEmpty()) {
                run.tracks.notCreated(contentPath);
                return;
            }
        } else if (run.replaceMode == ReplaceMode.CREATE_ONLY || !violations.isEmpty()) {
            run.tracks.notUpdated(contentPath);
            return;
        }
        batch.plans.add(new ImportPlan(collectionId, mediaFile, existingSource.orElse(null), existingTrack, result));
    }

    /**
     * Applies the sync mode to a file that already has a media source.
     */
    static boolean shouldReimport(SyncMode syncMode, MediaSource existingSource, Track existingTrack, byte[] digest) {
        boolean digestChanged = !Arrays.equals(existingSource.getContentDigest(), digest);
        switch (syncMode) {
            case ONCE:
                return false;
            case ALWAYS:
                return true;
            case MODIFIED_RESYNC:
                return digestChanged;
            case MODIFIED:
            default:
                if (!digestChanged) {
                    return false;
                }
                Long synchronizedRevision = existingSource.getSynchronizedRevision();
                return existingTrack == null
                        || synchronizedRevision == null
                        || existingTrack.getRevision() == synchronizedRevision;
        }
    }

    /**
     * Commits the planned creates and updates in one transaction. A storage failure rolls the batch back
     * and counts its files as failed.
     */
    private void flush(ImportRun run, DirectoryBatch batch) {
        if (batch.plans.isEmpty()) {
            return;
        }
        List<ImportPlan> plans = new ArrayList<>(batch.plans);
        batch.plans.clear();
        List<Applied> applied;
        try {
            applied = repository.inTransaction(() -> {
                List<Applied> results = new ArrayList<>();
                for (ImportPlan plan : plans) {
                    results.add(apply(plan));
                }
                return results;
            });
        } catch (DataAccessException e) {
            log.warn("IMPORT_BATCH_FAILED collectionId={} files={} reason={}",
                    run.context.getCollectionId(), plans.size(), e.getMessage());
            for (ImportPlan plan : plans) {
                String path = plan.file.getContentPath();
                run.addIssues(path, Collections.singletonList("Storage failure: " + e.getMessage()));
                run.tracks.failed(path);
                batch.failed++;
            }
            return;
        }
        for (int i = 0; i < plans.size(); i++) {
            String path = plans.get(i).file.getContentPath();
            switch (applied.get(i)) {
                case CREATED:
                    run.tracks.created(path);
                    run.created++;
                    break;
                case UPDATED:
                    run.tracks.updated(path);
                    run.updated++;
                    break;
                case CONFLICT:
                default:
                    run.addIssues(path, Collections.singletonList("Track was modified concurrently"));
                    run.tracks.failed(path);
                    batch.failed++;
                    break;
            }
        }
    }

    private Applied apply(ImportPlan plan) {
        LocalDateTime now = LocalDateTime.now();
        MediaSource source = plan.result.getSource();
        source.setCollectionId(plan.collectionId);
        source.setContentPath(plan.file.getContentPath());
        source.setContentDigest(plan.file.getContentDigest());
        source.setContentType(plan.file.getContentType());
        source.setSourceSize(plan.file.getSize());
        source.setSourceLastModified(
                LocalDateTime.ofInstant(Instant.ofEpochMilli(plan.file.getLastModifiedMillis()), ZoneId.systemDefault()));
        source.setSynchronizedAt(now);
        if (plan.existingSource != null) {
            source.setId(plan.existingSource.getId());
            source.setCollectedAt(plan.existingSource.getCollectedAt());
        } else {
            source.setCollectedAt(now);
        }

        Track track = plan.result.getTrack();
        if (plan.existingTrack == null) {
            track.setId(null);
            track.setUid(UUID.randomUUID().toString());
            track.setRevision(1L);
            track.setCreatedAt(now);
            track.setUpdatedAt(now);
            source.setSynchronizedRevision(1L);
            if (plan.existingSource == null) {
                repository.insertSource(source);
            } else {
                repository.updateSource(source);
            }
            track.setMediaSourceId(source.getId());
            repository.insertTrack(track);
            return Applied.CREATED;
        }

        long expectedRevision = plan.existingTrack.getRevision();
        track.setId(plan.existingTrack.getId());
        track.setUid(plan.existingTrack.getUid());
        track.setMediaSourceId(plan.existingTrack.getMediaSourceId());
        track.setCreatedAt(plan.existingTrack.getCreatedAt());
        track.setUpdatedAt(now);
        track.setRevision(expectedRevision + 1);
        if (!repository.updateTrack(track, expectedRevision)) {
            return Applied.CONFLICT;
        }
        source.setSynchronizedRevision(track.getRevision());
        repository.updateSource(source);
        return Applied.UPDATED;
    }

    private int untrackVanished(long collectionId, String directoryPath) {
        try {
            return repository.inTransaction(() -> repository.deleteDirectories(collectionId, directoryPath, null));
        } catch (DataAccessException e) {
            throw new BusinessException("STORAGE_ERROR", "Failed to untrack vanished directory '" + directoryPath
                    + "': " + e.getMessage(), null, e);
        }
    }

    private void markOutdated(long collectionId, String directoryPath) {
        try {
            repository.inTransaction(
                    () -> repository.updateDirectoryStatus(collectionId, directoryPath, DirTrackingStatus.OUTDATED));
        } catch (DataAccessException e) {
            throw new BusinessException("STORAGE_ERROR", "Failed to mark directory '" + directoryPath
                    + "' outdated: " + e.getMessage(), null, e);
        }
    }

    private static String contentTypeOf(String extension) {
        String contentType = CONTENT_TYPES.get(extension);
        return contentType == null ? "audio/" + extension : contentType;
    }

    private static class ImportPlan {

        private final long collectionId;
        private final MediaFile file;
        private final MediaSource existingSource;
        private final Track existingTrack;
        private final ImportResult result;

        private ImportPlan(long collectionId, MediaFile file, MediaSource existingSource, Track existingTrack,
                           ImportResult result) {
            this.collectionId = collectionId;
            this.file = file;
            this.existingSource = existingSource;
            this.existingTrack = existingTrack;
            this.result = result;
        }
    }

    private static class DirectoryBatch {

        private final List<ImportPlan> plans = new ArrayList<>();
        private int failed;
    }

    private class ImportRun {

        private final TrackerContext context;
        private final SyncMode syncMode;
        private final ReplaceMode replaceMode;
        private final ImportTrackConfig config;
        private final ProgressListener<ImportProgress> progressListener;
        private final BooleanSupplier cancelSignal;
        private final Set<String> audioExtensions;
        private final int batchSize;
        private final long startedAt = System.currentTimeMillis();

        private final TracksSummary.Builder tracks = new TracksSummary.Builder();
        private final Map<String, List<String>> issues = new LinkedHashMap<>();
        private int confirmed;
        private int skippedDirectories;
        private int untracked;
        private int sourcesUntracked;
        /**
         * Directories passed over that are still pending, which is where the next page starts.
         */
        private int pendingOffset;
        private int filesFinished;
        private int created;
        private int updated;
        private String lastPath;

        private ImportRun(TrackerContext context,
                          SyncMode syncMode,
                          ReplaceMode replaceMode,
                          ImportTrackConfig config,
                          ProgressListener<ImportProgress> progressListener,
                          BooleanSupplier cancelSignal) {
            this.context = context;
            this.syncMode = syncMode;
            this.replaceMode = replaceMode;
            this.config = config;
            this.progressListener = progressListener;
            this.cancelSignal = cancelSignal;
            this.audioExtensions = appTrackerProperties.normalizedAudioExtensions();
            this.batchSize = Math.max(1, appTrackerProperties.getImportBatchSize());
        }

        private boolean isCanceled() {
            return cancelSignal != null && cancelSignal.getAsBoolean();
        }

        private void keepPending() {
            skippedDirectories++;
            pendingOffset++;
        }

        private void addIssues(String path, List<String> messages) {
            if (messages.isEmpty()) {
                return;
            }
            issues.computeIfAbsent(path, key -> new ArrayList<>()).addAll(messages);
        }

        private long elapsedMs() {
            return System.currentTimeMillis() - startedAt;
        }

        private void notifyProgress() {
            ProgressNotifier.notifySafely(progressListener, new ImportProgress(
                    elapsedMs(),
                    filesFinished,
                    created,
                    updated,
                    tracks.unchangedCount(),
                    tracks.failedCount(),
                    confirmed,
                    skippedDirectories,
                    lastPath));
        }
    }
}
