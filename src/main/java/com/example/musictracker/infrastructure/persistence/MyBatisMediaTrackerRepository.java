package com.example.musictracker.infrastructure.persistence;

import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.common.util.ContentPaths;
import com.example.musictracker.common.util.HashUtil;
import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.model.DirectoriesStatus;
import com.example.musictracker.domain.model.MediaCollection;
import com.example.musictracker.domain.model.MediaSource;
import com.example.musictracker.domain.model.Track;
import com.example.musictracker.domain.model.TrackedDirectory;
import com.example.musictracker.domain.repository.CollectionWriteLease;
import com.example.musictracker.domain.repository.MediaTrackerRepository;
import com.example.musictracker.infrastructure.persistence.entity.MediaCollectionEntity;
import com.example.musictracker.infrastructure.persistence.entity.MediaSourceEntity;
import com.example.musictracker.infrastructure.persistence.entity.TrackEntity;
import com.example.musictracker.infrastructure.persistence.entity.TrackedDirectoryEntity;
import com.example.musictracker.infrastructure.persistence.mapper.MediaCollectionMapper;
import com.example.musictracker.infrastructure.persistence.mapper.MediaSourceMapper;
import com.example.musictracker.infrastructure.persistence.mapper.TrackMapper;
import com.example.musictracker.infrastructure.persistence.mapper.TrackedDirectoryMapper;
import com.example.musictracker.infrastructure.persistence.model.StatusCountRow;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * MySQL-backed tracker storage. Rows are addressed by the MD5 of their path, prefixes are matched with
 * escaped {@code LIKE} patterns.
 */
@Repository
public class MyBatisMediaTrackerRepository implements MediaTrackerRepository {

    private static final Logger log = LoggerFactory.getLogger(MyBatisMediaTrackerRepository.class);

    private static final List<Integer> PENDING_STATUS_CODES = Arrays.asList(
            DirTrackingStatus.ADDED.getCode(), DirTrackingStatus.MODIFIED.getCode());

    private final MediaCollectionMapper mediaCollectionMapper;
    private final TrackedDirectoryMapper trackedDirectoryMapper;
    private final MediaSourceMapper mediaSourceMapper;
    private final TrackMapper trackMapper;
    private final TransactionTemplate transactionTemplate;
    private final ConcurrentMap<Long, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    public MyBatisMediaTrackerRepository(MediaCollectionMapper mediaCollectionMapper,
                                         TrackedDirectoryMapper trackedDirectoryMapper,
                                         MediaSourceMapper mediaSourceMapper,
                                         TrackMapper trackMapper,
                                         PlatformTransactionManager transactionManager) {
        this.mediaCollectionMapper = mediaCollectionMapper;
        this.trackedDirectoryMapper = trackedDirectoryMapper;
        this.mediaSourceMapper = mediaSourceMapper;
        this.trackMapper = trackMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    @Override
    public CollectionWriteLease acquireWriteLease(long collectionId) {
        ReentrantLock lock = writeLocks.computeIfAbsent(collectionId, key -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.info("WRITE_LEASE_BUSY collectionId={}", collectionId);
            throw new BusinessException("409", "Collection " + collectionId + " is being modified by another operation",
                    "Retry after the running operation finished");
        }
        return new CollectionWriteLease() {
            @Override
            public long getCollectionId() {
                return collectionId;
            }

            @Override
            public void close() {
                lock.unlock();
            }
        };
    }

    @Override
    public Optional<MediaCollection> findCollectionByUid(String uid) {
        return Optional.ofNullable(mediaCollectionMapper.selectByUid(uid)).map(this::toCollection);
    }

    @Override
    public List<MediaCollection> findAllCollections() {
        return mediaCollectionMapper.selectAll().stream().map(this::toCollection).collect(Collectors.toList());
    }

    @Override
    public void insertCollection(MediaCollection collection) {
        MediaCollectionEntity entity = new MediaCollectionEntity();
        entity.setUid(collection.getUid());
        entity.setTitle(collection.getTitle());
        entity.setRootUrl(collection.getRootUrl());
        mediaCollectionMapper.insert(entity);
        collection.setId(entity.getId());
    }

    @Override
    public Optional<TrackedDirectory> findDirectory(long collectionId, String path) {
        return Optional.ofNullable(trackedDirectoryMapper.selectByPathMd5(collectionId, HashUtil.md5Hex(path)))
                .map(this::toDirectory);
    }

    @Override
    public void insertDirectory(long collectionId, TrackedDirectory directory) {
        trackedDirectoryMapper.insert(toEntity(collectionId, directory));
    }

    @Override
    public int updateDirectory(long collectionId, TrackedDirectory directory) {
        return trackedDirectoryMapper.update(toEntity(collectionId, directory));
    }

    @Override
    public int updateDirectoryStatus(long collectionId, String path, DirTrackingStatus status) {
        return trackedDirectoryMapper.updateStatus(collectionId, HashUtil.md5Hex(path), status.getCode());
    }

    @Override
    public List<TrackedDirectory> findDirectoriesByPrefix(long collectionId, String pathPrefix) {
        return trackedDirectoryMapper.selectByPrefix(collectionId, likePrefix(pathPrefix)).stream()
                .map(this::toDirectory)
                .collect(Collectors.toList());
    }

    @Override
    public List<TrackedDirectory> findPendingDirectories(long collectionId, String pathPrefix, int offset, int limit) {
        return trackedDirectoryMapper.selectByStatusIn(
                        collectionId, likePrefix(pathPrefix), PENDING_STATUS_CODES, offset, limit).stream()
                .map(this::toDirectory)
                .collect(Collectors.toList());
    }

    @Override
    public boolean confirmDirectory(long collectionId, String path, byte[] digest) {
        return trackedDirectoryMapper.updateStatusIfDigest(
                collectionId, HashUtil.md5Hex(path), digest, DirTrackingStatus.CURRENT.getCode()) > 0;
    }

    @Override
    public int deleteDirectories(long collectionId, String pathPrefix, DirTrackingStatus status) {
        return trackedDirectoryMapper.deleteByPrefix(
                collectionId, likePrefix(pathPrefix), status == null ? null : status.getCode());
    }

    @Override
    public DirectoriesStatus aggregateStatus(long collectionId, String pathPrefix) {
        Map<DirTrackingStatus, Integer> counts = new EnumMap<>(DirTrackingStatus.class);
        for (StatusCountRow row : trackedDirectoryMapper.countByStatus(collectionId, likePrefix(pathPrefix))) {
            counts.put(DirTrackingStatus.fromCode(row.getStatus()), row.getCnt() == null ? 0 : row.getCnt().intValue());
        }
        return DirectoriesStatus.of(counts);
    }

    @Override
    public int relocateDirectories(long collectionId, String oldPrefix, String newPrefix) {
        return trackedDirectoryMapper.relocate(collectionId, likePrefix(oldPrefix), oldPrefix, newPrefix);
    }

    @Override
    public Optional<MediaSource> findSourceByPath(long collectionId, String contentPath) {
        return Optional.ofNullable(mediaSourceMapper.selectByPathMd5(collectionId, HashUtil.md5Hex(contentPath)))
                .map(this::toSource);
    }

    @Override
    public List<MediaSource> findSourcesByPrefix(long collectionId, String pathPrefix) {
        return mediaSourceMapper.selectByPrefix(collectionId, likePrefix(pathPrefix)).stream()
                .map(this::toSource)
                .collect(Collectors.toList());
    }

    @Override
    public void insertSource(MediaSource source) {
        MediaSourceEntity entity = toEntity(source);
        mediaSourceMapper.insert(entity);
        source.setId(entity.getId());
    }

    @Override
    public int updateSource(MediaSource source) {
        return mediaSourceMapper.update(toEntity(source));
    }

    @Override
    public List<Long> findUntrackedSourceIds(long collectionId, String pathPrefix) {
        return mediaSourceMapper.selectUntrackedIds(collectionId, likePrefix(pathPrefix));
    }

    @Override
    public List<Long> findSourceIdsByDirectoryStatus(long collectionId, String pathPrefix, DirTrackingStatus status) {
        return mediaSourceMapper.selectIdsByDirectoryStatus(collectionId, likePrefix(pathPrefix), status.getCode());
    }

    @Override
    public int relinkDirectorySources(long collectionId, String directoryPath, List<String> presentPaths) {
        List<String> present = presentPaths == null ? Collections.<String>emptyList() : presentPaths;
        int untracked = mediaSourceMapper.untrackMissingInDirectory(collectionId, directoryPath, present);
        if (!present.isEmpty()) {
            mediaSourceMapper.retrackPresentInDirectory(collectionId, directoryPath, present);
        }
        return untracked;
    }

    @Override
    public int deleteSources(List<Long> sourceIds) {
        if (sourceIds == null || sourceIds.isEmpty()) {
            return 0;
        }
        return mediaSourceMapper.deleteByIds(sourceIds);
    }

    @Override
    public int relocateSources(long collectionId, String oldPrefix, String newPrefix) {
        return mediaSourceMapper.relocate(collectionId, likePrefix(oldPrefix), oldPrefix, newPrefix);
    }

    @Override
    public Optional<Track> findTrackByUid(String uid) {
        return Optional.ofNullable(trackMapper.selectByUid(uid)).map(this::toTrack);
    }

    @Override
    public Optional<Track> findTrackByMediaSourceId(long mediaSourceId) {
        return Optional.ofNullable(trackMapper.selectByMediaSourceId(mediaSourceId)).map(this::toTrack);
    }

    @Override
    public void insertTrack(Track track) {
        TrackEntity entity = toEntity(track);
        trackMapper.insert(entity);
        track.setId(entity.getId());
    }

    @Override
    public boolean updateTrack(Track track, long expectedRevision) {
        return trackMapper.updateIfRevision(toEntity(track), expectedRevision) > 0;
    }

    @Override
    public int deleteTracksByMediaSourceIds(List<Long> mediaSourceIds) {
        if (mediaSourceIds == null || mediaSourceIds.isEmpty()) {
            return 0;
        }
        return trackMapper.deleteByMediaSourceIds(mediaSourceIds);
    }

    static String likePrefix(String pathPrefix) {
        String prefix = pathPrefix == null ? ContentPaths.ROOT : pathPrefix;
        return prefix.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_") + "%";
    }

    private MediaCollection toCollection(MediaCollectionEntity entity) {
        MediaCollection collection = new MediaCollection();
        collection.setId(entity.getId());
        collection.setUid(entity.getUid());
        collection.setTitle(entity.getTitle());
        collection.setRootUrl(entity.getRootUrl());
        collection.setCreatedAt(entity.getCreatedAt());
        collection.setUpdatedAt(entity.getUpdatedAt());
        return collection;
    }

    private TrackedDirectory toDirectory(TrackedDirectoryEntity entity) {
        return new TrackedDirectory(
                entity.getPath(),
                entity.getDigest(),
                DirTrackingStatus.fromCode(entity.getStatus()),
                entity.getUpdatedAt());
    }

    private TrackedDirectoryEntity toEntity(long collectionId, TrackedDirectory directory) {
        TrackedDirectoryEntity entity = new TrackedDirectoryEntity();
        entity.setCollectionId(collectionId);
        entity.setPath(directory.getPath());
        entity.setPathMd5(HashUtil.md5Hex(directory.getPath()));
        entity.setDigest(directory.getDigest());
        entity.setStatus(directory.getStatus().getCode());
        return entity;
    }

    private MediaSource toSource(MediaSourceEntity entity) {
        MediaSource source = new MediaSource();
        source.setId(entity.getId());
        source.setCollectionId(entity.getCollectionId());
        source.setContentPath(entity.getContentPath());
        source.setTracked(entity.getTracked() == null || entity.getTracked() != 0);
        source.setContentDigest(entity.getContentDigest());
        source.setContentType(entity.getContentType());
        source.setSourceSize(entity.getSourceSize());
        source.setSourceLastModified(entity.getSourceLastModified());
        source.setDurationMs(entity.getDurationMs());
        source.setBitrate(entity.getBitrate());
        source.setSampleRate(entity.getSampleRate());
        source.setChannels(entity.getChannels());
        source.setHasArtwork(entity.getHasArtwork() == null ? null : entity.getHasArtwork() != 0);
        source.setArtworkMimeType(entity.getArtworkMimeType());
        source.setSynchronizedRevision(entity.getSynchronizedRevision());
        source.setCollectedAt(entity.getCollectedAt());
        source.setSynchronizedAt(entity.getSynchronizedAt());
        return source;
    }

    private MediaSourceEntity toEntity(MediaSource source) {
        MediaSourceEntity entity = new MediaSourceEntity();
        entity.setId(source.getId());
        entity.setCollectionId(source.getCollectionId());
        entity.setContentPath(source.getContentPath());
        entity.setContentPathMd5(HashUtil.md5Hex(source.getContentPath()));
        entity.setDirPath(ContentPaths.parentDirectory(source.getContentPath()));
        entity.setTracked(Boolean.FALSE.equals(source.getTracked()) ? 0 : 1);
        entity.setContentDigest(source.getContentDigest());
        entity.setContentType(source.getContentType());
        entity.setSourceSize(source.getSourceSize());
        entity.setSourceLastModified(source.getSourceLastModified());
        entity.setDurationMs(source.getDurationMs());
        entity.setBitrate(source.getBitrate());
        entity.setSampleRate(source.getSampleRate());
        entity.setChannels(source.getChannels());
        entity.setHasArtwork(source.getHasArtwork() == null ? null : (source.getHasArtwork() ? 1 : 0));
        entity.setArtworkMimeType(source.getArtworkMimeType());
        entity.setSynchronizedRevision(source.getSynchronizedRevision());
        entity.setCollectedAt(source.getCollectedAt());
        entity.setSynchronizedAt(source.getSynchronizedAt());
        return entity;
    }

    private Track toTrack(TrackEntity entity) {
        Track track = new Track();
        track.setId(entity.getId());
        track.setUid(entity.getUid());
        track.setRevision(entity.getRevision() == null ? 0L : entity.getRevision());
        track.setMediaSourceId(entity.getMediaSourceId());
        track.setTitle(entity.getTitle());
        track.setArtist(entity.getArtist());
        track.setAlbum(entity.getAlbum());
        track.setAlbumArtist(entity.getAlbumArtist());
        track.setComposer(entity.getComposer());
        track.setTrackNo(entity.getTrackNo());
        track.setDiscNo(entity.getDiscNo());
        track.setYear(entity.getYear());
        track.setGenre(entity.getGenre());
        track.setComment(entity.getComment());
        track.setBpm(entity.getBpm());
        track.setMusicalKey(entity.getMusicalKey());
        track.setCreatedAt(entity.getCreatedAt());
        track.setUpdatedAt(entity.getUpdatedAt());
        return track;
    }

    private TrackEntity toEntity(Track track) {
        TrackEntity entity = new TrackEntity();
        entity.setId(track.getId());
        entity.setUid(track.getUid());
        entity.setRevision(track.getRevision());
        entity.setMediaSourceId(track.getMediaSourceId());
        entity.setTitle(track.getTitle());
        entity.setArtist(track.getArtist());
        entity.setAlbum(track.getAlbum());
        entity.setAlbumArtist(track.getAlbumArtist());
        entity.setComposer(track.getComposer());
        entity.setTrackNo(track.getTrackNo());
        entity.setDiscNo(track.getDiscNo());
        entity.setYear(track.getYear());
        entity.setGenre(track.getGenre());
        entity.setComment(track.getComment());
        entity.setBpm(track.getBpm());
        entity.setMusicalKey(track.getMusicalKey());
        entity.setCreatedAt(track.getCreatedAt());
        entity.setUpdatedAt(track.getUpdatedAt());
        return entity;
    }
}
