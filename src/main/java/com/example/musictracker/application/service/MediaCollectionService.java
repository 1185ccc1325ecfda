package com.example.musictracker.application.service;

import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.common.util.ContentPaths;
import com.example.musictracker.domain.model.MediaCollection;
import com.example.musictracker.domain.repository.MediaTrackerRepository;
import com.example.musictracker.infrastructure.fs.ContentPathResolver;
import com.example.musictracker.infrastructure.fs.FileSystemContentPathResolver;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class MediaCollectionService {

    private static final Logger log = LoggerFactory.getLogger(MediaCollectionService.class);

    private final MediaTrackerRepository repository;

    public MediaCollectionService(MediaTrackerRepository repository) {
        this.repository = repository;
    }

    public MediaCollection createCollection(String uid, String title, String rootUrl) {
        if (!StringUtils.hasText(uid)) {
            throw new BusinessException("400", "Collection uid is missing");
        }
        ContentPathResolver resolver = FileSystemContentPathResolver.forRootUrl(rootUrl);
        if (repository.findCollectionByUid(uid.trim()).isPresent()) {
            throw new BusinessException("409", "Collection already exists: " + uid);
        }
        MediaCollection collection = new MediaCollection();
        collection.setUid(uid.trim());
        collection.setTitle(StringUtils.hasText(title) ? title.trim() : uid.trim());
        collection.setRootUrl(resolver.getRootLocation().toString());
        repository.inTransaction(() -> {
            repository.insertCollection(collection);
            return collection;
        });
        log.info("COLLECTION_CREATED uid={} id={} rootUrl={}", collection.getUid(), collection.getId(), collection.getRootUrl());
        return collection;
    }

    public List<MediaCollection> listCollections() {
        return repository.findAllCollections();
    }

    public MediaCollection getCollection(String uid) {
        if (!StringUtils.hasText(uid)) {
            throw new BusinessException("400", "Collection uid is missing");
        }
        return repository.findCollectionByUid(uid.trim())
                .orElseThrow(() -> new BusinessException("404", "Collection not found: " + uid));
    }

    /**
     * Scopes an operation to a root URL inside the collection, or to the whole collection if none is given.
     */
    public TrackerContext resolveContext(String collectionUid, String rootUrl) {
        MediaCollection collection = getCollection(collectionUid);
        ContentPathResolver resolver = FileSystemContentPathResolver.forRootUrl(collection.getRootUrl());
        if (!StringUtils.hasText(rootUrl)) {
            return new TrackerContext(collection, resolver, ContentPaths.ROOT);
        }
        URI location;
        try {
            location = new URI(rootUrl.trim());
        } catch (URISyntaxException e) {
            throw new BusinessException("400", "Malformed root URL: " + rootUrl);
        }
        String rootPath = ContentPaths.normalizeDirectory(resolver.locationToPath(location));
        return new TrackerContext(collection, resolver, rootPath);
    }

    /**
     * Scopes an operation to a content path prefix inside the collection.
     */
    public TrackerContext resolveContextByPath(String collectionUid, String rootPath) {
        MediaCollection collection = getCollection(collectionUid);
        ContentPathResolver resolver = FileSystemContentPathResolver.forRootUrl(collection.getRootUrl());
        return new TrackerContext(collection, resolver, ContentPaths.normalizeDirectory(rootPath));
    }
}
