package com.example.musictracker.application.service;

import com.example.musictracker.domain.model.MediaCollection;
import com.example.musictracker.infrastructure.fs.ContentPathResolver;

/**
 * Collection, path resolver and root directory an operation is scoped to.
 */
public final class TrackerContext {

    private final MediaCollection collection;
    private final ContentPathResolver resolver;
    private final String rootPath;

    public TrackerContext(MediaCollection collection, ContentPathResolver resolver, String rootPath) {
        this.collection = collection;
        this.resolver = resolver;
        this.rootPath = rootPath;
    }

    public MediaCollection getCollection() {
        return collection;
    }

    public long getCollectionId() {
        return collection.getId();
    }

    public ContentPathResolver getResolver() {
        return resolver;
    }

    /**
     * Content path of the root directory, empty for the collection root.
     */
    public String getRootPath() {
        return rootPath;
    }
}
