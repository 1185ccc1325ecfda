package com.example.musictracker.domain.repository;

/**
 * Exclusive right to mutate the tracking, media and track rows of one collection.
 */
public interface CollectionWriteLease extends AutoCloseable {

    long getCollectionId();

    @Override
    void close();
}
