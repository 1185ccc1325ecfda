package com.example.musictracker.domain.repository;

import java.util.function.Supplier;

/**
 * Storage contract of the media tracker.
 *
 * <p>Mutations run inside {@link #inTransaction(Supplier)} batches; a failing batch is rolled back
 * without touching batches committed before it. Only one synchronization operation may hold the write
 * lease of a collection at a time, while reads are never blocked by it.
 */
public interface MediaTrackerRepository extends CollectionAccess, DirectoryTrackingAccess, MediaSourceAccess, TrackAccess {

    <T> T inTransaction(Supplier<T> work);

    /**
     * @throws com.example.musictracker.common.exception.BusinessException with code {@code 409}
     *                                                                    if another writer holds the collection
     */
    CollectionWriteLease acquireWriteLease(long collectionId);
}
