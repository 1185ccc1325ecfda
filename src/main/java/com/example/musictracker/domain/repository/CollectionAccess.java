package com.example.musictracker.domain.repository;

import com.example.musictracker.domain.model.MediaCollection;
import java.util.List;
import java.util.Optional;

public interface CollectionAccess {

    Optional<MediaCollection> findCollectionByUid(String uid);

    List<MediaCollection> findAllCollections();

    void insertCollection(MediaCollection collection);
}
