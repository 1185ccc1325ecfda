package com.example.musictracker.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.domain.model.MediaCollection;
import com.example.musictracker.support.InMemoryMediaTrackerRepository;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MediaCollectionServiceTest {

    @TempDir
    Path root;

    private MediaCollectionService service;

    @BeforeEach
    void setUp() {
        service = new MediaCollectionService(new InMemoryMediaTrackerRepository());
    }

    @Test
    void shouldCreateAndFindCollection() {
        MediaCollection created = service.createCollection(" vinyl ", null, root.toUri().toString());

        assertNotNull(created.getId());
        assertEquals("vinyl", created.getUid());
        assertEquals("vinyl", created.getTitle());
        assertTrue(created.getRootUrl().endsWith("/"));
        assertEquals(created.getId(), service.getCollection("vinyl").getId());
        assertEquals(1, service.listCollections().size());
    }

    @Test
    void shouldRejectDuplicateAndInvalidCollections() {
        service.createCollection("vinyl", "Vinyl", root.toUri().toString());

        assertEquals("409", assertThrows(BusinessException.class,
                () -> service.createCollection("vinyl", "Again", root.toUri().toString())).getCode());
        assertEquals("400", assertThrows(BusinessException.class,
                () -> service.createCollection("", "Blank", root.toUri().toString())).getCode());
        assertEquals("400", assertThrows(BusinessException.class,
                () -> service.createCollection("remote", "Remote", "smb://nas/music")).getCode());
        assertEquals("404", assertThrows(BusinessException.class,
                () -> service.getCollection("cassette")).getCode());
    }

    @Test
    void shouldResolveRootUrlInsideCollection() {
        service.createCollection("vinyl", "Vinyl", root.toUri().toString());

        TrackerContext whole = service.resolveContext("vinyl", null);
        TrackerContext nested = service.resolveContext("vinyl", root.resolve("Jazz").resolve("Blue Note").toUri().toString());
        TrackerContext byPath = service.resolveContextByPath("vinyl", "/Jazz");

        assertEquals("", whole.getRootPath());
        assertEquals("Jazz/Blue Note/", nested.getRootPath());
        assertEquals("Jazz/", byPath.getRootPath());
        assertEquals("400", assertThrows(BusinessException.class,
                () -> service.resolveContext("vinyl", root.getParent().toUri().toString())).getCode());
    }
}
