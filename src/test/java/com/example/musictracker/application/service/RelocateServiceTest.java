package com.example.musictracker.application.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.enumtype.SyncMode;
import com.example.musictracker.domain.model.MediaSource;
import com.example.musictracker.domain.model.RelocateOutcome;
import com.example.musictracker.domain.model.Track;
import com.example.musictracker.support.TrackerFixture;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RelocateServiceTest {

    @TempDir
    Path root;

    private TrackerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new TrackerFixture(root);
        fixture.write("a/x.mp3", "x");
        fixture.write("a/b/y.mp3", "y");
        fixture.write("c/z.mp3", "z");
        fixture.scan();
        fixture.importPending(SyncMode.MODIFIED);
    }

    @Test
    void shouldRewritePrefixAndPreserveIdentity() {
        Track trackBefore = fixture.trackOf("a/b/y.mp3").get();
        MediaSource sourceBefore = fixture.source("a/b/y.mp3").get();
        byte[] directoryDigest = fixture.directory("a/b/").get().getDigest();
        int matchingRows = fixture.getRepository().findSourcesByPrefix(fixture.collectionId(), "a/").size()
                + fixture.getRepository().findDirectoriesByPrefix(fixture.collectionId(), "a/").size();

        RelocateOutcome outcome = fixture.getRelocateService().relocate(TrackerFixture.COLLECTION_UID, "/a", "moved/a");

        assertEquals("a/", outcome.getOldPrefix());
        assertEquals("moved/a/", outcome.getNewPrefix());
        assertEquals(2, outcome.getRelocatedSources());
        assertEquals(2, outcome.getRelocatedDirectories());
        assertEquals(matchingRows, outcome.getRelocatedCount());

        assertFalse(fixture.source("a/b/y.mp3").isPresent());
        MediaSource sourceAfter = fixture.source("moved/a/b/y.mp3").orElseThrow(AssertionError::new);
        Track trackAfter = fixture.trackOf("moved/a/b/y.mp3").orElseThrow(AssertionError::new);
        assertEquals(sourceBefore.getId(), sourceAfter.getId());
        assertArrayEquals(sourceBefore.getContentDigest(), sourceAfter.getContentDigest());
        assertEquals(trackBefore.getUid(), trackAfter.getUid());
        assertEquals(trackBefore.getRevision(), trackAfter.getRevision());
        assertArrayEquals(directoryDigest, fixture.directory("moved/a/b/").get().getDigest());
        assertEquals(DirTrackingStatus.CURRENT, fixture.statusOf("moved/a/b/"));
        assertTrue(fixture.source("c/z.mp3").isPresent());
    }

    @Test
    void shouldRejectMoveOntoExistingRows() {
        BusinessException error = assertThrows(BusinessException.class,
                () -> fixture.getRelocateService().relocate(fixture.collectionId(), "a/", "c/"));

        assertEquals("400", error.getCode());
        assertTrue(fixture.source("a/x.mp3").isPresent());
        assertEquals(DirTrackingStatus.CURRENT, fixture.statusOf("a/"));
    }

    @Test
    void shouldRejectIdenticalPrefixes() {
        BusinessException error = assertThrows(BusinessException.class,
                () -> fixture.getRelocateService().relocate(fixture.collectionId(), "a", "/a/"));

        assertEquals("400", error.getCode());
    }

    @Test
    void shouldAllowSwappingIntoFreedPrefix() {
        fixture.getRelocateService().relocate(fixture.collectionId(), "c/", "d/");

        RelocateOutcome outcome = fixture.getRelocateService().relocate(fixture.collectionId(), "a/", "c/");

        assertEquals(2, outcome.getRelocatedSources());
        assertTrue(fixture.source("c/b/y.mp3").isPresent());
        assertTrue(fixture.source("d/z.mp3").isPresent());
    }

    @Test
    void shouldFailForUnknownCollection() {
        BusinessException error = assertThrows(BusinessException.class,
                () -> fixture.getRelocateService().relocate("nope", "a/", "b/"));

        assertEquals("404", error.getCode());
    }
}
