package com.example.musictracker.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.domain.enumtype.Completion;
import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.enumtype.SyncMode;
import com.example.musictracker.domain.model.ImportOutcome;
import com.example.musictracker.domain.model.MediaSource;
import com.example.musictracker.domain.model.PurgeOutcome;
import com.example.musictracker.support.TrackerFixture;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PurgeServiceTest {

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
    void shouldPurgeSourcesTracksAndRecordsOfOrphanedDirectories() {
        fixture.deleteTree("a");
        fixture.scan();

        PurgeOutcome outcome = fixture.getPurgeService().purgeOrphaned(fixture.context(), () -> false);

        assertEquals(Completion.FINISHED, outcome.getCompletion());
        assertEquals(2, outcome.getPurgedCount());
        assertEquals(2, outcome.getPurgedTracks());
        assertEquals(2, outcome.getPurgedDirectories());
        assertFalse(fixture.source("a/x.mp3").isPresent());
        assertFalse(fixture.source("a/b/y.mp3").isPresent());
        assertEquals(1, fixture.getRepository().allTracks().size());
        assertTrue(fixture.trackOf("c/z.mp3").isPresent());
        assertNull(fixture.statusOf("a/"));
        assertEquals(DirTrackingStatus.CURRENT, fixture.statusOf("c/"));
    }

    @Test
    void shouldPurgeFileDeletedFromTrackedDirectory() {
        fixture.deleteTree("a/x.mp3");
        fixture.scan();
        assertEquals(DirTrackingStatus.MODIFIED, fixture.statusOf("a/"));

        ImportOutcome imported = fixture.importPending(SyncMode.MODIFIED);
        assertEquals(1, imported.getDirectories().getSourcesUntracked());
        assertEquals(DirTrackingStatus.CURRENT, fixture.statusOf("a/"));
        assertEquals(0, fixture.getPurgeService().purgeOrphaned(fixture.context(), () -> false).getPurgedCount());

        PurgeOutcome outcome = fixture.getPurgeService().purgeUntracked(fixture.context(), () -> false);

        assertEquals(1, outcome.getPurgedCount());
        assertEquals(1, outcome.getPurgedTracks());
        assertFalse(fixture.source("a/x.mp3").isPresent());
        assertTrue(fixture.trackOf("a/b/y.mp3").isPresent());
        assertTrue(fixture.trackOf("c/z.mp3").isPresent());
        assertEquals(DirTrackingStatus.CURRENT, fixture.statusOf("a/"));
    }

    @Test
    void shouldRetrackRestoredFileBeforePurge() {
        String uid = fixture.trackOf("a/x.mp3").get().getUid();
        fixture.deleteTree("a/x.mp3");
        fixture.scan();
        fixture.importPending(SyncMode.MODIFIED);

        fixture.write("a/x.mp3", "x");
        fixture.scan();
        ImportOutcome reimported = fixture.importPending(SyncMode.MODIFIED);
        PurgeOutcome outcome = fixture.getPurgeService().purgeUntracked(fixture.context(), () -> false);

        assertEquals(0, reimported.getDirectories().getSourcesUntracked());
        assertEquals(0, outcome.getPurgedCount());
        assertTrue(fixture.source("a/x.mp3").get().getTracked());
        assertEquals(uid, fixture.trackOf("a/x.mp3").get().getUid());
    }

    @Test
    void shouldKeepOrphanedRecordsWhenPurgeIsAborted() {
        fixture.deleteTree("a");
        fixture.scan();

        PurgeOutcome outcome = fixture.getPurgeService().purgeOrphaned(fixture.context(), () -> true);

        assertEquals(Completion.ABORTED, outcome.getCompletion());
        assertEquals(0, outcome.getPurgedCount());
        assertEquals(0, outcome.getPurgedDirectories());
        assertEquals(DirTrackingStatus.ORPHANED, fixture.statusOf("a/"));
        assertTrue(fixture.source("a/x.mp3").isPresent());

        PurgeOutcome resumed = fixture.getPurgeService().purgeOrphaned(fixture.context(), () -> false);
        assertEquals(2, resumed.getPurgedCount());
        assertEquals(2, resumed.getPurgedDirectories());
    }

    @Test
    void shouldPurgeExactlyTheUntrackedSourcesBelowRoot() {
        fixture.getRepository().seedImported(fixture.collectionId(), "elsewhere/q.mp3", new byte[] {7}, 1L, 1L);
        fixture.getUntrackService().untrack(fixture.context("a/"), null);

        PurgeOutcome outcome = fixture.getPurgeService().purgeUntracked(fixture.context("a/"), () -> false);

        assertEquals(2, outcome.getPurgedCount());
        assertEquals(2, outcome.getPurgedTracks());
        assertEquals(0, outcome.getPurgedDirectories());
        List<String> remaining = fixture.getRepository().allSources().stream()
                .map(MediaSource::getContentPath)
                .sorted()
                .collect(Collectors.toList());
        assertEquals(2, remaining.size());
        assertEquals("c/z.mp3", remaining.get(0));
        assertEquals("elsewhere/q.mp3", remaining.get(1));
    }

    @Test
    void shouldLeaveTrackedSourcesAloneWhenNothingIsUntracked() {
        PurgeOutcome outcome = fixture.getPurgeService().purgeUntracked(fixture.context(), () -> false);

        assertEquals(Completion.FINISHED, outcome.getCompletion());
        assertEquals(0, outcome.getPurgedCount());
        assertEquals(3, fixture.getRepository().allSources().size());
    }

    @Test
    void shouldRollBackBatchOnStorageFailure() {
        fixture.deleteTree("c");
        fixture.scan();
        fixture.getRepository().failTransaction(1);

        BusinessException error = assertThrows(BusinessException.class,
                () -> fixture.getPurgeService().purgeOrphaned(fixture.context(), () -> false));

        assertEquals("STORAGE_ERROR", error.getCode());
        assertTrue(fixture.source("c/z.mp3").isPresent());
        assertTrue(fixture.trackOf("c/z.mp3").isPresent());
    }
}
