package com.example.musictracker.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import com.example.musictracker.application.progress.ProgressListener;
import com.example.musictracker.application.progress.ScanProgress;
import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.domain.enumtype.Completion;
import com.example.musictracker.domain.enumtype.SyncMode;
import com.example.musictracker.domain.model.UntrackedFilesOutcome;
import com.example.musictracker.infrastructure.fs.DirectoryLister;
import com.example.musictracker.support.TrackerFixture;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UntrackedFilesServiceTest {

    @TempDir
    Path root;

    private TrackerFixture fixture;
    private UntrackedFilesService service;

    @BeforeEach
    void setUp() {
        fixture = new TrackerFixture(root);
        service = fixture.getUntrackedFilesService();
        fixture.write("a/x.mp3", "x");
        fixture.scan();
        fixture.importPending(SyncMode.MODIFIED);
        fixture.write("a/notes.txt", "liner notes");
        fixture.write("a/b/y.flac", "y");
        fixture.write("c/z.mp3", "z");
    }

    @Test
    void shouldListAudioFilesWithoutSource() {
        List<ScanProgress> events = new ArrayList<>();

        UntrackedFilesOutcome outcome = service.findUntrackedFiles(fixture.context(), null, events::add, () -> false);

        assertEquals(Completion.FINISHED, outcome.getCompletion());
        assertEquals("", outcome.getRoot());
        assertEquals(new HashSet<>(Arrays.asList("a/b/y.flac", "c/z.mp3")), new HashSet<>(outcome.getContentPaths()));
        assertEquals(0, outcome.getSkippedDirectories());
        assertEquals(4, events.size());
        assertEquals(4, events.get(events.size() - 1).getDirectoriesFinished());
    }

    @Test
    void shouldNotRecordDirectoriesWhileListing() {
        service.findUntrackedFiles(fixture.context(), null, ProgressListener.noop(), () -> false);

        assertTrue(!fixture.directory("c/").isPresent());
        assertTrue(!fixture.directory("a/b/").isPresent());
    }

    @Test
    void shouldReturnNothingOnceEverythingIsImported() {
        fixture.scan();
        fixture.importPending(SyncMode.MODIFIED);

        UntrackedFilesOutcome outcome = service.findUntrackedFiles(fixture.context(), null, ProgressListener.noop(),
                () -> false);

        assertTrue(outcome.getContentPaths().isEmpty());
    }

    @Test
    void shouldStopDescendingAtMaxDepth() {
        UntrackedFilesOutcome outcome = service.findUntrackedFiles(fixture.context(), 1, ProgressListener.noop(),
                () -> false);

        assertEquals(Arrays.asList("c/z.mp3"), outcome.getContentPaths());
    }

    @Test
    void shouldScopeListingToRootPath() {
        UntrackedFilesOutcome outcome = service.findUntrackedFiles(fixture.context("a/"), null,
                ProgressListener.noop(), () -> false);

        assertEquals("a/", outcome.getRoot());
        assertEquals(Arrays.asList("a/b/y.flac"), outcome.getContentPaths());
    }

    @Test
    void shouldAbortWhenCanceled() {
        UntrackedFilesOutcome outcome = service.findUntrackedFiles(fixture.context(), null, ProgressListener.noop(),
                () -> true);

        assertEquals(Completion.ABORTED, outcome.getCompletion());
        assertTrue(outcome.getContentPaths().isEmpty());
    }

    @Test
    void shouldCountUnreadableSubdirectoryAsSkipped() throws IOException {
        DirectoryLister lister = spy(new DirectoryLister(fixture.getProperties()));
        doThrow(new IOException("Permission denied")).when(lister).list(argThat(path -> path.endsWith("b")));
        UntrackedFilesService unreadable = new UntrackedFilesService(
                fixture.getRepository(), lister, fixture.getProperties());

        UntrackedFilesOutcome outcome = unreadable.findUntrackedFiles(fixture.context(), null,
                ProgressListener.noop(), () -> false);

        assertEquals(Completion.FINISHED, outcome.getCompletion());
        assertEquals(1, outcome.getSkippedDirectories());
        assertEquals(Arrays.asList("c/z.mp3"), outcome.getContentPaths());
    }

    @Test
    void shouldRejectNegativeDepthAndMissingRoot() {
        assertEquals("400", assertThrows(BusinessException.class, () -> service.findUntrackedFiles(
                fixture.context(), -1, ProgressListener.noop(), () -> false)).getCode());
        assertEquals("IO_ERROR", assertThrows(BusinessException.class, () -> service.findUntrackedFiles(
                fixture.context("missing/"), null, ProgressListener.noop(), () -> false)).getCode());
    }
}
