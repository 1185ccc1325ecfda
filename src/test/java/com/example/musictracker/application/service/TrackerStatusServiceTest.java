package com.example.musictracker.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.musictracker.domain.enumtype.SyncMode;
import com.example.musictracker.domain.model.DirectoriesStatus;
import com.example.musictracker.support.TrackerFixture;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TrackerStatusServiceTest {

    @TempDir
    Path root;

    private TrackerFixture fixture;
    private TrackerStatusService statusService;

    @BeforeEach
    void setUp() {
        fixture = new TrackerFixture(root);
        statusService = new TrackerStatusService(fixture.getRepository());
        fixture.write("a/x.mp3", "x");
        fixture.write("b/y.mp3", "y");
    }

    @Test
    void shouldCountDirectoriesPerStatus() {
        fixture.scan();

        DirectoriesStatus pending = statusService.directoriesStatus(fixture.context());
        assertEquals(3, pending.getAdded());
        assertEquals(3, pending.getPending());

        fixture.importPending(SyncMode.MODIFIED);
        fixture.deleteTree("b");
        fixture.scan();

        DirectoriesStatus status = statusService.directoriesStatus(fixture.context());
        assertEquals(1, status.getCurrent());
        assertEquals(1, status.getModified());
        assertEquals(1, status.getOrphaned());
        assertEquals(3, status.getTotal());
    }

    @Test
    void shouldScopeCountsToPathPrefix() {
        fixture.scan();

        DirectoriesStatus scoped = statusService.directoriesStatus(fixture.context("a/"));

        assertEquals(1, scoped.getTotal());
        assertEquals(1, scoped.getAdded());
    }
}
