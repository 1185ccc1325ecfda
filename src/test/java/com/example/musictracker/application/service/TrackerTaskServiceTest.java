package com.example.musictracker.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.musictracker.api.request.StartTrackerTaskRequest;
import com.example.musictracker.api.response.CreateTrackerTaskResponse;
import com.example.musictracker.api.response.TrackerTaskDetailResponse;
import com.example.musictracker.application.progress.ImportProgress;
import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.enumtype.SyncMode;
import com.example.musictracker.domain.enumtype.TrackerTaskType;
import com.example.musictracker.domain.model.ImportOutcome;
import com.example.musictracker.domain.model.ScanOutcome;
import com.example.musictracker.domain.model.UntrackOutcome;
import com.example.musictracker.domain.model.UntrackedFilesOutcome;
import com.example.musictracker.support.TrackerFixture;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class TrackerTaskServiceTest {

    @TempDir
    Path root;

    private TrackerFixture fixture;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private List<Runnable> submitted;
    private TrackerTaskService service;

    @BeforeEach
    void setUp() {
        fixture = new TrackerFixture(root);
        fixture.write("a/x.mp3", "x");
        fixture.write("a/y.mp3", "y");

        meterRegistry = new SimpleMeterRegistry();
        submitted = new ArrayList<>();
        executor = mock(ExecutorService.class);
        when(executor.submit(any(Runnable.class))).thenAnswer(invocation -> {
            submitted.add(invocation.getArgument(0));
            return null;
        });
        service = new TrackerTaskService(
                fixture.getCollectionService(),
                fixture.getScanService(),
                fixture.getImportService(),
                fixture.getUntrackService(),
                fixture.getPurgeService(),
                fixture.getUntrackedFilesService(),
                fixture.getProperties(),
                executor,
                beanProvider(meterRegistry));
    }

    @Test
    void shouldRunScanAndImportAndKeepOutcome() {
        CreateTrackerTaskResponse created = service.createTask(request(TrackerTaskType.SCAN_AND_IMPORT));
        assertEquals("PENDING", created.getStatus());

        runSubmitted();

        TrackerTaskDetailResponse detail = service.getTask(created.getTaskId());
        assertEquals("SUCCESS", detail.getStatus());
        assertNotNull(detail.getStartedAt());
        assertNotNull(detail.getFinishedAt());
        assertTrue(detail.getProgress() instanceof ImportProgress);
        Map<?, ?> outcome = (Map<?, ?>) detail.getOutcome();
        assertTrue(outcome.get("scan") instanceof ScanOutcome);
        ImportOutcome importOutcome = (ImportOutcome) outcome.get("import");
        assertEquals(2, importOutcome.getTracks().getCreated().size());
        assertEquals(DirTrackingStatus.CURRENT, fixture.statusOf("a/"));
        assertEquals(1.0, meterRegistry.counter("music.tracker.task.result",
                "type", "SCAN_AND_IMPORT", "status", "SUCCESS").count());
    }

    @Test
    void shouldReportPartialSuccessWhenFilesFail() {
        fixture.getImporter().failOn("a/y.mp3");
        CreateTrackerTaskResponse created = service.createTask(request(TrackerTaskType.SCAN_AND_IMPORT));

        runSubmitted();

        assertEquals("PARTIAL_SUCCESS", service.getTask(created.getTaskId()).getStatus());
        assertEquals(DirTrackingStatus.OUTDATED, fixture.statusOf("a/"));
    }

    @Test
    void shouldListFilesWithoutSourceAsTaskOutcome() {
        fixture.getRepository().seedImported(fixture.collectionId(), "a/x.mp3", new byte[] {1}, 1L, 1L);
        CreateTrackerTaskResponse created = service.createTask(request(TrackerTaskType.FIND_UNTRACKED_FILES));

        runSubmitted();

        TrackerTaskDetailResponse detail = service.getTask(created.getTaskId());
        assertEquals("SUCCESS", detail.getStatus());
        UntrackedFilesOutcome outcome = (UntrackedFilesOutcome) detail.getOutcome();
        assertEquals(1, outcome.getContentPaths().size());
        assertEquals("a/y.mp3", outcome.getContentPaths().get(0));
        assertNull(fixture.statusOf("a/"));
    }

    @Test
    void shouldRejectSecondTaskWhileCollectionIsBusy() {
        service.createTask(request(TrackerTaskType.SCAN));

        BusinessException error = assertThrows(BusinessException.class,
                () -> service.createTask(request(TrackerTaskType.IMPORT)));

        assertEquals("409", error.getCode());
        assertEquals(1, submitted.size());
    }

    @Test
    void shouldCancelPendingTaskBeforeItStarts() {
        CreateTrackerTaskResponse created = service.createTask(request(TrackerTaskType.SCAN));

        assertTrue(service.cancelTask(created.getTaskId()));
        runSubmitted();

        TrackerTaskDetailResponse detail = service.getTask(created.getTaskId());
        assertEquals("CANCELED", detail.getStatus());
        assertTrue(detail.isCancelRequested());
        assertNull(detail.getStartedAt());
        assertNull(fixture.statusOf("a/"));
        assertEquals(1.0, meterRegistry.counter("music.tracker.task.result",
                "type", "SCAN", "status", "CANCELED").count());

        service.createTask(request(TrackerTaskType.SCAN));
    }

    @Test
    void shouldRunUntrackWithStatusFilter() {
        fixture.scan();
        StartTrackerTaskRequest request = request(TrackerTaskType.UNTRACK);
        request.setStatusFilter(DirTrackingStatus.ADDED);
        CreateTrackerTaskResponse created = service.createTask(request);

        runSubmitted();

        TrackerTaskDetailResponse detail = service.getTask(created.getTaskId());
        assertEquals("SUCCESS", detail.getStatus());
        assertEquals(2, ((UntrackOutcome) detail.getOutcome()).getUntrackedCount());
    }

    @Test
    void shouldMarkTaskFailedWithErrorCode() {
        StartTrackerTaskRequest request = request(TrackerTaskType.SCAN);
        request.setRootPath("missing/");
        CreateTrackerTaskResponse created = service.createTask(request);

        runSubmitted();

        TrackerTaskDetailResponse detail = service.getTask(created.getTaskId());
        assertEquals("FAILED", detail.getStatus());
        assertTrue(detail.getErrorSummary().startsWith("IO_ERROR"));
    }

    @Test
    void shouldFailCreationWhenExecutorRejects() {
        when(executor.submit(any(Runnable.class))).thenThrow(new RejectedExecutionException("queue full"));

        BusinessException error = assertThrows(BusinessException.class,
                () -> service.createTask(request(TrackerTaskType.SCAN)));

        assertEquals("TASK_EXECUTOR_REJECTED", error.getCode());
        assertEquals("FAILED", service.listTasks().get(0).getStatus());
    }

    @Test
    void shouldValidateRequestAndCollection() {
        assertEquals("400", assertThrows(BusinessException.class,
                () -> service.createTask(new StartTrackerTaskRequest())).getCode());

        StartTrackerTaskRequest unknown = request(TrackerTaskType.SCAN);
        unknown.setCollectionUid("nope");
        assertEquals("404", assertThrows(BusinessException.class, () -> service.createTask(unknown)).getCode());
    }

    @Test
    void shouldReturnNothingForUnknownTask() {
        assertNull(service.getTask(42L));
        assertFalse(service.cancelTask(42L));
    }

    private StartTrackerTaskRequest request(TrackerTaskType type) {
        StartTrackerTaskRequest request = new StartTrackerTaskRequest();
        request.setTaskType(type);
        request.setCollectionUid(TrackerFixture.COLLECTION_UID);
        request.setSyncMode(SyncMode.MODIFIED);
        return request;
    }

    private void runSubmitted() {
        List<Runnable> pending = new ArrayList<>(submitted);
        submitted.clear();
        pending.forEach(Runnable::run);
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
