package com.example.musictracker.application.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musictracker.api.request.StartTrackerTaskRequest;
import com.example.musictracker.api.response.CreateTrackerTaskResponse;
import com.example.musictracker.application.job.ScheduledRescanJob.Submission;
import com.example.musictracker.application.service.MediaCollectionService;
import com.example.musictracker.application.service.TrackerTaskService;
import com.example.musictracker.common.config.AppTrackerProperties;
import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.domain.enumtype.SyncMode;
import com.example.musictracker.domain.enumtype.TrackerTaskType;
import com.example.musictracker.domain.model.MediaCollection;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatcher;

class ScheduledRescanJobTest {

    private AppTrackerProperties properties;
    private MediaCollectionService collectionService;
    private TrackerTaskService taskService;
    private ScheduledRescanJob job;

    @BeforeEach
    void setUp() {
        properties = new AppTrackerProperties();
        properties.setRescanEnabled(true);
        collectionService = mock(MediaCollectionService.class);
        taskService = mock(TrackerTaskService.class);
        job = new ScheduledRescanJob(properties, collectionService, taskService);
    }

    @Test
    void shouldSubmitOneTaskPerIdleCollection() {
        when(collectionService.listCollections()).thenReturn(
                Arrays.asList(collection("vinyl"), collection("cassette"), collection("tape")));
        when(taskService.createTask(argThat(forCollection("vinyl"))))
                .thenReturn(new CreateTrackerTaskResponse(1L, "PENDING"));
        when(taskService.createTask(argThat(forCollection("cassette"))))
                .thenThrow(new BusinessException("409", "Collection cassette already has an active task 3"));
        when(taskService.createTask(argThat(forCollection("tape"))))
                .thenThrow(new BusinessException("IO_ERROR", "Root directory is not accessible"));

        Map<Submission, Integer> round = job.rescanAll();

        assertEquals(Integer.valueOf(1), round.get(Submission.SUBMITTED));
        assertEquals(Integer.valueOf(1), round.get(Submission.BUSY));
        assertEquals(Integer.valueOf(1), round.get(Submission.REJECTED));
    }

    @Test
    void shouldUseConfiguredTaskTypeAndSyncMode() {
        properties.setRescanTaskType(TrackerTaskType.SCAN);
        properties.setDefaultSyncMode(SyncMode.ALWAYS);
        when(collectionService.listCollections()).thenReturn(Collections.singletonList(collection("vinyl")));
        when(taskService.createTask(any(StartTrackerTaskRequest.class)))
                .thenReturn(new CreateTrackerTaskResponse(1L, "PENDING"));

        job.run();

        verify(taskService).createTask(argThat(request -> request.getTaskType() == TrackerTaskType.SCAN
                && request.getSyncMode() == SyncMode.ALWAYS && "vinyl".equals(request.getCollectionUid())));
    }

    @Test
    void shouldStayIdleWhenDisabledOrEmpty() {
        when(collectionService.listCollections()).thenReturn(Collections.<MediaCollection>emptyList());

        assertTrue(job.rescanAll().isEmpty());

        properties.setRescanEnabled(false);
        job.run();

        verify(collectionService).listCollections();
        verify(taskService, never()).createTask(any(StartTrackerTaskRequest.class));
    }

    private static ArgumentMatcher<StartTrackerTaskRequest> forCollection(String uid) {
        return request -> request != null && uid.equals(request.getCollectionUid());
    }

    private static MediaCollection collection(String uid) {
        MediaCollection collection = new MediaCollection();
        collection.setUid(uid);
        return collection;
    }
}
