package com.example.musictracker.application.service;

import com.example.musictracker.application.progress.ProgressEvent;
import com.example.musictracker.domain.enumtype.TaskStatus;
import com.example.musictracker.domain.enumtype.TrackerTaskType;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory state of one background tracker operation.
 */
public class TrackerTask {

    private final long id;
    private final TrackerTaskType type;
    private final String collectionUid;
    private final String rootPath;
    private final LocalDateTime createdAt;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private TaskStatus status = TaskStatus.PENDING;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private volatile ProgressEvent lastProgress;
    private Object outcome;
    private String errorMessage;

    public TrackerTask(long id, TrackerTaskType type, String collectionUid, String rootPath) {
        this.id = id;
        this.type = type;
        this.collectionUid = collectionUid;
        this.rootPath = rootPath;
        this.createdAt = LocalDateTime.now();
    }

    public long getId() {
        return id;
    }

    public TrackerTaskType getType() {
        return type;
    }

    public String getCollectionUid() {
        return collectionUid;
    }

    public String getRootPath() {
        return rootPath;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public synchronized TaskStatus getStatus() {
        return status;
    }

    public synchronized LocalDateTime getStartedAt() {
        return startedAt;
    }

    public synchronized LocalDateTime getFinishedAt() {
        return finishedAt;
    }

    public ProgressEvent getLastProgress() {
        return lastProgress;
    }

    public synchronized Object getOutcome() {
        return outcome;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    void updateProgress(ProgressEvent event) {
        this.lastProgress = event;
    }

    /**
     * @return {@code false} if the task was canceled before it started
     */
    synchronized boolean markRunning() {
        if (status != TaskStatus.PENDING) {
            return false;
        }
        status = TaskStatus.RUNNING;
        startedAt = LocalDateTime.now();
        return true;
    }

    synchronized void markFinished(TaskStatus finalStatus, Object result, String error) {
        if (!status.isActive()) {
            return;
        }
        status = finalStatus;
        outcome = result;
        errorMessage = error;
        finishedAt = LocalDateTime.now();
    }

    /**
     * Requests cancellation. A pending task is canceled at once, a running one when the operation next
     * polls its cancel signal.
     *
     * @return {@code false} if the task already finished
     */
    synchronized boolean requestCancel() {
        if (!status.isActive()) {
            return false;
        }
        cancelRequested.set(true);
        if (status == TaskStatus.PENDING) {
            status = TaskStatus.CANCELED;
            finishedAt = LocalDateTime.now();
        }
        return true;
    }
}
