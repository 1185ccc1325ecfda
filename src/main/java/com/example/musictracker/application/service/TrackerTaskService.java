package com.example.musictracker.application.service;

import com.example.musictracker.api.request.StartTrackerTaskRequest;
import com.example.musictracker.api.response.CreateTrackerTaskResponse;
import com.example.musictracker.api.response.TrackerTaskDetailResponse;
import com.example.musictracker.application.progress.ImportProgress;
import com.example.musictracker.application.progress.LoggingProgressListener;
import com.example.musictracker.application.progress.ProgressEvent;
import com.example.musictracker.application.progress.ProgressListener;
import com.example.musictracker.application.progress.ScanProgress;
import com.example.musictracker.common.config.AppTrackerProperties;
import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.domain.enumtype.Completion;
import com.example.musictracker.domain.enumtype.TaskStatus;
import com.example.musictracker.domain.model.ImportOutcome;
import com.example.musictracker.domain.model.ImportTrackConfig;
import com.example.musictracker.domain.model.PurgeOutcome;
import com.example.musictracker.domain.model.ScanOutcome;
import com.example.musictracker.domain.model.UntrackOutcome;
import com.example.musictracker.domain.model.UntrackedFilesOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Runs scans, imports, untracking, purges and untracked file searches as background tasks.
 */
@Service
public class TrackerTaskService {

    private static final Logger log = LoggerFactory.getLogger(TrackerTaskService.class);

    private static final int MAX_FINISHED_TASKS = 200;

    private final MediaCollectionService mediaCollectionService;
    private final DirectoryScanService directoryScanService;
    private final PendingImportService pendingImportService;
    private final UntrackService untrackService;
    private final PurgeService purgeService;
    private final UntrackedFilesService untrackedFilesService;
    private final AppTrackerProperties appTrackerProperties;
    private final ExecutorService trackerTaskExecutor;
    private final MeterRegistry meterRegistry;

    private final AtomicLong taskIdSequence = new AtomicLong(0);
    private final ConcurrentMap<Long, TrackerTask> tasks = new ConcurrentHashMap<>();

    public TrackerTaskService(MediaCollectionService mediaCollectionService,
                              DirectoryScanService directoryScanService,
                              PendingImportService pendingImportService,
                              UntrackService untrackService,
                              PurgeService purgeService,
                              UntrackedFilesService untrackedFilesService,
                              AppTrackerProperties appTrackerProperties,
                              ExecutorService trackerTaskExecutor,
                              ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.mediaCollectionService = mediaCollectionService;
        this.directoryScanService = directoryScanService;
        this.pendingImportService = pendingImportService;
        this.untrackService = untrackService;
        this.purgeService = purgeService;
        this.untrackedFilesService = untrackedFilesService;
        this.appTrackerProperties = appTrackerProperties;
        this.trackerTaskExecutor = trackerTaskExecutor;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public CreateTrackerTaskResponse createTask(StartTrackerTaskRequest request) {
        if (request == null || request.getTaskType() == null) {
            throw new BusinessException("400", "Task type is missing");
        }
        TrackerContext context = StringUtils.hasText(request.getRootUrl())
                ? mediaCollectionService.resolveContext(request.getCollectionUid(), request.getRootUrl())
                : mediaCollectionService.resolveContextByPath(request.getCollectionUid(), request.getRootPath());
        String collectionUid = context.getCollection().getUid();

        TrackerTask task;
        synchronized (tasks) {
            for (TrackerTask existing : tasks.values()) {
                if (existing.getCollectionUid().equals(collectionUid) && existing.getStatus().isActive()) {
                    throw new BusinessException("409", "Collection " + collectionUid + " already has an active task "
                            + existing.getId(), "Wait for task " + existing.getId() + " to finish or cancel it");
                }
            }
            task = new TrackerTask(taskIdSequence.incrementAndGet(), request.getTaskType(), collectionUid,
                    context.getRootPath());
            tasks.put(task.getId(), task);
        }
        log.info("TRACKER_TASK_CREATED taskId={} type={} collection={} root='{}'",
                task.getId(), task.getType(), collectionUid, task.getRootPath());

        final TrackerTask submitted = task;
        try {
            trackerTaskExecutor.submit(() -> executeTask(submitted, context, request));
        } catch (RejectedExecutionException e) {
            task.markFinished(TaskStatus.FAILED, null, "Task scheduling failed: " + e.getMessage());
            recordResult(task);
            throw new BusinessException("TASK_EXECUTOR_REJECTED", "Task scheduling failed, try again later");
        }
        evictFinishedTasks();
        return new CreateTrackerTaskResponse(task.getId(), TaskStatus.PENDING.name());
    }

    public TrackerTaskDetailResponse getTask(Long taskId) {
        TrackerTask task = taskId == null ? null : tasks.get(taskId);
        if (task == null) {
            return null;
        }
        return toDetailResponse(task);
    }

    public List<TrackerTaskDetailResponse> listTasks() {
        return tasks.values().stream()
                .sorted(Comparator.comparingLong(TrackerTask::getId).reversed())
                .map(this::toDetailResponse)
                .collect(Collectors.toList());
    }

    public boolean cancelTask(Long taskId) {
        TrackerTask task = taskId == null ? null : tasks.get(taskId);
        if (task == null) {
            return false;
        }
        TaskStatus before = task.getStatus();
        if (task.requestCancel()) {
            log.info("TRACKER_TASK_CANCELED taskId={} fromStatus={}", taskId, before);
            if (task.getStatus() == TaskStatus.CANCELED) {
                recordResult(task);
            }
        } else {
            log.info("TRACKER_TASK_CANCEL_IGNORED taskId={} currentStatus={}", taskId, before);
        }
        return true;
    }

    void executeTask(TrackerTask task, TrackerContext context, StartTrackerTaskRequest request) {
        if (!task.markRunning()) {
            log.info("TRACKER_TASK_START_SKIPPED taskId={} currentStatus={}", task.getId(), task.getStatus());
            return;
        }
        log.info("TRACKER_TASK_RUNNING taskId={} type={} collection={}", task.getId(), task.getType(),
                task.getCollectionUid());
        BooleanSupplier cancelSignal = task::isCancelRequested;
        try {
            switch (task.getType()) {
                case SCAN:
                    finishScan(task, runScan(task, context, request, cancelSignal));
                    break;
                case IMPORT:
                    finishImport(task, runImport(task, context, request, cancelSignal));
                    break;
                case SCAN_AND_IMPORT:
                    runScanAndImport(task, context, request, cancelSignal);
                    break;
                case UNTRACK:
                    UntrackOutcome untrackOutcome = untrackService.untrack(context, request.getStatusFilter());
                    task.markFinished(TaskStatus.SUCCESS, untrackOutcome, null);
                    break;
                case PURGE_ORPHANED:
                    finishPurge(task, purgeService.purgeOrphaned(context, cancelSignal));
                    break;
                case FIND_UNTRACKED_FILES:
                    finishFindUntracked(task, untrackedFilesService.findUntrackedFiles(context, request.getMaxDepth(),
                            progressListener(task, "find-untracked"), cancelSignal));
                    break;
                case PURGE_UNTRACKED:
                default:
                    finishPurge(task, purgeService.purgeUntracked(context, cancelSignal));
                    break;
            }
        } catch (BusinessException e) {
            log.warn("TRACKER_TASK_FAILED taskId={} type={} code={} msg={}", task.getId(), task.getType(),
                    e.getCode(), e.getMessage());
            task.markFinished(TaskStatus.FAILED, null, e.getCode() + ": " + truncate(e.getMessage(), 1000));
        } catch (Exception e) {
            log.error("Tracker task failed, taskId={}", task.getId(), e);
            task.markFinished(TaskStatus.FAILED, null, truncate(e.getMessage(), 1000));
        }
        recordResult(task);
        log.info("TRACKER_TASK_RESULT taskId={} type={} status={} outcome={}", task.getId(), task.getType(),
                task.getStatus(), task.getOutcome());
    }

    private ScanOutcome runScan(TrackerTask task,
                                TrackerContext context,
                                StartTrackerTaskRequest request,
                                BooleanSupplier cancelSignal) {
        ProgressListener<ScanProgress> listener = progressListener(task, "scan");
        return directoryScanService.scan(context, request.getMaxDepth(), listener, cancelSignal);
    }

    private ImportOutcome runImport(TrackerTask task,
                                    TrackerContext context,
                                    StartTrackerTaskRequest request,
                                    BooleanSupplier cancelSignal) {
        ImportTrackConfig config = ImportTrackConfig.defaults();
        if (request.getFallbackTitleFromFileName() != null) {
            config.setFallbackTitleFromFileName(request.getFallbackTitleFromFileName());
        }
        if (request.getIncludeArtwork() != null) {
            config.setIncludeArtwork(request.getIncludeArtwork());
        }
        ProgressListener<ImportProgress> listener = progressListener(task, "import");
        return pendingImportService.importPending(context, request.getSyncMode(), request.getReplaceMode(), config,
                listener, cancelSignal);
    }

    private void runScanAndImport(TrackerTask task,
                                  TrackerContext context,
                                  StartTrackerTaskRequest request,
                                  BooleanSupplier cancelSignal) {
        Map<String, Object> outcome = new LinkedHashMap<>();
        ScanOutcome scanOutcome = runScan(task, context, request, cancelSignal);
        outcome.put("scan", scanOutcome);
        if (scanOutcome.getCompletion() == Completion.ABORTED) {
            task.markFinished(TaskStatus.CANCELED, outcome, null);
            return;
        }
        ImportOutcome importOutcome = runImport(task, context, request, cancelSignal);
        outcome.put("import", importOutcome);
        TaskStatus status = importStatus(importOutcome);
        if (status == TaskStatus.SUCCESS && scanOutcome.getSkippedDirectories() > 0) {
            status = TaskStatus.PARTIAL_SUCCESS;
        }
        task.markFinished(status, outcome, null);
    }

    private void finishScan(TrackerTask task, ScanOutcome outcome) {
        TaskStatus status;
        if (outcome.getCompletion() == Completion.ABORTED) {
            status = TaskStatus.CANCELED;
        } else {
            status = outcome.getSkippedDirectories() > 0 ? TaskStatus.PARTIAL_SUCCESS : TaskStatus.SUCCESS;
        }
        task.markFinished(status, outcome, null);
    }

    private void finishImport(TrackerTask task, ImportOutcome outcome) {
        task.markFinished(importStatus(outcome), outcome, null);
    }

    private TaskStatus importStatus(ImportOutcome outcome) {
        if (outcome.getCompletion() == Completion.ABORTED) {
            return TaskStatus.CANCELED;
        }
        boolean partial = !outcome.getTracks().getFailed().isEmpty() || outcome.getDirectories().getSkipped() > 0;
        return partial ? TaskStatus.PARTIAL_SUCCESS : TaskStatus.SUCCESS;
    }

    private void finishPurge(TrackerTask task, PurgeOutcome outcome) {
        TaskStatus status = outcome.getCompletion() == Completion.ABORTED ? TaskStatus.CANCELED : TaskStatus.SUCCESS;
        task.markFinished(status, outcome, null);
    }

    private void finishFindUntracked(TrackerTask task, UntrackedFilesOutcome outcome) {
        TaskStatus status;
        if (outcome.getCompletion() == Completion.ABORTED) {
            status = TaskStatus.CANCELED;
        } else {
            status = outcome.getSkippedDirectories() > 0 ? TaskStatus.PARTIAL_SUCCESS : TaskStatus.SUCCESS;
        }
        task.markFinished(status, outcome, null);
    }

    private <E extends ProgressEvent> ProgressListener<E> progressListener(TrackerTask task, String operation) {
        ProgressListener<E> latest = task::updateProgress;
        return latest.andThen(new LoggingProgressListener<E>(
                operation + "#" + task.getId(),
                appTrackerProperties.getProgressLogIntervalSec(),
                appTrackerProperties.getProgressLogIntervalEvents()));
    }

    /**
     * Drops the oldest finished tasks once more than {@link #MAX_FINISHED_TASKS} are kept.
     */
    private void evictFinishedTasks() {
        List<TrackerTask> finished = new ArrayList<>();
        for (TrackerTask task : tasks.values()) {
            if (!task.getStatus().isActive()) {
                finished.add(task);
            }
        }
        if (finished.size() <= MAX_FINISHED_TASKS) {
            return;
        }
        finished.sort(Comparator.comparingLong(TrackerTask::getId));
        for (int i = 0; i < finished.size() - MAX_FINISHED_TASKS; i++) {
            tasks.remove(finished.get(i).getId());
        }
    }

    private void recordResult(TrackerTask task) {
        recordCounter("music.tracker.task.result", "type", task.getType().name(), "status", task.getStatus().name());
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Tracker metric counter failed, name={}", name, ex);
        }
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private TrackerTaskDetailResponse toDetailResponse(TrackerTask task) {
        return new TrackerTaskDetailResponse(
                task.getId(),
                task.getType().name(),
                task.getStatus().name(),
                task.getCollectionUid(),
                task.getRootPath(),
                task.getCreatedAt(),
                task.getStartedAt(),
                task.getFinishedAt(),
                task.isCancelRequested(),
                task.getLastProgress(),
                task.getOutcome(),
                task.getErrorMessage());
    }
}
