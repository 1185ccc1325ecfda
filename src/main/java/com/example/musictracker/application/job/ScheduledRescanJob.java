package com.example.musictracker.application.job;

import com.example.musictracker.api.request.StartTrackerTaskRequest;
import com.example.musictracker.api.response.CreateTrackerTaskResponse;
import com.example.musictracker.application.service.MediaCollectionService;
import com.example.musictracker.application.service.TrackerTaskService;
import com.example.musictracker.common.config.AppTrackerProperties;
import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.domain.model.MediaCollection;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically submits one rescan task per collection. Collections that are busy with another task are left
 * alone until the next round.
 */
@Service
public class ScheduledRescanJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduledRescanJob.class);

    enum Submission {
        SUBMITTED,
        BUSY,
        REJECTED
    }

    private final AppTrackerProperties appTrackerProperties;
    private final MediaCollectionService mediaCollectionService;
    private final TrackerTaskService trackerTaskService;

    public ScheduledRescanJob(AppTrackerProperties appTrackerProperties,
                              MediaCollectionService mediaCollectionService,
                              TrackerTaskService trackerTaskService) {
        this.appTrackerProperties = appTrackerProperties;
        this.mediaCollectionService = mediaCollectionService;
        this.trackerTaskService = trackerTaskService;
    }

    @Scheduled(cron = "${app.tracker.rescan-cron:0 0 3 * * ?}")
    public void run() {
        if (appTrackerProperties.isRescanEnabled()) {
            rescanAll();
        }
    }

    /**
     * @return number of collections per submission result of this round
     */
    Map<Submission, Integer> rescanAll() {
        Map<Submission, Integer> round = new EnumMap<>(Submission.class);
        for (MediaCollection collection : mediaCollectionService.listCollections()) {
            round.merge(submit(collection), 1, Integer::sum);
        }
        if (round.isEmpty()) {
            log.debug("RESCAN_ROUND_EMPTY no collection registered");
        } else {
            log.info("RESCAN_ROUND type={} syncMode={} submitted={} busy={} rejected={}",
                    appTrackerProperties.getRescanTaskType(), appTrackerProperties.getDefaultSyncMode(),
                    round.getOrDefault(Submission.SUBMITTED, 0), round.getOrDefault(Submission.BUSY, 0),
                    round.getOrDefault(Submission.REJECTED, 0));
        }
        return round;
    }

    private Submission submit(MediaCollection collection) {
        StartTrackerTaskRequest request = new StartTrackerTaskRequest();
        request.setTaskType(appTrackerProperties.getRescanTaskType());
        request.setCollectionUid(collection.getUid());
        request.setSyncMode(appTrackerProperties.getDefaultSyncMode());
        try {
            CreateTrackerTaskResponse created = trackerTaskService.createTask(request);
            log.debug("RESCAN_SUBMITTED collection={} taskId={}", collection.getUid(), created.getTaskId());
            return Submission.SUBMITTED;
        } catch (BusinessException e) {
            if ("409".equals(e.getCode())) {
                log.debug("RESCAN_BUSY collection={} reason={}", collection.getUid(), e.getMessage());
                return Submission.BUSY;
            }
            log.warn("RESCAN_REJECTED collection={} code={} reason={}", collection.getUid(), e.getCode(),
                    e.getMessage());
            return Submission.REJECTED;
        } catch (RuntimeException e) {
            log.warn("RESCAN_REJECTED collection={}", collection.getUid(), e);
            return Submission.REJECTED;
        }
    }
}
