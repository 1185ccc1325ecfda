package com.example.musictracker.api.controller;

import com.example.musictracker.api.request.CreateCollectionRequest;
import com.example.musictracker.api.request.RelinkRequest;
import com.example.musictracker.api.request.RelocateRequest;
import com.example.musictracker.api.request.StartTrackerTaskRequest;
import com.example.musictracker.api.response.ApiResponse;
import com.example.musictracker.api.response.CreateTrackerTaskResponse;
import com.example.musictracker.api.response.TrackerTaskDetailResponse;
import com.example.musictracker.application.service.MediaCollectionService;
import com.example.musictracker.application.service.RelocateService;
import com.example.musictracker.application.service.TrackRelinkService;
import com.example.musictracker.application.service.TrackerContext;
import com.example.musictracker.application.service.TrackerStatusService;
import com.example.musictracker.application.service.TrackerTaskService;
import com.example.musictracker.domain.model.DirectoriesStatus;
import com.example.musictracker.domain.model.MediaCollection;
import com.example.musictracker.domain.model.RelinkOutcome;
import com.example.musictracker.domain.model.RelocateOutcome;
import java.util.List;
import javax.validation.Valid;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tracker")
public class MediaTrackerController {

    private final MediaCollectionService mediaCollectionService;
    private final TrackerTaskService trackerTaskService;
    private final TrackerStatusService trackerStatusService;
    private final RelocateService relocateService;
    private final TrackRelinkService trackRelinkService;

    public MediaTrackerController(MediaCollectionService mediaCollectionService,
                                  TrackerTaskService trackerTaskService,
                                  TrackerStatusService trackerStatusService,
                                  RelocateService relocateService,
                                  TrackRelinkService trackRelinkService) {
        this.mediaCollectionService = mediaCollectionService;
        this.trackerTaskService = trackerTaskService;
        this.trackerStatusService = trackerStatusService;
        this.relocateService = relocateService;
        this.trackRelinkService = trackRelinkService;
    }

    @PostMapping("/collections")
    public ApiResponse<MediaCollection> createCollection(@Valid @RequestBody CreateCollectionRequest request) {
        return ApiResponse.success(mediaCollectionService.createCollection(
                request.getUid(), request.getTitle(), request.getRootUrl()));
    }

    @GetMapping("/collections")
    public ApiResponse<List<MediaCollection>> listCollections() {
        return ApiResponse.success(mediaCollectionService.listCollections());
    }

    @PostMapping("/tasks")
    public ApiResponse<CreateTrackerTaskResponse> createTask(@Valid @RequestBody StartTrackerTaskRequest request) {
        return ApiResponse.success(trackerTaskService.createTask(request));
    }

    @GetMapping("/tasks")
    public ApiResponse<List<TrackerTaskDetailResponse>> listTasks() {
        return ApiResponse.success(trackerTaskService.listTasks());
    }

    @GetMapping("/tasks/{id}")
    public ApiResponse<TrackerTaskDetailResponse> getTask(@PathVariable("id") Long id) {
        TrackerTaskDetailResponse response = trackerTaskService.getTask(id);
        if (response == null) {
            return ApiResponse.notFound("Task");
        }
        return ApiResponse.success(response);
    }

    @PostMapping("/tasks/{id}/cancel")
    public ApiResponse<String> cancelTask(@PathVariable("id") Long id) {
        boolean canceled = trackerTaskService.cancelTask(id);
        if (!canceled) {
            return ApiResponse.notFound("Task");
        }
        return ApiResponse.success("CANCEL_REQUESTED");
    }

    @GetMapping("/status")
    public ApiResponse<DirectoriesStatus> status(@RequestParam("collectionUid") String collectionUid,
                                                 @RequestParam(value = "rootUrl", required = false) String rootUrl,
                                                 @RequestParam(value = "rootPath", required = false) String rootPath) {
        TrackerContext context = StringUtils.hasText(rootUrl)
                ? mediaCollectionService.resolveContext(collectionUid, rootUrl)
                : mediaCollectionService.resolveContextByPath(collectionUid, rootPath);
        return ApiResponse.success(trackerStatusService.directoriesStatus(context));
    }

    @PostMapping("/relocate")
    public ApiResponse<RelocateOutcome> relocate(@Valid @RequestBody RelocateRequest request) {
        return ApiResponse.success(relocateService.relocate(
                request.getCollectionUid(), request.getOldPrefix(), request.getNewPrefix()));
    }

    @PostMapping("/relink")
    public ApiResponse<RelinkOutcome> relink(@Valid @RequestBody RelinkRequest request) {
        return ApiResponse.success(trackRelinkService.relinkMovedTrack(
                request.getCollectionUid(), request.getOldContentPath(), request.getNewContentPath()));
    }
}
