package com.example.musictracker.api.request;

import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import com.example.musictracker.domain.enumtype.ReplaceMode;
import com.example.musictracker.domain.enumtype.SyncMode;
import com.example.musictracker.domain.enumtype.TrackerTaskType;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StartTrackerTaskRequest {

    @NotNull
    private TrackerTaskType taskType;

    @NotBlank
    private String collectionUid;

    /**
     * Absolute location of the root directory; takes precedence over {@link #rootPath}.
     */
    private String rootUrl;

    /**
     * Collection-relative root directory, the whole collection if neither root is given.
     */
    private String rootPath;

    @Min(0)
    private Integer maxDepth;

    private SyncMode syncMode;

    private ReplaceMode replaceMode;

    /**
     * Only for UNTRACK.
     */
    private DirTrackingStatus statusFilter;

    private Boolean fallbackTitleFromFileName;

    private Boolean includeArtwork;
}
