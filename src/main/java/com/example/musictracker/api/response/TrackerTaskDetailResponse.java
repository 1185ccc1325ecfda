package com.example.musictracker.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackerTaskDetailResponse {

    private Long id;

    private String taskType;

    private String status;

    private String collectionUid;

    private String rootPath;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    private boolean cancelRequested;

    /**
     * Latest progress event, {@code null} before the first unit of work finished.
     */
    private Object progress;

    /**
     * Outcome of the operation once it finished.
     */
    private Object outcome;

    private String errorSummary;
}
