package com.example.musictracker.domain.model;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class MediaCollection {

    private Long id;

    private String uid;

    private String title;

    /**
     * {@code file:} URL of the directory all content paths are relative to.
     */
    private String rootUrl;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
