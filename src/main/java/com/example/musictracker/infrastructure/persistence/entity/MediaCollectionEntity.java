package com.example.musictracker.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class MediaCollectionEntity {

    private Long id;

    private String uid;

    private String title;

    private String rootUrl;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
