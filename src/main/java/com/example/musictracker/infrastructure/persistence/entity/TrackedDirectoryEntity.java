package com.example.musictracker.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class TrackedDirectoryEntity {

    private Long id;

    private Long collectionId;

    private String path;

    private String pathMd5;

    private byte[] digest;

    private Integer status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
