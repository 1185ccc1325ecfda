package com.example.musictracker.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class MediaSourceEntity {

    private Long id;

    private Long collectionId;

    private String contentPath;

    private String contentPathMd5;

    private String dirPath;

    private Integer tracked;

    private byte[] contentDigest;

    private String contentType;

    private Long sourceSize;

    private LocalDateTime sourceLastModified;

    private Integer durationMs;

    private Integer bitrate;

    private Integer sampleRate;

    private Integer channels;

    private Integer hasArtwork;

    private String artworkMimeType;

    private Long synchronizedRevision;

    private LocalDateTime collectedAt;

    private LocalDateTime synchronizedAt;
}
