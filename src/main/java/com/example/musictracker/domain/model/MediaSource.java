package com.example.musictracker.domain.model;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * Catalog row of one physical file, unique per collection and content path.
 */
@Data
public class MediaSource {

    private Long id;

    private Long collectionId;

    private String contentPath;

    /**
     * {@code false} once the file is missing from the listing of its still tracked directory.
     */
    private Boolean tracked;

    private byte[] contentDigest;

    private String contentType;

    private Long sourceSize;

    private LocalDateTime sourceLastModified;

    private Integer durationMs;

    private Integer bitrate;

    private Integer sampleRate;

    private Integer channels;

    private Boolean hasArtwork;

    private String artworkMimeType;

    /**
     * Track revision written by the last import, {@code null} if never synchronized.
     */
    private Long synchronizedRevision;

    private LocalDateTime collectedAt;

    private LocalDateTime synchronizedAt;
}
