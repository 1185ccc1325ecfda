package com.example.musictracker.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class TrackEntity {

    private Long id;

    private String uid;

    private Long revision;

    private Long mediaSourceId;

    private String title;

    private String artist;

    private String album;

    private String albumArtist;

    private String composer;

    private Integer trackNo;

    private Integer discNo;

    private Integer year;

    private String genre;

    private String comment;

    private Integer bpm;

    private String musicalKey;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
