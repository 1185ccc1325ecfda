package com.example.musictracker.domain.model;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class Track {

    private Long id;

    private String uid;

    /**
     * Incremented on every persisted mutation.
     */
    private long revision;

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

    public Track copy() {
        Track copy = new Track();
        copy.setId(id);
        copy.setUid(uid);
        copy.setRevision(revision);
        copy.setMediaSourceId(mediaSourceId);
        copy.setTitle(title);
        copy.setArtist(artist);
        copy.setAlbum(album);
        copy.setAlbumArtist(albumArtist);
        copy.setComposer(composer);
        copy.setTrackNo(trackNo);
        copy.setDiscNo(discNo);
        copy.setYear(year);
        copy.setGenre(genre);
        copy.setComment(comment);
        copy.setBpm(bpm);
        copy.setMusicalKey(musicalKey);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
