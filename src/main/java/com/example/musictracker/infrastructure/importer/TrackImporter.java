package com.example.musictracker.infrastructure.importer;

import com.example.musictracker.domain.model.ImportResult;
import com.example.musictracker.domain.model.ImportTrackConfig;
import com.example.musictracker.domain.model.MediaFile;
import com.example.musictracker.domain.model.Track;

/**
 * Turns the content of a media file into track metadata.
 */
public interface TrackImporter {

    /**
     * Never throws for unreadable or malformed content; such files yield a failed result with issues.
     *
     * @param existing the stored track if the file was imported before, otherwise {@code null}
     */
    ImportResult importTrack(MediaFile file, Track existing, ImportTrackConfig config);
}
