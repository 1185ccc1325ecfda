package com.example.musictracker.application.service;

import com.example.musictracker.domain.model.MediaSource;
import com.example.musictracker.domain.model.Track;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Checks an imported track before it may replace or create a catalog row.
 */
@Component
public class TrackValidator {

    private static final int MAX_YEAR = 9999;

    /**
     * @return violation messages, empty if the track is acceptable
     */
    public List<String> validate(Track track, MediaSource source) {
        List<String> violations = new ArrayList<>();
        if (!StringUtils.hasText(track.getTitle())) {
            violations.add("Title is missing");
        }
        if (track.getTrackNo() != null && track.getTrackNo() <= 0) {
            violations.add("Track number must be positive: " + track.getTrackNo());
        }
        if (track.getDiscNo() != null && track.getDiscNo() <= 0) {
            violations.add("Disc number must be positive: " + track.getDiscNo());
        }
        if (track.getYear() != null && (track.getYear() < 0 || track.getYear() > MAX_YEAR)) {
            violations.add("Year out of range: " + track.getYear());
        }
        if (source != null && source.getDurationMs() != null && source.getDurationMs() < 0) {
            violations.add("Duration must not be negative: " + source.getDurationMs());
        }
        return violations;
    }
}
