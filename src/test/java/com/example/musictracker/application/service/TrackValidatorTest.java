package com.example.musictracker.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musictracker.domain.model.MediaSource;
import com.example.musictracker.domain.model.Track;
import java.util.List;
import org.junit.jupiter.api.Test;

class TrackValidatorTest {

    private final TrackValidator validator = new TrackValidator();

    @Test
    void shouldAcceptCompleteTrack() {
        Track track = new Track();
        track.setTitle("Intro");
        track.setTrackNo(1);
        track.setDiscNo(1);
        track.setYear(2001);
        MediaSource source = new MediaSource();
        source.setDurationMs(0);

        assertTrue(validator.validate(track, source).isEmpty());
        assertTrue(validator.validate(track, null).isEmpty());
    }

    @Test
    void shouldCollectEveryViolation() {
        Track track = new Track();
        track.setTitle("  ");
        track.setTrackNo(0);
        track.setDiscNo(-1);
        track.setYear(10000);
        MediaSource source = new MediaSource();
        source.setDurationMs(-5);

        List<String> violations = validator.validate(track, source);

        assertEquals(5, violations.size());
        assertEquals("Title is missing", violations.get(0));
    }
}
