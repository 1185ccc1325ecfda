package com.example.musictracker.support;

import com.example.musictracker.common.util.ContentPaths;
import com.example.musictracker.domain.model.ImportResult;
import com.example.musictracker.domain.model.ImportTrackConfig;
import com.example.musictracker.domain.model.MediaFile;
import com.example.musictracker.domain.model.MediaSource;
import com.example.musictracker.domain.model.Track;
import com.example.musictracker.infrastructure.importer.TrackImporter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Importer that derives the title from the file name and can be told to fail or misbehave per path.
 */
public class FakeTrackImporter implements TrackImporter {

    private final List<String> importedPaths = new ArrayList<>();
    private final Set<String> failingPaths = new HashSet<>();
    private final Set<String> throwingPaths = new HashSet<>();
    private final Set<String> untitledPaths = new HashSet<>();

    @Override
    public synchronized ImportResult importTrack(MediaFile file, Track existing, ImportTrackConfig config) {
        String path = file.getContentPath();
        importedPaths.add(path);
        if (throwingPaths.contains(path)) {
            throw new IllegalStateException("Importer crashed on " + path);
        }
        if (failingPaths.contains(path)) {
            return ImportResult.failed(Collections.singletonList("Malformed tag in " + path));
        }
        Track track = existing == null ? new Track() : existing.copy();
        track.setTitle(untitledPaths.contains(path) ? " " : ContentPaths.fileName(path));
        track.setArtist("Fake Artist");
        MediaSource source = new MediaSource();
        source.setContentType(file.getContentType());
        source.setDurationMs(1000);
        return ImportResult.imported(track, source, Collections.<String>emptyList());
    }

    public synchronized FakeTrackImporter failOn(String path) {
        failingPaths.add(path);
        return this;
    }

    public synchronized FakeTrackImporter throwOn(String path) {
        throwingPaths.add(path);
        return this;
    }

    public synchronized FakeTrackImporter untitled(String path) {
        untitledPaths.add(path);
        return this;
    }

    public synchronized void heal() {
        failingPaths.clear();
        throwingPaths.clear();
        untitledPaths.clear();
    }

    public synchronized int getCallCount() {
        return importedPaths.size();
    }

    public synchronized List<String> getImportedPaths() {
        return new ArrayList<>(importedPaths);
    }

    public synchronized void reset() {
        importedPaths.clear();
    }
}
