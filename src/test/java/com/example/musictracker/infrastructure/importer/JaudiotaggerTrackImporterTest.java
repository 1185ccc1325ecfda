package com.example.musictracker.infrastructure.importer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.musictracker.domain.model.ImportResult;
import com.example.musictracker.domain.model.ImportTrackConfig;
import com.example.musictracker.domain.model.MediaFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JaudiotaggerTrackImporterTest {

    private final JaudiotaggerTrackImporter importer = new JaudiotaggerTrackImporter();

    @Test
    void shouldReportUnparsableFileAsFailed(@TempDir Path root) throws IOException {
        Path file = Files.write(root.resolve("broken.mp3"),
                "this is not an mpeg stream".getBytes(StandardCharsets.UTF_8));
        MediaFile mediaFile = new MediaFile("broken.mp3", file, "audio/mpeg", Files.size(file),
                Files.getLastModifiedTime(file).toMillis(), new byte[32]);

        ImportResult result = importer.importTrack(mediaFile, null, ImportTrackConfig.defaults());

        assertFalse(result.isImported());
        assertNull(result.getTrack());
        assertEquals(1, result.getIssues().size());
    }

    @Test
    void shouldDeriveTitleFromFileName() {
        assertEquals("Intro", JaudiotaggerTrackImporter.titleFromFileName("a/01 - Intro.mp3"));
        assertEquals("Theme", JaudiotaggerTrackImporter.titleFromFileName("a/07.Theme.flac"));
        assertEquals("Closing Time", JaudiotaggerTrackImporter.titleFromFileName("12) Closing Time.ogg"));
        assertEquals("1999", JaudiotaggerTrackImporter.titleFromFileName("a/1999.mp3"));
        assertEquals("Song", JaudiotaggerTrackImporter.titleFromFileName("Song.mp3"));
    }
}
